package com.fileprovider.provider.resolution;

import com.fileprovider.document.Document;
import com.fileprovider.document.DocumentMerger;
import com.fileprovider.document.DocumentParseException;
import com.fileprovider.document.DocumentStore;
import com.fileprovider.document.MapValue;
import com.fileprovider.provider.ProviderException;
import com.fileprovider.provider.registry.ProviderInstance;
import com.fileprovider.provider.registry.RegistrySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a fetch path into a document value.
 *
 * <p>Path structure depends on the registry:</p>
 * <pre>
 * one instance:    [file, key...]          or [alias, file, key...]
 * many instances:  [alias, file, key...]
 * </pre>
 *
 * <p>{@code file} may be {@link FetchPath#WILDCARD}, which parses every file of
 * the instance in ascending base name order and deep-merges them, later files
 * winning. A trailing wildcard returns the map reached so far.</p>
 *
 * <p>Examples, with one instance "configs" holding {@code database.conf}:</p>
 * <pre>
 * ["database"]                    whole database.conf
 * ["configs", "database", "host"] {value: "localhost"}
 * ["*", "database"]               database section of all files merged
 * </pre>
 *
 * <p>Nothing is cached: each call parses the files it needs again.</p>
 */
public class ResolutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ResolutionEngine.class);

    /**
     * Key under which non-map results are wrapped.
     */
    public static final String VALUE_KEY = "value";

    private final DocumentStore documentStore;

    public ResolutionEngine(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    /**
     * Resolve a path against a registry snapshot.
     *
     * @param snapshot the registry state to resolve against
     * @param path the validated fetch path
     * @return the addressed value, always map-shaped
     * @throws ProviderException on any resolution failure
     */
    public MapValue resolve(RegistrySnapshot snapshot, FetchPath path) {
        ModeDecision decision = ModeDetector.detect(snapshot, path);

        ProviderInstance instance = switch (decision.mode()) {
            case EXPLICIT, IMPLICIT -> decision.instance();
            case UNINITIALIZED -> throw ProviderException.failedPrecondition("no provider instances initialized");
            case AMBIGUOUS -> throw ProviderException.notFound(String.format(
                    "provider instance \"%s\" not found (hint: with multiple instances, path must start with alias)",
                    path.first()));
        };

        int fileIndex = decision.fileNameIndex();
        if (path.size() <= fileIndex) {
            throw ProviderException.invalidInput("path must contain at least [alias, filename]");
        }
        String fileName = path.segment(fileIndex);

        log.debug("Fetching from provider instance: alias=\"{}\" mode={} path={}",
                instance.alias(), decision.mode(), path);

        MapValue root = FetchPath.isWildcard(fileName)
                ? mergeAll(instance)
                : parseOne(instance, fileName);

        Document value = DocumentNavigator.navigate(root, path, fileIndex + 1, fileName, instance.alias());
        return shape(value);
    }

    /**
     * Wrap non-map values as {@code {value: v}}.
     */
    static MapValue shape(Document value) {
        return switch (value.kind()) {
            case MAP -> (MapValue) value;
            case LIST, SCALAR -> MapValue.of(VALUE_KEY, value);
        };
    }

    private MapValue parseOne(ProviderInstance instance, String baseName) {
        Path file = instance.file(baseName).orElseThrow(() -> ProviderException.notFound(String.format(
                "file \"%s\" not found in provider instance \"%s\"", baseName, instance.alias())));
        return parse(instance, file);
    }

    private MapValue mergeAll(ProviderInstance instance) {
        List<MapValue> documents = new ArrayList<>();
        for (String baseName : instance.baseNames()) {
            documents.add(parse(instance, instance.file(baseName).orElseThrow()));
        }
        return DocumentMerger.mergeAll(documents);
    }

    private MapValue parse(ProviderInstance instance, Path file) {
        try {
            return documentStore.parse(file);
        } catch (DocumentParseException e) {
            throw ProviderException.internal(String.format(
                    "provider instance \"%s\": %s", instance.alias(), e.getMessage()), e);
        }
    }
}
