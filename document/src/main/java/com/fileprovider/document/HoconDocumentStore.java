package com.fileprovider.document;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigList;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigResolveOptions;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@link DocumentStore} reading HOCON ({@code .conf}) and JSON ({@code .json}) files
 * with the Typesafe Config parser.
 *
 * <p>Substitutions are resolved within the file being parsed and against
 * environment variables; there is no cross-file resolution. Includes are
 * resolved relative to the file.</p>
 *
 * <p>Example: a file {@code database.conf}</p>
 * <pre>
 * database {
 *   host = localhost
 *   port = 5432
 *   replicas = [ "r1", "r2" ]
 * }
 * </pre>
 * <p>parses to {@code {database: {host: "localhost", port: 5432, replicas: ["r1", "r2"]}}}.</p>
 */
public class HoconDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(HoconDocumentStore.class);

    private static final List<String> EXTENSIONS = List.of(".conf", ".json");

    @Override
    public List<String> fileExtensions() {
        return EXTENSIONS;
    }

    @Override
    public MapValue parse(Path file) throws DocumentParseException {
        log.debug("Parsing document: {}", file);
        try {
            Config config = ConfigFactory.parseFile(file.toFile(),
                    ConfigParseOptions.defaults().setAllowMissing(false));
            Config resolved = config.resolve(ConfigResolveOptions.defaults());
            return toMap(resolved.root());
        } catch (ConfigException e) {
            throw new DocumentParseException(file, "failed to parse " + file + ": " + e.getMessage(), e);
        }
    }

    private static MapValue toMap(ConfigObject object) {
        TreeMap<String, Document> entries = new TreeMap<>();
        for (Map.Entry<String, ConfigValue> entry : object.entrySet()) {
            entries.put(entry.getKey(), toDocument(entry.getValue()));
        }
        return new MapValue(entries);
    }

    private static Document toDocument(ConfigValue value) {
        return switch (value.valueType()) {
            case OBJECT -> toMap((ConfigObject) value);
            case LIST -> {
                List<Document> elements = new ArrayList<>();
                for (ConfigValue element : (ConfigList) value) {
                    elements.add(toDocument(element));
                }
                yield new ListValue(elements);
            }
            case STRING, NUMBER, BOOLEAN, NULL -> new ScalarValue(value.unwrapped());
        };
    }
}
