package com.fileprovider.provider.registry;

import com.fileprovider.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.SortedMap;

/**
 * Owns the set of registered {@link ProviderInstance}s.
 *
 * <p>State is held in an immutable {@link RegistrySnapshot}; a registration
 * builds the next snapshot and publishes it in a single assignment, so a failed
 * registration never leaves partial state behind.</p>
 *
 * <p>Rollback semantics: when a registration fails while other instances are
 * already committed, every committed instance is removed (in reverse commit
 * order) and the registry returns to empty. The error then ends with
 * {@code "; rolled back all N instance(s)"}. A duplicate-directory conflict is
 * the one exception: it is reported without touching committed state.</p>
 *
 * <p>Not thread-safe for writers. Callers serialize {@link #register} and
 * {@link #reset}; readers may use {@link #snapshot()} concurrently.</p>
 */
public class InstanceRegistry {

    private static final Logger log = LoggerFactory.getLogger(InstanceRegistry.class);

    private final DirectoryScanner scanner;
    private final Path workingDirectory;

    private volatile RegistrySnapshot snapshot = RegistrySnapshot.empty();

    /**
     * Create a registry resolving relative directories against the process working directory.
     *
     * @param extensions recognized configuration file extensions
     */
    public InstanceRegistry(List<String> extensions) {
        this(extensions, Paths.get("").toAbsolutePath());
    }

    /**
     * Create a registry resolving relative directories against the given directory.
     *
     * @param extensions recognized configuration file extensions
     * @param workingDirectory base for relative directories when no source file is given
     */
    public InstanceRegistry(List<String> extensions, Path workingDirectory) {
        this.scanner = new DirectoryScanner(extensions);
        this.workingDirectory = workingDirectory;
    }

    /**
     * Register a new instance.
     *
     * @param request the registration request
     * @return the committed instance
     * @throws ProviderException if any registration step fails
     */
    public ProviderInstance register(InitRequest request) {
        String alias = request.alias();
        RegistrySnapshot current = snapshot;

        if (alias.isEmpty()) {
            throw rollbackOnFailure(ProviderException.invalidInput("alias cannot be empty"));
        }
        if (current.lookup(alias).isPresent()) {
            throw rollbackOnFailure(ProviderException.conflict(
                    prefix(alias) + "provider instance already initialized"));
        }

        Path canonical;
        SortedMap<String, Path> files;
        try {
            canonical = locateDirectory(alias, request);
        } catch (ProviderException e) {
            throw rollbackOnFailure(e);
        }

        String owner = current.owner(canonical).orElse(null);
        if (owner != null) {
            throw ProviderException.conflict(String.format(
                    "directory \"%s\" already registered by provider instance \"%s\", cannot register as \"%s\"",
                    canonical, owner, alias));
        }

        try {
            files = scanner.scan(canonical);
        } catch (DirectoryScanException e) {
            throw rollbackOnFailure(ProviderException.internal(
                    prefix(alias) + "failed to enumerate configuration files: " + e.getMessage(), e));
        }

        ProviderInstance instance = new ProviderInstance(alias, canonical, files, true);
        snapshot = current.with(instance);

        log.info("Initialized provider instance: alias=\"{}\" directory=\"{}\" files={}",
                alias, canonical, files.size());
        return instance;
    }

    /**
     * Remove every instance unconditionally.
     */
    public void reset() {
        int count = snapshot.size();
        snapshot = RegistrySnapshot.empty();
        log.info("Registry reset, removed {} instance(s)", count);
    }

    /**
     * @return the current committed state
     */
    public RegistrySnapshot snapshot() {
        return snapshot;
    }

    public int size() {
        return snapshot.size();
    }

    // ========== Private Methods ==========

    /**
     * Resolve, verify and canonicalize the configured directory.
     */
    private Path locateDirectory(String alias, InitRequest request) {
        Object value = request.config().get(InitRequest.DIRECTORY_KEY);
        if (value == null && !request.config().containsKey(InitRequest.DIRECTORY_KEY)) {
            throw ProviderException.invalidInput(
                    prefix(alias) + "missing required config key '" + InitRequest.DIRECTORY_KEY + "'");
        }
        if (!(value instanceof String directory)) {
            String type = value == null ? "null" : value.getClass().getSimpleName();
            throw ProviderException.invalidInput(prefix(alias) + "directory must be a string, got " + type);
        }

        Path absolute = resolveAbsolute(alias, directory, request.sourceFilePath());

        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(absolute, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            throw ProviderException.notFound(prefix(alias) + "directory does not exist: " + absolute);
        } catch (IOException e) {
            throw ProviderException.internal(prefix(alias) + "failed to stat directory: " + e.getMessage(), e);
        }
        if (!attributes.isDirectory()) {
            throw ProviderException.invalidInput(prefix(alias) + "path is not a directory: " + absolute);
        }

        try {
            return absolute.toRealPath();
        } catch (IOException e) {
            throw ProviderException.internal(prefix(alias) + "failed to canonicalize path: " + e.getMessage(), e);
        }
    }

    private Path resolveAbsolute(String alias, String directory, String sourceFilePath) {
        try {
            Path raw = Paths.get(directory);
            if (raw.isAbsolute()) {
                return raw.normalize();
            }
            Path base = workingDirectory;
            if (sourceFilePath != null && !sourceFilePath.isEmpty()) {
                Path sourceParent = workingDirectory.resolve(sourceFilePath).normalize().getParent();
                if (sourceParent != null) {
                    base = sourceParent;
                }
            }
            return base.resolve(raw).normalize();
        } catch (InvalidPathException e) {
            throw ProviderException.invalidInput(
                    prefix(alias) + "failed to resolve path to absolute: " + e.getMessage());
        }
    }

    /**
     * Roll back all committed instances if there are any, and return the error to throw.
     */
    private ProviderException rollbackOnFailure(ProviderException failure) {
        RegistrySnapshot current = snapshot;
        if (current.isEmpty()) {
            return failure;
        }

        List<String> order = current.order();
        for (int i = order.size() - 1; i >= 0; i--) {
            log.warn("Rolling back provider instance: alias=\"{}\"", order.get(i));
        }
        snapshot = RegistrySnapshot.empty();

        return failure.withSuffix("; rolled back all " + order.size() + " instance(s)");
    }

    private static String prefix(String alias) {
        return "alias \"" + alias + "\": ";
    }
}
