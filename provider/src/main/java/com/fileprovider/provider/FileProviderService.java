package com.fileprovider.provider;

import com.fileprovider.config.Component;
import com.fileprovider.config.ComponentState;
import com.fileprovider.document.DocumentStore;
import com.fileprovider.document.MapValue;
import com.fileprovider.provider.config.ProviderConfig;
import com.fileprovider.provider.registry.InitRequest;
import com.fileprovider.provider.registry.InstanceRegistry;
import com.fileprovider.provider.registry.ProviderInstance;
import com.fileprovider.provider.resolution.FetchPath;
import com.fileprovider.provider.resolution.ResolutionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Entry point for the five provider operations.
 *
 * <p>Init and Shutdown take the write lock; Fetch, Info and Health take the
 * read lock, so fetches run in parallel and never observe a registration in
 * progress.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * FileProviderService service = new FileProviderService(
 *         ProviderConfig.fromConfig(config), new HoconDocumentStore());
 *
 * service.init(InitRequest.of("configs", "/etc/myapp"));
 * MapValue db = service.fetch(List.of("database"));
 * }</pre>
 */
public class FileProviderService implements Component {

    private static final Logger log = LoggerFactory.getLogger(FileProviderService.class);

    private static final String NAME = "file-provider";

    private final ProviderConfig config;
    private final InstanceRegistry registry;
    private final ResolutionEngine engine;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicReference<ComponentState> state =
            new AtomicReference<>(ComponentState.UNINITIALIZED);

    public FileProviderService(ProviderConfig config, DocumentStore documentStore) {
        this(config, documentStore, new InstanceRegistry(documentStore.fileExtensions()));
    }

    /**
     * Create a service resolving relative directories against {@code workingDirectory}.
     */
    public FileProviderService(ProviderConfig config, DocumentStore documentStore, Path workingDirectory) {
        this(config, documentStore, new InstanceRegistry(documentStore.fileExtensions(), workingDirectory));
    }

    private FileProviderService(ProviderConfig config, DocumentStore documentStore, InstanceRegistry registry) {
        this.config = config;
        this.registry = registry;
        this.engine = new ResolutionEngine(documentStore);
    }

    // ========== Operations ==========

    /**
     * Register a provider instance.
     *
     * @throws ProviderException if registration fails
     */
    public ProviderInstance init(InitRequest request) {
        lock.writeLock().lock();
        try {
            return registry.register(request);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Resolve a path to a map-shaped document.
     *
     * @throws ProviderException if the path is invalid or cannot be resolved
     */
    public MapValue fetch(List<String> path) {
        FetchPath fetchPath = FetchPath.of(path);
        lock.readLock().lock();
        try {
            return engine.resolve(registry.snapshot(), fetchPath);
        } finally {
            lock.readLock().unlock();
        }
    }

    public ProviderInfo info() {
        lock.readLock().lock();
        try {
            return new ProviderInfo(config.getVersion(), config.getType());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Never throws.
     */
    public HealthReport health() {
        lock.readLock().lock();
        try {
            return registry.size() > 0 ? HealthReport.healthy() : HealthReport.noInstances();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Remove every instance. Idempotent.
     */
    public void shutdown() {
        lock.writeLock().lock();
        try {
            registry.reset();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getInstanceCount() {
        return registry.size();
    }

    // ========== Component ==========

    @Override
    public void initialize() {
        if (!state.compareAndSet(ComponentState.UNINITIALIZED, ComponentState.INITIALIZED)) {
            throw new IllegalStateException("Cannot initialize from state: " + state.get());
        }
        log.info("[{}] Initialized: version={} type={}", NAME, config.getVersion(), config.getType());
    }

    @Override
    public void start() {
        if (!state.compareAndSet(ComponentState.INITIALIZED, ComponentState.ACTIVE)) {
            throw new IllegalStateException("Cannot start from state: " + state.get());
        }
        log.info("[{}] Started", NAME);
    }

    @Override
    public void stop() {
        if (state.getAndSet(ComponentState.STOPPED) == ComponentState.STOPPED) {
            return;
        }
        shutdown();
        log.info("[{}] Stopped", NAME);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ComponentState getState() {
        return state.get();
    }
}
