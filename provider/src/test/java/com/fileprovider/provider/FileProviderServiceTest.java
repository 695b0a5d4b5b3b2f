package com.fileprovider.provider;

import com.fileprovider.config.ComponentState;
import com.fileprovider.document.HoconDocumentStore;
import com.fileprovider.document.MapValue;
import com.fileprovider.document.ScalarValue;
import com.fileprovider.provider.config.ProviderConfig;
import com.fileprovider.provider.registry.InitRequest;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FileProviderService}.
 */
class FileProviderServiceTest {

    @TempDir
    Path tempDir;

    private FileProviderService service;

    @BeforeEach
    void setUp() {
        service = new FileProviderService(ProviderConfig.builder().build(), new HoconDocumentStore(), tempDir);
    }

    // ==================== Info / Health ====================

    @Test
    void infoComesFromReferenceConfig() {
        ProviderConfig config = ProviderConfig.fromConfig(ConfigFactory.load());
        FileProviderService configured = new FileProviderService(config, new HoconDocumentStore());

        assertEquals(new ProviderInfo("0.2.1", "file"), configured.info());
    }

    @Test
    void infoHonoursOverrides() {
        ProviderConfig config = ProviderConfig.fromConfig(
                ConfigFactory.parseMap(Map.of("provider.version", "9.9.9", "provider.type", "custom")));

        assertEquals(new ProviderInfo("9.9.9", "custom"),
                new FileProviderService(config, new HoconDocumentStore()).info());
    }

    @Test
    void healthTracksInstanceCount() throws IOException {
        assertEquals(new HealthReport(HealthStatus.DEGRADED, "no instances initialized"), service.health());

        service.init(InitRequest.of("x", configDir("configs", "app.conf", "name = myapp\n").toString()));
        assertEquals(new HealthReport(HealthStatus.OK, "healthy"), service.health());

        service.shutdown();
        assertEquals(HealthStatus.DEGRADED, service.health().status());
    }

    // ==================== Fetch ====================

    @Test
    void fetchValidatesPath() {
        ProviderException empty = assertThrows(ProviderException.class, () -> service.fetch(List.of()));
        assertEquals(ErrorKind.INVALID_INPUT, empty.getKind());
        assertEquals("path cannot be empty", empty.getMessage());

        ProviderException emptyFirst = assertThrows(ProviderException.class, () -> service.fetch(List.of("", "")));
        assertEquals("path[0] cannot be empty", emptyFirst.getMessage());

        ProviderException emptyLater = assertThrows(ProviderException.class,
                () -> service.fetch(List.of("app", "")));
        assertEquals(ErrorKind.INVALID_INPUT, emptyLater.getKind());
        assertEquals("path[1] cannot be empty", emptyLater.getMessage());
    }

    @Test
    void fetchBeforeInitIsFailedPrecondition() {
        ProviderException ex = assertThrows(ProviderException.class, () -> service.fetch(List.of("anything")));

        assertEquals(ErrorKind.FAILED_PRECONDITION, ex.getKind());
    }

    @Test
    void fetchAfterShutdownIsFailedPrecondition() throws IOException {
        service.init(InitRequest.of("x", configDir("configs", "app.conf", "name = myapp\n").toString()));
        service.shutdown();
        service.shutdown();

        ProviderException ex = assertThrows(ProviderException.class, () -> service.fetch(List.of("app")));
        assertEquals(ErrorKind.FAILED_PRECONDITION, ex.getKind());
    }

    @Test
    void scenarioTwoInstancesAddressedByAlias() throws IOException {
        service.init(InitRequest.of("a", configDir("dir1", "db.conf", "host = db1\n").toString()));
        service.init(InitRequest.of("b", configDir("dir2", "net.conf", "port = 8080\n").toString()));

        ProviderException ex = assertThrows(ProviderException.class, () -> service.fetch(List.of("a", "net")));
        assertEquals(ErrorKind.NOT_FOUND, ex.getKind());

        assertEquals(MapValue.of("port", ScalarValue.of(8080)), service.fetch(List.of("b", "net")));
    }

    @Test
    void secondAliasOnSameDirectoryKeepsFirst() throws IOException {
        Path dir = configDir("dir1", "app.conf", "name = myapp\n");
        service.init(InitRequest.of("first", dir.toString()));

        ProviderException ex = assertThrows(ProviderException.class,
                () -> service.init(InitRequest.of("second", dir.toString())));

        assertEquals(ErrorKind.CONFLICT, ex.getKind());
        assertEquals(1, service.getInstanceCount());
        assertEquals(MapValue.of("value", ScalarValue.of("myapp")),
                service.fetch(List.of("first", "app", "name")));
    }

    @Test
    void concurrentFetchesSeeConsistentResults() throws Exception {
        service.init(InitRequest.of("x", configDir("configs", "alpha.conf", "app { name = alpha, port = 1 }\n")
                .toString()));
        Files.writeString(tempDir.resolve("configs/beta.conf"), "app { port = 2 }\n");
        // beta.conf was written after registration and is not indexed
        MapValue expected = service.fetch(List.of("*"));

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<MapValue>> tasks = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                tasks.add(() -> service.fetch(Arrays.asList("x", "*")));
            }
            for (Future<MapValue> future : executor.invokeAll(tasks)) {
                assertEquals(expected, future.get());
            }
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }
        assertEquals(Map.of("app", Map.of("name", "alpha", "port", 1)), expected.toPlain());
    }

    @Test
    void initsRacingOnOneDirectoryCommitExactlyOnce() throws Exception {
        Path dir = configDir("shared", "app.conf", "name = myapp\n");

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                String alias = "alias-" + i;
                tasks.add(() -> {
                    try {
                        service.init(InitRequest.of(alias, dir.toString()));
                        return true;
                    } catch (ProviderException e) {
                        assertEquals(ErrorKind.CONFLICT, e.getKind());
                        return false;
                    }
                });
            }
            int committed = 0;
            for (Future<Boolean> future : executor.invokeAll(tasks)) {
                if (future.get()) {
                    committed++;
                }
            }
            assertEquals(1, committed);
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }
        assertEquals(1, service.getInstanceCount());
    }

    // ==================== Component ====================

    @Test
    void stopShutsDownRegistry() throws IOException {
        service.initialize();
        service.start();
        service.init(InitRequest.of("x", configDir("configs", "app.conf", "name = myapp\n").toString()));

        service.stop();
        service.stop();

        assertEquals(ComponentState.STOPPED, service.getState());
        assertEquals(0, service.getInstanceCount());
    }

    // ==================== Helpers ====================

    private Path configDir(String name, String fileName, String content) throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve(name));
        Files.writeString(dir.resolve(fileName), content);
        return dir;
    }
}
