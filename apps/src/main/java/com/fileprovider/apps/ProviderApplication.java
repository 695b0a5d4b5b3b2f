package com.fileprovider.apps;

import ch.qos.logback.classic.Level;
import com.fileprovider.admin.ProviderServer;
import com.fileprovider.admin.config.ProviderServerConfig;
import com.fileprovider.admin.routes.ProviderRoutes;
import com.fileprovider.config.ConfigLoader;
import com.fileprovider.config.LifeCycleComponent;
import com.fileprovider.document.HoconDocumentStore;
import com.fileprovider.provider.FileProviderService;
import com.fileprovider.provider.config.ProviderConfig;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * Starts the file provider HTTP server.
 *
 * <p>Once the server is listening, a single line {@code PROVIDER_PORT=<port>} is
 * written to stdout; logs go to stderr. The process runs until it receives
 * SIGINT/SIGTERM, then stops the server and clears all instances.</p>
 *
 * <pre>
 * provider -c provider.conf --port 0
 * </pre>
 */
@Command(name = "provider", mixinStandardHelpOptions = true, version = "file-provider 0.2.1",
         description = "File configuration provider server")
public class ProviderApplication implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ProviderApplication.class);

    static final String PORT_LINE_PREFIX = "PROVIDER_PORT=";

    @Option(names = {"-c", "--config"}, split = ",",
            description = "Configuration files, later files override earlier ones")
    private List<String> configFiles = new ArrayList<>();

    @Option(names = {"--host"}, description = "Listen address (default: server.host)")
    private String host;

    @Option(names = {"-p", "--port"}, description = "Listen port, 0 for any free port (default: server.port)")
    private Integer port;

    @Option(names = {"--log-level"}, description = "Log level for provider packages (e.g. DEBUG)")
    private String logLevel;

    private final PrintStream out;
    private final CountDownLatch stopped = new CountDownLatch(1);

    private volatile LifeCycleComponent lifecycle;
    private volatile Thread shutdownHook;

    public ProviderApplication() {
        this(System.out);
    }

    ProviderApplication(PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() {
        if (logLevel != null) {
            setLogLevel(logLevel);
        }

        ProviderServer server;
        try {
            log.info("Loading configuration from: {}", configFiles);
            server = launch(withOverrides(ConfigLoader.load(configFiles)));
        } catch (Exception e) {
            log.error("Failed to start provider", e);
            shutdown();
            return 1;
        }

        shutdownHook = new Thread(() -> {
            log.info("Shutdown signal received");
            shutdown();
        }, "provider-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        out.println(PORT_LINE_PREFIX + server.getPort());
        out.flush();

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown();
        }
        return 0;
    }

    /**
     * Build, initialize and start the service and server.
     *
     * @return the started server
     */
    ProviderServer launch(Config config) throws Exception {
        FileProviderService service = new FileProviderService(
                ProviderConfig.fromConfig(config), new HoconDocumentStore());
        ProviderServer server = new ProviderServer(ProviderServerConfig.fromConfig(config));
        server.addRouteProvider(new ProviderRoutes(service));

        LifeCycleComponent components = new LifeCycleComponent("provider");
        components.addComponent(service)
                  .addComponent(server);
        lifecycle = components;

        components.initialize();
        components.start();
        return server;
    }

    /**
     * Stop all components and release {@link #call()}. Idempotent.
     */
    void shutdown() {
        LifeCycleComponent components = lifecycle;
        if (components != null) {
            components.stop();
        }
        Thread hook = shutdownHook;
        if (hook != null && Thread.currentThread() != hook) {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down, keeping hook");
            }
        }
        stopped.countDown();
    }

    private Config withOverrides(Config config) {
        Map<String, Object> overrides = new HashMap<>();
        if (host != null) {
            overrides.put("server.host", host);
        }
        if (port != null) {
            overrides.put("server.port", port);
        }
        return ConfigFactory.parseMap(overrides).withFallback(config);
    }

    private static void setLogLevel(String level) {
        ch.qos.logback.classic.Logger logger =
                (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.fileprovider");
        logger.setLevel(Level.toLevel(level));
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ProviderApplication()).execute(args);
        System.exit(exitCode);
    }
}
