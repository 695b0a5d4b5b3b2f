package com.fileprovider.admin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fileprovider.admin.config.ProviderServerConfig;
import com.fileprovider.admin.routes.RouteProvider;
import com.fileprovider.config.Component;
import com.fileprovider.config.ComponentState;
import com.fileprovider.provider.ErrorKind;
import com.fileprovider.provider.ProviderException;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * HTTP server exposing the provider over JSON, built on Javalin.
 *
 * <p>Implements the {@link Component} lifecycle: routes are registered in
 * {@link #initialize()}, the listener is bound in {@link #start()}. With port 0
 * the server binds a free port, available from {@link #getPort()} once started.</p>
 *
 * <p>Errors are returned as {@code {"error": message, "kind": KIND}} with the
 * status given by {@link #statusOf(ErrorKind)}.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ProviderServer server = new ProviderServer(ProviderServerConfig.fromConfig(config));
 * server.addRouteProvider(new ProviderRoutes(service));
 *
 * server.initialize();
 * server.start();
 * System.out.println("PROVIDER_PORT=" + server.getPort());
 * }</pre>
 */
public class ProviderServer implements Component {

    private static final Logger log = LoggerFactory.getLogger(ProviderServer.class);

    private final String name;
    private final ProviderServerConfig config;
    private final AtomicReference<ComponentState> state;
    private final List<RouteProvider> routeProviders;
    private final ObjectMapper objectMapper;

    private Javalin app;

    public ProviderServer(String name, ProviderServerConfig config) {
        this.name = name;
        this.config = config;
        this.state = new AtomicReference<>(ComponentState.UNINITIALIZED);
        this.routeProviders = new CopyOnWriteArrayList<>();
        this.objectMapper = createObjectMapper();
    }

    public ProviderServer(ProviderServerConfig config) {
        this("provider-server", config);
    }

    /**
     * Add a route provider. Must be called before {@link #initialize()}.
     *
     * @return this server for chaining
     */
    public ProviderServer addRouteProvider(RouteProvider provider) {
        if (state.get() != ComponentState.UNINITIALIZED) {
            throw new IllegalStateException("Cannot add routes after initialization");
        }
        routeProviders.add(provider);
        log.debug("[{}] Added route provider: {} -> {}",
                name, provider.getBasePath(), provider.getDescription());
        return this;
    }

    /**
     * @return the bound port; only meaningful once started
     */
    public int getPort() {
        if (state.get() != ComponentState.ACTIVE) {
            throw new IllegalStateException("Server is not running: " + state.get());
        }
        return app.port();
    }

    /**
     * HTTP status for an error kind.
     */
    public static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
            case FAILED_PRECONDITION -> HttpStatus.PRECONDITION_FAILED;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    // ========== Component Lifecycle ==========

    @Override
    public void initialize() {
        if (!state.compareAndSet(ComponentState.UNINITIALIZED, ComponentState.INITIALIZED)) {
            throw new IllegalStateException("Cannot initialize from state: " + state.get());
        }

        log.info("[{}] Initializing provider server on {}:{}", name, config.getHost(), config.getPort());

        app = Javalin.create(cfg -> {
            cfg.showJavalinBanner = false;
            cfg.jsonMapper(new JavalinJackson(objectMapper, false));

            if (config.isCorsEnabled()) {
                cfg.bundledPlugins.enableCors(cors -> cors.addRule(rule -> {
                    for (String origin : config.getCorsAllowedOrigins()) {
                        if ("*".equals(origin)) {
                            rule.anyHost();
                        } else {
                            rule.allowHost(origin);
                        }
                    }
                }));
            }

            cfg.requestLogger.http((ctx, ms) ->
                    log.debug("[{}] {} {} -> {} ({}ms)", name, ctx.method(), ctx.path(), ctx.status(), ms));
        });

        registerErrorHandlers();
        registerRoutes();

        log.info("[{}] Initialized with {} route providers", name, routeProviders.size());
    }

    @Override
    public void start() {
        ComponentState currentState = state.get();
        if (currentState != ComponentState.INITIALIZED) {
            throw new IllegalStateException("Cannot start from state: " + currentState);
        }

        app.start(config.getHost(), config.getPort());

        state.set(ComponentState.ACTIVE);
        log.info("[{}] Provider server started at http://{}:{}{}",
                name, config.getHost(), app.port(), config.getContextPath());
    }

    @Override
    public void stop() {
        ComponentState previous = state.getAndSet(ComponentState.STOPPED);
        if (previous == ComponentState.STOPPED) {
            log.debug("[{}] Already stopped", name);
            return;
        }

        log.info("[{}] Stopping provider server", name);
        if (app != null) {
            try {
                app.stop();
            } catch (Exception e) {
                log.warn("[{}] Error stopping Javalin", name, e);
            }
        }
        log.info("[{}] Provider server stopped", name);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ComponentState getState() {
        return state.get();
    }

    // ========== Private Methods ==========

    private ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    private void registerErrorHandlers() {
        app.exception(ProviderException.class, (e, ctx) -> {
            if (e.getKind() == ErrorKind.INTERNAL) {
                log.error("[{}] {} {} failed: {}", name, ctx.method(), ctx.path(), e.getMessage(), e);
            } else {
                log.debug("[{}] {} {} rejected: {}", name, ctx.method(), ctx.path(), e.getMessage());
            }
            error(ctx, statusOf(e.getKind()), e.getMessage(), e.getKind());
        });

        app.exception(JsonProcessingException.class, (e, ctx) ->
                error(ctx, HttpStatus.BAD_REQUEST,
                        "malformed request body: " + e.getOriginalMessage(), ErrorKind.INVALID_INPUT));

        app.exception(Exception.class, (e, ctx) -> {
            log.error("[{}] Unhandled exception", name, e);
            error(ctx, HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", ErrorKind.INTERNAL);
        });
    }

    private static void error(Context ctx, HttpStatus status, String message, ErrorKind kind) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("kind", kind.name());
        ctx.status(status);
        ctx.json(body);
    }

    private void registerRoutes() {
        List<RouteProvider> sorted = new ArrayList<>(routeProviders);
        sorted.sort(Comparator.comparingInt(RouteProvider::getPriority));

        for (RouteProvider provider : sorted) {
            provider.registerRoutes(app, config.getContextPath());
            log.info("[{}] Registered routes: {} -> {}",
                    name, config.getContextPath() + provider.getBasePath(), provider.getDescription());
        }
    }
}
