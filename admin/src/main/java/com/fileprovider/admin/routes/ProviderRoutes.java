package com.fileprovider.admin.routes;

import com.fileprovider.provider.FileProviderService;
import com.fileprovider.provider.HealthReport;
import com.fileprovider.provider.ProviderException;
import com.fileprovider.provider.ProviderInfo;
import com.fileprovider.provider.registry.InitRequest;
import com.fileprovider.provider.registry.ProviderInstance;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API routes for the provider operations.
 *
 * <p>Endpoints:</p>
 * <pre>
 * POST   /provider/init      - Register an instance: {"alias", "config": {"directory"}, "sourceFilePath"}
 * POST   /provider/fetch     - Resolve a path: {"path": ["file", "key"]}
 * GET    /provider/fetch     - Resolve a path given as repeated ?path= parameters
 * GET    /provider/info      - Provider version and type
 * GET    /provider/health    - OK with at least one instance, DEGRADED otherwise
 * POST   /provider/shutdown  - Remove all instances
 * </pre>
 *
 * <p>Failures surface as {@link com.fileprovider.provider.ProviderException} and are
 * mapped to HTTP status codes by the server.</p>
 */
public class ProviderRoutes implements RouteProvider {

    private final FileProviderService service;

    public ProviderRoutes(FileProviderService service) {
        this.service = service;
    }

    @Override
    public String getBasePath() {
        return "/provider";
    }

    @Override
    public String getDescription() {
        return "File Provider API";
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public void registerRoutes(Javalin app, String contextPath) {
        String base = contextPath + getBasePath();

        app.post(base + "/init", this::init);
        app.post(base + "/fetch", this::fetchFromBody);
        app.get(base + "/fetch", this::fetchFromQuery);
        app.get(base + "/info", this::info);
        app.get(base + "/health", this::health);
        app.post(base + "/shutdown", this::shutdown);
    }

    // ========== Handlers ==========

    private void init(Context ctx) {
        InitBody body = readBody(ctx, InitBody.class);
        ProviderInstance instance = service.init(
                new InitRequest(body.alias(), body.config(), body.sourceFilePath()));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("alias", instance.alias());
        ctx.json(result);
    }

    private void fetchFromBody(Context ctx) {
        FetchBody body = readBody(ctx, FetchBody.class);
        ctx.json(service.fetch(body.path()).toPlain());
    }

    private void fetchFromQuery(Context ctx) {
        ctx.json(service.fetch(ctx.queryParams("path")).toPlain());
    }

    private void info(Context ctx) {
        ProviderInfo info = service.info();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("version", info.version());
        result.put("type", info.type());
        ctx.json(result);
    }

    private void health(Context ctx) {
        HealthReport report = service.health();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", report.status().name());
        result.put("message", report.message());
        ctx.json(result);
    }

    private void shutdown(Context ctx) {
        service.shutdown();
        ctx.json(Map.of("success", true));
    }

    private static <T> T readBody(Context ctx, Class<T> type) {
        T body = ctx.bodyAsClass(type);
        if (body == null) {
            throw ProviderException.invalidInput("request body is required");
        }
        return body;
    }

    // ========== Request bodies ==========

    /**
     * Body of {@code POST /provider/init}.
     */
    public record InitBody(String alias, Map<String, Object> config, String sourceFilePath) {
    }

    /**
     * Body of {@code POST /provider/fetch}.
     */
    public record FetchBody(List<String> path) {
    }
}
