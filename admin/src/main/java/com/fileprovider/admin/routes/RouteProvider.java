package com.fileprovider.admin.routes;

import io.javalin.Javalin;

/**
 * Contributes REST routes to the {@link com.fileprovider.admin.ProviderServer}.
 *
 * <p>Example implementation:</p>
 * <pre>{@code
 * public class StatusRoutes implements RouteProvider {
 *     @Override
 *     public String getBasePath() {
 *         return "/status";
 *     }
 *
 *     @Override
 *     public void registerRoutes(Javalin app, String contextPath) {
 *         app.get(contextPath + getBasePath(), ctx -> ctx.json(Map.of("status", "ok")));
 *     }
 * }
 * }</pre>
 */
public interface RouteProvider {

    /**
     * Base path appended to the server's context path; starts with "/".
     */
    String getBasePath();

    /**
     * Register routes with the Javalin application.
     *
     * @param app the Javalin application
     * @param contextPath the server's context path (e.g., "/api")
     */
    void registerRoutes(Javalin app, String contextPath);

    default String getDescription() {
        return getClass().getSimpleName();
    }

    /**
     * Lower values are registered first.
     */
    default int getPriority() {
        return 100;
    }
}
