package org.profd.node.spi;

import io.javalin.Javalin;

/**
 * An HTTP API controller that contributes routes to the node's Javalin application.
 */
public interface IController {

    /**
     * Registers all HTTP routes for this controller with the given Javalin instance.
     *
     * @param app      The Javalin application instance to register routes with.
     * @param basePath The base path under which the controller's routes are nested, ending with '/'.
     */
    void registerRoutes(Javalin app, String basePath);
}
