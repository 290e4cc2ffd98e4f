package org.profd.node.processes.http;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.profd.node.spi.IController;
import org.profd.node.spi.IProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * A manageable process that runs a Javalin HTTP server. Every controller handed in at
 * construction registers its routes under its base path when the server starts.
 */
public class HttpServerProcess implements IProcess {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpServerProcess.class);

    private final String processName;
    private final Config options;
    private final Map<String, IController> controllers;
    private Javalin app;

    /**
     * Constructs a new HttpServerProcess.
     *
     * @param processName The name of this process, also used for the Jetty thread pool.
     * @param options     The {@code node.http} block: host, port and thread-pool settings.
     * @param controllers Controllers keyed by the base path their routes are mounted at.
     */
    public HttpServerProcess(final String processName, final Config options, final Map<String, IController> controllers) {
        this.processName = Objects.requireNonNull(processName, "processName cannot be null");
        this.options = Objects.requireNonNull(options, "options cannot be null");
        this.controllers = Map.copyOf(Objects.requireNonNull(controllers, "controllers cannot be null"));
    }

    @Override
    public void start() {
        if (app != null) {
            LOGGER.warn("HTTP server is already running.");
            return;
        }

        final String host = options.getString("host");
        final int port = options.getInt("port");

        app = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.requestLogger.http((ctx, ms) -> {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Request: {} {} (completed in {} ms)", ctx.method(), ctx.path(), ms);
                }
            });

            final int minThreads = options.hasPath("thread-pool.min-threads")
                ? options.getInt("thread-pool.min-threads")
                : 2;
            final int maxThreads = options.hasPath("thread-pool.max-threads")
                ? options.getInt("thread-pool.max-threads")
                : 16;
            final int idleTimeout = options.hasPath("thread-pool.idle-timeout-ms")
                ? options.getInt("thread-pool.idle-timeout-ms")
                : 60000;

            final QueuedThreadPool threadPool = new QueuedThreadPool(maxThreads, minThreads, idleTimeout);
            threadPool.setName(processName);
            config.jetty.threadPool = threadPool;

            LOGGER.debug("Configured thread pool '{}' with {} min threads, {} max threads, {} ms idle timeout",
                threadPool.getName(), minThreads, maxThreads, idleTimeout);
        });

        for (final Map.Entry<String, IController> entry : controllers.entrySet()) {
            final String basePath = entry.getKey().endsWith("/") ? entry.getKey() : entry.getKey() + "/";
            entry.getValue().registerRoutes(app, basePath);
            LOGGER.debug("Registered controller {} at '{}'", entry.getValue().getClass().getSimpleName(), basePath);
        }

        app.start(host, port);
        LOGGER.info("HTTP server started on {}:{}", host, app.port());
    }

    @Override
    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
            LOGGER.info("HTTP server stopped.");
        }
    }

    /**
     * Returns the port the server listens on. Differs from the configured port when that is {@code 0}.
     *
     * @return The bound port.
     * @throws IllegalStateException if the server is not running.
     */
    public int port() {
        if (app == null) {
            throw new IllegalStateException("HTTP server is not running");
        }
        return app.port();
    }
}
