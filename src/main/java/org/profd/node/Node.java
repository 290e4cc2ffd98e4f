package org.profd.node;

import com.typesafe.config.Config;
import org.profd.api.engine.ISamplingEngine;
import org.profd.api.queue.ITelemetryQueue;
import org.profd.codec.ProtobufConfigCodec;
import org.profd.delivery.DeliverySink;
import org.profd.engine.CommandSampleCollector;
import org.profd.engine.RoundBasedSamplingEngine;
import org.profd.node.processes.http.HttpServerProcess;
import org.profd.node.processes.http.api.session.SessionHttpController;
import org.profd.node.shell.ShellCommandHandler;
import org.profd.queue.InMemoryTelemetryQueue;
import org.profd.queue.SpoolDirectoryTelemetryQueue;
import org.profd.session.SessionConfiguration;
import org.profd.session.SessionConfigurationFactory;
import org.profd.session.SessionController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;

/**
 * The daemon process. Wires exactly one {@link SessionController} together with its engine,
 * delivery sink and telemetry queue, and exposes it through the HTTP server.
 */
public final class Node {
    private static final Logger LOGGER = LoggerFactory.getLogger(Node.class);
    public static final String SESSION_API_PATH = "/api/session/";

    private final SessionController sessionController;
    private final ShellCommandHandler shellCommandHandler;
    private final HttpServerProcess httpServer;
    private Thread shutdownHook;

    /**
     * Creates a node with the engine selected by {@code profd.engine}.
     *
     * @param config The fully resolved application configuration.
     */
    public Node(final Config config) {
        this(config, createEngine(config.getConfig("profd.engine")));
    }

    /**
     * Creates a node running the given engine.
     *
     * @param config The fully resolved application configuration.
     * @param engine The sampling engine every session runs.
     */
    public Node(final Config config, final ISamplingEngine engine) {
        final Config sessionConfig = config.getConfig("profd.session");
        final SessionConfigurationFactory factory = new SessionConfigurationFactory(
            SessionConfiguration.fromConfig(sessionConfig.getConfig("defaults")),
            new ProtobufConfigCodec());
        final DeliverySink sink = new DeliverySink(
            createQueue(config.getConfig("profd.queue")),
            sessionConfig.getString("telemetry-tag"));

        this.sessionController = new SessionController(factory, engine, sink, sessionConfig.getInt("max-errors"));
        this.shellCommandHandler = new ShellCommandHandler(sessionController);
        this.httpServer = new HttpServerProcess("http-server", config.getConfig("node.http"),
            Map.of(SESSION_API_PATH, new SessionHttpController(sessionController, shellCommandHandler)));
        LOGGER.debug("Node initialized with engine {}", engine.getClass().getSimpleName());
    }

    /**
     * Starts the HTTP server and registers a shutdown hook for graceful termination.
     */
    public void start() {
        httpServer.start();
        shutdownHook = new Thread(this::stop, "shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        LOGGER.info("Node started successfully. Running until interrupted.");
    }

    /**
     * Requests the running session to stop and shuts the HTTP server down. Does not wait for
     * the session thread.
     */
    public void stop() {
        LOGGER.info("Shutdown sequence initiated...");

        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (final IllegalStateException e) {
                // Shutdown hook is already running or JVM is shutting down
                LOGGER.debug("Could not remove shutdown hook: {}", e.getMessage());
            }
            shutdownHook = null;
        }

        if (sessionController.stopIfRunning()) {
            LOGGER.info("Requested stop of the running profiling session.");
        }
        try {
            httpServer.stop();
        } catch (final Exception e) {
            LOGGER.error("Error while stopping the HTTP server.", e);
        }
        LOGGER.info("Node stopped. Goodbye.");
    }

    public SessionController getSessionController() {
        return sessionController;
    }

    public ShellCommandHandler getShellCommandHandler() {
        return shellCommandHandler;
    }

    /**
     * @return The port the HTTP server is bound to.
     */
    public int httpPort() {
        return httpServer.port();
    }

    static ITelemetryQueue createQueue(final Config queueConfig) {
        final String type = queueConfig.getString("type");
        switch (type) {
            case "spool":
                return new SpoolDirectoryTelemetryQueue(Path.of(queueConfig.getString("spool-directory")));
            case "memory":
                return new InMemoryTelemetryQueue();
            default:
                throw new IllegalArgumentException("Unknown telemetry queue type '" + type + "'");
        }
    }

    static ISamplingEngine createEngine(final Config engineConfig) {
        final String type = engineConfig.getString("type");
        if ("command".equals(type)) {
            return new RoundBasedSamplingEngine(new CommandSampleCollector(Path.of(engineConfig.getString("output-directory"))));
        }
        throw new IllegalArgumentException("Unknown sampling engine type '" + type + "'");
    }
}
