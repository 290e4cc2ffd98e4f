package org.profd.node.processes.http.api.session;

import io.javalin.Javalin;
import io.javalin.http.ContentType;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.profd.api.errors.ConfigDecodeException;
import org.profd.node.processes.http.api.session.dto.ErrorResponseDto;
import org.profd.node.processes.http.api.session.dto.MessageResponseDto;
import org.profd.node.processes.http.api.session.dto.SessionStatusDto;
import org.profd.node.processes.http.api.session.dto.ShellResultDto;
import org.profd.node.shell.ShellCommandHandler;
import org.profd.node.spi.IController;
import org.profd.session.SessionController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * HTTP surface of the session controller.
 * <p>
 * Start and stop requests are answered with 202 since the session runs detached. A second
 * start and a stop without a session are answered with 409, malformed parameters or
 * configurations with 400.
 */
public class SessionHttpController implements IController {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionHttpController.class);

    private final SessionController sessionController;
    private final ShellCommandHandler shellCommandHandler;

    /**
     * @param sessionController   The controller owning the single session.
     * @param shellCommandHandler Dispatcher for the shell-style endpoint.
     */
    public SessionHttpController(final SessionController sessionController, final ShellCommandHandler shellCommandHandler) {
        this.sessionController = Objects.requireNonNull(sessionController, "sessionController cannot be null");
        this.shellCommandHandler = Objects.requireNonNull(shellCommandHandler, "shellCommandHandler cannot be null");
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.get(basePath + "status", this::getStatus);
        app.get(basePath + "dump", this::getDump);
        app.post(basePath + "start", this::handleStart);
        app.post(basePath + "start-proto", this::handleStartProto);
        app.post(basePath + "stop", this::handleStop);
        app.post(basePath + "shell", this::handleShell);

        app.exception(ConfigDecodeException.class, (e, ctx) -> {
            LOGGER.warn("Rejected configuration for request {}: {}", ctx.path(), e.getMessage());
            error(ctx, HttpStatus.BAD_REQUEST, e.getMessage());
        });
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            LOGGER.warn("Bad request {}: {}", ctx.path(), e.getMessage());
            error(ctx, HttpStatus.BAD_REQUEST, e.getMessage());
        });
        // AlreadyRunningException and NotRunningException
        app.exception(IllegalStateException.class, (e, ctx) -> {
            LOGGER.warn("Invalid state transition for request {}: {}", ctx.path(), e.getMessage());
            error(ctx, HttpStatus.CONFLICT, e.getMessage());
        });
        app.exception(Exception.class, (e, ctx) -> {
            LOGGER.error("Unhandled exception for request {}", ctx.path(), e);
            error(ctx, HttpStatus.INTERNAL_SERVER_ERROR, "An internal server error occurred.");
        });
    }

    void getStatus(final Context ctx) {
        ctx.status(HttpStatus.OK).json(SessionStatusDto.from(sessionController.status()));
    }

    void getDump(final Context ctx) {
        ctx.status(HttpStatus.OK).contentType(ContentType.TEXT_PLAIN).result(sessionController.dump());
    }

    void handleStart(final Context ctx) {
        final int duration = requiredInt(ctx, "duration");
        final int interval = requiredInt(ctx, "interval");
        final int iterations = requiredInt(ctx, "iterations");
        sessionController.startSimple(duration, interval, iterations);
        ctx.status(HttpStatus.ACCEPTED).json(new MessageResponseDto("Profiling session started."));
    }

    void handleStartProto(final Context ctx) throws ConfigDecodeException {
        sessionController.startStructured(ctx.bodyAsBytes());
        ctx.status(HttpStatus.ACCEPTED).json(new MessageResponseDto("Profiling session started."));
    }

    void handleStop(final Context ctx) {
        sessionController.stop();
        ctx.status(HttpStatus.ACCEPTED).json(new MessageResponseDto("Stop requested."));
    }

    void handleShell(final Context ctx) {
        final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        final int exitCode;
        try (PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            exitCode = shellCommandHandler.execute(ctx.queryParams("arg"), new ByteArrayInputStream(ctx.bodyAsBytes()), out);
        }
        ctx.status(HttpStatus.OK).json(new ShellResultDto(exitCode, buffer.toString(StandardCharsets.UTF_8)));
    }

    private static int requiredInt(final Context ctx, final String name) {
        final String value = ctx.queryParam(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing query parameter '" + name + "'");
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Query parameter '" + name + "' is not an integer: " + value);
        }
    }

    private static void error(final Context ctx, final HttpStatus status, final String message) {
        ctx.status(status).json(ErrorResponseDto.of(status.getCode(), status.getMessage(), message));
    }
}
