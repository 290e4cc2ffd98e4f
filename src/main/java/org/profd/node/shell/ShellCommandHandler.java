package org.profd.node.shell;

import org.profd.api.errors.AlreadyRunningException;
import org.profd.api.errors.ConfigDecodeException;
import org.profd.api.errors.NotRunningException;
import org.profd.session.SessionController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * Dispatches textual, shell-style commands to the session controller.
 *
 * <pre>
 * dump
 * startProfiling &lt;duration&gt; &lt;interval&gt; &lt;iterations&gt;
 * startProfilingProto -        (encoded configuration on stdin)
 * stopProfiling
 * </pre>
 * Numbers accept decimal, {@code 0x} hexadecimal and leading-zero octal notation.
 */
public class ShellCommandHandler {

    public static final int OK = 0;
    public static final int SERVICE_ERROR = 1;
    public static final int MALFORMED_CONFIG = 2;
    public static final int BAD_VALUE = -22;

    private static final Logger LOG = LoggerFactory.getLogger(ShellCommandHandler.class);

    private final SessionController controller;

    public ShellCommandHandler(final SessionController controller) {
        this.controller = Objects.requireNonNull(controller, "controller cannot be null");
    }

    /**
     * Executes one command.
     *
     * @param args  The command name followed by its arguments.
     * @param stdin Source of the encoded configuration for {@code startProfilingProto -}.
     * @param out   Receives the command output.
     * @return The exit code.
     */
    public int execute(final List<String> args, final InputStream stdin, final PrintStream out) {
        if (args == null || args.isEmpty()) {
            out.println("Missing command");
            return BAD_VALUE;
        }
        final String command = args.get(0);
        switch (command) {
            case "dump":
                out.print(controller.dump());
                return OK;
            case "startProfiling":
                return startProfiling(args, out);
            case "startProfilingProto":
                return startProfilingProto(args, stdin, out);
            case "stopProfiling":
                return stopProfiling(out);
            default:
                out.println("Unknown command: " + command);
                return BAD_VALUE;
        }
    }

    private int startProfiling(final List<String> args, final PrintStream out) {
        if (args.size() < 4) {
            out.println("Usage: startProfiling <duration> <interval> <iterations>");
            return BAD_VALUE;
        }
        final int duration;
        final int interval;
        final int iterations;
        try {
            duration = Integer.decode(args.get(1));
            interval = Integer.decode(args.get(2));
            iterations = Integer.decode(args.get(3));
        } catch (final NumberFormatException e) {
            out.println("Invalid number: " + e.getMessage());
            return BAD_VALUE;
        }
        try {
            controller.startSimple(duration, interval, iterations);
        } catch (final AlreadyRunningException e) {
            out.println(e.getMessage());
            return SERVICE_ERROR;
        }
        out.println("Profiling started");
        return OK;
    }

    private int startProfilingProto(final List<String> args, final InputStream stdin, final PrintStream out) {
        if (args.size() < 2 || !"-".equals(args.get(1))) {
            out.println("Usage: startProfilingProto -");
            return BAD_VALUE;
        }
        final byte[] blob;
        try {
            blob = stdin.readAllBytes();
        } catch (final IOException e) {
            LOG.warn("Could not read configuration from stdin: {}", e.getMessage());
            out.println("Could not read configuration: " + e.getMessage());
            return BAD_VALUE;
        }
        try {
            controller.startStructured(blob);
        } catch (final ConfigDecodeException e) {
            out.println(e.getMessage());
            return MALFORMED_CONFIG;
        } catch (final AlreadyRunningException e) {
            out.println(e.getMessage());
            return SERVICE_ERROR;
        }
        out.println("Profiling started");
        return OK;
    }

    private int stopProfiling(final PrintStream out) {
        try {
            controller.stop();
        } catch (final NotRunningException e) {
            out.println(e.getMessage());
            return SERVICE_ERROR;
        }
        out.println("Profiling stop requested");
        return OK;
    }
}
