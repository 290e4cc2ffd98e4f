package org.profd.cli.commands.session;

import com.typesafe.config.Config;
import org.profd.cli.CommandLineInterface;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.net.http.HttpResponse;

@Command(
    name = "session",
    description = "Controls the profiling session of a running daemon",
    subcommands = {
        SessionStartCommand.class,
        SessionStartProtoCommand.class,
        SessionStopCommand.class,
        SessionStatusCommand.class,
        SessionDumpCommand.class,
        SessionEncodeConfigCommand.class
    }
)
public class SessionCommand {

    static final int EXIT_OK = 0;
    static final int EXIT_SERVICE_ERROR = 1;
    static final int EXIT_MALFORMED = 2;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = "--host", description = "Daemon host, overrides node.http.host.")
    private String host;

    @Option(names = {"-p", "--port"}, description = "Daemon port, overrides node.http.port.")
    private Integer port;

    public CommandLineInterface getParent() {
        return parent;
    }

    /**
     * Builds the client for the daemon's session API. The configuration is only loaded when
     * {@code --host} or {@code --port} leave an endpoint part open.
     */
    SessionApiClient client() {
        if (host != null && port != null) {
            return new SessionApiClient(host, port);
        }
        final Config config = parent.getConfig();
        return new SessionApiClient(
            host != null ? host : config.getString("node.http.host"),
            port != null ? port : config.getInt("node.http.port"));
    }

    /**
     * Sends a request and prints the daemon's answer. 2xx maps to {@value #EXIT_OK},
     * 400 to {@value #EXIT_MALFORMED}, everything else to {@value #EXIT_SERVICE_ERROR}.
     */
    int exchange(final Request request) {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        try {
            final HttpResponse<String> response = request.send(client());
            final int status = response.statusCode();
            if (status >= 200 && status < 300) {
                out.println(response.body());
                out.flush();
                return EXIT_OK;
            }
            err.println(response.body());
            err.flush();
            return status == 400 ? EXIT_MALFORMED : EXIT_SERVICE_ERROR;
        } catch (final IOException e) {
            err.println("Failed to connect to the daemon. Is it running? " + e.getMessage());
            err.flush();
            return EXIT_SERVICE_ERROR;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return EXIT_SERVICE_ERROR;
        }
    }

    @FunctionalInterface
    interface Request {
        HttpResponse<String> send(SessionApiClient client) throws IOException, InterruptedException;
    }
}
