package org.profd.cli.commands.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValueFactory;
import org.profd.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Runs the profd daemon in the foreground until it is terminated."
)
public class NodeRunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(NodeRunCommand.class);

    @ParentCommand
    private NodeCommand parent;

    @Option(names = "--host", description = "Overrides node.http.host.")
    private String host;

    @Option(names = {"-p", "--port"}, description = "Overrides node.http.port (0 picks a free port).")
    private Integer port;

    @Override
    public Integer call() {
        final Config config = withOverrides(parent.getParent().getConfig(), host, port);

        final Node node = new Node(config);
        node.start();
        LOGGER.info("profd listening on {}:{}, session API at {}",
            config.getString("node.http.host"), node.httpPort(), Node.SESSION_API_PATH);

        // Shutdown hook in Node stops the session and the HTTP server.
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            node.stop();
        }
        return 0;
    }

    /**
     * Layers command line overrides of the HTTP endpoint over the loaded configuration.
     *
     * @param config The loaded configuration.
     * @param host   Host override, or {@code null}.
     * @param port   Port override, or {@code null}.
     * @return The configuration the node is started with.
     */
    static Config withOverrides(final Config config, final String host, final Integer port) {
        Config result = config;
        if (host != null) {
            result = result.withValue("node.http.host", ConfigValueFactory.fromAnyRef(host));
        }
        if (port != null) {
            result = result.withValue("node.http.port", ConfigValueFactory.fromAnyRef(port));
        }
        return result;
    }
}
