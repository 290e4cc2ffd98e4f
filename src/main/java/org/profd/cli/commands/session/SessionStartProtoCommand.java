package org.profd.cli.commands.session;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "start-proto",
    description = "Starts a profiling session from an encoded ProfilingConfig merged over the defaults."
)
public class SessionStartProtoCommand implements Callable<Integer> {

    @ParentCommand
    private SessionCommand parent;

    @Parameters(index = "0", paramLabel = "<file|->", description = "File holding the encoded configuration, '-' for stdin.")
    private String source;

    @Override
    public Integer call() throws IOException {
        final byte[] blob = "-".equals(source) ? System.in.readAllBytes() : Files.readAllBytes(Path.of(source));
        return parent.exchange(client -> client.post("start-proto", blob));
    }
}
