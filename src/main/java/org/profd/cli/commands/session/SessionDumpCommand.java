package org.profd.cli.commands.session;

import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(
    name = "dump",
    description = "Prints the human readable session diagnostics."
)
public class SessionDumpCommand implements Callable<Integer> {

    @ParentCommand
    private SessionCommand parent;

    @Override
    public Integer call() {
        return parent.exchange(client -> client.get("dump"));
    }
}
