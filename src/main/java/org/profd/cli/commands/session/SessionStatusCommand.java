package org.profd.cli.commands.session;

import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(
    name = "status",
    description = "Prints the session status as JSON."
)
public class SessionStatusCommand implements Callable<Integer> {

    @ParentCommand
    private SessionCommand parent;

    @Override
    public Integer call() {
        return parent.exchange(client -> client.get("status"));
    }
}
