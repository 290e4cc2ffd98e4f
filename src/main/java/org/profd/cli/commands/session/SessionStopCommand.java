package org.profd.cli.commands.session;

import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(
    name = "stop",
    description = "Requests the running profiling session to stop."
)
public class SessionStopCommand implements Callable<Integer> {

    @ParentCommand
    private SessionCommand parent;

    @Override
    public Integer call() {
        return parent.exchange(client -> client.post("stop", null));
    }
}
