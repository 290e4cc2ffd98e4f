package org.profd.cli.commands.session;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(
    name = "start",
    description = "Starts a profiling session from the defaults with duration, interval and iterations replaced."
)
public class SessionStartCommand implements Callable<Integer> {

    @ParentCommand
    private SessionCommand parent;

    @Parameters(index = "0", description = "Sampling duration of one round in seconds.")
    private int duration;

    @Parameters(index = "1", description = "Pause between rounds in seconds.")
    private int interval;

    @Parameters(index = "2", description = "Number of rounds, 0 to run until stopped.")
    private int iterations;

    @Override
    public Integer call() {
        final String path = String.format("start?duration=%d&interval=%d&iterations=%d", duration, interval, iterations);
        return parent.exchange(client -> client.post(path, null));
    }
}
