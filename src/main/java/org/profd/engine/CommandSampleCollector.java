package org.profd.engine;

import com.google.protobuf.ByteString;
import org.profd.api.contracts.SampleRecord;
import org.profd.api.engine.IArtifact;
import org.profd.delivery.DeliverySink;
import org.profd.session.CancellationToken;
import org.profd.session.SessionConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Collects one round by running the configured sampling binary ({@code perfPath record}) for
 * {@code sampleDurationSeconds} and wrapping its output into a {@link SampleRecord}.
 * <p>
 * The child process is polled so a stop request terminates it within {@link #POLL_MILLIS}.
 * When artifacts are stored locally and {@code maxUnprocessedProfiles} of them are already
 * waiting in the destination directory, the round is skipped.
 */
public class CommandSampleCollector implements ISampleCollector {

    static final long POLL_MILLIS = 200;
    static final int DEFAULT_FREQUENCY = 4000;

    private static final Logger LOG = LoggerFactory.getLogger(CommandSampleCollector.class);
    private static final long GRACE_SECONDS = 10;

    private final Path workDirectory;

    /**
     * @param workDirectory Directory the raw sampler output is written to before it is wrapped.
     */
    public CommandSampleCollector(final Path workDirectory) {
        this.workDirectory = workDirectory;
    }

    @Override
    public Optional<IArtifact> collect(final SessionConfiguration configuration,
                                       final int iteration,
                                       final CancellationToken token)
            throws SampleCollectionException, InterruptedException {
        if (backlogFull(configuration)) {
            LOG.info("Skipping round {}: {} unprocessed profiles in {}", iteration,
                configuration.maxUnprocessedProfiles(), configuration.destinationDirectory());
            return Optional.empty();
        }

        final Path output = workDirectory.resolve("perf.data.raw");
        final List<String> command = buildCommand(configuration, output);
        final long started = System.currentTimeMillis();
        final int exitCode = runToCompletion(command, configuration.sampleDurationSeconds(), token);
        if (exitCode < 0) {
            LOG.debug("Round {} cancelled while sampling", iteration);
            deleteQuietly(output);
            return Optional.empty();
        }

        final byte[] data;
        try {
            data = Files.exists(output) ? Files.readAllBytes(output) : new byte[0];
        } catch (final IOException e) {
            throw new SampleCollectionException("Could not read sampler output " + output, false, e);
        } finally {
            deleteQuietly(output);
        }
        if (exitCode != 0) {
            throw new SampleCollectionException(
                "Sampler exited with code " + exitCode + ": " + String.join(" ", command), false);
        }

        final SampleRecord.Builder record = SampleRecord.newBuilder()
            .setTimestampMillis(started)
            .setIteration(iteration)
            .setSampleDurationInS(configuration.sampleDurationSeconds())
            .setSamplingPeriod(configuration.samplingPeriod())
            .setProcess(configuration.process())
            .addAllCommandLine(command)
            .setExitCode(exitCode)
            .setPerfData(ByteString.copyFrom(data));
        if (configuration.collectCpuUtilization()) {
            final double cpuLoad = cpuUtilization();
            if (cpuLoad >= 0) {
                record.setCpuUtilization(cpuLoad);
            }
        }
        return Optional.of(new ProtobufArtifact(record.build()));
    }

    /**
     * Builds the sampler command line for one round.
     *
     * @param configuration The session configuration.
     * @param output        The raw output file.
     * @return The command line.
     */
    static List<String> buildCommand(final SessionConfiguration configuration, final Path output) {
        final List<String> command = new ArrayList<>();
        command.add(configuration.perfPath());
        command.add("record");
        command.add("-o");
        command.add(output.toString());
        if (configuration.samplingPeriod() > 0) {
            command.add("-c");
            command.add(Integer.toString(configuration.samplingPeriod()));
        } else {
            command.add("-F");
            command.add(Integer.toString(DEFAULT_FREQUENCY));
        }
        if (configuration.stackProfile()) {
            command.add("-g");
        }
        if (configuration.process() >= 0) {
            command.add("-p");
            command.add(Integer.toString(configuration.process()));
        } else {
            command.add("-a");
        }
        command.add("--");
        command.add("sleep");
        command.add(Integer.toString(Math.max(configuration.sampleDurationSeconds(), 0)));
        return command;
    }

    /**
     * @return the exit code, or {@code -1} if the process was terminated because of a stop request
     */
    private int runToCompletion(final List<String> command, final int durationSeconds, final CancellationToken token)
            throws SampleCollectionException, InterruptedException {
        final Process process;
        try {
            Files.createDirectories(workDirectory);
            process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .start();
        } catch (final IOException e) {
            throw new SampleCollectionException("Could not launch sampler '" + command.get(0) + "'", true, e);
        }

        final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(Math.max(durationSeconds, 0) + GRACE_SECONDS);
        try {
            while (!process.waitFor(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (token.shouldStop()) {
                    process.destroy();
                    return -1;
                }
                if (System.nanoTime() > deadline) {
                    process.destroyForcibly();
                    throw new SampleCollectionException("Sampler did not finish within its duration", false);
                }
            }
        } catch (final InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
        return process.exitValue();
    }

    private static boolean backlogFull(final SessionConfiguration configuration) {
        if (configuration.sendToTelemetryQueue() || configuration.maxUnprocessedProfiles() <= 0) {
            return false;
        }
        final Path destination = Path.of(configuration.destinationDirectory());
        if (!Files.isDirectory(destination)) {
            return false;
        }
        int count = 0;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(destination, DeliverySink.LOCAL_FILE_PREFIX + "*")) {
            for (final Path ignored : entries) {
                count++;
            }
        } catch (final IOException e) {
            LOG.debug("Could not count unprocessed profiles in {}: {}", destination, e.getMessage());
            return false;
        }
        return count >= configuration.maxUnprocessedProfiles();
    }

    private static double cpuUtilization() {
        final java.lang.management.OperatingSystemMXBean bean = ManagementFactory.getOperatingSystemMXBean();
        if (bean instanceof com.sun.management.OperatingSystemMXBean) {
            final double load = ((com.sun.management.OperatingSystemMXBean) bean).getCpuLoad();
            return load < 0 ? -1 : load * 100.0;
        }
        return -1;
    }

    private static void deleteQuietly(final Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (final IOException e) {
            LOG.debug("Could not delete {}: {}", path, e.getMessage());
        }
    }
}
