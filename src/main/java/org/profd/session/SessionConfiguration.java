package org.profd.session;

import com.typesafe.config.Config;

/**
 * The canonical configuration of a sampling session.
 * <p>
 * Every field is independently defaulted from {@code profd.session.defaults}. Numeric values are
 * carried exactly as supplied: range checks belong to the sampling engine, so zero and negative
 * values pass through unchanged.
 *
 * @param collectionIntervalSeconds      Pause between two sampling rounds.
 * @param useFixedSeed                   Seed for randomized scheduling, {@code 0} for none.
 * @param mainLoopIterations             Number of rounds, {@code 0} to run until stopped.
 * @param destinationDirectory           Directory for locally stored artifacts and temporary files.
 * @param configDirectory                Directory the engine reads auxiliary configuration from.
 * @param perfPath                       Path to the sampling binary.
 * @param samplingPeriod                 Events between two samples, {@code 0} to use the default frequency.
 * @param sampleDurationSeconds          Length of one sampling round.
 * @param onlyDebugBuild                 Only sample on debug builds of the host.
 * @param hardwireCpus                   Keep all CPUs online while sampling.
 * @param hardwireCpusMaxDurationSeconds Upper bound for keeping CPUs online.
 * @param maxUnprocessedProfiles         Local backlog limit before rounds are skipped.
 * @param stackProfile                   Record call stacks.
 * @param collectCpuUtilization          Attach CPU utilization to each artifact.
 * @param collectChargingState           Attach the charging state to each artifact.
 * @param collectBooting                 Attach the booting flag to each artifact.
 * @param collectCameraActive            Attach the camera state to each artifact.
 * @param process                        Process to sample, {@code -1} for system wide.
 * @param useElfSymbolizer               Symbolize with the ELF symbolizer.
 * @param sendToTelemetryQueue           Route artifacts to the telemetry queue instead of local storage.
 */
public record SessionConfiguration(
    int collectionIntervalSeconds,
    int useFixedSeed,
    int mainLoopIterations,
    String destinationDirectory,
    String configDirectory,
    String perfPath,
    int samplingPeriod,
    int sampleDurationSeconds,
    boolean onlyDebugBuild,
    boolean hardwireCpus,
    int hardwireCpusMaxDurationSeconds,
    int maxUnprocessedProfiles,
    boolean stackProfile,
    boolean collectCpuUtilization,
    boolean collectChargingState,
    boolean collectBooting,
    boolean collectCameraActive,
    int process,
    boolean useElfSymbolizer,
    boolean sendToTelemetryQueue
) {

    /**
     * Reads a complete configuration from a HOCON block. Every key must be present, which is
     * guaranteed for {@code profd.session.defaults} by {@code reference.conf}.
     *
     * @param defaults The block holding one key per field.
     * @return The configuration described by the block.
     */
    public static SessionConfiguration fromConfig(final Config defaults) {
        return new Builder()
            .collectionIntervalSeconds(defaults.getInt("collection-interval-seconds"))
            .useFixedSeed(defaults.getInt("use-fixed-seed"))
            .mainLoopIterations(defaults.getInt("main-loop-iterations"))
            .destinationDirectory(defaults.getString("destination-directory"))
            .configDirectory(defaults.getString("config-directory"))
            .perfPath(defaults.getString("perf-path"))
            .samplingPeriod(defaults.getInt("sampling-period"))
            .sampleDurationSeconds(defaults.getInt("sample-duration-seconds"))
            .onlyDebugBuild(defaults.getBoolean("only-debug-build"))
            .hardwireCpus(defaults.getBoolean("hardwire-cpus"))
            .hardwireCpusMaxDurationSeconds(defaults.getInt("hardwire-cpus-max-duration-seconds"))
            .maxUnprocessedProfiles(defaults.getInt("max-unprocessed-profiles"))
            .stackProfile(defaults.getBoolean("stack-profile"))
            .collectCpuUtilization(defaults.getBoolean("collect-cpu-utilization"))
            .collectChargingState(defaults.getBoolean("collect-charging-state"))
            .collectBooting(defaults.getBoolean("collect-booting"))
            .collectCameraActive(defaults.getBoolean("collect-camera-active"))
            .process(defaults.getInt("process"))
            .useElfSymbolizer(defaults.getBoolean("use-elf-symbolizer"))
            .sendToTelemetryQueue(defaults.getBoolean("send-to-telemetry-queue"))
            .build();
    }

    /**
     * Returns a builder initialized with the values of this configuration.
     *
     * @return A new builder.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Mutable builder for {@link SessionConfiguration}. Fields not set explicitly are zero,
     * {@code false} or {@code null} unless the builder was seeded from an existing configuration.
     */
    public static final class Builder {
        private int collectionIntervalSeconds;
        private int useFixedSeed;
        private int mainLoopIterations;
        private String destinationDirectory;
        private String configDirectory;
        private String perfPath;
        private int samplingPeriod;
        private int sampleDurationSeconds;
        private boolean onlyDebugBuild;
        private boolean hardwireCpus;
        private int hardwireCpusMaxDurationSeconds;
        private int maxUnprocessedProfiles;
        private boolean stackProfile;
        private boolean collectCpuUtilization;
        private boolean collectChargingState;
        private boolean collectBooting;
        private boolean collectCameraActive;
        private int process;
        private boolean useElfSymbolizer;
        private boolean sendToTelemetryQueue;

        public Builder() {
        }

        private Builder(final SessionConfiguration source) {
            this.collectionIntervalSeconds = source.collectionIntervalSeconds;
            this.useFixedSeed = source.useFixedSeed;
            this.mainLoopIterations = source.mainLoopIterations;
            this.destinationDirectory = source.destinationDirectory;
            this.configDirectory = source.configDirectory;
            this.perfPath = source.perfPath;
            this.samplingPeriod = source.samplingPeriod;
            this.sampleDurationSeconds = source.sampleDurationSeconds;
            this.onlyDebugBuild = source.onlyDebugBuild;
            this.hardwireCpus = source.hardwireCpus;
            this.hardwireCpusMaxDurationSeconds = source.hardwireCpusMaxDurationSeconds;
            this.maxUnprocessedProfiles = source.maxUnprocessedProfiles;
            this.stackProfile = source.stackProfile;
            this.collectCpuUtilization = source.collectCpuUtilization;
            this.collectChargingState = source.collectChargingState;
            this.collectBooting = source.collectBooting;
            this.collectCameraActive = source.collectCameraActive;
            this.process = source.process;
            this.useElfSymbolizer = source.useElfSymbolizer;
            this.sendToTelemetryQueue = source.sendToTelemetryQueue;
        }

        public Builder collectionIntervalSeconds(final int value) {
            this.collectionIntervalSeconds = value;
            return this;
        }

        public Builder useFixedSeed(final int value) {
            this.useFixedSeed = value;
            return this;
        }

        public Builder mainLoopIterations(final int value) {
            this.mainLoopIterations = value;
            return this;
        }

        public Builder destinationDirectory(final String value) {
            this.destinationDirectory = value;
            return this;
        }

        public Builder configDirectory(final String value) {
            this.configDirectory = value;
            return this;
        }

        public Builder perfPath(final String value) {
            this.perfPath = value;
            return this;
        }

        public Builder samplingPeriod(final int value) {
            this.samplingPeriod = value;
            return this;
        }

        public Builder sampleDurationSeconds(final int value) {
            this.sampleDurationSeconds = value;
            return this;
        }

        public Builder onlyDebugBuild(final boolean value) {
            this.onlyDebugBuild = value;
            return this;
        }

        public Builder hardwireCpus(final boolean value) {
            this.hardwireCpus = value;
            return this;
        }

        public Builder hardwireCpusMaxDurationSeconds(final int value) {
            this.hardwireCpusMaxDurationSeconds = value;
            return this;
        }

        public Builder maxUnprocessedProfiles(final int value) {
            this.maxUnprocessedProfiles = value;
            return this;
        }

        public Builder stackProfile(final boolean value) {
            this.stackProfile = value;
            return this;
        }

        public Builder collectCpuUtilization(final boolean value) {
            this.collectCpuUtilization = value;
            return this;
        }

        public Builder collectChargingState(final boolean value) {
            this.collectChargingState = value;
            return this;
        }

        public Builder collectBooting(final boolean value) {
            this.collectBooting = value;
            return this;
        }

        public Builder collectCameraActive(final boolean value) {
            this.collectCameraActive = value;
            return this;
        }

        public Builder process(final int value) {
            this.process = value;
            return this;
        }

        public Builder useElfSymbolizer(final boolean value) {
            this.useElfSymbolizer = value;
            return this;
        }

        public Builder sendToTelemetryQueue(final boolean value) {
            this.sendToTelemetryQueue = value;
            return this;
        }

        public SessionConfiguration build() {
            return new SessionConfiguration(
                collectionIntervalSeconds,
                useFixedSeed,
                mainLoopIterations,
                destinationDirectory,
                configDirectory,
                perfPath,
                samplingPeriod,
                sampleDurationSeconds,
                onlyDebugBuild,
                hardwireCpus,
                hardwireCpusMaxDurationSeconds,
                maxUnprocessedProfiles,
                stackProfile,
                collectCpuUtilization,
                collectChargingState,
                collectBooting,
                collectCameraActive,
                process,
                useElfSymbolizer,
                sendToTelemetryQueue
            );
        }
    }
}
