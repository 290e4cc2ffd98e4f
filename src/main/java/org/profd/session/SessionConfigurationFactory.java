package org.profd.session;

import org.profd.api.codec.IConfigCodec;
import org.profd.api.contracts.ProfilingConfig;
import org.profd.api.errors.ConfigDecodeException;

import java.util.Objects;

/**
 * Builds session configurations from the two start entry points.
 * <p>
 * Both paths start from the process defaults. Nothing from a previous session survives into
 * the result, including the telemetry routing flag.
 */
public final class SessionConfigurationFactory {

    private final SessionConfiguration defaults;
    private final IConfigCodec codec;

    /**
     * @param defaults The process-wide default configuration.
     * @param codec    The codec used to decode structured blobs.
     */
    public SessionConfigurationFactory(final SessionConfiguration defaults, final IConfigCodec codec) {
        this.defaults = Objects.requireNonNull(defaults, "defaults cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
    }

    public SessionConfiguration defaults() {
        return defaults;
    }

    /**
     * Returns the defaults with duration, interval and iteration count replaced. No range
     * validation is applied.
     *
     * @param durationSeconds Length of one sampling round.
     * @param intervalSeconds Pause between two rounds.
     * @param iterations      Number of rounds.
     * @return The resulting configuration.
     */
    public SessionConfiguration fromSimpleParams(final int durationSeconds, final int intervalSeconds, final int iterations) {
        return defaults.toBuilder()
            .sampleDurationSeconds(durationSeconds)
            .collectionIntervalSeconds(intervalSeconds)
            .mainLoopIterations(iterations)
            .build();
    }

    /**
     * Decodes a structured blob and merges every field it sets over the defaults.
     *
     * @param blob The encoded {@link ProfilingConfig}.
     * @return The resulting configuration.
     * @throws ConfigDecodeException if the blob cannot be decoded.
     */
    public SessionConfiguration fromStructuredBlob(final byte[] blob) throws ConfigDecodeException {
        if (blob == null) {
            throw new ConfigDecodeException("Configuration blob is missing");
        }
        return merge(codec.decode(blob));
    }

    /**
     * Overrides a default field only where the message explicitly sets it.
     *
     * @param proto The decoded message.
     * @return The merged configuration.
     */
    public SessionConfiguration merge(final ProfilingConfig proto) {
        final SessionConfiguration.Builder builder = defaults.toBuilder();
        if (proto.hasCollectionIntervalInS()) {
            builder.collectionIntervalSeconds(proto.getCollectionIntervalInS());
        }
        if (proto.hasUseFixedSeed()) {
            builder.useFixedSeed(proto.getUseFixedSeed());
        }
        if (proto.hasMainLoopIterations()) {
            builder.mainLoopIterations(proto.getMainLoopIterations());
        }
        if (proto.hasDestinationDirectory()) {
            builder.destinationDirectory(proto.getDestinationDirectory());
        }
        if (proto.hasConfigDirectory()) {
            builder.configDirectory(proto.getConfigDirectory());
        }
        if (proto.hasPerfPath()) {
            builder.perfPath(proto.getPerfPath());
        }
        if (proto.hasSamplingPeriod()) {
            builder.samplingPeriod(proto.getSamplingPeriod());
        }
        if (proto.hasSampleDurationInS()) {
            builder.sampleDurationSeconds(proto.getSampleDurationInS());
        }
        if (proto.hasOnlyDebugBuild()) {
            builder.onlyDebugBuild(proto.getOnlyDebugBuild());
        }
        if (proto.hasHardwireCpus()) {
            builder.hardwireCpus(proto.getHardwireCpus());
        }
        if (proto.hasHardwireCpusMaxDurationInS()) {
            builder.hardwireCpusMaxDurationSeconds(proto.getHardwireCpusMaxDurationInS());
        }
        if (proto.hasMaxUnprocessedProfiles()) {
            builder.maxUnprocessedProfiles(proto.getMaxUnprocessedProfiles());
        }
        if (proto.hasStackProfile()) {
            builder.stackProfile(proto.getStackProfile());
        }
        if (proto.hasCollectCpuUtilization()) {
            builder.collectCpuUtilization(proto.getCollectCpuUtilization());
        }
        if (proto.hasCollectChargingState()) {
            builder.collectChargingState(proto.getCollectChargingState());
        }
        if (proto.hasCollectBooting()) {
            builder.collectBooting(proto.getCollectBooting());
        }
        if (proto.hasCollectCameraActive()) {
            builder.collectCameraActive(proto.getCollectCameraActive());
        }
        if (proto.hasProcess()) {
            builder.process(proto.getProcess());
        }
        if (proto.hasUseElfSymbolizer()) {
            builder.useElfSymbolizer(proto.getUseElfSymbolizer());
        }
        if (proto.hasSendToTelemetryQueue()) {
            builder.sendToTelemetryQueue(proto.getSendToTelemetryQueue());
        }
        return builder.build();
    }
}
