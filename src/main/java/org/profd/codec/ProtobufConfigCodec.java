package org.profd.codec;

import com.google.protobuf.InvalidProtocolBufferException;
import org.profd.api.codec.IConfigCodec;
import org.profd.api.contracts.ProfilingConfig;
import org.profd.api.errors.ConfigDecodeException;
import org.profd.session.SessionConfiguration;

/**
 * {@link IConfigCodec} backed by the {@link ProfilingConfig} Protocol Buffers message.
 * Proto2 optional fields carry presence, which is what the structured merge relies on.
 */
public class ProtobufConfigCodec implements IConfigCodec {

    @Override
    public ProfilingConfig decode(final byte[] blob) throws ConfigDecodeException {
        try {
            return ProfilingConfig.parseFrom(blob);
        } catch (final InvalidProtocolBufferException e) {
            throw new ConfigDecodeException("Malformed profiling configuration: " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] encode(final SessionConfiguration configuration) {
        return toProto(configuration).toByteArray();
    }

    /**
     * Converts a configuration into a message with every field set.
     *
     * @param configuration The configuration to convert.
     * @return The message.
     */
    public static ProfilingConfig toProto(final SessionConfiguration configuration) {
        return ProfilingConfig.newBuilder()
            .setCollectionIntervalInS(configuration.collectionIntervalSeconds())
            .setUseFixedSeed(configuration.useFixedSeed())
            .setMainLoopIterations(configuration.mainLoopIterations())
            .setDestinationDirectory(configuration.destinationDirectory())
            .setConfigDirectory(configuration.configDirectory())
            .setPerfPath(configuration.perfPath())
            .setSamplingPeriod(configuration.samplingPeriod())
            .setSampleDurationInS(configuration.sampleDurationSeconds())
            .setOnlyDebugBuild(configuration.onlyDebugBuild())
            .setHardwireCpus(configuration.hardwireCpus())
            .setHardwireCpusMaxDurationInS(configuration.hardwireCpusMaxDurationSeconds())
            .setMaxUnprocessedProfiles(configuration.maxUnprocessedProfiles())
            .setStackProfile(configuration.stackProfile())
            .setCollectCpuUtilization(configuration.collectCpuUtilization())
            .setCollectChargingState(configuration.collectChargingState())
            .setCollectBooting(configuration.collectBooting())
            .setCollectCameraActive(configuration.collectCameraActive())
            .setProcess(configuration.process())
            .setUseElfSymbolizer(configuration.useElfSymbolizer())
            .setSendToTelemetryQueue(configuration.sendToTelemetryQueue())
            .build();
    }
}
