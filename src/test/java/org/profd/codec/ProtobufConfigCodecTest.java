package org.profd.codec;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.profd.api.contracts.ProfilingConfig;
import org.profd.api.errors.ConfigDecodeException;
import org.profd.session.SessionConfiguration;
import org.profd.session.TestConfigurations;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ProtobufConfigCodecTest {

    private final ProtobufConfigCodec codec = new ProtobufConfigCodec();

    @Test
    void encodeSetsEveryField() throws ConfigDecodeException {
        final ProfilingConfig decoded = codec.decode(codec.encode(TestConfigurations.defaults()));

        assertThat(decoded.getAllFields()).hasSize(ProfilingConfig.getDescriptor().getFields().size());
    }

    @Test
    void decodeKeepsPresenceOfZeroValues() throws ConfigDecodeException {
        final byte[] blob = ProfilingConfig.newBuilder().setMainLoopIterations(0).build().toByteArray();

        final ProfilingConfig decoded = codec.decode(blob);

        assertThat(decoded.hasMainLoopIterations()).isTrue();
        assertThat(decoded.hasSampleDurationInS()).isFalse();
    }

    @Test
    void decodeRejectsTruncatedMessage() {
        final SessionConfiguration configuration = TestConfigurations.defaults();
        final byte[] full = codec.encode(configuration);
        final byte[] truncated = Arrays.copyOf(full, full.length - 1);

        assertThatThrownBy(() -> codec.decode(truncated))
            .isInstanceOf(ConfigDecodeException.class)
            .hasMessageStartingWith("Malformed profiling configuration");
    }
}
