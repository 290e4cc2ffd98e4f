package org.profd.cli.commands.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.profd.junit.extensions.logging.LogWatchExtension;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class NodeRunCommandTest {

    private final Config base = ConfigFactory.parseString("node.http { host = \"127.0.0.1\", port = 8081 }");

    @Test
    void keepsConfiguredEndpointWithoutOverrides() {
        final Config result = NodeRunCommand.withOverrides(base, null, null);

        assertThat(result.getString("node.http.host")).isEqualTo("127.0.0.1");
        assertThat(result.getInt("node.http.port")).isEqualTo(8081);
    }

    @Test
    void appliesHostAndPortOverrides() {
        final Config result = NodeRunCommand.withOverrides(base, "0.0.0.0", 0);

        assertThat(result.getString("node.http.host")).isEqualTo("0.0.0.0");
        assertThat(result.getInt("node.http.port")).isZero();
    }

    @Test
    void portOverrideLeavesHostUntouched() {
        final Config result = NodeRunCommand.withOverrides(base, null, 9100);

        assertThat(result.getString("node.http.host")).isEqualTo("127.0.0.1");
        assertThat(result.getInt("node.http.port")).isEqualTo(9100);
    }
}
