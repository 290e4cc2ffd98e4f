package org.profd.session;

import com.typesafe.config.ConfigFactory;

/**
 * Configurations for tests, seeded from the shipped defaults.
 */
public final class TestConfigurations {

    private TestConfigurations() {
    }

    public static SessionConfiguration defaults() {
        return SessionConfiguration.fromConfig(ConfigFactory.parseResources("reference.conf").getConfig("profd.session.defaults"));
    }

    /**
     * Defaults that store artifacts locally in the given directory and never pause between rounds.
     */
    public static SessionConfiguration local(final String destinationDirectory) {
        return defaults().toBuilder()
            .destinationDirectory(destinationDirectory)
            .sendToTelemetryQueue(false)
            .collectionIntervalSeconds(0)
            .build();
    }
}
