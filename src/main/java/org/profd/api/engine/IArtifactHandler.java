package org.profd.api.engine;

import org.profd.session.SessionConfiguration;

/**
 * Callback invoked by a sampling engine for every artifact it produces.
 */
@FunctionalInterface
public interface IArtifactHandler {

    /**
     * Hands an artifact off for delivery.
     *
     * @param artifact      The produced artifact.
     * @param configuration The configuration of the session that produced it.
     * @return {@code true} if the artifact was delivered, {@code false} if delivery failed.
     */
    boolean handle(IArtifact artifact, SessionConfiguration configuration);
}
