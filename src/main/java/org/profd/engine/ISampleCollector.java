package org.profd.engine;

import org.profd.api.engine.IArtifact;
import org.profd.session.CancellationToken;
import org.profd.session.SessionConfiguration;

import java.util.Optional;

/**
 * Performs one sampling round for {@link RoundBasedSamplingEngine}.
 */
public interface ISampleCollector {

    /**
     * Collects one round of samples.
     *
     * @param configuration The session configuration.
     * @param iteration     Zero-based round number within the session.
     * @param token         The session's cancellation token.
     * @return The produced artifact, or empty if the round produced nothing worth delivering.
     * @throws SampleCollectionException if the round failed.
     * @throws InterruptedException      if the calling thread was interrupted.
     */
    Optional<IArtifact> collect(SessionConfiguration configuration, int iteration, CancellationToken token)
        throws SampleCollectionException, InterruptedException;
}
