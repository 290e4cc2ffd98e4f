package org.profd.api.engine;

import org.profd.session.CancellationToken;
import org.profd.session.SessionConfiguration;

/**
 * The sampling engine performs the session loop: it collects samples, passes every produced
 * artifact to the supplied handler and paces itself through the cancellation token.
 * <p>
 * Cancellation is cooperative. An engine must call {@link CancellationToken#shouldStop()} after
 * every unit of work and must use {@link CancellationToken#sleep(long)} as its only suspension
 * point, otherwise a stop request cannot reach it.
 */
public interface ISamplingEngine {

    /**
     * Runs a complete session on the calling thread.
     *
     * @param configuration The session configuration.
     * @param token         The token to poll and sleep on.
     * @param handler       Receives every produced artifact.
     * @return How the run ended.
     */
    EngineOutcome run(SessionConfiguration configuration, CancellationToken token, IArtifactHandler handler);
}
