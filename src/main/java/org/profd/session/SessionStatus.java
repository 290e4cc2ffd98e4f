package org.profd.session;

import org.profd.api.engine.EngineOutcome;
import org.profd.api.monitoring.OperationalError;

import java.util.List;

/**
 * Snapshot of the session controller at a specific point in time.
 *
 * @param state              The controller state.
 * @param configuration      The configuration of the current or most recent session.
 * @param nextSequence       Sequence number the next locally stored artifact will get.
 * @param sessionsStarted    Number of sessions started since the process came up.
 * @param artifactsDelivered Artifacts delivered successfully, over all sessions.
 * @param artifactsFailed    Artifacts that could not be serialized or delivered, over all sessions.
 * @param lastOutcome        Outcome of the most recent finished session, or {@code null} if none finished yet.
 * @param errors             Recorded operational errors, oldest first.
 */
public record SessionStatus(
    SessionState state,
    SessionConfiguration configuration,
    int nextSequence,
    long sessionsStarted,
    long artifactsDelivered,
    long artifactsFailed,
    EngineOutcome lastOutcome,
    List<OperationalError> errors
) {
}
