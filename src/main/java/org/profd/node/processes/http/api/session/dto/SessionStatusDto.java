package org.profd.node.processes.http.api.session.dto;

import org.profd.api.monitoring.OperationalError;
import org.profd.session.SessionConfiguration;
import org.profd.session.SessionStatus;

import java.util.List;

/**
 * Response DTO for the session status endpoint.
 *
 * @param state              "IDLE" or "RUNNING"
 * @param configuration      Configuration of the current or most recent session
 * @param nextSequence       Sequence number of the next locally stored artifact
 * @param sessionsStarted    Sessions started since the process came up
 * @param artifactsDelivered Artifacts delivered over all sessions
 * @param artifactsFailed    Artifacts that failed over all sessions
 * @param lastOutcome        Outcome of the most recent finished session, or {@code null}
 * @param errors             Recorded operational errors, oldest first
 */
public record SessionStatusDto(
    String state,
    SessionConfiguration configuration,
    int nextSequence,
    long sessionsStarted,
    long artifactsDelivered,
    long artifactsFailed,
    String lastOutcome,
    List<ErrorDto> errors
) {

    /**
     * @param timestamp ISO-8601 timestamp
     * @param errorType Error category
     * @param message   Human-readable message
     * @param details   Additional context, may be {@code null}
     */
    public record ErrorDto(String timestamp, String errorType, String message, String details) {
        static ErrorDto from(final OperationalError error) {
            return new ErrorDto(error.timestamp().toString(), error.errorType(), error.message(), error.details());
        }
    }

    public static SessionStatusDto from(final SessionStatus status) {
        return new SessionStatusDto(
            status.state().name(),
            status.configuration(),
            status.nextSequence(),
            status.sessionsStarted(),
            status.artifactsDelivered(),
            status.artifactsFailed(),
            status.lastOutcome() == null ? null : status.lastOutcome().name(),
            status.errors().stream().map(ErrorDto::from).toList()
        );
    }
}
