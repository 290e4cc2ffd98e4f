package org.profd.session;

import org.profd.api.engine.EngineOutcome;
import org.profd.api.engine.IArtifact;
import org.profd.api.engine.ISamplingEngine;
import org.profd.api.errors.AlreadyRunningException;
import org.profd.api.errors.ConfigDecodeException;
import org.profd.api.errors.DeliveryException;
import org.profd.api.errors.NotRunningException;
import org.profd.api.errors.SerializationException;
import org.profd.api.monitoring.IMonitorable;
import org.profd.api.monitoring.OperationalError;
import org.profd.delivery.DeliverySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the single profiling session of the process.
 * <p>
 * At most one session runs at a time. Starting a session resets the cancellation token, replaces
 * the configuration and launches a dedicated, detached thread that runs the sampling engine. A
 * stop request only raises the token's flag; the session thread clears the running flag itself,
 * under the session lock, as its last act. A new start is therefore rejected until the previous
 * thread has fully finished.
 * <p>
 * The session lock guards state and configuration only. Artifact delivery runs outside of it.
 * <p>
 * Per-artifact failures are transient: they are logged, counted and recorded as
 * {@link OperationalError}s but never end the session. Use {@link #getErrors()} or
 * {@link #dump()} to inspect them.
 */
public class SessionController implements IMonitorable {

    private static final Logger LOG = LoggerFactory.getLogger(SessionController.class);
    private static final int DEFAULT_MAX_ERRORS = 10000;

    private final SessionConfigurationFactory configurationFactory;
    private final ISamplingEngine engine;
    private final DeliverySink deliverySink;
    private final int maxErrors;

    private final Object lock = new Object();
    private final CancellationToken token = new CancellationToken();

    // Guarded by lock.
    private boolean running = false;
    private SessionConfiguration configuration;
    private long sessionsStarted = 0;
    private EngineOutcome lastOutcome;

    private final AtomicLong artifactsDelivered = new AtomicLong();
    private final AtomicLong artifactsFailed = new AtomicLong();
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    public SessionController(final SessionConfigurationFactory configurationFactory,
                             final ISamplingEngine engine,
                             final DeliverySink deliverySink) {
        this(configurationFactory, engine, deliverySink, DEFAULT_MAX_ERRORS);
    }

    /**
     * @param configurationFactory Builds configurations for both start entry points.
     * @param engine               The sampling engine run by every session.
     * @param deliverySink         Receives every artifact the engine produces.
     * @param maxErrors            Number of operational errors kept before the oldest are dropped.
     */
    public SessionController(final SessionConfigurationFactory configurationFactory,
                             final ISamplingEngine engine,
                             final DeliverySink deliverySink,
                             final int maxErrors) {
        this.configurationFactory = Objects.requireNonNull(configurationFactory, "configurationFactory cannot be null");
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
        this.deliverySink = Objects.requireNonNull(deliverySink, "deliverySink cannot be null");
        this.maxErrors = maxErrors;
        this.configuration = configurationFactory.defaults();
    }

    /**
     * Starts a session from the default configuration with duration, interval and iteration
     * count replaced. Values are not range checked.
     *
     * @param durationSeconds Length of one sampling round.
     * @param intervalSeconds Pause between two rounds.
     * @param iterations      Number of rounds, {@code 0} to run until stopped.
     * @throws AlreadyRunningException if a session is running.
     */
    public void startSimple(final int durationSeconds, final int intervalSeconds, final int iterations) {
        start(configurationFactory.fromSimpleParams(durationSeconds, intervalSeconds, iterations));
    }

    /**
     * Starts a session from an encoded structured configuration merged over the defaults.
     * The blob is decoded before the session state is touched.
     *
     * @param encodedConfig The encoded configuration.
     * @throws ConfigDecodeException   if the blob is malformed; the controller stays idle.
     * @throws AlreadyRunningException if a session is running.
     */
    public void startStructured(final byte[] encodedConfig) throws ConfigDecodeException {
        start(configurationFactory.fromStructuredBlob(encodedConfig));
    }

    /**
     * Requests the running session to stop. Returns without waiting for the session thread.
     *
     * @throws NotRunningException if no session is running.
     */
    public void stop() {
        synchronized (lock) {
            if (!running) {
                throw new NotRunningException("No active profiling session");
            }
            token.requestStop();
        }
        LOG.info("Stop requested for profiling session #{}", sessionsStartedSnapshot());
    }

    /**
     * Requests the running session to stop if there is one.
     *
     * @return {@code true} if a stop was requested.
     */
    public boolean stopIfRunning() {
        synchronized (lock) {
            if (!running) {
                return false;
            }
            token.requestStop();
            return true;
        }
    }

    /**
     * Returns whether a session is running.
     *
     * @return {@code true} between a successful start and the end of the session thread.
     */
    public boolean isRunning() {
        synchronized (lock) {
            return running;
        }
    }

    /**
     * Returns a snapshot of the controller. Does not mutate state.
     *
     * @return The current status.
     */
    public SessionStatus status() {
        synchronized (lock) {
            return new SessionStatus(
                running ? SessionState.RUNNING : SessionState.IDLE,
                configuration,
                deliverySink.nextSequence(),
                sessionsStarted,
                artifactsDelivered.get(),
                artifactsFailed.get(),
                lastOutcome,
                getErrors()
            );
        }
    }

    /**
     * Renders the status as human readable text for diagnostic surfaces.
     *
     * @return The rendered status.
     */
    public String dump() {
        final SessionStatus status = status();
        final StringBuilder sb = new StringBuilder();
        sb.append("state: ").append(status.state()).append('\n');
        sb.append("sessions started: ").append(status.sessionsStarted()).append('\n');
        sb.append("last outcome: ").append(status.lastOutcome() == null ? "none" : status.lastOutcome()).append('\n');
        sb.append("next sequence: ").append(status.nextSequence()).append('\n');
        sb.append("artifacts delivered: ").append(status.artifactsDelivered()).append('\n');
        sb.append("artifacts failed: ").append(status.artifactsFailed()).append('\n');
        sb.append("configuration: ").append(status.configuration()).append('\n');
        sb.append("errors: ").append(status.errors().size()).append('\n');
        for (final OperationalError error : status.errors()) {
            sb.append("  ").append(error.timestamp()).append(' ')
                .append(error.errorType()).append(": ").append(error.message()).append('\n');
        }
        return sb.toString();
    }

    @Override
    public Map<String, Number> getMetrics() {
        final Map<String, Number> metrics = new LinkedHashMap<>();
        synchronized (lock) {
            metrics.put("running", running ? 1 : 0);
            metrics.put("sessions_started", sessionsStarted);
        }
        metrics.put("artifacts_delivered", artifactsDelivered.get());
        metrics.put("artifacts_failed", artifactsFailed.get());
        metrics.put("next_sequence", deliverySink.nextSequence());
        metrics.put("error_count", errors.size());
        return metrics;
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    @Override
    public boolean isHealthy() {
        return errors.isEmpty();
    }

    private void start(final SessionConfiguration newConfiguration) {
        synchronized (lock) {
            if (running) {
                throw new AlreadyRunningException("Profiling session already active");
            }
            running = true;
            token.reset();
            configuration = newConfiguration;
            final long sessionId = ++sessionsStarted;

            final Thread sessionThread = new Thread(() -> runSession(sessionId, newConfiguration));
            sessionThread.setName("profd-session-" + sessionId);
            sessionThread.setDaemon(true);
            try {
                sessionThread.start();
            } catch (final RuntimeException | OutOfMemoryError e) {
                running = false;
                throw e;
            }
            LOG.info("Profiling session #{} started (duration={}s, interval={}s, iterations={}, telemetry={})",
                sessionId,
                newConfiguration.sampleDurationSeconds(),
                newConfiguration.collectionIntervalSeconds(),
                newConfiguration.mainLoopIterations(),
                newConfiguration.sendToTelemetryQueue());
        }
    }

    private void runSession(final long sessionId, final SessionConfiguration sessionConfiguration) {
        EngineOutcome outcome = EngineOutcome.FAILURE;
        try {
            final EngineOutcome result = engine.run(sessionConfiguration, token, this::handleArtifact);
            if (result != null) {
                outcome = result;
            }
        } catch (final RuntimeException e) {
            LOG.error("Profiling session #{} ended by engine error {}", sessionId, e.getClass().getSimpleName());
            LOG.debug("Exception details:", e);
            recordError("ENGINE_ERROR", "Sampling engine failed", e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            LOG.info("Profiling session #{} finished with outcome {}", sessionId, outcome);
            synchronized (lock) {
                lastOutcome = outcome;
                running = false;
            }
        }
    }

    private boolean handleArtifact(final IArtifact artifact, final SessionConfiguration sessionConfiguration) {
        try {
            deliverySink.deliver(artifact, sessionConfiguration);
            artifactsDelivered.incrementAndGet();
            return true;
        } catch (final SerializationException e) {
            LOG.warn("Failed to serialize artifact: {}", e.getMessage());
            recordError("SERIALIZATION_FAILED", "Failed to serialize artifact", e.getMessage());
        } catch (final DeliveryException e) {
            LOG.warn("Failed artifact delivery ({}): {}", e.getKind(), e.getMessage());
            recordError(e.getKind().name(), "Failed artifact delivery", e.getMessage());
        }
        artifactsFailed.incrementAndGet();
        return false;
    }

    private void recordError(final String errorType, final String message, final String details) {
        errors.add(new OperationalError(Instant.now(), errorType, message, details));
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    private long sessionsStartedSnapshot() {
        synchronized (lock) {
            return sessionsStarted;
        }
    }
}
