package org.profd.engine;

import org.profd.api.engine.EngineOutcome;
import org.profd.api.engine.IArtifact;
import org.profd.api.engine.IArtifactHandler;
import org.profd.api.engine.ISamplingEngine;
import org.profd.session.CancellationToken;
import org.profd.session.SessionConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Sampling engine that runs a fixed number of rounds through an {@link ISampleCollector}.
 * <p>
 * Each round checks the stop flag, collects, hands the artifact off, checks the stop flag again
 * and then sleeps for the collection interval on the cancellation token. No sleep follows the
 * final round. {@code mainLoopIterations == 0} runs until stopped; a negative count runs no round.
 * <p>
 * A non-fatal collection failure skips the round. A fatal one ends the run with
 * {@link EngineOutcome#FAILURE}.
 */
public class RoundBasedSamplingEngine implements ISamplingEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RoundBasedSamplingEngine.class);

    private final ISampleCollector collector;

    public RoundBasedSamplingEngine(final ISampleCollector collector) {
        this.collector = Objects.requireNonNull(collector, "collector cannot be null");
    }

    @Override
    public EngineOutcome run(final SessionConfiguration configuration,
                             final CancellationToken token,
                             final IArtifactHandler handler) {
        final int iterations = configuration.mainLoopIterations();
        try {
            for (int iteration = 0; iterations == 0 || iteration < iterations; iteration++) {
                if (token.shouldStop()) {
                    LOG.debug("Stop observed before round {}", iteration);
                    return EngineOutcome.INTERRUPTED;
                }

                final Optional<IArtifact> artifact;
                try {
                    artifact = collector.collect(configuration, iteration, token);
                } catch (final SampleCollectionException e) {
                    if (e.isFatal()) {
                        LOG.error("Sampling round {} failed fatally: {}", iteration, e.getMessage());
                        LOG.debug("Exception details:", e);
                        return EngineOutcome.FAILURE;
                    }
                    LOG.warn("Sampling round {} failed: {}", iteration, e.getMessage());
                    if (!pace(configuration, token, iteration, iterations)) {
                        return EngineOutcome.INTERRUPTED;
                    }
                    continue;
                }

                if (artifact.isPresent()) {
                    final boolean delivered = handler.handle(artifact.get(), configuration);
                    LOG.debug("Round {} produced {} bytes, delivered={}", iteration, artifact.get().serializedSize(), delivered);
                } else {
                    LOG.debug("Round {} produced no artifact", iteration);
                }

                if (!pace(configuration, token, iteration, iterations)) {
                    return EngineOutcome.INTERRUPTED;
                }
            }
        } catch (final InterruptedException e) {
            LOG.debug("Sampling engine interrupted, shutting down.");
            Thread.currentThread().interrupt();
            return EngineOutcome.INTERRUPTED;
        }
        return EngineOutcome.SUCCESS;
    }

    /**
     * Sleeps between rounds unless this was the final one.
     *
     * @return {@code false} if a stop was observed.
     */
    private boolean pace(final SessionConfiguration configuration, final CancellationToken token,
                         final int iteration, final int iterations) throws InterruptedException {
        if (token.shouldStop()) {
            return false;
        }
        final boolean lastRound = iterations != 0 && iteration + 1 >= iterations;
        if (!lastRound) {
            token.sleep(configuration.collectionIntervalSeconds());
        }
        return !token.shouldStop() || lastRound;
    }
}
