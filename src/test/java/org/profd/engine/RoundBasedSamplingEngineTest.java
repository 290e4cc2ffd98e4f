package org.profd.engine;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.profd.api.contracts.SampleRecord;
import org.profd.api.engine.EngineOutcome;
import org.profd.api.engine.IArtifact;
import org.profd.junit.extensions.logging.ExpectLog;
import org.profd.junit.extensions.logging.LogLevel;
import org.profd.junit.extensions.logging.LogWatchExtension;
import org.profd.session.CancellationToken;
import org.profd.session.SessionConfiguration;
import org.profd.session.TestConfigurations;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class RoundBasedSamplingEngineTest {

    private final CancellationToken token = new CancellationToken();
    private final List<IArtifact> handled = new ArrayList<>();

    private static SessionConfiguration rounds(final int iterations, final int intervalSeconds) {
        return TestConfigurations.defaults().toBuilder()
            .mainLoopIterations(iterations)
            .collectionIntervalSeconds(intervalSeconds)
            .build();
    }

    private static Optional<IArtifact> record(final int iteration) {
        return Optional.of(new ProtobufArtifact(SampleRecord.newBuilder().setIteration(iteration).build()));
    }

    private EngineOutcome run(final ISampleCollector collector, final SessionConfiguration configuration) {
        return new RoundBasedSamplingEngine(collector).run(configuration, token, (artifact, cfg) -> handled.add(artifact));
    }

    @Test
    void runsConfiguredNumberOfRounds() {
        final EngineOutcome outcome = run((cfg, iteration, t) -> record(iteration), rounds(3, 0));

        assertThat(outcome).isEqualTo(EngineOutcome.SUCCESS);
        assertThat(handled).hasSize(3);
    }

    @Test
    void negativeIterationCountRunsNoRound() {
        final EngineOutcome outcome = run((cfg, iteration, t) -> record(iteration), rounds(-1, 0));

        assertThat(outcome).isEqualTo(EngineOutcome.SUCCESS);
        assertThat(handled).isEmpty();
    }

    @Test
    @Timeout(value = 2, unit = TimeUnit.SECONDS)
    void doesNotPauseAfterFinalRound() {
        final EngineOutcome outcome = run((cfg, iteration, t) -> record(iteration), rounds(1, 3600));

        assertThat(outcome).isEqualTo(EngineOutcome.SUCCESS);
        assertThat(handled).hasSize(1);
    }

    @Test
    void zeroIterationsRunsUntilStopped() {
        final EngineOutcome outcome = run((cfg, iteration, t) -> {
            if (iteration == 4) {
                t.requestStop();
            }
            return record(iteration);
        }, rounds(0, 0));

        assertThat(outcome).isEqualTo(EngineOutcome.INTERRUPTED);
        assertThat(handled).hasSize(5);
    }

    @Test
    void emptyRoundDeliversNothing() {
        final EngineOutcome outcome = run((cfg, iteration, t) -> Optional.empty(), rounds(2, 0));

        assertThat(outcome).isEqualTo(EngineOutcome.SUCCESS);
        assertThat(handled).isEmpty();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Sampling round 1 failed: sampler exited with 1")
    void nonFatalFailureSkipsRound() {
        final EngineOutcome outcome = run((cfg, iteration, t) -> {
            if (iteration == 1) {
                throw new SampleCollectionException("sampler exited with 1", false);
            }
            return record(iteration);
        }, rounds(3, 0));

        assertThat(outcome).isEqualTo(EngineOutcome.SUCCESS);
        assertThat(handled).hasSize(2);
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Sampling round 0 failed fatally: .*")
    void fatalFailureEndsRun() {
        final EngineOutcome outcome = run((cfg, iteration, t) -> {
            throw new SampleCollectionException("no sampler binary", true);
        }, rounds(3, 0));

        assertThat(outcome).isEqualTo(EngineOutcome.FAILURE);
        assertThat(handled).isEmpty();
    }

    @Test
    void stopRequestedBeforeStartRunsNoRound() {
        token.requestStop();

        final EngineOutcome outcome = run((cfg, iteration, t) -> record(iteration), rounds(3, 0));

        assertThat(outcome).isEqualTo(EngineOutcome.INTERRUPTED);
        assertThat(handled).isEmpty();
    }
}
