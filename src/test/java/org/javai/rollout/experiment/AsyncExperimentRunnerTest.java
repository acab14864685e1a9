package org.javai.rollout.experiment;

import org.javai.rollout.ComparisonResult;
import org.javai.rollout.bucketing.Sampler;
import org.javai.rollout.config.InMemoryConfigProvider;
import org.javai.rollout.config.RolloutSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class AsyncExperimentRunnerTest {

    private RolloutSettings settings;
    private List<ComparisonResult> published;
    private AtomicInteger candidateCalls;
    private ExperimentRunner runner;

    @BeforeEach
    void setUp() {
        settings = new RolloutSettings(new InMemoryConfigProvider());
        settings.setPercentage(100);
        published = new ArrayList<>();
        candidateCalls = new AtomicInteger();
        runner = new ExperimentRunner(settings, published::add, Sampler.seeded(1), new ExperimentExecutor());
    }

    private CompletableFuture<String> candidate(CompletableFuture<String> future) {
        candidateCalls.incrementAndGet();
        return future;
    }

    @Test
    void runAsync_completedStages_returnsControlAndPublishes() throws Exception {
        CompletableFuture<String> result = runner.runAsync(AsyncExperiment.of("exp",
                () -> CompletableFuture.completedFuture("A"),
                () -> candidate(CompletableFuture.completedFuture("A"))));

        assertThat(result.get()).isEqualTo("A");
        assertThat(published).hasSize(1);
        assertThat(published.get(0).matched()).isTrue();
    }

    @Test
    void runAsync_disabled_neverInvokesCandidate() throws Exception {
        settings.enableRollout(false);

        CompletableFuture<String> result = runner.runAsync(AsyncExperiment.of("exp",
                () -> CompletableFuture.completedFuture("A"),
                () -> candidate(CompletableFuture.completedFuture("B"))));

        assertThat(result.get()).isEqualTo("A");
        assertThat(candidateCalls).hasValue(0);
        assertThat(published).isEmpty();
    }

    @Test
    void runAsync_waitsForBothBeforePublishing() throws Exception {
        CompletableFuture<String> control = new CompletableFuture<>();
        CompletableFuture<String> candidate = new CompletableFuture<>();

        CompletableFuture<String> result = runner.runAsync(AsyncExperiment.of("exp", () -> control, () -> candidate));

        control.complete("A");
        assertThat(result).isNotDone();
        assertThat(published).isEmpty();

        candidate.complete("B");
        assertThat(result.get()).isEqualTo("A");
        assertThat(published).hasSize(1);
        assertThat(published.get(0).matched()).isFalse();
    }

    @Test
    void runAsync_candidateFails_controlValueReturned() throws Exception {
        CompletableFuture<String> result = runner.runAsync(AsyncExperiment.of("exp",
                () -> CompletableFuture.completedFuture("A"),
                () -> CompletableFuture.failedFuture(new IllegalStateException("candidate broke"))));

        assertThat(result.get()).isEqualTo("A");
        ComparisonResult comparison = published.get(0);
        assertThat(comparison.candidateFailed()).isTrue();
        assertThat(comparison.candidate().error()).hasValueSatisfying(error ->
                assertThat(error.type()).isEqualTo(IllegalStateException.class.getName()));
    }

    @Test
    void runAsync_candidateSupplierThrows_treatedAsFailure() throws Exception {
        CompletableFuture<String> result = runner.runAsync(AsyncExperiment.<String>of("exp",
                () -> CompletableFuture.completedFuture("A"),
                () -> {
                    throw new IllegalStateException("never started");
                }));

        assertThat(result.get()).isEqualTo("A");
        assertThat(published.get(0).candidate().failed()).isTrue();
    }

    @Test
    void runAsync_candidateSupplierThrowsError_stillContained() throws Exception {
        CompletableFuture<String> result = runner.runAsync(AsyncExperiment.<String>of("exp",
                () -> CompletableFuture.completedFuture("A"),
                () -> {
                    throw new AssertionError("candidate bug");
                }));

        assertThat(result.get()).isEqualTo("A");
        assertThat(published).hasSize(1);
        assertThat(published.get(0).candidate().error())
                .hasValueSatisfying(error -> assertThat(error.type()).isEqualTo(AssertionError.class.getName()));
    }

    @Test
    void runAsync_controlFails_sameErrorSurfaced() {
        IllegalStateException failure = new IllegalStateException("control broke");

        CompletableFuture<String> result = runner.runAsync(AsyncExperiment.of("exp",
                () -> CompletableFuture.failedFuture(failure),
                () -> CompletableFuture.completedFuture("B")));

        assertThatThrownBy(result::get)
                .isInstanceOf(ExecutionException.class)
                .cause().isSameAs(failure);
        assertThat(published).hasSize(1);
        assertThat(published.get(0).control().failed()).isTrue();
    }

    @Test
    void runAsync_cancelled_cancelsCandidate() {
        CompletableFuture<String> control = new CompletableFuture<>();
        CompletableFuture<String> candidate = new CompletableFuture<>();

        CompletableFuture<String> result = runner.runAsync(AsyncExperiment.of("exp", () -> control, () -> candidate));
        result.cancel(true);

        assertThat(candidate).isCancelled();
        assertThat(result).isCancelled();
    }

    @Test
    void runAsync_cancelledCandidate_notSurfacedToCaller() throws Exception {
        CompletableFuture<String> candidate = new CompletableFuture<>();

        CompletableFuture<String> result = runner.runAsync(AsyncExperiment.of("exp",
                () -> CompletableFuture.completedFuture("A"), () -> candidate));
        candidate.cancel(true);

        assertThat(result.get()).isEqualTo("A");
        assertThat(published.get(0).candidate().failed()).isTrue();
    }

    @Test
    void runAsyncFor_publishingDisabled_publishesNothing() throws Exception {
        settings.setPublishResults(false);

        CompletableFuture<String> result = runner.runAsyncFor(1, AsyncExperiment.of("exp",
                () -> CompletableFuture.completedFuture("A"),
                () -> candidate(CompletableFuture.completedFuture("A"))));

        assertThat(result.get()).isEqualTo("A");
        assertThat(candidateCalls).hasValue(1);
        assertThat(published).isEmpty();
    }
}
