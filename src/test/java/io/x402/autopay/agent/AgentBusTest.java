package io.x402.autopay.agent;

import io.x402.autopay.config.AgentConfig;
import io.x402.autopay.model.ChallengeDetails;
import io.x402.autopay.store.InMemoryStateStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static io.x402.autopay.TestChallenges.TEST_ITERATIONS;
import static io.x402.autopay.TestChallenges.challenge;
import static org.junit.jupiter.api.Assertions.*;

class AgentBusTest {

    private final CountDownLatch release = new CountDownLatch(1);
    private AgentBus bus;

    @AfterEach
    void tearDown() {
        release.countDown();
        if (bus != null) {
            bus.close();
        }
    }

    private AgentBus busWith(ApprovalPrompt prompt, Duration timeout) {
        AgentConfig config = AgentConfig.builder().keyDerivationIterations(TEST_ITERATIONS).build();
        PaymentAgent agent = new PaymentAgent(new InMemoryStateStore(), config, prompt, null);
        bus = new AgentBus(agent, timeout);
        return bus;
    }

    /** Prompt that holds the agent thread until the test releases it. */
    private ApprovalPrompt blockingPrompt() {
        return new ApprovalPrompt() {
            @Override
            public Integer open(ChallengeDetails challenge) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            }

            @Override
            public void close(Integer windowId) {
            }
        };
    }

    @Test
    void repliesArriveOnTheCallersFuture() throws Exception {
        AgentBus.Connection connection = busWith(ApprovalPrompt.NONE, Duration.ofSeconds(5)).connect();

        AgentStateView state = connection.send(new AgentCommand.GetState()).get(5, TimeUnit.SECONDS);

        assertNull(state.wallet());
        assertTrue(state.history().isEmpty());
    }

    @Test
    void slowCommandsTimeOut() {
        AgentBus.Connection connection = busWith(blockingPrompt(), Duration.ofMillis(200)).connect();

        CompletableFuture<ChallengeResolution> reply =
            connection.send(new AgentCommand.SubmitChallenge(challenge("c-1", 0.50), null));

        ExecutionException failure = assertThrows(ExecutionException.class, () -> reply.get(5, TimeUnit.SECONDS));
        assertInstanceOf(TimeoutException.class, failure.getCause());
    }

    @Test
    void disconnectCancelsWhatIsInFlight() throws Exception {
        AgentBus.Connection connection = busWith(blockingPrompt(), Duration.ofSeconds(30)).connect();
        CompletableFuture<ChallengeResolution> blocked =
            connection.send(new AgentCommand.SubmitChallenge(challenge("c-1", 0.50), null));
        CompletableFuture<AgentStateView> queued = connection.send(new AgentCommand.GetState());

        connection.disconnect();

        assertFalse(connection.isConnected());
        assertThrows(CancellationException.class, () -> blocked.get(1, TimeUnit.SECONDS));
        assertThrows(CancellationException.class, () -> queued.get(1, TimeUnit.SECONDS));
        assertThrows(CancellationException.class,
            () -> connection.send(new AgentCommand.GetState()).get(1, TimeUnit.SECONDS));
    }

    @Test
    void disconnectCancelsTrackedWaits() {
        AgentBus.Connection connection = busWith(ApprovalPrompt.NONE, Duration.ofSeconds(5)).connect();
        CompletableFuture<ChallengeResolution> decision = connection.track(new CompletableFuture<>());
        CompletableFuture<ChallengeResolution> answered = connection.track(new CompletableFuture<>());
        answered.complete(null);

        connection.disconnect();

        assertTrue(decision.isCancelled());
        assertFalse(answered.isCancelled());
        assertTrue(connection.track(new CompletableFuture<>()).isCancelled());
    }

    @Test
    void resolutionsReachRegisteredListeners() throws Exception {
        AgentBus.Connection connection = busWith(ApprovalPrompt.NONE, Duration.ofSeconds(5)).connect();
        CompletableFuture<ChallengeResolution> heard = new CompletableFuture<>();
        connection.onResolution((challengeId, resolution) -> heard.complete(resolution));

        ChallengeResolution submitted = connection.send(new AgentCommand.SubmitChallenge(challenge("c-1", 0.50), null))
            .get(5, TimeUnit.SECONDS);
        assertEquals(ChallengeResolution.Action.PENDING, submitted.action());

        DecisionResult result = connection.send(
            new AgentCommand.ResolvePendingChallenge("c-1", PromptDecision.deny())).get(5, TimeUnit.SECONDS);

        assertEquals(DecisionResult.Status.DENIED, result.status());
        assertEquals(ChallengeResolution.Action.DENY, heard.get(5, TimeUnit.SECONDS).action());
    }
}
