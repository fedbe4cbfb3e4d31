package io.x402.autopay.client;

import com.github.tomakehurst.wiremock.WireMockServer;
import io.x402.autopay.agent.AgentBus;
import io.x402.autopay.agent.AgentCommand;
import io.x402.autopay.agent.AgentStateView;
import io.x402.autopay.agent.ApprovalPrompt;
import io.x402.autopay.agent.PaymentAgent;
import io.x402.autopay.agent.PromptDecision;
import io.x402.autopay.config.AgentConfig;
import io.x402.autopay.model.ChallengeDetails;
import io.x402.autopay.model.PaymentRecord;
import io.x402.autopay.model.PaymentStatus;
import io.x402.autopay.store.InMemoryStateStore;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static io.x402.autopay.TestChallenges.PASSPHRASE;
import static io.x402.autopay.TestChallenges.SELLER;
import static io.x402.autopay.TestChallenges.TEST_ITERATIONS;
import static io.x402.autopay.TestChallenges.TEST_KEY;
import static io.x402.autopay.TestChallenges.USDC_AMOY;
import static org.junit.jupiter.api.Assertions.*;

class X402HttpClientTest {

    static WireMockServer wm;

    AgentBus bus;
    AgentBus.Connection connection;
    DecidingPrompt prompt;

    @BeforeAll
    static void startServer() {
        wm = new WireMockServer(0);
        wm.start();
    }

    @AfterAll
    static void stopServer() { wm.stop(); }

    @BeforeEach
    void setUp() throws Exception {
        wm.resetAll();
        prompt = new DecidingPrompt();
        AgentConfig config = AgentConfig.builder().keyDerivationIterations(TEST_ITERATIONS).build();
        PaymentAgent agent = new PaymentAgent(new InMemoryStateStore(), config, prompt, null);
        bus = new AgentBus(agent, Duration.ofSeconds(5));
        connection = bus.connect();
        prompt.connection = connection;
        connection.send(new AgentCommand.ConfigureWallet(TEST_KEY, PASSPHRASE, 15, null)).get(5, TimeUnit.SECONDS);
    }

    @AfterEach
    void tearDown() {
        connection.close();
        bus.close();
    }

    private static String challengeJson(String id, double amountUsd, String atomic) {
        return "{\"id\":\"" + id + "\",\"amount\":\"" + atomic + "\",\"amountUsd\":" + amountUsd
            + ",\"token\":\"USDC\",\"chainId\":80002,\"seller\":\"" + SELLER + "\",\"tokenAddress\":\""
            + USDC_AMOY + "\"}";
    }

    private void stubPaidResource(String id, double amountUsd, String atomic) {
        wm.stubFor(get(urlEqualTo("/premium"))
            .withHeader("X-PAYMENT", absent())
            .willReturn(aResponse()
                .withStatus(402)
                .withHeader("X-Payment-Challenge", challengeJson(id, amountUsd, atomic))
                .withBody("payment required")));
        wm.stubFor(get(urlEqualTo("/premium"))
            .withHeader("X-PAYMENT", matching(".+"))
            .willReturn(aResponse()
                .withStatus(200)
                .withHeader("X-PAYMENT-RESPONSE", "{\"success\":true,\"transaction\":\"0xfeed\"}")
                .withBody("premium content")));
    }

    private X402HttpClient client(Duration approvalTimeout) {
        return new X402HttpClient(HttpClient.newHttpClient(), connection, approvalTimeout);
    }

    private HttpRequest premium() {
        return HttpRequest.newBuilder(URI.create("http://localhost:" + wm.port() + "/premium")).GET().build();
    }

    private PaymentRecord latestPayment() throws Exception {
        AgentStateView state = connection.send(new AgentCommand.GetState()).get(5, TimeUnit.SECONDS);
        return state.history().get(0);
    }

    @Test
    void paysUnderThresholdAndRecordsSettlement() throws Exception {
        stubPaidResource("c-1", 0.01, "10000");

        HttpResponse<String> response = client(Duration.ofSeconds(5)).send(premium());

        assertEquals(200, response.statusCode());
        assertEquals("premium content", response.body());
        wm.verify(getRequestedFor(urlEqualTo("/premium"))
            .withHeader("X-PAYMENT", matching("^[A-Za-z0-9+/=]+$"))
            .withHeader("X-PAYMENT-ID", equalTo("c-1")));
        PaymentRecord record = latestPayment();
        assertEquals("c-1", record.id);
        assertEquals(PaymentStatus.SUCCESS, record.status);
        assertEquals("0xfeed", record.txReference);
    }

    @Test
    void passesThroughResponsesThatNeedNoPayment() throws Exception {
        wm.stubFor(get(urlEqualTo("/premium")).willReturn(aResponse().withStatus(200).withBody("free")));

        HttpResponse<String> response = client(Duration.ofSeconds(5)).send(premium());

        assertEquals("free", response.body());
        wm.verify(1, getRequestedFor(urlEqualTo("/premium")));
    }

    @Test
    void unparsable402IsReturnedUntouched() throws Exception {
        wm.stubFor(get(urlEqualTo("/premium")).willReturn(aResponse().withStatus(402).withBody("pay up")));

        HttpResponse<String> response = client(Duration.ofSeconds(5)).send(premium());

        assertEquals(402, response.statusCode());
        assertEquals("pay up", response.body());
        wm.verify(1, getRequestedFor(urlEqualTo("/premium")));
    }

    @Test
    void waitsForApprovalAndThenRetries() throws Exception {
        stubPaidResource("c-2", 0.50, "500000");
        prompt.decision = PromptDecision.approveOnce();

        HttpResponse<String> response = client(Duration.ofSeconds(5)).send(premium());

        assertEquals(200, response.statusCode());
        assertEquals(1, prompt.opened);
        assertEquals(PaymentStatus.SUCCESS, latestPayment().status);
        assertFalse(latestPayment().autoApproved);
    }

    @Test
    void denialKeepsThe402() throws Exception {
        stubPaidResource("c-3", 0.50, "500000");
        prompt.decision = PromptDecision.deny();

        HttpResponse<String> response = client(Duration.ofSeconds(5)).send(premium());

        assertEquals(402, response.statusCode());
        assertEquals(PaymentStatus.DENIED, latestPayment().status);
        wm.verify(0, getRequestedFor(urlEqualTo("/premium")).withHeader("X-PAYMENT", matching(".+")));
    }

    @Test
    void unansweredPromptTimesOut() throws Exception {
        stubPaidResource("c-4", 0.50, "500000");

        HttpResponse<String> response = client(Duration.ofMillis(300)).send(premium());

        assertEquals(402, response.statusCode());
        assertEquals(1, prompt.opened);
        wm.verify(1, getRequestedFor(urlEqualTo("/premium")));
    }

    @Test
    void disconnectEndsTheApprovalWait() throws Exception {
        stubPaidResource("c-5", 0.50, "500000");
        CompletableFuture.runAsync(() -> {
            while (prompt.opened == 0) {
                Thread.onSpinWait();
            }
            connection.disconnect();
        }, CompletableFuture.delayedExecutor(300, TimeUnit.MILLISECONDS));

        long started = System.nanoTime();
        HttpResponse<String> response = client(Duration.ofSeconds(15)).send(premium());
        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertEquals(402, response.statusCode());
        assertTrue(elapsed < 5000, "waited " + elapsed + " ms");
        assertEquals(1, prompt.opened);
        wm.verify(1, getRequestedFor(urlEqualTo("/premium")));
    }

    /** Answers the prompt from another thread the way a person clicking a button would. */
    static final class DecidingPrompt implements ApprovalPrompt {
        volatile AgentBus.Connection connection;
        volatile PromptDecision decision;
        volatile int opened;

        @Override
        public Integer open(ChallengeDetails challenge) {
            opened++;
            if (decision != null) {
                connection.send(new AgentCommand.ResolvePendingChallenge(challenge.challengeId(), decision));
            }
            return null;
        }

        @Override
        public void close(Integer windowId) {
        }
    }
}
