package io.x402.autopay.client;

import io.x402.autopay.agent.AgentBus;
import io.x402.autopay.agent.AgentCommand;
import io.x402.autopay.agent.ChallengeResolution;
import io.x402.autopay.agent.ResolutionListener;
import io.x402.autopay.challenge.ChallengeParser;
import io.x402.autopay.challenge.RequestContext;
import io.x402.autopay.challenge.ResponseHeaders;
import io.x402.autopay.model.ChallengeDetails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP client that answers 402 challenges through the payment agent.
 *
 * <p>A 402 response is parsed and submitted to the agent. When the agent signs a payment the
 * request is sent again with the payment headers and the server's settlement header is
 * reported back. When the agent needs a human decision the call waits for it up to the
 * approval timeout. In every other case, including bus failures, the original 402 response is
 * returned unchanged. The client never sees wallet secrets or the agent state.</p>
 */
public class X402HttpClient {

    private static final Logger LOG = LoggerFactory.getLogger(X402HttpClient.class);

    public static final String HEADER_PAYMENT_RESPONSE = "X-PAYMENT-RESPONSE";
    public static final String HEADER_PAYMENT_RESPONSE_V2 = "PAYMENT-RESPONSE";

    private final HttpClient http;
    private final AgentBus.Connection connection;
    private final ChallengeParser parser;
    private final Duration approvalTimeout;

    public X402HttpClient(HttpClient http, AgentBus.Connection connection, Duration approvalTimeout) {
        this(http, connection, new ChallengeParser(), approvalTimeout);
    }

    X402HttpClient(HttpClient http, AgentBus.Connection connection, ChallengeParser parser, Duration approvalTimeout) {
        this.http = http;
        this.connection = connection;
        this.parser = parser;
        this.approvalTimeout = approvalTimeout;
    }

    /**
     * Sends the request, paying for it if the server asks and the agent agrees.
     *
     * @return the paid response, or the server's original response when no payment was made
     * @throws IOException          if the HTTP exchange fails
     * @throws InterruptedException if the thread is interrupted while sending or waiting
     */
    public HttpResponse<String> send(HttpRequest request) throws IOException, InterruptedException {
        HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
        if (!ChallengeParser.isPaymentRequired(response.statusCode())) {
            return response;
        }

        Optional<ChallengeDetails> parsed = parser.parse(
            ResponseHeaders.of(response.headers()),
            response.body(),
            RequestContext.of(request.uri(), request.method()));
        if (parsed.isEmpty()) {
            LOG.debug("Passing unparsable 402 from {} through", request.uri());
            return response;
        }
        ChallengeDetails challenge = parsed.get();

        CompletableFuture<ChallengeResolution> decided = new CompletableFuture<>();
        ResolutionListener listener = (challengeId, resolution) -> {
            if (challenge.challengeId().equals(challengeId)) {
                decided.complete(resolution);
            }
        };
        connection.onResolution(listener);
        try {
            ChallengeResolution resolution = await(connection.send(new AgentCommand.SubmitChallenge(challenge, null)));
            if (resolution == null) {
                return response;
            }
            switch (resolution.action()) {
                case RETRY:
                    return retry(request, resolution, response);
                case PENDING:
                    return awaitDecision(request, challenge, decided, response);
                default:
                    LOG.info("Payment for {} not made: {}", challenge.challengeId(),
                        resolution.message() != null ? resolution.message() : resolution.action().wireName());
                    return response;
            }
        } finally {
            connection.removeResolutionListener(listener);
        }
    }

    private HttpResponse<String> awaitDecision(HttpRequest request, ChallengeDetails challenge,
                                               CompletableFuture<ChallengeResolution> decided,
                                               HttpResponse<String> original)
        throws IOException, InterruptedException {
        LOG.info("Waiting up to {} for approval of {}", approvalTimeout, challenge.challengeId());
        ChallengeResolution resolution;
        try {
            resolution = connection.track(decided).get(approvalTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.info("No decision for {} within {}", challenge.challengeId(), approvalTimeout);
            decided.cancel(false);
            return original;
        } catch (CancellationException e) {
            LOG.info("Stopped waiting for {}: connection closed", challenge.challengeId());
            return original;
        } catch (ExecutionException e) {
            LOG.warn("Decision for {} failed", challenge.challengeId(), e.getCause());
            return original;
        }
        if (resolution.action() == ChallengeResolution.Action.RETRY) {
            return retry(request, resolution, original);
        }
        return original;
    }

    private HttpResponse<String> retry(HttpRequest request, ChallengeResolution resolution, HttpResponse<String> original)
        throws IOException, InterruptedException {
        Map<String, String> retryHeaders = resolution.retryHeaders();
        if (retryHeaders == null || retryHeaders.isEmpty()) {
            return original;
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(request, (name, value) -> !retryHeaders.containsKey(name));
        retryHeaders.forEach(builder::setHeader);
        HttpResponse<String> retried = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        LOG.info("Retried {} with payment {}: {}", request.uri(),
            retryHeaders.get(ChallengeResolution.HEADER_PAYMENT_ID), retried.statusCode());
        reportSettlement(retried, retryHeaders.get(ChallengeResolution.HEADER_PAYMENT_ID));
        return retried;
    }

    private void reportSettlement(HttpResponse<String> retried, String paymentId) throws InterruptedException {
        if (retried.statusCode() < 200 || retried.statusCode() >= 300) {
            return;
        }
        Optional<String> settlement = retried.headers().firstValue(HEADER_PAYMENT_RESPONSE)
            .or(() -> retried.headers().firstValue(HEADER_PAYMENT_RESPONSE_V2));
        if (settlement.isEmpty()) {
            LOG.debug("No settlement header for payment {}", paymentId);
            return;
        }
        Boolean applied = await(connection.send(new AgentCommand.ReconcileSettlement(paymentId, settlement.get())));
        LOG.debug("Settlement for {} reconciled: {}", paymentId, applied);
    }

    /** Reply of a bus call, or null when it timed out, failed or was cancelled. Never retried. */
    private static <R> R await(CompletableFuture<R> reply) throws InterruptedException {
        try {
            return reply.get();
        } catch (ExecutionException e) {
            LOG.warn("Agent call failed: {}", e.getCause().toString());
            return null;
        } catch (CancellationException e) {
            LOG.warn("Agent call cancelled");
            return null;
        }
    }
}
