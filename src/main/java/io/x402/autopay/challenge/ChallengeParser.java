package io.x402.autopay.challenge;

import io.x402.autopay.model.ChallengeDetails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Turns a 402 response into a {@link ChallengeDetails}, trying each known encoding in order:
 * dedicated challenge header, WWW-Authenticate, legacy flat headers, JSON body.
 * An empty result means the response must be passed through untouched.
 */
public final class ChallengeParser {

    private static final Logger LOG = LoggerFactory.getLogger(ChallengeParser.class);

    public static final String HEADER_CHALLENGE_ID = "x-402-id";
    public static final int PAYMENT_REQUIRED = 402;

    private final List<ChallengeFormat> formats;
    private final Supplier<String> idGenerator;

    public ChallengeParser() {
        this(() -> UUID.randomUUID().toString());
    }

    ChallengeParser(Supplier<String> idGenerator) {
        this.formats = List.of(
            new JsonChallengeFormat(),
            new AuthenticateChallengeFormat(),
            new LegacyHeaderChallengeFormat(),
            new AcceptsBodyChallengeFormat());
        this.idGenerator = idGenerator;
    }

    public static boolean isPaymentRequired(int status) {
        return status == PAYMENT_REQUIRED;
    }

    /**
     * @param headers response headers
     * @param body    response body, may be null
     * @param context the request the response answers
     */
    public Optional<ChallengeDetails> parse(ResponseHeaders headers, String body, RequestContext context) {
        String fallbackId = headers.first(HEADER_CHALLENGE_ID).orElseGet(idGenerator);
        ChallengeFormat.ParseInput input = new ChallengeFormat.ParseInput(headers, body, context, fallbackId);
        for (ChallengeFormat format : formats) {
            Optional<ChallengeDetails> parsed = format.parse(input);
            if (parsed.isPresent()) {
                ChallengeDetails challenge = parsed.get();
                LOG.debug("Parsed challenge {} from {} for {}{} amountAtomic={} amountUsd={}",
                    challenge.challengeId(), format.getClass().getSimpleName(), context.origin(),
                    context.endpoint(), challenge.amountAtomic(), challenge.amountUsd());
                return parsed;
            }
        }
        LOG.warn("Received 402 without a parsable challenge from {}{}", context.origin(), context.endpoint());
        return Optional.empty();
    }
}
