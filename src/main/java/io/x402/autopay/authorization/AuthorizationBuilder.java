package io.x402.autopay.authorization;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.x402.autopay.crypto.CryptoSigner;
import io.x402.autopay.crypto.SigningFailureException;
import io.x402.autopay.internal.Json;
import io.x402.autopay.model.AgentSettings;
import io.x402.autopay.model.ChallengeDetails;
import io.x402.autopay.model.PaymentPayload;
import io.x402.autopay.model.TransferAuthorization;
import io.x402.autopay.wallet.WalletLockedException;
import io.x402.autopay.wallet.WalletSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;

/**
 * Builds and signs the {@code exact} scheme payment for a challenge.
 *
 * <p>The authorization is valid from five seconds in the past (clock skew) until two minutes
 * from now, and carries a fresh random 32-byte nonce.</p>
 */
public class AuthorizationBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(AuthorizationBuilder.class);

    static final long VALID_AFTER_SKEW_SECONDS = 5;
    static final long VALIDITY_SECONDS = 120;
    private static final int NONCE_BYTES = 32;

    private final Clock clock;
    private final SecureRandom random;

    public AuthorizationBuilder(Clock clock) {
        this(clock, new SecureRandom());
    }

    public AuthorizationBuilder(Clock clock, SecureRandom random) {
        this.clock = clock;
        this.random = random;
    }

    /**
     * @throws WalletLockedException   when the session is missing or expired
     * @throws SigningFailureException when the typed data cannot be signed or encoded
     */
    public SignedAuthorization build(WalletSession session, AgentSettings settings, ChallengeDetails challenge)
        throws WalletLockedException, SigningFailureException {
        if (session == null || !session.isActive(clock.millis())) {
            throw new WalletLockedException();
        }
        CryptoSigner signer = session.signer();

        long now = clock.instant().getEpochSecond();
        byte[] nonce = new byte[NONCE_BYTES];
        random.nextBytes(nonce);
        TransferAuthorization authorization = new TransferAuthorization(
            signer.address(),
            challenge.seller(),
            challenge.amountAtomic(),
            String.valueOf(now - VALID_AFTER_SKEW_SECONDS),
            String.valueOf(now + VALIDITY_SECONDS),
            Numeric.toHexString(nonce));

        String signature = signer.sign(TransferTypedData.of(challenge, authorization));
        NetworkDescriptor descriptor = NetworkDescriptor.resolve(challenge, settings);

        PaymentPayload payload = new PaymentPayload();
        payload.x402Version = descriptor.version();
        payload.scheme = "exact";
        payload.network = descriptor.network();
        payload.payload = new PaymentPayload.Exact(authorization, signature);

        String headerValue;
        try {
            byte[] json = Json.mapper().writeValueAsString(payload).getBytes(StandardCharsets.UTF_8);
            headerValue = Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new SigningFailureException("Failed to encode payment header", e);
        }

        LOG.debug("Signed payment {} on {} (x402 v{})", challenge.challengeId(), descriptor.network(), descriptor.version());
        return new SignedAuthorization(challenge.challengeId(), headerValue, payload);
    }
}
