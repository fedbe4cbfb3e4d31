package io.x402.autopay.authorization;

import com.fasterxml.jackson.databind.JsonNode;
import io.x402.autopay.MutableClock;
import io.x402.autopay.crypto.Web3jSigner;
import io.x402.autopay.internal.Json;
import io.x402.autopay.model.AgentSettings;
import io.x402.autopay.model.ChallengeDetails;
import io.x402.autopay.model.TransferAuthorization;
import io.x402.autopay.store.InMemoryStateStore;
import io.x402.autopay.wallet.SecretCipher;
import io.x402.autopay.wallet.WalletLockedException;
import io.x402.autopay.wallet.WalletSession;
import io.x402.autopay.wallet.WalletVault;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Base64;
import java.util.Map;

import static io.x402.autopay.TestChallenges.PASSPHRASE;
import static io.x402.autopay.TestChallenges.SELLER;
import static io.x402.autopay.TestChallenges.TEST_ADDRESS;
import static io.x402.autopay.TestChallenges.TEST_ITERATIONS;
import static io.x402.autopay.TestChallenges.TEST_KEY;
import static io.x402.autopay.TestChallenges.challenge;
import static org.junit.jupiter.api.Assertions.*;

class AuthorizationBuilderTest {

    private MutableClock clock;
    private WalletVault vault;
    private AuthorizationBuilder builder;

    @BeforeEach
    void setUp() throws Exception {
        clock = MutableClock.at("2025-03-01T12:00:00Z");
        vault = new WalletVault(new InMemoryStateStore(), clock, new SecretCipher(TEST_ITERATIONS), 15);
        vault.configure(TEST_KEY, PASSPHRASE, 15, null);
        builder = new AuthorizationBuilder(clock);
    }

    private static JsonNode decodeHeader(String headerValue) throws Exception {
        return Json.mapper().readTree(new String(Base64.getDecoder().decode(headerValue), StandardCharsets.UTF_8));
    }

    @Test
    void headerCarriesSignedExactPayment() throws Exception {
        ChallengeDetails challenge = challenge("c-1", 0.01);

        SignedAuthorization signed = builder.build(vault.requireSession(), new AgentSettings(), challenge);

        assertEquals("c-1", signed.paymentId());
        JsonNode header = decodeHeader(signed.headerValue());
        assertEquals("exact", header.get("scheme").asText());
        assertEquals("eip155:80002", header.get("network").asText());
        assertEquals(2, header.get("x402Version").asInt());
        JsonNode authorization = header.get("payload").get("authorization");
        assertEquals(TEST_ADDRESS, authorization.get("from").asText());
        assertEquals(SELLER, authorization.get("to").asText());
        assertEquals("10000", authorization.get("value").asText());
        assertTrue(header.get("payload").get("signature").asText().matches("^0x[0-9a-f]{130}$"));
    }

    @Test
    void validityWindowIsFiveSecondsBackToTwoMinutesAhead() throws Exception {
        long now = clock.instant().getEpochSecond();

        TransferAuthorization authorization = builder.build(vault.requireSession(), new AgentSettings(),
            challenge("c-1", 0.01)).payload().payload.authorization;

        assertEquals(String.valueOf(now - 5), authorization.validAfter);
        assertEquals(String.valueOf(now + 120), authorization.validBefore);
        assertTrue(authorization.nonce.matches("^0x[0-9a-f]{64}$"));
    }

    @Test
    void noncesAreFresh() throws Exception {
        WalletSession session = vault.requireSession();
        ChallengeDetails challenge = challenge("c-1", 0.01);

        String first = builder.build(session, new AgentSettings(), challenge).payload().payload.authorization.nonce;
        String second = builder.build(session, new AgentSettings(), challenge).payload().payload.authorization.nonce;

        assertNotEquals(first, second);
    }

    @Test
    void signatureRecoversToWalletAddress() throws Exception {
        ChallengeDetails challenge = challenge("c-1", 0.01);
        SignedAuthorization signed = builder.build(vault.requireSession(), new AgentSettings(), challenge);

        TransferAuthorization authorization = signed.payload().payload.authorization;
        byte[] digest = Web3jSigner.typedDataHash(TransferTypedData.of(challenge, authorization));
        byte[] signature = Numeric.hexStringToByteArray(signed.payload().payload.signature);
        Sign.SignatureData data = new Sign.SignatureData(signature[64],
            Arrays.copyOfRange(signature, 0, 32), Arrays.copyOfRange(signature, 32, 64));
        BigInteger publicKey = Sign.signedMessageHashToKey(digest, data);

        assertEquals(TEST_ADDRESS.toLowerCase(), "0x" + Keys.getAddress(publicKey));
    }

    @Test
    void domainDefaultsToUsdCoinVersionTwo() {
        ChallengeDetails challenge = challenge("c-1", 0.01);
        TransferAuthorization authorization = new TransferAuthorization(TEST_ADDRESS, SELLER, "1", "0", "1",
            "0x" + "00".repeat(32));

        @SuppressWarnings("unchecked")
        Map<String, Object> domain = (Map<String, Object>) TransferTypedData.of(challenge, authorization).get("domain");

        assertEquals("USD Coin", domain.get("name"));
        assertEquals("2", domain.get("version"));
        assertEquals(80002L, domain.get("chainId"));
        assertEquals(challenge.tokenAddress(), domain.get("verifyingContract"));
    }

    @Test
    void expiredSessionCannotSign() {
        WalletSession session = vault.activeSession().orElseThrow();
        clock.advance(Duration.ofMinutes(16));

        assertThrows(WalletLockedException.class,
            () -> builder.build(session, new AgentSettings(), challenge("c-1", 0.01)));
        assertThrows(WalletLockedException.class,
            () -> builder.build(null, new AgentSettings(), challenge("c-1", 0.01)));
    }
}
