package io.x402.autopay.challenge;

import io.x402.autopay.model.ChallengeDetails;

import java.util.Optional;

/** Flat x-402-* / x-payment-* headers used by early servers. */
final class LegacyHeaderChallengeFormat implements ChallengeFormat {

    @Override
    public Optional<ChallengeDetails> parse(ParseInput input) {
        ResponseHeaders headers = input.headers();
        Optional<String> seller = headers.first("x-402-address", "x-payment-seller");
        Optional<String> tokenAddress = headers.first("x-402-token-address", "x-payment-token-address");
        Optional<String> atomic = headers.first("x-402-amount-atomic", "x-payment-amount")
            .flatMap(ChallengeValues::atomicAmount);
        if (atomic.isEmpty()
            || !ChallengeValues.isAddress(seller.orElse(null))
            || !ChallengeValues.isAddress(tokenAddress.orElse(null))) {
            return Optional.empty();
        }
        long chainId = headers.first("x-402-chain", "x-payment-chain")
            .flatMap(ChallengeValues::number)
            .filter(value -> value > 0 && value == Math.rint(value))
            .map(Double::longValue)
            .orElse(ChallengeValues.DEFAULT_CHAIN_ID);
        double amountUsd = headers.first("x-402-amount", "x-payment-amount-usd")
            .flatMap(ChallengeValues::number)
            .filter(ChallengeValues::isUsdAmount)
            .orElseGet(() -> ChallengeValues.estimateUsd(atomic.get(), null));

        return Optional.of(ChallengeDetails.builder()
            .challengeId(input.fallbackId())
            .origin(input.context().origin())
            .endpoint(input.context().endpoint())
            .method(input.context().method())
            .amountUsd(amountUsd)
            .tokenSymbol(ChallengeValues.tokenSymbol(headers.first("x-402-token", "x-payment-token").orElse(null)))
            .chainId(chainId)
            .tokenAddress(tokenAddress.get())
            .seller(seller.get())
            .amountAtomic(atomic.get())
            .rawHeaders(headers.asMap())
            .build());
    }
}
