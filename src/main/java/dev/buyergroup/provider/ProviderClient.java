package dev.buyergroup.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.buyergroup.config.ProviderConfig;
import dev.buyergroup.metrics.EngineMetrics;
import dev.buyergroup.model.CreditLedger;
import dev.buyergroup.model.PersonProfile;
import dev.buyergroup.model.SearchQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.DecodingException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Budget-aware wrapper around the {@link ProfileProvider}.
 * Every call goes cache, ledger, dry-run check, pacer, provider, in that order,
 * and ends in a {@link ProviderResult}; provider errors never propagate.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderClient {

    static final String SEARCH = "search";
    static final String COLLECT = "collect";

    private final ProfileProvider provider;
    private final ResponseCache cache;
    private final RequestPacer pacer;
    private final ProviderConfig config;
    private final EngineMetrics metrics;

    /**
     * Run a search, charging the search budget.
     *
     * @param query  Query to issue
     * @param ledger Ledger of the current run
     * @param budget Search credit budget of the current run
     * @param dryRun Charge without calling the provider
     */
    public Mono<ProviderResult<List<String>>> search(SearchQuery query, CreditLedger ledger, int budget,
                                                     boolean dryRun) {
        String key = ResponseCache.searchKey(sha256(provider.render(query)));
        int cost = config.getSearchCreditCost();
        return execute(SEARCH, query.getId(), key, cost, () -> ledger.tryChargeSearch(cost, budget), dryRun,
                () -> provider.search(query));
    }

    /**
     * Collect a full profile, charging the collect budget.
     */
    public Mono<ProviderResult<PersonProfile>> collect(String candidateId, CreditLedger ledger, int budget,
                                                       boolean dryRun) {
        String key = ResponseCache.collectKey(candidateId);
        int cost = config.getCollectCreditCost();
        return execute(COLLECT, candidateId, key, cost, () -> ledger.tryChargeCollect(cost, budget), dryRun,
                () -> provider.collect(candidateId));
    }

    public int getCollectCost() {
        return config.getCollectCreditCost();
    }

    @SuppressWarnings("unchecked")
    private <T> Mono<ProviderResult<T>> execute(String operation, String subject, String cacheKey, int cost,
                                                Supplier<Boolean> charge, boolean dryRun, Supplier<Mono<T>> call) {
        return Mono.defer(() -> {
            // 1. Cache hits are free
            Object cached = cache.get(cacheKey);
            if (cached != null) {
                log.debug("{} {} served from cache", operation, subject);
                return Mono.just(record(operation, ProviderResult.cached((T) cached)));
            }

            // 2. Reserve credits before issuing
            if (!Boolean.TRUE.equals(charge.get())) {
                log.debug("{} {} skipped: budget exhausted", operation, subject);
                return Mono.just(record(operation, ProviderResult.<T>budgetExhausted()));
            }
            metrics.recordCreditsCharged(operation, cost);

            if (dryRun) {
                return Mono.just(record(operation, ProviderResult.<T>dryRun(cost)));
            }

            // 3. Paced live call, one retry on transient errors
            return Mono.defer(() -> pacer.acquire().then(Mono.defer(call)))
                    .timeout(config.getCallTimeout())
                    .retryWhen(Retry.fixedDelay(1, config.getRetryDelay())
                            .filter(ProviderClient::isTransient)
                            .doBeforeRetry(signal -> log.warn("{} {} failed ({}), retrying once",
                                    operation, subject, describe(signal.failure())))
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .map(value -> {
                        cache.put(cacheKey, value);
                        return record(operation, ProviderResult.success(value, cost));
                    })
                    .switchIfEmpty(Mono.fromSupplier(() ->
                            record(operation, ProviderResult.<T>softFail(cost, "empty response"))))
                    .onErrorResume(e -> {
                        if (isSoft(e)) {
                            log.debug("{} {} unavailable: {}", operation, subject, describe(e));
                            return Mono.just(record(operation, ProviderResult.<T>softFail(cost, describe(e))));
                        }
                        log.warn("{} {} failed: {}", operation, subject, describe(e));
                        return Mono.just(record(operation, ProviderResult.<T>hardFail(cost, describe(e))));
                    });
        });
    }

    private <T> ProviderResult<T> record(String operation, ProviderResult<T> result) {
        metrics.recordProviderCall(operation, result.status().name());
        return result;
    }

    static boolean isTransient(Throwable e) {
        if (e instanceof WebClientResponseException response) {
            return response.getStatusCode().is5xxServerError() || response.getStatusCode().value() == 429;
        }
        return e instanceof TimeoutException
                || e instanceof WebClientRequestException
                || (e instanceof IOException && !(e instanceof JsonProcessingException));
    }

    static boolean isSoft(Throwable e) {
        if (e instanceof WebClientResponseException response) {
            return response.getStatusCode().is4xxClientError() && response.getStatusCode().value() != 429;
        }
        return e instanceof CandidateUnavailableException
                || e instanceof DecodingException
                || e instanceof JsonProcessingException;
    }

    private static String describe(Throwable e) {
        if (e instanceof WebClientResponseException response) {
            return "HTTP " + response.getStatusCode().value();
        }
        if (e instanceof TimeoutException) {
            return "timeout";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
