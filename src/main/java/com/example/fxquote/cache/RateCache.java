package com.example.fxquote.cache;

import com.example.fxquote.config.QuoteProperties;
import com.example.fxquote.currency.CurrencyRegistry;
import com.example.fxquote.service.RateReconciler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * 통화쌍 환율 캐시 (Redis)
 *
 * - 키: "USD:EUR", 값: 환율 문자열, TTL: quotes.cache-lifetime-seconds
 * - Cache-Aside: 미스가 나면 기준 통화 전체를 한 번에 갱신 후 다시 읽음
 * - 같은 기준 통화의 동시 미스는 SingleFlight로 한 번의 원천 조회로 합침
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateCache {

    private static final String KEY_SEPARATOR = ":";

    private final StringRedisTemplate stringRedisTemplate;
    private final RateReconciler rateReconciler;
    private final CurrencyRegistry currencyRegistry;
    private final QuoteProperties quoteProperties;

    private final ConcurrentHashMap<String, CompletableFuture<Void>> inFlightRefreshes =
            new ConcurrentHashMap<>();

    /**
     * 캐시 조회만 수행 (만료된 키는 Redis가 이미 지운 상태)
     */
    public Optional<String> get(String baseCurrency, String targetCurrency) {
        String cacheKey = getCacheKey(baseCurrency, targetCurrency);
        String cached = stringRedisTemplate.opsForValue().get(cacheKey);
        if (cached == null) {
            log.debug("[캐시 미스] key={}", cacheKey);
            return Optional.empty();
        }
        log.debug("[캐시 히트] key={}", cacheKey);
        return Optional.of(cached);
    }

    /**
     * 원천에서 기준 통화의 환율을 다시 받아 모든 통화쌍을 덮어씀
     */
    public void refresh(String baseCurrency) {
        Map<String, BigDecimal> rates = rateReconciler.getMaxRates(baseCurrency);
        Duration ttl = Duration.ofSeconds(quoteProperties.getCacheLifetimeSeconds());
        rates.forEach((targetCurrency, rate) ->
                stringRedisTemplate.opsForValue()
                        .set(getCacheKey(baseCurrency, targetCurrency), rate.toPlainString(), ttl));
        log.info("[캐시 갱신] base={}, pairs={}, ttl={}s", baseCurrency, rates.size(), ttl.getSeconds());
    }

    /**
     * 캐시 히트면 바로 반환, 미스면 갱신 후 재조회
     * 갱신 후에도 없으면 empty (모든 소스가 해당 환율을 주지 못한 상태)
     */
    public Optional<String> getOrRefresh(String baseCurrency, String targetCurrency) {
        Optional<String> cached = get(baseCurrency, targetCurrency);
        if (cached.isPresent()) {
            return cached;
        }
        refreshWithSingleFlight(baseCurrency);
        Optional<String> refreshed = get(baseCurrency, targetCurrency);
        if (refreshed.isEmpty()) {
            log.warn("[갱신 후에도 없음] key={}", getCacheKey(baseCurrency, targetCurrency));
        }
        return refreshed;
    }

    /**
     * 기준 통화의 모든 통화쌍 캐시 삭제
     */
    public void evict(String baseCurrency) {
        List<String> keys = currencyRegistry.allExcept(baseCurrency).stream()
                .map(targetCurrency -> getCacheKey(baseCurrency, targetCurrency))
                .toList();
        Long deleted = stringRedisTemplate.delete(keys);
        log.info("[캐시 삭제] base={}, deleted={}", baseCurrency, deleted);
    }

    private void refreshWithSingleFlight(String baseCurrency) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        CompletableFuture<Void> existing = inFlightRefreshes.putIfAbsent(baseCurrency, future);
        if (existing == null) {
            try {
                refresh(baseCurrency);
                future.complete(null);
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
                throw e;
            } finally {
                inFlightRefreshes.remove(baseCurrency);
            }
            return;
        }

        try {
            log.debug("[SingleFlight 대기] base={}", baseCurrency);
            existing.get(quoteProperties.getSingleFlightWaitMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[SingleFlight 대기 중단] base={}", baseCurrency);
        } catch (Exception e) {
            log.warn("[SingleFlight 대기 실패] 직접 원천 조회 - base={}, cause={}", baseCurrency, e.toString());
            refresh(baseCurrency);
        }
    }

    public static String getCacheKey(String baseCurrency, String targetCurrency) {
        return baseCurrency + KEY_SEPARATOR + targetCurrency;
    }
}
