package com.example.fxquote.service;

import com.example.fxquote.client.RateSourceClient;
import com.example.fxquote.config.QuoteProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 원천 환율 병합
 * - 모든 소스를 동시에 조회하고 전부 끝날 때까지 기다림
 * - 실패/타임아웃 소스는 빈 결과로 취급 (나머지 소스로 계속 진행)
 * - 소스별 제한 시간은 풀 스레드에서 조회가 시작될 때부터 잼 (큐 대기 시간 제외)
 * - 통화별로 소스들이 보고한 값 중 최댓값을 채택
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateReconciler {

    private final List<RateSourceClient> sourceClients;
    private final QuoteProperties quoteProperties;

    private ExecutorService fetchExecutor;
    private ScheduledExecutorService deadlineScheduler;

    @PostConstruct
    public void init() {
        fetchExecutor = Executors.newFixedThreadPool(quoteProperties.getFetchThreads());
        deadlineScheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @PreDestroy
    public void shutdown() {
        if (fetchExecutor != null) {
            fetchExecutor.shutdownNow();
        }
        if (deadlineScheduler != null) {
            deadlineScheduler.shutdownNow();
        }
    }

    /**
     * 원천(캐시 아님)에서 기준 통화의 최고 환율 조회
     * 예: getMaxRates("USD") => {EUR=0.84, ILS=3.32}
     */
    public Map<String, BigDecimal> getMaxRates(String baseCurrency) {
        List<CompletableFuture<Map<String, BigDecimal>>> futures = new ArrayList<>(sourceClients.size());
        for (RateSourceClient client : sourceClients) {
            futures.add(fetchOrEmpty(client, baseCurrency));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<Map<String, BigDecimal>> results = futures.stream()
                .map(CompletableFuture::join)
                .toList();
        if (log.isDebugEnabled()) {
            log.debug("[소스별 환율] base={}\n{}", baseCurrency, ratesTable(results));
        }

        Map<String, BigDecimal> merged = merge(results);
        log.info("[환율 병합] base={}, rates={}", baseCurrency, merged);
        return merged;
    }

    /**
     * 통화별 최댓값 병합 (소스 순서와 무관)
     */
    public static Map<String, BigDecimal> merge(List<Map<String, BigDecimal>> results) {
        Map<String, BigDecimal> merged = new TreeMap<>();
        for (Map<String, BigDecimal> rates : results) {
            rates.forEach((currency, rate) -> merged.merge(currency, rate, BigDecimal::max));
        }
        return merged;
    }

    private CompletableFuture<Map<String, BigDecimal>> fetchOrEmpty(RateSourceClient client, String baseCurrency) {
        CompletableFuture<Map<String, BigDecimal>> result = new CompletableFuture<>();
        fetchExecutor.execute(new TimedFetch(client, baseCurrency, result));
        return result.exceptionally(e -> {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.warn("[소스 실패] source={}, base={}, cause={}",
                    client.getName(), baseCurrency, cause.toString());
            return Map.of();
        });
    }

    /**
     * 실행이 시작되는 순간 마감 타이머를 걸고, 마감되면 작업 스레드를 인터럽트한다
     */
    private class TimedFetch extends FutureTask<Map<String, BigDecimal>> {

        private final CompletableFuture<Map<String, BigDecimal>> result;

        TimedFetch(RateSourceClient client, String baseCurrency, CompletableFuture<Map<String, BigDecimal>> result) {
            super(() -> client.fetchRates(baseCurrency));
            this.result = result;
        }

        @Override
        public void run() {
            ScheduledFuture<?> deadline = deadlineScheduler.schedule(
                    () -> cancel(true), quoteProperties.getSourceTimeoutMs(), TimeUnit.MILLISECONDS);
            try {
                super.run();
            } finally {
                deadline.cancel(false);
            }
        }

        @Override
        protected void done() {
            if (isCancelled()) {
                result.completeExceptionally(new TimeoutException(
                        "no response within " + quoteProperties.getSourceTimeoutMs() + "ms"));
                return;
            }
            try {
                result.complete(get());
            } catch (ExecutionException e) {
                result.completeExceptionally(e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result.completeExceptionally(e);
            }
        }
    }

    private String ratesTable(List<Map<String, BigDecimal>> results) {
        TreeSet<String> currencies = new TreeSet<>();
        results.forEach(rates -> currencies.addAll(rates.keySet()));

        StringBuilder table = new StringBuilder(String.format("%-16s", "source"));
        currencies.forEach(currency -> table.append(String.format("%16s", currency)));
        for (int i = 0; i < results.size(); i++) {
            table.append('\n').append(String.format("%-16s", sourceClients.get(i).getName()));
            Map<String, BigDecimal> rates = results.get(i);
            for (String currency : currencies) {
                BigDecimal rate = rates.get(currency);
                table.append(String.format("%16s", rate == null ? "-" : rate.toPlainString()));
            }
        }
        return table.toString();
    }
}
