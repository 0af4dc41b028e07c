package com.example.fxquote.service;

import com.example.fxquote.cache.RateCache;
import com.example.fxquote.domain.ProblemReport;
import com.example.fxquote.domain.QuoteRequest;
import com.example.fxquote.domain.QuoteResponse;
import com.example.fxquote.validation.AmountChecker;
import com.example.fxquote.validation.QuoteValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * 환전 견적 서비스
 *
 * 1. 요청 검증 (문제가 있으면 I/O 없이 바로 반환)
 * 2. 캐시에서 환율 조회 (미스면 원천 갱신)
 * 3. 환율 검사 후 금액 계산
 *
 * 예외를 던지지 않고 항상 성공/오류 응답을 돌려준다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuoteEngine {

    private final QuoteValidator quoteValidator;
    private final RateCache rateCache;

    public QuoteResponse getQuote(QuoteRequest request) {
        log.info("[견적 요청] {}", request);

        List<ProblemReport> problems = quoteValidator.validate(request);
        if (!problems.isEmpty()) {
            log.info("[요청 검증 실패] problems={}", problems);
            return QuoteResponse.problems(problems);
        }

        BigDecimal amount = AmountChecker.parsePositive(request.getAmount()).orElseThrow();
        String from = request.getFromCurrencyCode();
        String to = request.getToCurrencyCode();

        // 같은 통화끼리는 원천에 환율이 없으므로 1로 고정
        if (from.equals(to)) {
            return respond(compute(BigDecimal.ONE, to, amount));
        }

        Optional<BigDecimal> rate = lookupRate(from, to).flatMap(AmountChecker::parsePositive);
        if (rate.isEmpty()) {
            log.warn("[서비스 불가] 사용할 수 있는 환율 없음 - pair={}", RateCache.getCacheKey(from, to));
            return QuoteResponse.serviceDown();
        }
        return respond(compute(rate.get(), to, amount));
    }

    private QuoteResponse compute(BigDecimal rate, String to, BigDecimal amount) {
        try {
            return QuoteResponse.success(rate, to, amount);
        } catch (ArithmeticException e) {
            log.error("[견적 계산 실패] rate={}, amount={}", rate, amount, e);
            return QuoteResponse.serviceDown();
        }
    }

    private Optional<String> lookupRate(String from, String to) {
        try {
            return rateCache.getOrRefresh(from, to);
        } catch (DataAccessException e) {
            log.error("[캐시 장애] pair={}", RateCache.getCacheKey(from, to), e);
            return Optional.empty();
        }
    }

    private QuoteResponse respond(QuoteResponse response) {
        log.info("[견적 응답] {}", response);
        return response;
    }
}
