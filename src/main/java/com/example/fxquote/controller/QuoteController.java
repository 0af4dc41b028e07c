package com.example.fxquote.controller;

import com.example.fxquote.cache.RateCache;
import com.example.fxquote.currency.CurrencyRegistry;
import com.example.fxquote.domain.Problem;
import com.example.fxquote.domain.QuoteRequest;
import com.example.fxquote.domain.QuoteResponse;
import com.example.fxquote.service.QuoteEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 환전 견적 API 컨트롤러
 */
@Slf4j
@RestController
@RequestMapping("/api/quotes")
@RequiredArgsConstructor
public class QuoteController {

    private final QuoteEngine quoteEngine;
    private final RateCache rateCache;
    private final CurrencyRegistry currencyRegistry;

    @GetMapping
    public ResponseEntity<QuoteResponse> getQuote(
            @RequestParam(name = "from_currency_code", required = false) String fromCurrencyCode,
            @RequestParam(name = "amount", required = false) String amount,
            @RequestParam(name = "to_currency_code", required = false) String toCurrencyCode) {
        QuoteResponse response = quoteEngine.getQuote(QuoteRequest.builder()
                .fromCurrencyCode(fromCurrencyCode)
                .amount(amount)
                .toCurrencyCode(toCurrencyCode)
                .build());
        return ResponseEntity.status(statusOf(response)).body(response);
    }

    @PostMapping("/rates/{base}/refresh")
    public ResponseEntity<Void> refreshRates(@PathVariable String base) {
        if (!currencyRegistry.isSupported(base)) {
            return ResponseEntity.badRequest().build();
        }
        try {
            rateCache.refresh(base);
        } catch (DataAccessException e) {
            log.error("[캐시 장애] 갱신 실패 - base={}", base, e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/rates/{base}/cache")
    public ResponseEntity<Void> evictRates(@PathVariable String base) {
        if (!currencyRegistry.isSupported(base)) {
            return ResponseEntity.badRequest().build();
        }
        try {
            rateCache.evict(base);
        } catch (DataAccessException e) {
            log.error("[캐시 장애] 삭제 실패 - base={}", base, e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        return ResponseEntity.noContent().build();
    }

    private HttpStatus statusOf(QuoteResponse response) {
        if (!response.hasError()) {
            return HttpStatus.OK;
        }
        return response.hasProblem(Problem.SERVICE_DOWN) ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_REQUEST;
    }
}
