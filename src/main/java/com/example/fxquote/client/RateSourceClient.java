package com.example.fxquote.client;

import com.example.fxquote.currency.CurrencyRegistry;
import com.example.fxquote.domain.Problem;
import com.example.fxquote.domain.ProblemReport;
import com.example.fxquote.validation.AmountChecker;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 원천 환율 API 클라이언트 공통 처리
 * 1. 기준 통화로 요청 (URL 구성은 구현체 담당)
 * 2. 응답의 rates 중 기대 통화만 남김
 * 3. 양수가 아닌 값은 버리고 로그만 남김 (나머지 통화는 계속 사용)
 *
 * 전송 실패/파싱 실패/rates 누락은 RateSourceException 으로 던진다
 */
@Slf4j
public abstract class RateSourceClient {

    private final String name;
    private final RestTemplate restTemplate;
    private final CurrencyRegistry currencyRegistry;
    private final ObjectMapper objectMapper;

    protected RateSourceClient(String name,
                               RestTemplate restTemplate,
                               CurrencyRegistry currencyRegistry,
                               ObjectMapper objectMapper) {
        this.name = name;
        this.restTemplate = restTemplate;
        this.currencyRegistry = currencyRegistry;
        this.objectMapper = objectMapper;
    }

    public String getName() {
        return name;
    }

    /**
     * 기준 통화 1단위당 대상 통화 환율 조회
     * 예: fetchRates("USD") => {EUR=0.8389261745, ILS=3.3077181208}
     */
    public Map<String, BigDecimal> fetchRates(String baseCurrency) {
        Set<String> expected = currencyRegistry.allExcept(baseCurrency);
        URI uri = ratesUri(baseCurrency, expected);
        log.debug("[원천 조회] source={}, uri={}", name, uri);

        JsonNode rates = readRates(requestBody(uri));
        Map<String, BigDecimal> result = new LinkedHashMap<>();
        for (String currency : expected) {
            JsonNode value = rates.get(currency);
            if (value == null || value.isNull()) {
                log.warn("[환율 누락] source={}, {}", name, Problem.MISSING_CURRENCY.format(currency));
                continue;
            }
            String raw = value.asText();
            Optional<ProblemReport> problem = AmountChecker.check(raw);
            if (problem.isPresent()) {
                log.warn("[환율 값 오류] source={}, currency={}, {}", name, currency, problem.get().getMessage());
                continue;
            }
            result.put(currency, new BigDecimal(raw.trim()));
        }

        if (result.size() != expected.size()) {
            log.warn("[환율 개수 불일치] source={}, base={}, expected={}, valid={}",
                    name, baseCurrency, expected.size(), result.size());
        }
        return result;
    }

    protected abstract URI ratesUri(String baseCurrency, Set<String> expectedCurrencies);

    private String requestBody(URI uri) {
        try {
            String body = restTemplate.getForObject(uri, String.class);
            if (body == null) {
                throw new RateSourceException(name, "empty response body");
            }
            return body;
        } catch (RestClientException e) {
            throw new RateSourceException(name, "request failed: " + e.getMessage(), e);
        }
    }

    private JsonNode readRates(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RateSourceException(name, "unparseable response body", e);
        }
        JsonNode rates = root == null ? null : root.get("rates");
        if (rates == null || !rates.isObject()) {
            throw new RateSourceException(name, "response has no 'rates' object");
        }
        return rates;
    }
}
