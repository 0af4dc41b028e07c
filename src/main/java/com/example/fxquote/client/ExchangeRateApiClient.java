package com.example.fxquote.client;

import com.example.fxquote.currency.CurrencyRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Set;

/**
 * ExchangeRate-API: GET {url}/USD
 * 기준 통화의 전체 환율을 돌려주므로 기대 통화 필터링은 공통 처리에 맡긴다
 */
public class ExchangeRateApiClient extends RateSourceClient {

    public static final String NAME = "exchange_rates";

    private final String url;

    public ExchangeRateApiClient(String url,
                                 RestTemplate restTemplate,
                                 CurrencyRegistry currencyRegistry,
                                 ObjectMapper objectMapper) {
        super(NAME, restTemplate, currencyRegistry, objectMapper);
        this.url = url;
    }

    @Override
    protected URI ratesUri(String baseCurrency, Set<String> expectedCurrencies) {
        return UriComponentsBuilder.fromUriString(url)
                .pathSegment(baseCurrency)
                .encode()
                .build()
                .toUri();
    }
}
