package com.example.fxquote.client;

import com.example.fxquote.currency.CurrencyRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Set;

/**
 * OpenRates: GET {url}?base=USD&symbols=EUR,ILS
 */
public class OpenRatesClient extends RateSourceClient {

    public static final String NAME = "openrates";

    private final String url;

    public OpenRatesClient(String url,
                           RestTemplate restTemplate,
                           CurrencyRegistry currencyRegistry,
                           ObjectMapper objectMapper) {
        super(NAME, restTemplate, currencyRegistry, objectMapper);
        this.url = url;
    }

    @Override
    protected URI ratesUri(String baseCurrency, Set<String> expectedCurrencies) {
        return UriComponentsBuilder.fromUriString(url)
                .queryParam("base", baseCurrency)
                .queryParam("symbols", String.join(",", expectedCurrencies))
                .encode()
                .build()
                .toUri();
    }
}
