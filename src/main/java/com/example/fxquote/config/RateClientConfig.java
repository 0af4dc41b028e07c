package com.example.fxquote.config;

import com.example.fxquote.client.ExchangeRateApiClient;
import com.example.fxquote.client.OpenRatesClient;
import com.example.fxquote.currency.CurrencyRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * 원천 환율 API 연동 설정
 * - RestTemplate 하나를 두 소스가 공유 (연결/읽기 타임아웃 적용)
 * - 지원 통화 화이트리스트
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class RateClientConfig {

    private final QuoteProperties quoteProperties;

    @Bean
    public CurrencyRegistry currencyRegistry() {
        log.info("[지원 통화] {}", quoteProperties.getSupportedCurrencies());
        return new CurrencyRegistry(quoteProperties.getSupportedCurrencies());
    }

    @Bean
    public RestTemplate rateRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(quoteProperties.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(quoteProperties.getReadTimeoutMs()))
                .additionalInterceptors(loggingInterceptor())
                .build();
    }

    @Bean
    public OpenRatesClient openRatesClient(RestTemplate rateRestTemplate,
                                           CurrencyRegistry currencyRegistry,
                                           ObjectMapper objectMapper) {
        return new OpenRatesClient(quoteProperties.getOpenRatesUrl(), rateRestTemplate, currencyRegistry, objectMapper);
    }

    @Bean
    public ExchangeRateApiClient exchangeRateApiClient(RestTemplate rateRestTemplate,
                                                       CurrencyRegistry currencyRegistry,
                                                       ObjectMapper objectMapper) {
        return new ExchangeRateApiClient(quoteProperties.getExchangeRateApiUrl(), rateRestTemplate, currencyRegistry, objectMapper);
    }

    private ClientHttpRequestInterceptor loggingInterceptor() {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();
            ClientHttpResponse response = execution.execute(request, body);
            log.debug("[원천 응답] {} {} - status={}, {}ms",
                    request.getMethod(), request.getURI(), response.getStatusCode(),
                    System.currentTimeMillis() - startTime);
            return response;
        };
    }
}
