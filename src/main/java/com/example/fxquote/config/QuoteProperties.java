package com.example.fxquote.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "quotes")
public class QuoteProperties {

    /**
     * 환율 캐시 수명 (초)
     */
    private int cacheLifetimeSeconds = 10;

    /**
     * 지원 통화 목록 (설정 순서 유지)
     */
    private List<String> supportedCurrencies = new ArrayList<>(List.of("USD", "EUR", "ILS"));

    /**
     * OpenRates 엔드포인트 - base/symbols를 쿼리 파라미터로 전달
     */
    private String openRatesUrl = "http://api.openrates.io/latest";

    /**
     * ExchangeRate-API 엔드포인트 - base를 경로 세그먼트로 전달
     */
    private String exchangeRateApiUrl = "https://api.exchangerate-api.com/v4/latest";

    /**
     * 원천 API 연결 타임아웃 (밀리초)
     */
    private int connectTimeoutMs = 2000;

    /**
     * 원천 API 읽기 타임아웃 (밀리초)
     */
    private int readTimeoutMs = 3000;

    /**
     * 소스 하나당 전체 조회 제한 시간 (밀리초) - 초과 시 실패로 간주
     */
    private int sourceTimeoutMs = 5000;

    /**
     * 원천 동시 조회 스레드 수
     */
    private int fetchThreads = 4;

    /**
     * SingleFlight 대기 시간 (밀리초)
     */
    private int singleFlightWaitMs = 3000;
}
