package com.example.fxquote.client;

import com.example.fxquote.currency.CurrencyRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("RateSourceClient 테스트")
class RateSourceClientTest {

    private static final String OPEN_RATES_URL = "http://openrates.test/latest";
    private static final String EXCHANGE_RATE_URL = "http://exchangerate.test/v4/latest";

    private final CurrencyRegistry registry = new CurrencyRegistry(List.of("USD", "EUR", "ILS"));
    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockRestServiceServer server;
    private OpenRatesClient openRatesClient;
    private ExchangeRateApiClient exchangeRateApiClient;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        openRatesClient = new OpenRatesClient(OPEN_RATES_URL, restTemplate, registry, objectMapper);
        exchangeRateApiClient = new ExchangeRateApiClient(EXCHANGE_RATE_URL, restTemplate, registry, objectMapper);
    }

    @Nested
    @DisplayName("1. 요청 형식")
    class RequestTest {

        @Test
        @DisplayName("OpenRates는 base/symbols를 쿼리 파라미터로 보낸다")
        void openRates_sendsBaseAndSymbolsAsQuery() {
            server.expect(method(HttpMethod.GET))
                    .andExpect(queryParam("base", "USD"))
                    .andExpect(queryParam("symbols", "EUR,ILS"))
                    .andRespond(withSuccess("{\"base\":\"USD\",\"rates\":{\"EUR\":0.8389261745,\"ILS\":3.3077181208}}",
                            MediaType.APPLICATION_JSON));

            Map<String, BigDecimal> rates = openRatesClient.fetchRates("USD");

            server.verify();
            assertThat(rates).containsOnlyKeys("EUR", "ILS");
            assertThat(rates.get("EUR")).isEqualByComparingTo("0.8389261745");
            assertThat(rates.get("ILS")).isEqualByComparingTo("3.3077181208");
        }

        @Test
        @DisplayName("ExchangeRate-API는 base를 경로 세그먼트로 보낸다")
        void exchangeRateApi_sendsBaseAsPathSegment() {
            server.expect(requestTo(EXCHANGE_RATE_URL + "/EUR"))
                    .andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess("{\"base\":\"EUR\",\"rates\":{\"EUR\":1,\"USD\":1.19,\"ILS\":3.95,\"GBP\":0.9}}",
                            MediaType.APPLICATION_JSON));

            Map<String, BigDecimal> rates = exchangeRateApiClient.fetchRates("EUR");

            server.verify();
            assertThat(rates).containsOnlyKeys("USD", "ILS");
        }
    }

    @Nested
    @DisplayName("2. 응답 정규화")
    class NormalizationTest {

        @Test
        @DisplayName("기대하지 않은 통화는 조용히 버린다")
        void unexpectedCurrencies_areDropped() {
            server.expect(requestTo(EXCHANGE_RATE_URL + "/USD"))
                    .andRespond(withSuccess("{\"rates\":{\"EUR\":0.84,\"ILS\":3.32,\"JPY\":110.5,\"USD\":1}}",
                            MediaType.APPLICATION_JSON));

            assertThat(exchangeRateApiClient.fetchRates("USD")).containsOnlyKeys("EUR", "ILS");
        }

        @Test
        @DisplayName("숫자 문자열 값도 환율로 받아들인다")
        void numericStrings_areAccepted() {
            server.expect(requestTo(EXCHANGE_RATE_URL + "/USD"))
                    .andRespond(withSuccess("{\"rates\":{\"EUR\":\"0.84\",\"ILS\":\"3.32\"}}",
                            MediaType.APPLICATION_JSON));

            Map<String, BigDecimal> rates = exchangeRateApiClient.fetchRates("USD");

            assertThat(rates.get("EUR")).isEqualByComparingTo("0.84");
            assertThat(rates.get("ILS")).isEqualByComparingTo("3.32");
        }

        @Test
        @DisplayName("양수가 아니거나 숫자가 아닌 값은 해당 통화만 제외한다")
        void invalidValues_dropOnlyThatCurrency() {
            server.expect(requestTo(EXCHANGE_RATE_URL + "/USD"))
                    .andRespond(withSuccess("{\"rates\":{\"EUR\":-0.84,\"ILS\":3.32}}", MediaType.APPLICATION_JSON));

            assertThat(exchangeRateApiClient.fetchRates("USD")).containsOnlyKeys("ILS");

            server.reset();
            server.expect(requestTo(EXCHANGE_RATE_URL + "/USD"))
                    .andRespond(withSuccess("{\"rates\":{\"EUR\":\"n/a\",\"ILS\":3.32}}", MediaType.APPLICATION_JSON));

            assertThat(exchangeRateApiClient.fetchRates("USD")).containsOnlyKeys("ILS");
        }

        @Test
        @DisplayName("지수가 범위를 벗어난 값은 해당 통화만 제외한다")
        void outOfRangeValues_dropOnlyThatCurrency() {
            server.expect(requestTo(EXCHANGE_RATE_URL + "/USD"))
                    .andRespond(withSuccess("{\"rates\":{\"EUR\":\"1E-2147483647\",\"ILS\":3.32}}",
                            MediaType.APPLICATION_JSON));

            assertThat(exchangeRateApiClient.fetchRates("USD")).containsOnlyKeys("ILS");
        }

        @Test
        @DisplayName("누락된 통화는 결과에서 빠진다")
        void missingCurrency_isAbsent() {
            server.expect(requestTo(EXCHANGE_RATE_URL + "/USD"))
                    .andRespond(withSuccess("{\"rates\":{\"EUR\":0.84,\"ILS\":null}}", MediaType.APPLICATION_JSON));

            assertThat(exchangeRateApiClient.fetchRates("USD")).containsOnlyKeys("EUR");
        }
    }

    @Nested
    @DisplayName("3. 원천 실패")
    class FailureTest {

        @Test
        @DisplayName("HTTP 오류는 RateSourceException")
        void serverError_throws() {
            server.expect(requestTo(EXCHANGE_RATE_URL + "/USD")).andRespond(withServerError());

            assertThatThrownBy(() -> exchangeRateApiClient.fetchRates("USD"))
                    .isInstanceOf(RateSourceException.class)
                    .extracting("source").isEqualTo(ExchangeRateApiClient.NAME);
        }

        @Test
        @DisplayName("4xx 응답도 실패로 처리한다")
        void clientError_throws() {
            server.expect(method(HttpMethod.GET)).andRespond(withStatus(HttpStatus.NOT_FOUND));

            assertThatThrownBy(() -> openRatesClient.fetchRates("USD"))
                    .isInstanceOf(RateSourceException.class)
                    .extracting("source").isEqualTo(OpenRatesClient.NAME);
        }

        @Test
        @DisplayName("JSON이 아닌 응답은 RateSourceException")
        void unparseableBody_throws() {
            server.expect(requestTo(EXCHANGE_RATE_URL + "/USD"))
                    .andRespond(withSuccess("<html>maintenance</html>", MediaType.TEXT_HTML));

            assertThatThrownBy(() -> exchangeRateApiClient.fetchRates("USD"))
                    .isInstanceOf(RateSourceException.class)
                    .hasMessageContaining("unparseable");
        }

        @Test
        @DisplayName("rates 필드가 없으면 RateSourceException")
        void missingRatesField_throws() {
            server.expect(requestTo(EXCHANGE_RATE_URL + "/USD"))
                    .andRespond(withSuccess("{\"result\":\"error\"}", MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> exchangeRateApiClient.fetchRates("USD"))
                    .isInstanceOf(RateSourceException.class)
                    .hasMessageContaining("rates");
        }
    }
}
