package com.example.fxquote.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * 견적 응답
 * 성공: exchange_rate / currency_code / amount
 * 실패: error (SERVICE_DOWN은 문자열 하나, 검증 실패는 메시지 목록)
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"exchange_rate", "currency_code", "amount", "error"})
public class QuoteResponse {

    private static final int RATE_SCALE = 3;
    private static final int AMOUNT_SCALE = 5;

    @JsonProperty("exchange_rate")
    String exchangeRate;

    @JsonProperty("currency_code")
    String currencyCode;

    @JsonProperty("amount")
    String amount;

    @JsonProperty("error")
    Object error;

    @JsonIgnore
    List<Problem> problems;

    public static QuoteResponse success(BigDecimal rate, String currencyCode, BigDecimal amount) {
        BigDecimal converted = amount.multiply(rate);
        return new QuoteResponse(
                rate.setScale(RATE_SCALE, RoundingMode.HALF_EVEN).toPlainString(),
                currencyCode,
                converted.setScale(AMOUNT_SCALE, RoundingMode.HALF_EVEN).toPlainString(),
                null,
                List.of()
        );
    }

    public static QuoteResponse problems(List<ProblemReport> reports) {
        return new QuoteResponse(
                null,
                null,
                null,
                reports.stream().map(ProblemReport::getMessage).toList(),
                reports.stream().map(ProblemReport::getProblem).toList()
        );
    }

    public static QuoteResponse serviceDown() {
        return new QuoteResponse(
                null,
                null,
                null,
                Problem.SERVICE_DOWN.format(null),
                List.of(Problem.SERVICE_DOWN)
        );
    }

    public boolean hasError() {
        return error != null;
    }

    public boolean hasProblem(Problem problem) {
        return problems.contains(problem);
    }
}
