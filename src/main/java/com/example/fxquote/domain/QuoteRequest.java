package com.example.fxquote.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 환전 견적 요청
 * 전송 계층에서 받은 문자열 그대로 보관하고, 파싱/검증은 QuoteValidator가 담당
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuoteRequest {

    private String fromCurrencyCode; // 기준 통화 (USD 등)
    private String amount;           // 환전 금액 (원문 문자열)
    private String toCurrencyCode;   // 대상 통화
}
