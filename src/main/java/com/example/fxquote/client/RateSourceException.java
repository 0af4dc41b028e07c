package com.example.fxquote.client;

import lombok.Getter;

/**
 * 원천 환율 API 조회 실패 (네트워크/HTTP 오류, 파싱 불가, rates 필드 누락)
 */
@Getter
public class RateSourceException extends RuntimeException {

    private final String source;

    public RateSourceException(String source, String message) {
        super("[" + source + "] " + message);
        this.source = source;
    }

    public RateSourceException(String source, String message, Throwable cause) {
        super("[" + source + "] " + message, cause);
        this.source = source;
    }
}
