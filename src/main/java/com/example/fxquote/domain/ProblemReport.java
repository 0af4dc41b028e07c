package com.example.fxquote.domain;

import lombok.Value;

/**
 * 문제 종류 + 포맷된 메시지
 */
@Value
public class ProblemReport {

    Problem problem;
    String message;
}
