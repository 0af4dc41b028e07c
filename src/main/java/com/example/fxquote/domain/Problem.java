package com.example.fxquote.domain;

/**
 * 견적 처리 중 발생할 수 있는 문제 종류
 * 각 종류는 사용자에게 보여줄 메시지 템플릿을 가진다 ({} 자리에 값이 들어감)
 */
public enum Problem {

    MISSING_CURRENCY("The exchange rate for {} is missing."),
    SERVICE_DOWN("The service is temporarily down for maintenance."),
    NOT_A_NUMBER("The specified 'amount'={} is not a number. Please specify a positive numeric value."),
    NOT_POSITIVE("The specified 'amount'={} is not a positive number."),
    FROM_CURRENCY("The 'from_currency_code'={} is not supported."),
    TO_CURRENCY("The 'to_currency_code'={} is not supported.");

    private final String template;

    Problem(String template) {
        this.template = template;
    }

    public String format(Object value) {
        return template.replace("{}", value == null ? "" : String.valueOf(value));
    }

    public ProblemReport report(Object value) {
        return new ProblemReport(this, format(value));
    }
}
