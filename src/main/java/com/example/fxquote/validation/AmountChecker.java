package com.example.fxquote.validation;

import com.example.fxquote.domain.Problem;
import com.example.fxquote.domain.ProblemReport;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * 금액/환율 값 검사 규칙 (요청 금액, 원천 환율, 캐시 값에 공통 적용)
 * - 유한한 10진수로 파싱되어야 하고 0보다 커야 함
 * - NaN, Infinity 는 BigDecimal 파싱 단계에서 NOT_A_NUMBER 로 걸러짐
 * - 자릿수(10의 지수)가 ±MAX_EXPONENT 를 넘는 값도 NOT_A_NUMBER (double 유한 범위 수준)
 */
public final class AmountChecker {

    static final int MAX_EXPONENT = 400;

    private AmountChecker() {
    }

    public static Optional<ProblemReport> check(String raw) {
        Optional<BigDecimal> parsed = parse(raw);
        if (parsed.isEmpty()) {
            return Optional.of(Problem.NOT_A_NUMBER.report(raw));
        }
        if (parsed.get().signum() <= 0) {
            return Optional.of(Problem.NOT_POSITIVE.report(raw));
        }
        return Optional.empty();
    }

    public static Optional<BigDecimal> parsePositive(String raw) {
        return parse(raw).filter(value -> value.signum() > 0);
    }

    private static Optional<BigDecimal> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        try {
            BigDecimal value = new BigDecimal(raw.trim());
            return withinRange(value) ? Optional.of(value) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    // 1E-2147483647, 1E+999999999 같은 값은 곱셈/setScale/toPlainString 에서 터지거나 멈춤
    private static boolean withinRange(BigDecimal value) {
        if (value.signum() == 0) {
            return true;
        }
        long exponent = (long) value.precision() - value.scale() - 1;
        return Math.abs(exponent) <= MAX_EXPONENT;
    }
}
