package com.example.fxquote.validation;

import com.example.fxquote.currency.CurrencyRegistry;
import com.example.fxquote.domain.Problem;
import com.example.fxquote.domain.ProblemReport;
import com.example.fxquote.domain.QuoteRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 견적 요청 검증 (I/O 전에 수행)
 * 모든 항목을 끝까지 검사해서 문제를 한 번에 돌려준다
 */
@Component
@RequiredArgsConstructor
public class QuoteValidator {

    private final CurrencyRegistry currencyRegistry;

    public List<ProblemReport> validate(QuoteRequest request) {
        List<ProblemReport> problems = new ArrayList<>();
        AmountChecker.check(request.getAmount()).ifPresent(problems::add);
        checkCurrency(request.getFromCurrencyCode(), Problem.FROM_CURRENCY, problems);
        checkCurrency(request.getToCurrencyCode(), Problem.TO_CURRENCY, problems);
        return problems;
    }

    private void checkCurrency(String currency, Problem problem, List<ProblemReport> problems) {
        if (!currencyRegistry.isSupported(currency)) {
            problems.add(problem.report(currency));
        }
    }
}
