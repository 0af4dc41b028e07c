package com.example.fxquote.currency;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 지원 통화 화이트리스트
 * 기동 시 한 번 구성되고 이후 읽기 전용
 */
public class CurrencyRegistry {

    private final Set<String> currencies;

    public CurrencyRegistry(Collection<String> currencies) {
        this.currencies = Collections.unmodifiableSet(new LinkedHashSet<>(currencies));
    }

    public boolean isSupported(String code) {
        return code != null && currencies.contains(code);
    }

    /**
     * 기준 통화를 제외한 지원 통화 (원천 응답에서 기대하는 통화 목록)
     * 예: allExcept("USD") => [EUR, ILS]
     */
    public Set<String> allExcept(String code) {
        Set<String> others = new LinkedHashSet<>(currencies);
        others.remove(code);
        return Collections.unmodifiableSet(others);
    }

    public Set<String> getCurrencies() {
        return currencies;
    }
}
