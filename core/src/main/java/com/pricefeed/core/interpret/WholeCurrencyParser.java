package com.pricefeed.core.interpret;

import java.util.Optional;
import java.util.regex.Pattern;

/** 원 단위 정수 가격: "3,848,000" → 3848000. 숫자 외 문자가 남으면 empty. */
public final class WholeCurrencyParser implements PriceParser<Long> {

    private static final Pattern DIGITS = Pattern.compile("[0-9]+");

    @Override
    public Optional<Long> parse(String raw) {
        String s = PriceText.clean(raw);
        if (!DIGITS.matcher(s).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(s));
        } catch (NumberFormatException e) {
            // Long 범위 밖은 가격으로 보지 않음
            return Optional.empty();
        }
    }
}
