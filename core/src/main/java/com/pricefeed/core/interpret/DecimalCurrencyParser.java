package com.pricefeed.core.interpret;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 소수 가격: "17,800" → 17800.0, "51306.539" → 51306.539.
 * 정리된 문자열은 숫자와 소수점 하나만 허용.
 */
public final class DecimalCurrencyParser implements PriceParser<Double> {

    private static final Pattern DECIMAL = Pattern.compile("[0-9]*\\.?[0-9]*");
    private static final Pattern HAS_DIGIT = Pattern.compile(".*[0-9].*");

    @Override
    public Optional<Double> parse(String raw) {
        String s = PriceText.clean(raw);
        if (s.isEmpty() || !DECIMAL.matcher(s).matches() || !HAS_DIGIT.matcher(s).matches()) {
            return Optional.empty();
        }
        double v = Double.parseDouble(s);
        // 자릿수가 너무 길면 Infinity 가 된다
        return Double.isFinite(v) ? Optional.of(v) : Optional.empty();
    }
}
