package com.pricefeed.core.interpret;

import java.util.Optional;

/** 가격 문자열 → 판매처 숫자 도메인. 숫자가 아니면 empty (0 아님). */
@FunctionalInterface
public interface PriceParser<P extends Number> {
    Optional<P> parse(String raw);
}
