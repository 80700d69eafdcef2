package com.pricefeed.core.interpret;

/** 가격 셀 텍스트 정리: 공백(NBSP 포함) 제거 후 천 단위 구분자(,) 삭제. */
final class PriceText {
    private PriceText() {}

    static String clean(String raw) {
        if (raw == null) return "";
        return raw.replace('\u00A0', ' ').strip().replace(",", "");
    }
}
