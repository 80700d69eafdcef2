package com.pricefeed.core.model;

/** 시세 대상 금속(= 판매처별 페이지 하나). */
public enum Metal {
    GOLD("gold"),
    SILVER("silver");

    private final String key;

    Metal(String key) { this.key = key; }

    /** 응답 envelope 의 필드명으로도 쓰인다. */
    public String key() { return key; }
}
