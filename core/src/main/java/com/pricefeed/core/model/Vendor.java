package com.pricefeed.core.model;

import java.util.Locale;
import java.util.Optional;

/** 시세표를 게시하는 판매처. key 는 쿼리 파라미터(?vendor=) 값. */
public enum Vendor {
    PHU_QUY("phuquy", "Phú Quý Group"),
    BTMC("btmc", "Bảo Tín Minh Châu");

    private final String key;
    private final String displayName;

    Vendor(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String key() { return key; }
    public String displayName() { return displayName; }

    /** key 또는 enum 이름(대소문자 무시)으로 조회. 모르는 값이면 empty. */
    public static Optional<Vendor> fromKey(String s) {
        if (s == null || s.isBlank()) return Optional.empty();
        String t = s.trim();
        for (Vendor v : values()) {
            if (v.key.equalsIgnoreCase(t) || v.name().equalsIgnoreCase(t)) return Optional.of(v);
        }
        return Optional.empty();
    }

    @Override public String toString() { return name().toLowerCase(Locale.ROOT); }
}
