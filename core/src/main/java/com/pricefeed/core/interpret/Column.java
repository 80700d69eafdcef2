package com.pricefeed.core.interpret;

/** 위치 기반 표에서 의미를 갖는 열. */
public enum Column {
    PRODUCT,
    PURITY,
    BUY,
    SELL
}
