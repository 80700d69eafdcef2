package com.pricefeed.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 판매처와 무관한 정규화 시세 한 줄.
 *
 * <p>숫자 타입 P 는 판매처마다 다르다: 원 단위 정수(Long) 또는 소수(Double).
 * 가격 부재는 null(=Optional.empty)로 보관하며 0 과 구분된다.
 * product 는 비어 있을 수 없고 buy/sell 중 하나 이상은 반드시 존재한다.
 */
public final class PriceRecord<P extends Number> {
    private final String product;
    private final String category;
    private final String purity;
    private final String unit;
    private final P buyPrice;
    private final P sellPrice;

    private PriceRecord(Builder<P> b) {
        this.product = b.product;
        this.category = (b.category == null) ? "" : b.category;
        this.purity = b.purity;
        this.unit = (b.unit == null) ? "" : b.unit;
        this.buyPrice = b.buyPrice;
        this.sellPrice = b.sellPrice;
    }

    public String getProduct() { return product; }
    /** 카테고리 헤더 아래에 있지 않으면 "" (null 아님). */
    public String getCategory() { return category; }
    public Optional<String> getPurity() { return Optional.ofNullable(purity); }
    public String getUnit() { return unit; }
    public Optional<P> getBuyPrice() { return Optional.ofNullable(buyPrice); }
    public Optional<P> getSellPrice() { return Optional.ofNullable(sellPrice); }

    /** 같은 값에 카테고리만 바꾼 사본. */
    public PriceRecord<P> withCategory(String newCategory) {
        return toBuilder().category(newCategory).build();
    }

    /**
     * 직렬화용 필드 맵(삽입 순서 유지). 가격 부재는 null 값으로 남기고,
     * purity 는 판매처가 게시할 때만 키가 생긴다.
     */
    public Map<String, Object> toFields() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("product", product);
        m.put("category", category);
        if (purity != null) m.put("purity", purity);
        m.put("unit", unit);
        m.put("buy_price", buyPrice);
        m.put("sell_price", sellPrice);
        return Collections.unmodifiableMap(m);
    }

    public Builder<P> toBuilder() {
        return new Builder<P>()
                .product(product)
                .category(category)
                .purity(purity)
                .unit(unit)
                .buyPrice(buyPrice)
                .sellPrice(sellPrice);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PriceRecord<?> r)) return false;
        return product.equals(r.product)
                && category.equals(r.category)
                && Objects.equals(purity, r.purity)
                && unit.equals(r.unit)
                && Objects.equals(buyPrice, r.buyPrice)
                && Objects.equals(sellPrice, r.sellPrice);
    }

    @Override
    public int hashCode() {
        return Objects.hash(product, category, purity, unit, buyPrice, sellPrice);
    }

    @Override
    public String toString() {
        return "PriceRecord" + toFields();
    }

    // ----- 빌더 -----
    public static <P extends Number> Builder<P> builder() { return new Builder<>(); }

    public static final class Builder<P extends Number> {
        private String product;
        private String category;
        private String purity;
        private String unit;
        private P buyPrice;
        private P sellPrice;

        public Builder<P> product(String product) { this.product = product; return this; }
        public Builder<P> category(String category) { this.category = category; return this; }
        public Builder<P> purity(String purity) { this.purity = purity; return this; }
        public Builder<P> unit(String unit) { this.unit = unit; return this; }
        public Builder<P> buyPrice(P buyPrice) { this.buyPrice = buyPrice; return this; }
        public Builder<P> sellPrice(P sellPrice) { this.sellPrice = sellPrice; return this; }

        /** 출력 가능 조건: product 비어있지 않음 + 가격 하나 이상. */
        public boolean isComplete() {
            return product != null && !product.isBlank() && (buyPrice != null || sellPrice != null);
        }

        public PriceRecord<P> build() {
            if (product == null || product.isBlank()) {
                throw new IllegalStateException("product must not be empty");
            }
            if (buyPrice == null && sellPrice == null) {
                throw new IllegalStateException("buy or sell price required: " + product);
            }
            return new PriceRecord<>(this);
        }
    }
}
