package com.pricefeed.core.interpret;

import com.pricefeed.core.model.Vendor;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 셀 개수별 열 배치 한 가지: {vendor, minCells, indexMap}.
 * 셀 수가 minCells 이상이면 적용 가능.
 */
public record ColumnLayout(Vendor vendor, int minCells, Map<Column, Integer> indexes) {

    public ColumnLayout {
        Objects.requireNonNull(vendor, "vendor");
        if (minCells < 1) throw new IllegalArgumentException("minCells must be >= 1");
        if (!indexes.containsKey(Column.PRODUCT)) {
            throw new IllegalArgumentException("layout needs a PRODUCT column");
        }
        for (var e : indexes.entrySet()) {
            if (e.getValue() < 0 || e.getValue() >= minCells) {
                throw new IllegalArgumentException(e.getKey() + " index out of layout: " + e.getValue());
            }
        }
        indexes = Collections.unmodifiableMap(new EnumMap<>(indexes));
    }

    public static ColumnLayout of(Vendor vendor, int minCells, Map<Column, Integer> indexes) {
        return new ColumnLayout(vendor, minCells, indexes);
    }

    public Optional<Integer> indexOf(Column column) {
        return Optional.ofNullable(indexes.get(column));
    }

    /**
     * 셀 수에 맞는 배치를 고른다: minCells 를 만족하는 것 중 가장 넓은 배치.
     * 어떤 배치의 최소치도 못 채우면 empty(= 노이즈 행).
     */
    public static Optional<ColumnLayout> select(List<ColumnLayout> layouts, int cellCount) {
        ColumnLayout best = null;
        for (ColumnLayout l : layouts) {
            if (cellCount >= l.minCells() && (best == null || l.minCells() > best.minCells())) {
                best = l;
            }
        }
        return Optional.ofNullable(best);
    }
}
