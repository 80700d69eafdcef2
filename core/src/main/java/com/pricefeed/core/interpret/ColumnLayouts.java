package com.pricefeed.core.interpret;

import com.pricefeed.core.model.Vendor;

import java.util.List;
import java.util.Map;

import static com.pricefeed.core.interpret.Column.*;

/** 판매처별 열 배치 표. 새 판매처/레이아웃은 여기에 항목을 추가한다. */
public final class ColumnLayouts {
    private ColumnLayouts() {}

    /** BTMC 금: 5칸(0번 장식 셀) / 4칸 */
    public static final List<ColumnLayout> BTMC_GOLD = List.of(
            ColumnLayout.of(Vendor.BTMC, 5, Map.of(PRODUCT, 1, PURITY, 2, BUY, 3, SELL, 4)),
            ColumnLayout.of(Vendor.BTMC, 4, Map.of(PRODUCT, 0, PURITY, 1, BUY, 2, SELL, 3))
    );

    /** BTMC 은: 4칸(0번 장식 셀) / 3칸 */
    public static final List<ColumnLayout> BTMC_SILVER = List.of(
            ColumnLayout.of(Vendor.BTMC, 4, Map.of(PRODUCT, 1, BUY, 2, SELL, 3)),
            ColumnLayout.of(Vendor.BTMC, 3, Map.of(PRODUCT, 0, BUY, 1, SELL, 2))
    );
}
