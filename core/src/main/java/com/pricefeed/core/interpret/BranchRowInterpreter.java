package com.pricefeed.core.interpret;

import com.pricefeed.core.api.IRowInterpreter;
import com.pricefeed.core.model.PriceRecord;
import org.jsoup.nodes.Element;

import java.util.Objects;

/**
 * 지점/카테고리 묶음 시세표 행 해석기(Phú Quý 은 시세표).
 * - 헤더 행(td[colspan] .branch_title) → 카테고리 전환
 * - 데이터 행: td.col-product, td.col-unit-value(선택), td.col-buy-cell 두 개(매수, 매도)
 */
public final class BranchRowInterpreter<P extends Number> implements IRowInterpreter<P> {

    public static final String PRODUCT_CELL = "td.col-product";
    public static final String UNIT_CELL = "td.col-unit-value";
    public static final String PRICE_CELLS = "td.col-buy-cell";

    private final CategoryHeaders headers;
    private final PriceParser<P> parser;
    private final String defaultUnit;

    public BranchRowInterpreter(CategoryHeaders headers, PriceParser<P> parser, String defaultUnit) {
        this.headers = Objects.requireNonNull(headers, "headers");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.defaultUnit = defaultUnit;
    }

    @Override
    public RowOutcome<P> interpret(Element row) {
        var header = headers.match(row);
        if (header.isPresent()) return RowOutcome.header(header.get());

        Element product = row.selectFirst(PRODUCT_CELL);
        var prices = row.select(PRICE_CELLS);
        if (product == null || prices.size() < 2) return RowOutcome.noise("missing product/price cells");

        Element unitCell = row.selectFirst(UNIT_CELL);
        String unit = unitCell == null ? "" : Cells.text(unitCell);
        if (unit.isEmpty()) unit = defaultUnit;

        PriceRecord.Builder<P> draft = PriceRecord.<P>builder()
                .product(Cells.text(product))
                .unit(unit)
                .buyPrice(parser.parse(Cells.text(prices.get(0))).orElse(null))
                .sellPrice(parser.parse(Cells.text(prices.get(1))).orElse(null));
        return RowOutcome.of(draft);
    }
}
