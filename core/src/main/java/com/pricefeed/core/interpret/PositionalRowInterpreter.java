package com.pricefeed.core.interpret;

import com.pricefeed.core.api.IRowInterpreter;
import com.pricefeed.core.model.PriceRecord;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 위치 기반 행 해석기: 셀 개수로 ColumnLayout 을 고른 뒤 인덱스로 필드를 읽는다.
 * 최소 셀 수 미달 행은 노이즈. 카테고리 헤더는 없다.
 */
public final class PositionalRowInterpreter<P extends Number> implements IRowInterpreter<P> {

    private final List<ColumnLayout> layouts;
    private final PriceParser<P> parser;
    private final String unit;

    public PositionalRowInterpreter(List<ColumnLayout> layouts, PriceParser<P> parser, String unit) {
        if (layouts == null || layouts.isEmpty()) throw new IllegalArgumentException("layouts must not be empty");
        this.layouts = List.copyOf(layouts);
        this.parser = Objects.requireNonNull(parser, "parser");
        this.unit = unit;
    }

    @Override
    public RowOutcome<P> interpret(Element row) {
        List<Element> cells = Cells.of(row);
        Optional<ColumnLayout> layout = ColumnLayout.select(layouts, cells.size());
        if (layout.isEmpty()) return RowOutcome.noise("cells=" + cells.size());

        ColumnLayout l = layout.get();
        PriceRecord.Builder<P> draft = PriceRecord.<P>builder()
                .product(text(cells, l, Column.PRODUCT))
                .unit(unit)
                .buyPrice(parser.parse(text(cells, l, Column.BUY)).orElse(null))
                .sellPrice(parser.parse(text(cells, l, Column.SELL)).orElse(null));
        String purity = text(cells, l, Column.PURITY);
        if (!purity.isEmpty()) draft.purity(purity);
        return RowOutcome.of(draft);
    }

    private static String text(List<Element> cells, ColumnLayout l, Column c) {
        return l.indexOf(c).map(i -> Cells.text(cells.get(i))).orElse("");
    }
}
