package com.pricefeed.core.interpret;

import com.pricefeed.core.api.IRowInterpreter;
import com.pricefeed.core.model.PriceRecord;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Objects;

/**
 * 클래스 속성으로 매수/매도 셀을 찾는 행 해석기(Phú Quý 금 시세표).
 * 상품명은 항상 첫 셀, 매수/매도 셀은 위치와 무관하게 td.buy-price / td.sell-price.
 */
public final class ClassCellRowInterpreter<P extends Number> implements IRowInterpreter<P> {

    public static final int MIN_CELLS = 3;
    public static final String BUY_CELL = "td.buy-price";
    public static final String SELL_CELL = "td.sell-price";

    private final CategoryHeaders headers;
    private final PriceParser<P> parser;
    private final String unit;

    public ClassCellRowInterpreter(CategoryHeaders headers, PriceParser<P> parser, String unit) {
        this.headers = Objects.requireNonNull(headers, "headers");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.unit = unit;
    }

    @Override
    public RowOutcome<P> interpret(Element row) {
        var header = headers.match(row);
        if (header.isPresent()) return RowOutcome.header(header.get());

        List<Element> cells = Cells.of(row);
        if (cells.size() < MIN_CELLS) return RowOutcome.noise("cells=" + cells.size());

        Element buy = row.selectFirst(BUY_CELL);
        Element sell = row.selectFirst(SELL_CELL);

        PriceRecord.Builder<P> draft = PriceRecord.<P>builder()
                .product(Cells.text(cells.get(0)))
                .unit(unit)
                .buyPrice(buy == null ? null : parser.parse(Cells.text(buy)).orElse(null))
                .sellPrice(sell == null ? null : parser.parse(Cells.text(sell)).orElse(null));
        return RowOutcome.of(draft);
    }
}
