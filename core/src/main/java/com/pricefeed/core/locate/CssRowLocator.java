package com.pricefeed.core.locate;

import com.pricefeed.core.api.IRowLocator;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * jsoup CSS 선택자 기반 행 탐색기. 의미 판별은 하지 않는다(RowInterpreter 몫).
 *
 * <p>주의: jsoup 파서는 HTML5 규칙대로 table 직속 tr 에 tbody 를 보충한다.
 */
public final class CssRowLocator implements IRowLocator {

    /** table 의 tbody 아래 행만 (thead/tfoot 제외) */
    public static final String BODY_ROWS = "table tbody tr";
    /** 모든 table 의 모든 행 */
    public static final String ALL_ROWS = "table tr";

    private final String rowQuery;

    public CssRowLocator(String rowQuery) {
        this.rowQuery = Objects.requireNonNull(rowQuery, "rowQuery");
    }

    public static CssRowLocator bodyRows() { return new CssRowLocator(BODY_ROWS); }
    public static CssRowLocator allRows() { return new CssRowLocator(ALL_ROWS); }

    @Override
    public List<Element> locate(Optional<String> html) {
        if (html == null || html.isEmpty() || html.get().isBlank()) return List.of();
        Document doc = Jsoup.parse(html.get());
        return List.copyOf(doc.select(rowQuery));
    }
}
