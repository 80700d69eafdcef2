package com.pricefeed.core.interpret;

import org.jsoup.nodes.Element;

import java.util.Optional;

/** 카테고리 헤더 행 판별: 병합 셀(td[colspan]) 안의 표식 클래스 요소. */
public final class CategoryHeaders {

    public static final String BRANCH_TITLE = "td[colspan] .branch_title";

    private final String query;

    public CategoryHeaders(String query) {
        this.query = query;
    }

    public static CategoryHeaders branchTitle() { return new CategoryHeaders(BRANCH_TITLE); }

    /** 헤더 행이면 카테고리 텍스트. */
    public Optional<String> match(Element row) {
        Element marker = row.selectFirst(query);
        return marker == null ? Optional.empty() : Optional.of(Cells.text(marker));
    }
}
