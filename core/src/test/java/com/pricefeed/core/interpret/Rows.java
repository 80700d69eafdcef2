package com.pricefeed.core.interpret;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

import java.util.List;

/** 테스트용: &lt;tr&gt; 조각을 표 안에서 파싱해 행 Element 로 돌려준다. */
final class Rows {
    private Rows() {}

    static Element row(String trHtml) {
        return rows(trHtml).get(0);
    }

    static List<Element> rows(String trHtml) {
        return Jsoup.parse("<table><tbody>" + trHtml + "</tbody></table>").select("table tbody tr");
    }
}
