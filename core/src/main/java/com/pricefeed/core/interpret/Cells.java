package com.pricefeed.core.interpret;

import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/** 행 셀 헬퍼. 중첩 표의 td 는 세지 않는다(직계 자식만). */
final class Cells {
    private Cells() {}

    static List<Element> of(Element row) {
        List<Element> out = new ArrayList<>();
        for (Element child : row.children()) {
            if ("td".equals(child.normalName())) out.add(child);
        }
        return out;
    }

    /** 앞뒤 공백 제거된 텍스트. 셀이 없으면 "" */
    static String text(Element cell) {
        return cell == null ? "" : cell.text().replace('\u00A0', ' ').strip();
    }
}
