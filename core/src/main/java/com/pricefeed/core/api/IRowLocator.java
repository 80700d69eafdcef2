// IRowLocator.java
package com.pricefeed.core.api;

import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Optional;

/** 표 위치 탐색 계약: HTML(또는 부재)에서 시세가 들어 있을 수 있는 행들을 문서 순서대로. */
public interface IRowLocator {
    List<Element> locate(Optional<String> html);
}
