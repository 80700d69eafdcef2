// IPageFetcher.java
package com.pricefeed.core.api;

import java.net.URI;
import java.util.Optional;

/** 페이지 수집 최소 계약: URL을 받아 HTML 본문을 돌려준다. 실패는 empty(예외 아님). */
public interface IPageFetcher {
    Optional<String> fetch(URI url);
}
