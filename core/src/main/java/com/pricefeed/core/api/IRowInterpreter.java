// IRowInterpreter.java
package com.pricefeed.core.api;

import com.pricefeed.core.interpret.RowOutcome;
import org.jsoup.nodes.Element;

/** 행 해석 계약: 한 행을 헤더/데이터/노이즈 중 하나로 분류한다. 부수효과 없음. */
public interface IRowInterpreter<P extends Number> {
    RowOutcome<P> interpret(Element row);
}
