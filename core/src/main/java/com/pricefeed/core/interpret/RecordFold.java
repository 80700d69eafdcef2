package com.pricefeed.core.interpret;

import com.pricefeed.core.api.IRowInterpreter;
import com.pricefeed.core.model.PriceRecord;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * 행 분류 결과를 순서대로 접어 레코드 목록을 만든다.
 *
 * <p>상태: NoCategory("") → 헤더 행마다 InCategory(name). 데이터 행은 현재 카테고리를 물려받는다.
 * 상태는 호출마다 새로 만들어지며 호출 간 공유되지 않는다.
 */
public final class RecordFold {
    private RecordFold() {}

    /** 접기 결과: 레코드 + 버려진 행 수 */
    public record Result<P extends Number>(List<PriceRecord<P>> records, int headers, int skipped) {}

    public static <P extends Number> List<PriceRecord<P>> fold(List<Element> rows, IRowInterpreter<P> interpreter) {
        return foldWithStats(rows, interpreter).records();
    }

    public static <P extends Number> Result<P> foldWithStats(List<Element> rows, IRowInterpreter<P> interpreter) {
        Acc<P> acc = new Acc<>();
        for (Element row : rows) {
            acc.accept(interpreter.interpret(row));
        }
        return new Result<>(List.copyOf(acc.records), acc.headers, acc.skipped);
    }

    /** 한 번의 접기 동안만 사는 누산기 */
    private static final class Acc<P extends Number> {
        String category = "";
        final List<PriceRecord<P>> records = new ArrayList<>();
        int headers;
        int skipped;

        void accept(RowOutcome<P> outcome) {
            if (outcome instanceof RowOutcome.Header<P> h) {
                category = h.category();
                headers++;
            } else if (outcome instanceof RowOutcome.Data<P> d) {
                records.add(d.record().withCategory(category));
            } else {
                skipped++;
            }
        }
    }
}
