package com.pricefeed.core.interpret;

import com.pricefeed.core.model.PriceRecord;

/**
 * 행 하나의 분류 결과.
 * - Header: 새 카테고리 시작(레코드 아님)
 * - Data: 출력 조건을 만족한 레코드(카테고리는 RecordFold 가 채움)
 * - Noise: 버려지는 행. reason 은 디버그용
 */
public interface RowOutcome<P extends Number> {

    record Header<P extends Number>(String category) implements RowOutcome<P> {}

    record Data<P extends Number>(PriceRecord<P> record) implements RowOutcome<P> {}

    record Noise<P extends Number>(String reason) implements RowOutcome<P> {}

    static <P extends Number> RowOutcome<P> header(String category) { return new Header<>(category); }
    static <P extends Number> RowOutcome<P> data(PriceRecord<P> record) { return new Data<>(record); }
    static <P extends Number> RowOutcome<P> noise(String reason) { return new Noise<>(reason); }

    /** 빌더가 출력 조건을 만족하면 Data, 아니면 Noise. */
    static <P extends Number> RowOutcome<P> of(PriceRecord.Builder<P> draft) {
        return draft.isComplete() ? data(draft.build()) : noise("incomplete");
    }
}
