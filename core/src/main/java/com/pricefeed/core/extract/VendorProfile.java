package com.pricefeed.core.extract;

import com.pricefeed.core.api.IPageFetcher;
import com.pricefeed.core.model.FeedConfig;
import com.pricefeed.core.model.Metal;
import com.pricefeed.core.model.Vendor;

/** 판매처별 배선(로케이터/해석기/숫자 도메인) 전략. */
public interface VendorProfile {

    Vendor vendor();

    /** 금속별 추출기 조립. fetcher 는 호출자가 공급(테스트에서 대체 가능). */
    PriceExtractor<? extends Number> extractor(Metal metal, FeedConfig.VendorCfg cfg, IPageFetcher fetcher);

    static VendorProfile of(Vendor vendor) {
        return switch (vendor) {
            case PHU_QUY -> new PhuQuyProfile();
            case BTMC -> new BtmcProfile();
        };
    }
}
