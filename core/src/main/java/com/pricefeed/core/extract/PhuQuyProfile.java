package com.pricefeed.core.extract;

import com.pricefeed.core.api.IPageFetcher;
import com.pricefeed.core.api.IRowInterpreter;
import com.pricefeed.core.interpret.BranchRowInterpreter;
import com.pricefeed.core.interpret.CategoryHeaders;
import com.pricefeed.core.interpret.ClassCellRowInterpreter;
import com.pricefeed.core.interpret.WholeCurrencyParser;
import com.pricefeed.core.locate.CssRowLocator;
import com.pricefeed.core.model.FeedConfig;
import com.pricefeed.core.model.Metal;
import com.pricefeed.core.model.Vendor;

/** Phú Quý: tbody 행, 클래스 기반 셀, 카테고리 헤더, 원 단위 정수. */
public final class PhuQuyProfile implements VendorProfile {

    @Override public Vendor vendor() { return Vendor.PHU_QUY; }

    @Override
    public PriceExtractor<Long> extractor(Metal metal, FeedConfig.VendorCfg cfg, IPageFetcher fetcher) {
        WholeCurrencyParser parser = new WholeCurrencyParser();
        CategoryHeaders headers = CategoryHeaders.branchTitle();
        String unit = cfg.unitFor(metal);
        IRowInterpreter<Long> interpreter = (metal == Metal.GOLD)
                ? new ClassCellRowInterpreter<>(headers, parser, unit)
                : new BranchRowInterpreter<>(headers, parser, unit);
        return new PriceExtractor<>(Vendor.PHU_QUY, metal, cfg.urlFor(metal),
                fetcher, CssRowLocator.bodyRows(), interpreter);
    }
}
