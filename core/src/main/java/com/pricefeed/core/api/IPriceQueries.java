// IPriceQueries.java
package com.pricefeed.core.api;

import com.pricefeed.core.model.Metal;
import com.pricefeed.core.model.PriceRecord;
import com.pricefeed.core.model.PriceSnapshot;
import com.pricefeed.core.model.Vendor;

import java.net.URI;
import java.util.List;

/** 조회 계약: 표현 계층(HTTP 등)이 소비하는 읽기 전용 시세 조회면. */
public interface IPriceQueries {
    List<PriceRecord<?>> prices(Vendor vendor, Metal metal);
    PriceSnapshot snapshot(Vendor vendor);
    URI source(Vendor vendor, Metal metal);
    Vendor defaultVendor();
}
