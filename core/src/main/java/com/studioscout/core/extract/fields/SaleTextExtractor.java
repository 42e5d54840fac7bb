package com.studioscout.core.extract.fields;

import com.studioscout.core.extract.SelectorSet;

/** 할인/프로모션 문구 */
public final class SaleTextExtractor extends FirstTextExtractor {
    public SaleTextExtractor(SelectorSet selectors) {
        super("saleText", selectors.get(SelectorSet.SALE));
    }
}
