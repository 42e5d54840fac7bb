package com.studioscout.core.extract.fields;

import com.studioscout.core.extract.SelectorSet;

public final class DescriptionExtractor extends FirstTextExtractor {
    public DescriptionExtractor(SelectorSet selectors) {
        super("description", selectors.get(SelectorSet.DESCRIPTION));
    }
}
