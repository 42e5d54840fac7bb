package com.studioscout.core.extract.fields;

import com.studioscout.core.extract.SelectorSet;

/** 스튜디오 이름 (h1 제목) */
public final class NameExtractor extends FirstTextExtractor {
    public NameExtractor(SelectorSet selectors) {
        super("name", selectors.get(SelectorSet.NAME));
    }
}
