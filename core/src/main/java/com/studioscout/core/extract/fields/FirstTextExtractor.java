package com.studioscout.core.extract.fields;

import com.studioscout.core.extract.FieldExtractor;
import com.studioscout.core.extract.FieldResult;
import com.studioscout.core.extract.PageTree;
import com.studioscout.core.extract.FieldSelector;

import java.util.Objects;

/** 스칼라 필드 공통: 첫 매칭 요소의 텍스트, 없으면 ABSENT */
public abstract class FirstTextExtractor implements FieldExtractor<String> {

    private final String fieldName;
    private final FieldSelector selector;

    protected FirstTextExtractor(String fieldName, FieldSelector selector) {
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
        this.selector = Objects.requireNonNull(selector, "selector");
    }

    @Override
    public String fieldName() { return fieldName; }

    @Override
    public FieldResult<String> extract(PageTree tree) {
        return FieldResult.ofOptional(tree.findFirst(selector).map(tree::text));
    }
}
