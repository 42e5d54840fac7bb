package com.studioscout.core.extract.fields;

import com.studioscout.core.extract.FieldExtractor;
import com.studioscout.core.extract.FieldResult;
import com.studioscout.core.extract.PageTree;
import com.studioscout.core.extract.FieldSelector;
import com.studioscout.core.extract.SelectorSet;
import com.studioscout.core.model.Rating;

import java.util.Optional;

/** 총점 "4.8 (123)" → Rating("4.8", "123") */
public final class RatingExtractor implements FieldExtractor<Rating> {

    private final FieldSelector selector;

    public RatingExtractor(SelectorSet selectors) {
        this.selector = selectors.get(SelectorSet.RATING);
    }

    @Override
    public String fieldName() { return "rating"; }

    @Override
    public FieldResult<Rating> extract(PageTree tree) {
        return FieldResult.ofOptional(tree.findFirst(selector).map(tree::text).flatMap(RatingExtractor::parse));
    }

    /**
     * 첫 '(' 기준 분할. 왼쪽 trim = 점수, 오른쪽에서 ')' 제거 후 trim = 평가 수.
     * '('가 없으면 empty.
     */
    public static Optional<Rating> parse(String text) {
        if (text == null) return Optional.empty();
        int open = text.indexOf('(');
        if (open < 0) return Optional.empty();
        String score = text.substring(0, open).trim();
        String count = text.substring(open + 1).replace(")", "").trim();
        return Optional.of(new Rating(score, count));
    }
}
