package com.studioscout.core.extract.fields;

import com.studioscout.core.extract.FieldExtractor;
import com.studioscout.core.extract.FieldResult;
import com.studioscout.core.extract.PageTree;
import com.studioscout.core.extract.FieldSelector;
import com.studioscout.core.extract.SelectorSet;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** 세부 평점 항목 "라벨: 값". 라벨이나 값 중 하나라도 없는 항목은 조용히 건너뛴다. */
public final class RatingFactorsExtractor implements FieldExtractor<List<String>> {

    private final FieldSelector item;
    private final FieldSelector label;
    private final FieldSelector value;

    public RatingFactorsExtractor(SelectorSet selectors) {
        this.item = selectors.get(SelectorSet.RATING_FACTOR);
        this.label = selectors.get(SelectorSet.RATING_FACTOR_LABEL);
        this.value = selectors.get(SelectorSet.RATING_FACTOR_VALUE);
    }

    @Override
    public String fieldName() { return "ratingFactors"; }

    @Override
    public FieldResult<List<String>> extract(PageTree tree) {
        List<Element> items = tree.findAll(item);
        if (items.isEmpty()) return FieldResult.absent();

        List<String> out = new ArrayList<>();
        for (Element it : items) {
            Optional<Element> l = tree.findFirstWithin(it, label);
            Optional<Element> v = tree.findFirstWithin(it, value);
            if (l.isPresent() && v.isPresent()) {
                out.add(tree.text(l.get()) + ": " + tree.text(v.get()));
            }
        }
        return FieldResult.present(out);
    }
}
