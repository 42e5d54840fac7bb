package com.studioscout.core.extract.fields;

import com.studioscout.core.extract.FieldExtractor;
import com.studioscout.core.extract.FieldResult;
import com.studioscout.core.extract.PageTree;
import com.studioscout.core.extract.FieldSelector;
import com.studioscout.core.extract.SelectorSet;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/** 개요 버튼 라벨: 개요 컨테이너 안의 모든 <a> 텍스트(컨테이너 순 → 문서 순) */
public final class OverviewLabelsExtractor implements FieldExtractor<List<String>> {

    private static final FieldSelector ANCHOR = FieldSelector.tag("a");

    private final FieldSelector container;

    public OverviewLabelsExtractor(SelectorSet selectors) {
        this.container = selectors.get(SelectorSet.OVERVIEW);
    }

    @Override
    public String fieldName() { return "overviewLabels"; }

    @Override
    public FieldResult<List<String>> extract(PageTree tree) {
        List<Element> divs = tree.findAll(container);
        if (divs.isEmpty()) return FieldResult.absent();

        List<String> labels = new ArrayList<>();
        for (Element div : divs) {
            for (Element a : tree.findAllWithin(div, ANCHOR)) {
                labels.add(tree.text(a));
            }
        }
        return FieldResult.present(labels);
    }
}
