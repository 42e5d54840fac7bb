package com.studioscout.core.extract.fields;

import com.studioscout.core.extract.FieldExtractor;
import com.studioscout.core.extract.FieldResult;
import com.studioscout.core.extract.PageTree;
import com.studioscout.core.extract.FieldSelector;
import com.studioscout.core.extract.SelectorSet;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/** 제공 수업/시설 종류 목록 */
public final class AmenitiesExtractor implements FieldExtractor<List<String>> {

    private final FieldSelector item;

    public AmenitiesExtractor(SelectorSet selectors) {
        this.item = selectors.get(SelectorSet.AMENITY);
    }

    @Override
    public String fieldName() { return "amenities"; }

    @Override
    public FieldResult<List<String>> extract(PageTree tree) {
        List<Element> found = tree.findAll(item);
        if (found.isEmpty()) return FieldResult.absent();
        List<String> out = new ArrayList<>(found.size());
        for (Element p : found) out.add(tree.text(p));
        return FieldResult.present(out);
    }
}
