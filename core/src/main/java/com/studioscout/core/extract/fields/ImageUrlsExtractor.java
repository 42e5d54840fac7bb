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

/**
 * 갤러리 이미지 URL.
 * 컨테이너마다 첫 <img>의 src. img가 없거나 src가 비면 그 컨테이너만 건너뛴다.
 * src는 마크업 값 그대로(절대화하지 않음).
 */
public final class ImageUrlsExtractor implements FieldExtractor<List<String>> {

    private static final FieldSelector IMG = FieldSelector.tag("img");

    private final FieldSelector container;

    public ImageUrlsExtractor(SelectorSet selectors) {
        this.container = selectors.get(SelectorSet.IMAGE);
    }

    @Override
    public String fieldName() { return "imageUrls"; }

    @Override
    public FieldResult<List<String>> extract(PageTree tree) {
        List<Element> divs = tree.findAll(container);
        if (divs.isEmpty()) return FieldResult.absent();

        List<String> urls = new ArrayList<>();
        for (Element div : divs) {
            Optional<String> src = tree.findFirstWithin(div, IMG).flatMap(img -> tree.attribute(img, "src"));
            src.ifPresent(urls::add);
        }
        return FieldResult.present(urls);
    }
}
