package com.studioscout.core.extract.fields;

import com.studioscout.core.extract.FieldExtractor;
import com.studioscout.core.extract.FieldResult;
import com.studioscout.core.extract.PageTree;
import com.studioscout.core.extract.FieldSelector;
import com.studioscout.core.extract.SelectorSet;
import com.studioscout.core.model.ContactKind;
import org.jsoup.nodes.Element;

import java.util.AbstractMap;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 연락처: 연락처 컨테이너 안의 href 있는 <a>를 분류.
 * mailto: → EMAIL, tel: → PHONE, 그 외 → HOMEPAGE.
 * 같은 종류가 여러 번 나오면 마지막 값이 남는다(last-write-wins).
 */
public final class ContactExtractor implements FieldExtractor<Map<ContactKind, String>> {

    static final String MAILTO = "mailto:";
    static final String TEL = "tel:";

    private static final FieldSelector ANCHOR = FieldSelector.tag("a");

    private final FieldSelector container;

    public ContactExtractor(SelectorSet selectors) {
        this.container = selectors.get(SelectorSet.CONTACT);
    }

    @Override
    public String fieldName() { return "contact"; }

    @Override
    public FieldResult<Map<ContactKind, String>> extract(PageTree tree) {
        List<Element> divs = tree.findAll(container);
        if (divs.isEmpty()) return FieldResult.absent();

        Map<ContactKind, String> out = new EnumMap<>(ContactKind.class);
        for (Element div : divs) {
            for (Element a : tree.findAllWithin(div, ANCHOR)) {
                if (!a.hasAttr("href")) continue;
                Map.Entry<ContactKind, String> hit = classify(a.attr("href"));
                out.put(hit.getKey(), hit.getValue());
            }
        }
        return FieldResult.present(out);
    }

    /** href 하나를 종류/값으로. 스킴 접두어는 제거(대소문자 구분) */
    public static Map.Entry<ContactKind, String> classify(String href) {
        if (href.startsWith(MAILTO)) {
            return new AbstractMap.SimpleImmutableEntry<>(ContactKind.EMAIL, href.replace(MAILTO, ""));
        }
        if (href.startsWith(TEL)) {
            return new AbstractMap.SimpleImmutableEntry<>(ContactKind.PHONE, href.replace(TEL, ""));
        }
        return new AbstractMap.SimpleImmutableEntry<>(ContactKind.HOMEPAGE, href);
    }
}
