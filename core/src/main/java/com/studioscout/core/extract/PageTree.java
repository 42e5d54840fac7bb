package com.studioscout.core.extract;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 한 페이지의 파싱된 문서 트리(jsoup Document 래퍼).
 * 추출기는 읽기만 하고, 레코드 조립이 끝나면 버린다.
 * 조회는 jsoup select(컴파일된 FieldSelector)로 하고 결과는 문서 순서.
 */
public final class PageTree {

    private final Document doc;

    private PageTree(Document doc) {
        this.doc = doc;
    }

    public static PageTree parse(String html, String baseUri) {
        return new PageTree(Jsoup.parse(html == null ? "" : html, baseUri == null ? "" : baseUri));
    }

    public Optional<Element> findFirst(FieldSelector sel) {
        return Optional.ofNullable(doc.selectFirst(sel.evaluator()));
    }

    public List<Element> findAll(FieldSelector sel) {
        return new ArrayList<>(doc.select(sel.evaluator()));
    }

    /** scope 하위(자기 자신 제외)에서 첫 매칭 */
    public Optional<Element> findFirstWithin(Element scope, FieldSelector sel) {
        Objects.requireNonNull(sel, "sel");
        if (!sel.matches(scope)) return Optional.ofNullable(scope.selectFirst(sel.evaluator()));
        // jsoup select는 scope 자신도 후보로 본다
        List<Element> all = findAllWithin(scope, sel);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    /** scope 하위(자기 자신 제외)의 모든 매칭 */
    public List<Element> findAllWithin(Element scope, FieldSelector sel) {
        Objects.requireNonNull(sel, "sel");
        List<Element> out = new ArrayList<>();
        for (Element e : scope.select(sel.evaluator())) {
            if (e != scope) out.add(e);
        }
        return out;
    }

    /** 정규화된(공백 접기) 텍스트 */
    public String text(Element e) {
        return e.text();
    }

    /** 값이 비어 있지 않은 속성만 */
    public Optional<String> attribute(Element e, String name) {
        if (!e.hasAttr(name)) return Optional.empty();
        String v = e.attr(name);
        return v.isEmpty() ? Optional.empty() : Optional.of(v);
    }
}
