package com.studioscout.core.extract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 필드별 셀렉터 묶음(불변).
 * 기본값은 현재 대상 사이트(MUI 기반) 마크업. css-xxxx 해시 클래스는 사이트 배포마다 바뀔 수 있어
 * scrape.yml `selectors:` 섹션에서 키 단위로 덮어쓸 수 있다.
 */
public final class SelectorSet {

    public static final String NAME = "name";
    public static final String OVERVIEW = "overview";
    public static final String CONTACT = "contact";
    public static final String ADDRESS = "address";
    public static final String DESCRIPTION = "description";
    public static final String RATING = "rating";
    public static final String RATING_FACTOR = "ratingFactor";
    public static final String RATING_FACTOR_LABEL = "ratingFactorLabel";
    public static final String RATING_FACTOR_VALUE = "ratingFactorValue";
    public static final String AMENITY = "amenity";
    public static final String SALE = "sale";
    public static final String IMAGE = "image";

    private static final String BODY1 = "MuiTypography-root MuiTypography-body1 ";

    private static final Map<String, FieldSelector> DEFAULTS;
    static {
        Map<String, FieldSelector> m = new LinkedHashMap<>();
        m.put(NAME,                FieldSelector.of("h1",  "MuiTypography-root MuiTypography-h1 css-qinhw0"));
        m.put(OVERVIEW,            FieldSelector.of("div", "MuiStack-root css-sgccrm"));
        m.put(CONTACT,             FieldSelector.of("div", "css-1x2phcg"));
        m.put(ADDRESS,             FieldSelector.of("p",   BODY1 + "css-1619old"));
        m.put(DESCRIPTION,         FieldSelector.of("div", "MuiBox-root css-0"));
        m.put(RATING,              FieldSelector.of("p",   BODY1 + "css-2g7rhg"));
        m.put(RATING_FACTOR,       FieldSelector.of("div", "MuiStack-root css-95g4uk"));
        m.put(RATING_FACTOR_LABEL, FieldSelector.of("p",   BODY1 + "css-1k55edk"));
        m.put(RATING_FACTOR_VALUE, FieldSelector.of("p",   BODY1 + "css-1y0caop"));
        m.put(AMENITY,             FieldSelector.of("p",   BODY1 + "css-6ik050"));
        m.put(SALE,                FieldSelector.of("p",   BODY1 + "css-153qxhx"));
        m.put(IMAGE,               FieldSelector.of("div", "MuiBox-root css-1fivxf"));
        DEFAULTS = Collections.unmodifiableMap(m);
    }

    private final Map<String, FieldSelector> byKey;

    private SelectorSet(Map<String, FieldSelector> byKey) {
        this.byKey = Collections.unmodifiableMap(byKey);
    }

    public static SelectorSet defaults() {
        return new SelectorSet(new LinkedHashMap<>(DEFAULTS));
    }

    public FieldSelector get(String key) {
        FieldSelector s = byKey.get(key);
        if (s == null) throw new IllegalArgumentException("unknown selector key: " + key);
        return s;
    }

    /** 한 키만 바꾼 사본 */
    public SelectorSet with(String key, FieldSelector selector) {
        Objects.requireNonNull(selector, "selector");
        if (!DEFAULTS.containsKey(key)) throw new IllegalArgumentException("unknown selector key: " + key);
        Map<String, FieldSelector> m = new LinkedHashMap<>(byKey);
        m.put(key, selector);
        return new SelectorSet(m);
    }

    /** "key" → "tag|class tokens" 형식 오버라이드 일괄 적용 */
    public SelectorSet withOverrides(Map<String, String> overrides) {
        SelectorSet out = this;
        if (overrides == null) return out;
        for (Map.Entry<String, String> e : overrides.entrySet()) {
            out = out.with(e.getKey(), FieldSelector.parse(e.getValue()));
        }
        return out;
    }

    public Map<String, FieldSelector> asMap() { return byKey; }

    @Override public boolean equals(Object o) {
        return this == o || (o instanceof SelectorSet s && byKey.equals(s.byKey));
    }

    @Override public int hashCode() { return byKey.hashCode(); }
}
