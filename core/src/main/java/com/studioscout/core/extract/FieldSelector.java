package com.studioscout.core.extract;

import org.jsoup.nodes.Element;
import org.jsoup.select.Evaluator;
import org.jsoup.select.QueryParser;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 태그 이름 + 클래스 시그니처를 jsoup CSS 쿼리로 컴파일한 셀렉터.
 * "p" + "A B" → {@code p.A.B}: 해당 태그이고 모든 클래스 토큰을 가지면 매칭(순서/추가 클래스 무관).
 * 시그니처가 비어 있으면 태그만 본다.
 */
public final class FieldSelector {

    /** 이스케이프 없이 CSS 쿼리에 넣을 수 있는 식별자만 허용 */
    private static final Pattern IDENT = Pattern.compile("-?[_a-zA-Z][_a-zA-Z0-9-]*");

    private final String tag;
    private final List<String> classTokens;
    private final String query;
    private final Evaluator evaluator;

    private FieldSelector(String tag, List<String> classTokens) {
        this.tag = tag;
        this.classTokens = classTokens;
        StringBuilder q = new StringBuilder(tag);
        for (String c : classTokens) q.append('.').append(c);
        this.query = q.toString();
        this.evaluator = QueryParser.parse(query);
    }

    public static FieldSelector of(String tag, String classSignature) {
        if (tag == null || tag.isBlank()) throw new IllegalArgumentException("tag must not be blank");
        String t = tag.trim().toLowerCase(Locale.ROOT);
        if (!IDENT.matcher(t).matches()) throw new IllegalArgumentException("invalid tag: " + tag);
        String sig = (classSignature == null) ? "" : classSignature.trim();
        List<String> tokens = sig.isEmpty() ? List.of() : List.copyOf(Arrays.asList(sig.split("\\s+")));
        for (String c : tokens) {
            if (!IDENT.matcher(c).matches()) throw new IllegalArgumentException("invalid class token: " + c);
        }
        return new FieldSelector(t, tokens);
    }

    public static FieldSelector tag(String tag) {
        return of(tag, "");
    }

    /** 설정용 텍스트 형식: "tag|class tokens" (클래스 생략 시 "tag") */
    public static FieldSelector parse(String expr) {
        if (expr == null || expr.isBlank()) throw new IllegalArgumentException("selector must not be blank");
        int bar = expr.indexOf('|');
        if (bar < 0) return tag(expr);
        return of(expr.substring(0, bar), expr.substring(bar + 1));
    }

    public boolean matches(Element e) {
        return e != null && e.is(evaluator);
    }

    /** 컴파일된 jsoup 평가기(PageTree 조회용) */
    Evaluator evaluator() { return evaluator; }

    /** jsoup CSS 쿼리 표기, 예: h1.MuiTypography-root.css-qinhw0 */
    public String query() { return query; }

    /** parse()와 왕복 가능한 표기 */
    public String asText() {
        return classTokens.isEmpty() ? tag : tag + "|" + String.join(" ", classTokens);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldSelector s)) return false;
        return tag.equals(s.tag) && classTokens.equals(s.classTokens);
    }

    @Override public int hashCode() { return Objects.hash(tag, classTokens); }

    @Override public String toString() { return query; }
}
