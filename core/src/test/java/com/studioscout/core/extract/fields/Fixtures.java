package com.studioscout.core.extract.fields;

import com.studioscout.core.extract.PageTree;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** 테스트 리소스 HTML 로딩 */
public final class Fixtures {
    public static final String STUDIO_PAGE = "/fixtures/studio-page.html";
    public static final String STUDIO_URL = "https://www.eversports.de/s/poda-studio";

    private Fixtures() {}

    public static String html(String resource) {
        try (InputStream in = Fixtures.class.getResourceAsStream(resource)) {
            if (in == null) throw new IllegalStateException("missing test resource: " + resource);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static PageTree studioPage() {
        return PageTree.parse(html(STUDIO_PAGE), STUDIO_URL);
    }

    public static PageTree page(String bodyHtml) {
        return PageTree.parse("<html><body>" + bodyHtml + "</body></html>", "https://example.com/");
    }
}
