package com.studioscout.core.model;

import com.studioscout.core.extract.SelectorSet;
import com.studioscout.core.http.DefaultRetryPolicy;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 스크레이프 설정 (scrape.yml 매핑 대상). 순수 설정 보관용.
 * 기본 타깃은 원래 수집 대상이던 두 스튜디오 페이지.
 */
public final class ScrapeConfig {

    public static final List<String> DEFAULT_TARGETS = List.of(
            "https://www.eversports.de/s/poda-studio",
            "https://www.eversports.de/s/nordpole");

    public static final Set<String> KNOWN_FORMATS = Set.of("csv", "json", "errors");

    /** YAML `retry:` 섹션 */
    public static final class RetryCfg {
        private int maxAttempts = DefaultRetryPolicy.DEFAULT_MAX_ATTEMPTS;
        private long baseMillis = DefaultRetryPolicy.DEFAULT_BASE_MILLIS;

        public int getMaxAttempts() { return maxAttempts; }
        public RetryCfg setMaxAttempts(int v) { this.maxAttempts = v; return this; }

        public long getBaseMillis() { return baseMillis; }
        public RetryCfg setBaseMillis(long v) { this.baseMillis = v; return this; }
    }

    // ---------- 기본 필드 ----------
    private List<String> targets = DEFAULT_TARGETS;
    private Path targetsFile;                          // 옵션: 한 줄에 하나씩
    private Duration timeout = Duration.ofSeconds(10);
    private int concurrency = 4;
    private boolean followRedirects = true;
    private int rps = 5;
    private String userAgent = "StudioScout/0.1 (+facility-scraper)";
    private Path outputDir = Path.of("out");
    private Set<String> formats = new LinkedHashSet<>(List.of("csv", "json", "errors"));
    private RetryCfg retry = new RetryCfg();
    private SelectorSet selectors = SelectorSet.defaults();

    // ---------- getters ----------
    public List<String> getTargets() { return targets; }
    public Path getTargetsFile() { return targetsFile; }
    public Duration getTimeout() { return timeout; }
    public int getConcurrency() { return concurrency; }
    public boolean isFollowRedirects() { return followRedirects; }
    public int getRps() { return rps; }
    public String getUserAgent() { return userAgent; }
    public Path getOutputDir() { return outputDir; }
    public Set<String> getFormats() { return formats; }
    public RetryCfg getRetry() { return retry; }
    public SelectorSet getSelectors() { return selectors; }

    // ---------- fluent setters ----------
    public ScrapeConfig setTargets(List<String> targets) {
        this.targets = (targets == null) ? List.of() : List.copyOf(targets);
        return this;
    }
    public ScrapeConfig setTargetsFile(Path targetsFile) { this.targetsFile = targetsFile; return this; }
    public ScrapeConfig setConcurrency(int concurrency) { this.concurrency = Math.max(1, concurrency); return this; }
    public ScrapeConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public ScrapeConfig setRps(int rps) { this.rps = rps; return this; }
    public ScrapeConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public ScrapeConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public ScrapeConfig setSelectors(SelectorSet selectors) {
        this.selectors = (selectors != null ? selectors : SelectorSet.defaults());
        return this;
    }

    /** 소문자로 정규화해서 보관 */
    public ScrapeConfig setFormats(List<String> formats) {
        Set<String> out = new LinkedHashSet<>();
        if (formats != null) {
            for (String f : formats) {
                if (f != null && !f.isBlank()) out.add(f.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.formats = out;
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(targets, "targets");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (rps <= 0) throw new IllegalArgumentException("rps must be > 0");
        if (userAgent == null || userAgent.isBlank()) throw new IllegalArgumentException("userAgent must not be blank");
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(formats, "formats");
        for (String f : formats) {
            if (!KNOWN_FORMATS.contains(f)) throw new IllegalArgumentException("unknown output format: " + f);
        }
        Objects.requireNonNull(retry, "retry");
        if (retry.getMaxAttempts() < 1) throw new IllegalArgumentException("retry.maxAttempts must be >= 1");
        if (retry.getBaseMillis() < 1) throw new IllegalArgumentException("retry.baseMillis must be >= 1");
        Objects.requireNonNull(selectors, "selectors");
        for (String t : targets) toLocator(t);
    }

    // ---------- helpers ----------
    public static ScrapeConfig defaults() { return new ScrapeConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }

    public ScrapeConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    /** targets를 URI 목록으로 (입력 순서 유지) */
    public List<URI> locators() {
        List<URI> out = new ArrayList<>(targets.size());
        for (String t : targets) out.add(toLocator(t));
        return out;
    }

    /** http/https 절대 URL만 허용 */
    public static URI toLocator(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("target must not be blank");
        final URI u;
        try {
            u = URI.create(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid target URL: " + raw, e);
        }
        String s = u.getScheme();
        if (s == null || !(s.equalsIgnoreCase("http") || s.equalsIgnoreCase("https")) || u.getHost() == null) {
            throw new IllegalArgumentException("target must be an absolute http(s) URL: " + raw);
        }
        return u;
    }
}
