package com.studioscout.core.util;

import com.studioscout.core.model.ScrapeConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * 루트 scrape.yml을 읽어 ScrapeConfig로 변환.
 *
 * 예상 YAML 키:
 * targets: ["https://www.eversports.de/s/poda-studio"]
 * targetsFile: "targets.txt"      # 한 줄에 URL 하나, 빈 줄/# 주석 무시
 * concurrency: 4
 * timeoutMs: 10000
 * followRedirects: true
 * rps: 5
 * userAgent: "StudioScout/0.1"
 * retry:
 *   maxAttempts: 3
 *   baseMillis: 250
 * output:
 *   dir: "out"
 *   formats: [csv, json, errors]
 * selectors:
 *   name: "h1|MuiTypography-root MuiTypography-h1 css-qinhw0"
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "scrape.yml";

    private YamlConfigLoader() {}

    public static ScrapeConfig loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    public static ScrapeConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("scrape.yml not found at: " + yamlPath.toAbsolutePath());
        }
        final Object root;
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            root = yaml.load(in);
        } catch (YAMLException e) {
            throw new IOException("invalid YAML in " + yamlPath + ": " + e.getMessage(), e);
        }

        ScrapeConfig cfg = ScrapeConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setStringList(map, "targets", cfg::setTargets);
        setInt(map, "concurrency", cfg::setConcurrency);
        setLong(map, "timeoutMs", cfg::setTimeoutMs);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setInt(map, "rps", cfg::setRps);
        setString(map, "userAgent", cfg::setUserAgent);

        // 2) targetsFile: YAML 파일 기준 상대 경로
        Object tf = map.get("targetsFile");
        if (tf != null) {
            Path p = Path.of(String.valueOf(tf));
            if (!p.isAbsolute() && yamlPath.toAbsolutePath().getParent() != null) {
                p = yamlPath.toAbsolutePath().getParent().resolve(p);
            }
            cfg.setTargetsFile(p);
            List<String> merged = new ArrayList<>(map.containsKey("targets") ? cfg.getTargets() : List.of());
            merged.addAll(readTargetsFile(p));
            cfg.setTargets(merged);
        }

        // 3) retry.*
        Map<String, Object> retry = getMap(map, "retry");
        if (retry != null) {
            var r = cfg.getRetry();
            setInt(retry, "maxAttempts", r::setMaxAttempts);
            setLong(retry, "baseMillis", r::setBaseMillis);
        }

        // 4) output.dir / output.formats
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setString(output, "dir", s -> cfg.setOutputDir(Path.of(s)));
            setStringList(output, "formats", cfg::setFormats);
        }

        // 5) selectors: key → "tag|class tokens"
        Map<String, Object> selectors = getMap(map, "selectors");
        if (selectors != null) {
            Map<String, String> overrides = new LinkedHashMap<>();
            for (Map.Entry<String, Object> e : selectors.entrySet()) {
                if (e.getValue() != null) overrides.put(e.getKey(), String.valueOf(e.getValue()));
            }
            cfg.setSelectors(cfg.getSelectors().withOverrides(overrides));
        }

        // 기본값/필수값 확인
        cfg.validate();
        return cfg;
    }

    /** 한 줄에 로케이터 하나. 빈 줄과 '#' 주석 줄은 건너뛴다 */
    public static List<String> readTargetsFile(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) {
            throw new IOException("targetsFile not found at: " + file.toAbsolutePath());
        }
        List<String> out = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String s = line.trim();
            if (s.isEmpty() || s.startsWith("#")) continue;
            out.add(s);
        }
        return out;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof List<?> list) {
            List<String> out = new ArrayList<>();
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
            setter.accept(List.copyOf(out));
            return;
        }
        // "a,b,c" 형태 지원
        String s = String.valueOf(v).trim();
        List<String> out = new ArrayList<>();
        for (String p : s.split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    /** 숫자가 아니면 NumberFormatException(IllegalArgumentException) */
    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }
}
