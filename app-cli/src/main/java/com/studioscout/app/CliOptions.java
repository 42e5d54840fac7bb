package com.studioscout.app;

import java.nio.file.Path;
import java.util.*;

/**
 * 명령행 해석.
 * App [config.yml] [--out DIR] [--format csv,json,errors] [url ...]
 * - .yml/.yaml 로 끝나는 첫 위치 인자는 설정 파일
 * - 나머지 위치 인자는 URL (있으면 설정의 targets를 대체)
 */
public final class CliOptions {

    private final Path configFile;      // null이면 ./scrape.yml(있을 때) 또는 defaults
    private final Path outDir;          // null이면 설정값
    private final List<String> formats; // null이면 설정값
    private final List<String> urls;
    private final boolean help;

    private CliOptions(Path configFile, Path outDir, List<String> formats, List<String> urls, boolean help) {
        this.configFile = configFile;
        this.outDir = outDir;
        this.formats = formats;
        this.urls = List.copyOf(urls);
        this.help = help;
    }

    /** 잘못된 인자는 IllegalArgumentException */
    public static CliOptions parse(String... args) {
        Path config = null;
        Path out = null;
        List<String> formats = null;
        List<String> urls = new ArrayList<>();
        boolean help = false;

        String[] a = (args == null) ? new String[0] : args;
        for (int i = 0; i < a.length; i++) {
            String arg = a[i];
            switch (arg) {
                case "-h", "--help" -> help = true;
                case "--out" -> out = Path.of(requireValue(a, ++i, arg));
                case "--format" -> {
                    List<String> f = new ArrayList<>();
                    for (String s : requireValue(a, ++i, arg).split("\\s*,\\s*")) {
                        if (!s.isBlank()) f.add(s.trim().toLowerCase(Locale.ROOT));
                    }
                    if (f.isEmpty()) throw new IllegalArgumentException("--format needs at least one value");
                    formats = f;
                }
                default -> {
                    if (arg.startsWith("--")) throw new IllegalArgumentException("unknown option: " + arg);
                    String lower = arg.toLowerCase(Locale.ROOT);
                    if (config == null && urls.isEmpty() && (lower.endsWith(".yml") || lower.endsWith(".yaml"))) {
                        config = Path.of(arg);
                    } else {
                        urls.add(arg);
                    }
                }
            }
        }
        return new CliOptions(config, out, formats, urls, help);
    }

    private static String requireValue(String[] a, int i, String opt) {
        if (i >= a.length || a[i].startsWith("--")) throw new IllegalArgumentException(opt + " needs a value");
        return a[i];
    }

    public Optional<Path> getConfigFile() { return Optional.ofNullable(configFile); }
    public Optional<Path> getOutDir() { return Optional.ofNullable(outDir); }
    public Optional<List<String>> getFormats() { return Optional.ofNullable(formats); }
    public List<String> getUrls() { return urls; }
    public boolean isHelp() { return help; }

    public static String usage() {
        return "Usage: studioscout [config.yml] [--out DIR] [--format csv,json,errors] [url ...]";
    }
}
