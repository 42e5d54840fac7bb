package com.studioscout.core.service.export;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

public final class ReportNaming {

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmm").withZone(ZoneId.systemDefault());

    private ReportNaming() {}

    public static ExportContext context(Path baseDir, String startedIso) {
        Path out = (baseDir == null ? Paths.get("out") : baseDir);
        return new ExportContext(out, parseIsoOrNow(startedIso));
    }

    public static String timestamp(ExportContext ctx) { return TS_FMT.format(ctx.startedAt()); }
    public static Path exportsDir(ExportContext ctx) { return ctx.baseDir().resolve("exports"); }
    public static Path csvPath(ExportContext ctx)    { return exportsDir(ctx).resolve("studios-" + timestamp(ctx) + ".csv"); }
    public static Path jsonPath(ExportContext ctx)   { return exportsDir(ctx).resolve("studios-" + timestamp(ctx) + ".json"); }
    public static Path errorsPath(ExportContext ctx) { return exportsDir(ctx).resolve("errors-" + timestamp(ctx) + ".csv"); }

    public record ExportContext(Path baseDir, Instant startedAt) {}

    // ===== helpers =====
    static Instant parseIsoOrNow(String iso) {
        if (iso == null || iso.isBlank()) return Instant.now();
        try { return Instant.parse(iso); } catch (java.time.format.DateTimeParseException e) { return Instant.now(); }
    }
}
