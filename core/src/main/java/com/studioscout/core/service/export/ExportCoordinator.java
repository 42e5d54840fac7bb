package com.studioscout.core.service.export;

import com.studioscout.core.service.BatchResult;
import com.studioscout.core.util.StructuredLog;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class ExportCoordinator {

    private static final Logger LOG = Logger.getLogger(ExportCoordinator.class.getName());
    private static final StructuredLog SLOG = StructuredLog.get(ExportCoordinator.class);

    private final RecordExporter csv;
    private final RecordExporter json;
    private final RecordExporter errors;

    public ExportCoordinator() {
        this(new CsvRecordExporter(), new JsonRecordExporter(), new ErrorCsvExporter());
    }

    /** 테스트/DI용 */
    public ExportCoordinator(RecordExporter csv, RecordExporter json, RecordExporter errors) {
        this.csv = Objects.requireNonNull(csv, "csv");
        this.json = Objects.requireNonNull(json, "json");
        this.errors = Objects.requireNonNull(errors, "errors");
    }

    /**
     * formats: 소문자 {"csv","json","errors"}
     * @return 실제로 만들어진 파일들(요청 순서 csv → json → errors)
     */
    public List<Path> exportAll(Path baseDir, BatchResult result, String startedIso, Set<String> formats)
            throws IOException {
        Objects.requireNonNull(result, "result");
        final Set<String> fmts = (formats == null) ? Set.of() : formats;

        final boolean wantCsv = fmts.contains("csv");
        final boolean wantJson = fmts.contains("json");
        final boolean wantErrors = fmts.contains("errors");

        LOG.info(() -> "[Export plan] wantCsv=" + wantCsv + ", wantJson=" + wantJson + ", wantErrors=" + wantErrors
                + ", records=" + result.getRecords().size() + ", errors=" + result.getErrors().size());

        List<Path> written = new ArrayList<>();

        // 포맷별로 격리: 하나가 실패해도 나머지는 계속
        if (wantCsv) tryExport("csv", csv, baseDir, result, startedIso, written);
        if (wantJson) tryExport("json", json, baseDir, result, startedIso, written);
        if (wantErrors) tryExport("errors", errors, baseDir, result, startedIso, written);

        // 아무것도 못 만들었으면 최소 JSON (이 실패는 호출자에게 전달)
        if (written.isEmpty()) {
            LOG.warning("No export produced. Falling back to JSON.");
            written.add(json.export(baseDir, result, startedIso));
        }

        SLOG.info("export-done", "files", written.size(), "last", String.valueOf(written.get(written.size() - 1)));
        return List.copyOf(written);
    }

    private static void tryExport(String format, RecordExporter exporter, Path baseDir, BatchResult result,
                                  String startedIso, List<Path> written) {
        try {
            Path p = exporter.export(baseDir, result, startedIso);
            LOG.info(() -> format.toUpperCase(Locale.ROOT) + " exported: " + p.toAbsolutePath());
            written.add(p);
        } catch (IOException | RuntimeException e) {
            LOG.log(Level.WARNING, format + " export failed. Continuing with remaining formats.", e);
        }
    }
}
