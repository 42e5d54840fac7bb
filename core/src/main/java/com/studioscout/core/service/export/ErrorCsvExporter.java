package com.studioscout.core.service.export;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.studioscout.core.model.ExtractionError;
import com.studioscout.core.service.BatchResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static com.studioscout.core.service.export.ReportNaming.*;

/** 오류 로그를 발생 순서대로 errors-*.csv 에 기록 */
public class ErrorCsvExporter implements RecordExporter {

    public static final List<String> COLUMNS =
            List.of("kind", "url", "field", "causeType", "message", "occurredAt");

    private final CsvMapper mapper = new CsvMapper();

    @Override
    public Path export(Path baseDir, BatchResult result, String startedIso) throws IOException {
        Objects.requireNonNull(result, "result");
        var ctx = context(baseDir, startedIso);
        Files.createDirectories(exportsDir(ctx));
        Path outFile = errorsPath(ctx);

        List<Map<String, String>> rows = new ArrayList<>();
        for (ExtractionError e : result.getErrors()) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put("kind", e.getKind().name());
            row.put("url", e.getLocator() == null ? "" : e.getLocator().toString());
            row.put("field", nz(e.getFieldName()));
            row.put("causeType", nz(e.getCauseType()));
            row.put("message", nz(e.getMessage()));
            row.put("occurredAt", e.getOccurredAt().toString());
            rows.add(row);
        }
        CsvRecordExporter.writeRows(outFile, COLUMNS, rows, mapper);
        return outFile;
    }

    private static String nz(String s) { return s == null ? "" : s; }
}
