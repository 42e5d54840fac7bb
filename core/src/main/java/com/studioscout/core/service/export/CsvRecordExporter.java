package com.studioscout.core.service.export;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.studioscout.core.model.AddressParts;
import com.studioscout.core.model.ContactKind;
import com.studioscout.core.model.FacilityRecord;
import com.studioscout.core.model.Rating;
import com.studioscout.core.service.BatchResult;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static com.studioscout.core.service.export.ReportNaming.*;

/**
 * 레코드 1건 = CSV 1행. 리스트 값은 " | " 로 잇는다.
 * 없는 필드는 빈 칸.
 */
public class CsvRecordExporter implements RecordExporter {

    public static final String LIST_SEPARATOR = " | ";

    public static final List<String> COLUMNS = List.of(
            "url", "name", "overview",
            ContactKind.EMAIL.label(), ContactKind.HOMEPAGE.label(), ContactKind.PHONE.label(),
            "address", "postal_code", "city", "street",
            "description", "rating", "rating_count", "rating_factors",
            "amenities", "sale", "images");

    private final CsvMapper mapper = new CsvMapper();

    @Override
    public Path export(Path baseDir, BatchResult result, String startedIso) throws IOException {
        Objects.requireNonNull(result, "result");
        var ctx = context(baseDir, startedIso);
        Files.createDirectories(exportsDir(ctx));
        Path outFile = csvPath(ctx);

        List<Map<String, String>> rows = new ArrayList<>(result.getRecords().size());
        for (FacilityRecord r : result.getRecords()) rows.add(toRow(r));
        writeRows(outFile, COLUMNS, rows, mapper);
        return outFile;
    }

    /** 헤더 순서대로 채운 한 행 */
    static Map<String, String> toRow(FacilityRecord r) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("url", String.valueOf(r.getLocator()));
        row.put("name", r.getName().orElse(""));
        row.put("overview", join(r.getOverviewLabels()));
        for (ContactKind k : ContactKind.values()) row.put(k.label(), r.contact(k).orElse(""));

        AddressParts a = r.getAddress().orElse(null);
        row.put("address", a == null ? "" : String.join(",", a.rawSegments()));
        row.put("postal_code", a == null ? "" : a.postalCode());
        row.put("city", a == null ? "" : a.city());
        row.put("street", a == null ? "" : a.street());

        row.put("description", r.getDescription().orElse(""));
        Rating rating = r.getRating().orElse(null);
        row.put("rating", rating == null ? "" : rating.scoreText());
        row.put("rating_count", rating == null ? "" : rating.countText());
        row.put("rating_factors", join(r.getRatingFactors()));
        row.put("amenities", join(r.getAmenities()));
        row.put("sale", r.getSaleText().orElse(""));
        row.put("images", join(r.getImageUrls()));
        return row;
    }

    static String join(List<String> values) {
        return (values == null || values.isEmpty()) ? "" : String.join(LIST_SEPARATOR, values);
    }

    /** 행이 없어도 헤더는 남긴다 */
    static void writeRows(Path outFile, List<String> columns, List<Map<String, String>> rows, CsvMapper mapper)
            throws IOException {
        CsvSchema.Builder b = CsvSchema.builder();
        for (String c : columns) b.addColumn(c);
        CsvSchema schema = b.build().withHeader();

        try (Writer w = Files.newBufferedWriter(outFile, StandardCharsets.UTF_8)) {
            mapper.writer(schema).writeValue(w, rows);
        }
    }
}
