package com.studioscout.core.service.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.studioscout.core.model.ContactKind;
import com.studioscout.core.model.ExtractionError;
import com.studioscout.core.model.FacilityRecord;
import com.studioscout.core.model.ScrapeStats;
import com.studioscout.core.service.BatchResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

import static com.studioscout.core.service.export.ReportNaming.*;

/**
 * JSON 내보내기.
 * - meta: generatedAt/startedAt/counts/runtime
 * - records: 입력 순서, 없는 단일 필드는 null, 리스트 필드는 []
 * - errors: 발생 순서
 */
public class JsonRecordExporter implements RecordExporter {

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public Path export(Path baseDir, BatchResult result, String startedIso) throws IOException {
        Objects.requireNonNull(result, "result");
        var ctx = context(baseDir, startedIso);
        Files.createDirectories(exportsDir(ctx));
        Path outFile = jsonPath(ctx);

        om.writeValue(outFile.toFile(), toTree(result, ctx.startedAt()));
        return outFile;
    }

    ObjectNode toTree(BatchResult result, Instant startedAt) {
        ObjectNode root = om.createObjectNode();

        // meta
        ObjectNode meta = root.putObject("meta");
        meta.putPOJO("generatedAt", Instant.now());
        meta.putPOJO("startedAt", startedAt);
        ObjectNode counts = meta.putObject("counts");
        counts.put("locators", result.getOutcomes().size());
        counts.put("records", result.getRecords().size());
        counts.put("retrievalErrors", result.retrievalErrorCount());
        counts.put("fieldErrors", result.fieldErrorCount());
        ScrapeStats.Snapshot rt = result.getStats();
        if (rt != null) {
            ObjectNode runtime = meta.putObject("runtime");
            runtime.put("requestsTotal", rt.requestsTotal);
            runtime.put("retriesTotal", rt.retriesTotal);
            runtime.put("maxObservedConcurrency", rt.maxObservedConcurrency);
            runtime.put("avgLatencyMs", rt.avgLatencyMs);
        }

        // records
        ArrayNode records = root.putArray("records");
        for (FacilityRecord r : result.getRecords()) records.add(recordNode(r));

        // errors
        ArrayNode errors = root.putArray("errors");
        for (ExtractionError e : result.getErrors()) {
            ObjectNode n = errors.addObject();
            n.put("kind", e.getKind().name());
            n.put("url", e.getLocator() == null ? null : e.getLocator().toString());
            n.put("field", e.getFieldName());
            n.put("causeType", e.getCauseType());
            n.put("message", e.getMessage());
            n.putPOJO("occurredAt", e.getOccurredAt());
        }
        return root;
    }

    private ObjectNode recordNode(FacilityRecord r) {
        ObjectNode n = om.createObjectNode();
        n.put("url", String.valueOf(r.getLocator()));
        n.put("name", r.getName().orElse(null));
        strings(n.putArray("overviewLabels"), r.getOverviewLabels());

        ObjectNode contact = n.putObject("contact");
        for (ContactKind k : ContactKind.values()) contact.put(k.label(), r.contact(k).orElse(null));

        r.getAddress().ifPresentOrElse(a -> {
            ObjectNode addr = n.putObject("address");
            strings(addr.putArray("segments"), a.rawSegments());
            addr.put("postalCode", a.postalCode());
            addr.put("city", a.city());
            addr.put("street", a.street());
        }, () -> n.putNull("address"));

        n.put("description", r.getDescription().orElse(null));
        r.getRating().ifPresentOrElse(rt -> {
            ObjectNode rating = n.putObject("rating");
            rating.put("score", rt.scoreText());
            rating.put("count", rt.countText());
        }, () -> n.putNull("rating"));

        strings(n.putArray("ratingFactors"), r.getRatingFactors());
        strings(n.putArray("amenities"), r.getAmenities());
        n.put("saleText", r.getSaleText().orElse(null));
        strings(n.putArray("imageUrls"), r.getImageUrls());
        return n;
    }

    private static void strings(ArrayNode arr, List<String> values) {
        for (String v : values) arr.add(v);
    }
}
