package com.studioscout.core.service.export;

import com.studioscout.core.model.*;
import com.studioscout.core.service.BatchResult;

import java.io.IOException;
import java.net.URI;
import java.util.List;

/** 내보내기 테스트용 배치 결과 */
final class ExportFixtures {
    static final String STARTED = "2025-03-01T21:34:00Z";

    private ExportFixtures() {}

    static BatchResult sample() {
        URI ok = URI.create("https://www.eversports.de/s/poda-studio");
        URI gone = URI.create("https://www.eversports.de/s/gone");
        FacilityRecord full = FacilityRecord.builder(ok)
                .name("Poda Studio")
                .overviewLabels(List.of("Yoga", "Pilates"))
                .contact(ContactKind.EMAIL, "hello@poda.example")
                .contact(ContactKind.PHONE, "+4930123")
                .address(new AddressParts(List.of("Main St 5", " 10115 Berlin"), "10115", "Berlin", "Main St 5"))
                .description("Hell, \"ruhig\" und zentral")
                .rating(new Rating("4.8", "123"))
                .ratingFactors(List.of("Sauberkeit: 4.9"))
                .amenities(List.of("Duschen", "Matten"))
                .imageUrls(List.of("https://cdn.example/1.jpg"))
                .build();
        FacilityRecord empty = FacilityRecord.builder(URI.create("https://www.eversports.de/s/empty")).build();

        List<ExtractionError> errors = List.of(
                ExtractionError.retrieval(gone, new IOException("HTTP status 404")),
                ExtractionError.field(ok, "saleText", new IllegalStateException("boom")));
        List<BatchResult.ItemOutcome> outcomes = List.of(
                new BatchResult.ItemOutcome(ok, ItemState.DONE),
                new BatchResult.ItemOutcome(gone, ItemState.LOAD_FAILED),
                new BatchResult.ItemOutcome(empty.getLocator(), ItemState.DONE));
        return new BatchResult(List.of(full, empty), errors, outcomes, new ScrapeStats().snapshot());
    }

    static BatchResult none() {
        return new BatchResult(List.of(), List.of(), List.of(), new ScrapeStats().snapshot());
    }
}
