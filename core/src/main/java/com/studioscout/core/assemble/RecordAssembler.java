package com.studioscout.core.assemble;

import com.studioscout.core.error.ScrapeErrorManager;
import com.studioscout.core.extract.FieldExtractor;
import com.studioscout.core.extract.FieldResult;
import com.studioscout.core.extract.PageTree;
import com.studioscout.core.extract.SelectorSet;
import com.studioscout.core.extract.fields.AddressExtractor;
import com.studioscout.core.extract.fields.AmenitiesExtractor;
import com.studioscout.core.extract.fields.ContactExtractor;
import com.studioscout.core.extract.fields.DescriptionExtractor;
import com.studioscout.core.extract.fields.ImageUrlsExtractor;
import com.studioscout.core.extract.fields.NameExtractor;
import com.studioscout.core.extract.fields.OverviewLabelsExtractor;
import com.studioscout.core.extract.fields.RatingExtractor;
import com.studioscout.core.extract.fields.RatingFactorsExtractor;
import com.studioscout.core.extract.fields.SaleTextExtractor;
import com.studioscout.core.model.FacilityRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * 문서 하나에 대해 모든 필드 추출기를 정확히 한 번씩 실행하고 레코드로 합친다.
 * - PRESENT → 빌더에 반영
 * - ABSENT  → 필드 비움(로그 없음)
 * - FAILED/런타임 예외 → FieldError 보고, 필드 비움
 * 조립 자체는 실패하지 않는다. 전부 비어 있는 레코드도 정상 결과.
 */
public final class RecordAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(RecordAssembler.class);

    /** 추출기 + 결과를 빌더에 넣는 방법 */
    public record Binding<T>(FieldExtractor<T> extractor, BiConsumer<FacilityRecord.Builder, T> sink) {
        public Binding {
            Objects.requireNonNull(extractor, "extractor");
            Objects.requireNonNull(sink, "sink");
        }
    }

    private final List<Binding<?>> bindings;
    private final ScrapeErrorManager errors;

    public RecordAssembler(SelectorSet selectors, ScrapeErrorManager errors) {
        this(standardBindings(selectors), errors);
    }

    /** 테스트/확장용: 바인딩 목록 직접 주입 */
    public RecordAssembler(List<Binding<?>> bindings, ScrapeErrorManager errors) {
        this.bindings = List.copyOf(bindings);
        this.errors = Objects.requireNonNull(errors, "errors");
    }

    /** 기본 필드 10종(레코드 필드 순서) */
    public static List<Binding<?>> standardBindings(SelectorSet s) {
        Objects.requireNonNull(s, "selectors");
        List<Binding<?>> out = new ArrayList<>();
        out.add(new Binding<>(new NameExtractor(s),           FacilityRecord.Builder::name));
        out.add(new Binding<>(new OverviewLabelsExtractor(s), FacilityRecord.Builder::overviewLabels));
        out.add(new Binding<>(new ContactExtractor(s),        (b, v) -> b.contact(v)));
        out.add(new Binding<>(new AddressExtractor(s),        FacilityRecord.Builder::address));
        out.add(new Binding<>(new DescriptionExtractor(s),    FacilityRecord.Builder::description));
        out.add(new Binding<>(new RatingExtractor(s),         FacilityRecord.Builder::rating));
        out.add(new Binding<>(new RatingFactorsExtractor(s),  FacilityRecord.Builder::ratingFactors));
        out.add(new Binding<>(new AmenitiesExtractor(s),      FacilityRecord.Builder::amenities));
        out.add(new Binding<>(new SaleTextExtractor(s),       FacilityRecord.Builder::saleText));
        out.add(new Binding<>(new ImageUrlsExtractor(s),      FacilityRecord.Builder::imageUrls));
        return List.copyOf(out);
    }

    public FacilityRecord assemble(URI locator, PageTree tree) {
        Objects.requireNonNull(locator, "locator");
        Objects.requireNonNull(tree, "tree");

        FacilityRecord.Builder b = FacilityRecord.builder(locator);
        int present = 0;
        for (Binding<?> binding : bindings) {
            if (apply(binding, locator, tree, b)) present++;
        }
        LOG.debug("Assembled {} -> {}/{} fields present", locator, present, bindings.size());
        return b.build();
    }

    private <T> boolean apply(Binding<T> binding, URI locator, PageTree tree, FacilityRecord.Builder b) {
        String field = binding.extractor().fieldName();
        FieldResult<T> r;
        try {
            r = binding.extractor().extract(tree);
        } catch (RuntimeException e) {
            // 추출기 버그/예상 못한 마크업: 이 필드만 실패 처리
            errors.reportFieldError(locator, field, e);
            return false;
        }
        if (r == null || r.isAbsent()) return false;
        if (r.isFailed()) {
            errors.reportFieldError(locator, field, r.cause());
            return false;
        }
        try {
            binding.sink().accept(b, r.get());
        } catch (RuntimeException e) {
            errors.reportFieldError(locator, field, e);
            return false;
        }
        return true;
    }
}
