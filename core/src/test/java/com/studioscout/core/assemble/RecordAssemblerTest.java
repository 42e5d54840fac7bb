package com.studioscout.core.assemble;

import com.studioscout.core.error.ScrapeErrorManager;
import com.studioscout.core.extract.FieldExtractor;
import com.studioscout.core.extract.FieldResult;
import com.studioscout.core.extract.PageTree;
import com.studioscout.core.extract.SelectorSet;
import com.studioscout.core.extract.fields.Fixtures;
import com.studioscout.core.extract.fields.NameExtractor;
import com.studioscout.core.model.ContactKind;
import com.studioscout.core.model.ExtractionError;
import com.studioscout.core.model.FacilityRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecordAssemblerTest {

    private static final URI URL = URI.create(Fixtures.STUDIO_URL);

    @Test
    @DisplayName("fixture 페이지: 모든 필드 채움, 오류 없음")
    void full_page_yields_complete_record() {
        ScrapeErrorManager errors = new ScrapeErrorManager();
        FacilityRecord r = new RecordAssembler(SelectorSet.defaults(), errors).assemble(URL, Fixtures.studioPage());

        assertThat(errors.size()).isZero();
        assertThat(r.getLocator()).isEqualTo(URL);
        assertThat(r.getName()).contains("Poda Studio");
        assertThat(r.contact(ContactKind.EMAIL)).contains("hello@poda-studio.example");
        assertThat(r.getAddress()).isPresent();
        assertThat(r.getRating()).isPresent();
        assertThat(r.getRatingFactors()).hasSize(2);
        assertThat(r.getImageUrls()).hasSize(2);
        assertThat(r.isEmpty()).isFalse();
    }

    @Test
    @DisplayName("아무 것도 없는 페이지: 빈 레코드, 오류 없음")
    void all_absent_is_silent() {
        ScrapeErrorManager errors = new ScrapeErrorManager();
        FacilityRecord r = new RecordAssembler(SelectorSet.defaults(), errors)
                .assemble(URL, Fixtures.page("<p>nothing here</p>"));

        assertThat(errors.errors()).isEmpty();
        assertThat(r.isEmpty()).isTrue();
        assertThat(r.getContact()).containsOnlyKeys(ContactKind.values());
        assertThat(r.getContact().values()).containsOnlyNulls();
    }

    @Test
    @DisplayName("추출기 예외는 그 필드만 FieldError, 나머지 필드는 유지")
    void throwing_extractor_only_loses_its_field() {
        ScrapeErrorManager errors = new ScrapeErrorManager();
        FieldExtractor<String> broken = new FieldExtractor<>() {
            @Override public String fieldName() { return "description"; }
            @Override public FieldResult<String> extract(PageTree tree) {
                throw new IllegalStateException("boom");
            }
        };
        List<RecordAssembler.Binding<?>> bindings = new ArrayList<>();
        bindings.add(new RecordAssembler.Binding<>(new NameExtractor(SelectorSet.defaults()), FacilityRecord.Builder::name));
        bindings.add(new RecordAssembler.Binding<>(broken, FacilityRecord.Builder::description));

        FacilityRecord r = new RecordAssembler(bindings, errors).assemble(URL, Fixtures.studioPage());

        assertThat(r.getName()).contains("Poda Studio");
        assertThat(r.getDescription()).isEmpty();
        assertThat(errors.fieldErrors()).singleElement().satisfies(e -> {
            assertThat(e.getKind()).isEqualTo(ExtractionError.Kind.FIELD);
            assertThat(e.getFieldName()).isEqualTo("description");
            assertThat(e.getCauseType()).isEqualTo("IllegalStateException");
            assertThat(e.getLocator()).isEqualTo(URL);
        });
        assertThat(errors.retrievalErrors()).isEmpty();
    }

    @Test
    void failed_address_is_reported_as_field_error() {
        ScrapeErrorManager errors = new ScrapeErrorManager();
        FacilityRecord r = new RecordAssembler(SelectorSet.defaults(), errors).assemble(URL, Fixtures.page(
                "<h1 class='MuiTypography-root MuiTypography-h1 css-qinhw0'>X</h1>" +
                "<p class='MuiTypography-root MuiTypography-body1 css-1619old'>kein Komma</p>"));

        assertThat(r.getName()).contains("X");
        assertThat(r.getAddress()).isEmpty();
        assertThat(errors.fieldErrors()).extracting(ExtractionError::getFieldName).containsExactly("address");
    }
}
