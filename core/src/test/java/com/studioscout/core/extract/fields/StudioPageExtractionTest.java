package com.studioscout.core.extract.fields;

import com.studioscout.core.extract.FieldResult;
import com.studioscout.core.extract.PageTree;
import com.studioscout.core.extract.SelectorSet;
import com.studioscout.core.model.AddressParts;
import com.studioscout.core.model.ContactKind;
import com.studioscout.core.model.Rating;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("스튜디오 상세 페이지 fixture: 필드별 추출")
class StudioPageExtractionTest {

    private final SelectorSet sel = SelectorSet.defaults();
    private final PageTree tree = Fixtures.studioPage();

    @Test
    void name_is_normalized_text_of_first_heading() {
        FieldResult<String> r = new NameExtractor(sel).extract(tree);
        assertThat(r.isPresent()).isTrue();
        assertThat(r.get()).isEqualTo("Poda Studio");
    }

    @Test
    @DisplayName("개요 라벨: 모든 컨테이너의 앵커 텍스트, 문서 순서")
    void overview_labels_from_all_containers() {
        assertThat(new OverviewLabelsExtractor(sel).extract(tree).get())
                .containsExactly("Yoga", "Pilates", "Barre");
    }

    @Test
    void contact_is_classified_by_scheme() {
        Map<ContactKind, String> c = new ContactExtractor(sel).extract(tree).get();
        assertThat(c)
                .containsEntry(ContactKind.EMAIL, "hello@poda-studio.example")
                .containsEntry(ContactKind.PHONE, "+49301234567")
                .containsEntry(ContactKind.HOMEPAGE, "https://poda-studio.example");
    }

    @Test
    void address_is_split_by_position() {
        AddressParts a = new AddressExtractor(sel).extract(tree).get();
        assertThat(a.rawSegments()).containsExactly("Main St 5", " 10115 Berlin");
        assertThat(a.postalCode()).isEqualTo("10115");
        assertThat(a.city()).isEqualTo("Berlin");
        assertThat(a.street()).isEqualTo("Main St 5");
    }

    @Test
    void description_and_sale_text() {
        assertThat(new DescriptionExtractor(sel).extract(tree).get())
                .isEqualTo("Ein helles Studio für Yoga und Pilates.");
        assertThat(new SaleTextExtractor(sel).extract(tree).get()).isEqualTo("10er-Karte -20%");
    }

    @Test
    void rating_score_and_count() {
        assertThat(new RatingExtractor(sel).extract(tree).get()).isEqualTo(new Rating("4.8", "123"));
    }

    @Test
    @DisplayName("평가 항목: 라벨/값 둘 다 있는 항목만 (3개 중 1개 누락)")
    void rating_factors_skip_incomplete_items() {
        List<String> f = new RatingFactorsExtractor(sel).extract(tree).get();
        assertThat(f).containsExactly("Sauberkeit: 4.9", "Atmosphäre: 4.7");
    }

    @Test
    void amenities_in_document_order() {
        assertThat(new AmenitiesExtractor(sel).extract(tree).get())
                .containsExactly("Duschen", "Umkleide", "Matten");
    }

    @Test
    @DisplayName("이미지: 컨테이너당 첫 img, src 없으면 건너뜀, 값은 그대로")
    void images_first_img_per_container() {
        assertThat(new ImageUrlsExtractor(sel).extract(tree).get())
                .containsExactly("https://cdn.example/img/1.jpg", "/img/3.jpg");
    }

    @Test
    void field_names_are_stable() {
        assertThat(List.of(
                new NameExtractor(sel).fieldName(),
                new OverviewLabelsExtractor(sel).fieldName(),
                new ContactExtractor(sel).fieldName(),
                new AddressExtractor(sel).fieldName(),
                new DescriptionExtractor(sel).fieldName(),
                new RatingExtractor(sel).fieldName(),
                new RatingFactorsExtractor(sel).fieldName(),
                new AmenitiesExtractor(sel).fieldName(),
                new SaleTextExtractor(sel).fieldName(),
                new ImageUrlsExtractor(sel).fieldName()))
                .containsExactly("name", "overviewLabels", "contact", "address", "description",
                        "rating", "ratingFactors", "amenities", "saleText", "imageUrls");
    }
}
