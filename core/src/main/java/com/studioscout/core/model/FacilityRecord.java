package com.studioscout.core.model;

import java.net.URI;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 로케이터 한 건의 조립 결과. 모든 필드는 독립적으로 비어 있을 수 있다.
 * 시퀀스 필드는 문서 순서를 유지한 불변 리스트.
 */
public final class FacilityRecord {
    private final URI locator;
    private final String name;
    private final List<String> overviewLabels;
    private final Map<ContactKind, String> contact;
    private final AddressParts address;
    private final String description;
    private final Rating rating;
    private final List<String> ratingFactors;
    private final List<String> amenities;
    private final String saleText;
    private final List<String> imageUrls;

    private FacilityRecord(Builder b) {
        this.locator = b.locator;
        this.name = b.name;
        this.overviewLabels = List.copyOf(b.overviewLabels);
        EnumMap<ContactKind, String> c = new EnumMap<>(ContactKind.class);
        for (ContactKind k : ContactKind.values()) c.put(k, b.contact.get(k));
        this.contact = Collections.unmodifiableMap(c);
        this.address = b.address;
        this.description = b.description;
        this.rating = b.rating;
        this.ratingFactors = List.copyOf(b.ratingFactors);
        this.amenities = List.copyOf(b.amenities);
        this.saleText = b.saleText;
        this.imageUrls = List.copyOf(b.imageUrls);
    }

    public URI getLocator() { return locator; }
    public Optional<String> getName() { return Optional.ofNullable(name); }
    public List<String> getOverviewLabels() { return overviewLabels; }
    /** 세 종류 키가 항상 존재, 값은 null 가능 */
    public Map<ContactKind, String> getContact() { return contact; }
    public Optional<String> contact(ContactKind kind) { return Optional.ofNullable(contact.get(kind)); }
    public Optional<AddressParts> getAddress() { return Optional.ofNullable(address); }
    public Optional<String> getDescription() { return Optional.ofNullable(description); }
    public Optional<Rating> getRating() { return Optional.ofNullable(rating); }
    public List<String> getRatingFactors() { return ratingFactors; }
    public List<String> getAmenities() { return amenities; }
    public Optional<String> getSaleText() { return Optional.ofNullable(saleText); }
    public List<String> getImageUrls() { return imageUrls; }

    /** 어떤 필드도 채워지지 않은 레코드(유효한 결과) */
    public boolean isEmpty() {
        return name == null && overviewLabels.isEmpty()
                && contact.values().stream().allMatch(Objects::isNull)
                && address == null && description == null && rating == null
                && ratingFactors.isEmpty() && amenities.isEmpty()
                && saleText == null && imageUrls.isEmpty();
    }

    public static Builder builder(URI locator) { return new Builder(locator); }

    public static final class Builder {
        private final URI locator;
        private String name;
        private List<String> overviewLabels = List.of();
        private final Map<ContactKind, String> contact = new EnumMap<>(ContactKind.class);
        private AddressParts address;
        private String description;
        private Rating rating;
        private List<String> ratingFactors = List.of();
        private List<String> amenities = List.of();
        private String saleText;
        private List<String> imageUrls = List.of();

        private Builder(URI locator) { this.locator = Objects.requireNonNull(locator, "locator"); }

        public Builder name(String v) { this.name = v; return this; }
        public Builder overviewLabels(List<String> v) { this.overviewLabels = (v == null ? List.of() : v); return this; }
        public Builder contact(Map<ContactKind, String> v) {
            this.contact.clear();
            if (v != null) v.forEach((k, val) -> { if (k != null) this.contact.put(k, val); });
            return this;
        }
        public Builder contact(ContactKind kind, String v) { this.contact.put(kind, v); return this; }
        public Builder address(AddressParts v) { this.address = v; return this; }
        public Builder description(String v) { this.description = v; return this; }
        public Builder rating(Rating v) { this.rating = v; return this; }
        public Builder ratingFactors(List<String> v) { this.ratingFactors = (v == null ? List.of() : v); return this; }
        public Builder amenities(List<String> v) { this.amenities = (v == null ? List.of() : v); return this; }
        public Builder saleText(String v) { this.saleText = v; return this; }
        public Builder imageUrls(List<String> v) { this.imageUrls = (v == null ? List.of() : v); return this; }

        public FacilityRecord build() { return new FacilityRecord(this); }
    }
}
