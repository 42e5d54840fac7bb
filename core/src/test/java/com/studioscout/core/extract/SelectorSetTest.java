package com.studioscout.core.extract;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SelectorSetTest {

    @Test
    void defaults_cover_every_field_key() {
        SelectorSet s = SelectorSet.defaults();
        assertThat(s.asMap()).containsOnlyKeys(
                SelectorSet.NAME, SelectorSet.OVERVIEW, SelectorSet.CONTACT, SelectorSet.ADDRESS,
                SelectorSet.DESCRIPTION, SelectorSet.RATING, SelectorSet.RATING_FACTOR,
                SelectorSet.RATING_FACTOR_LABEL, SelectorSet.RATING_FACTOR_VALUE,
                SelectorSet.AMENITY, SelectorSet.SALE, SelectorSet.IMAGE);
        assertThat(s.get(SelectorSet.NAME).asText()).isEqualTo("h1|MuiTypography-root MuiTypography-h1 css-qinhw0");
    }

    @Test
    void overrides_replace_only_named_keys() {
        SelectorSet base = SelectorSet.defaults();
        SelectorSet o = base.withOverrides(Map.of("name", "h2|title"));
        assertThat(o.get("name")).isEqualTo(FieldSelector.of("h2", "title"));
        assertThat(o.get("address")).isEqualTo(base.get("address"));
        assertThat(base.get("name").query()).startsWith("h1.");
    }

    @Test
    void unknown_key_is_rejected() {
        assertThatThrownBy(() -> SelectorSet.defaults().withOverrides(Map.of("price", "p|x")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("price");
        assertThatThrownBy(() -> SelectorSet.defaults().get("nope"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
