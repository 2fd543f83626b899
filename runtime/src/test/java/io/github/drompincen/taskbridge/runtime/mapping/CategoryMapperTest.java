package io.github.drompincen.taskbridge.runtime.mapping;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class CategoryMapperTest {

    @Test
    void mapsKnownCategories() {
        assertThat(CategoryMapper.map("Blogs")).isEqualTo("SEO");
        assertThat(CategoryMapper.map("Website Updates")).isEqualTo("Website - SEO");
        assertThat(CategoryMapper.map("Onboarding | Access")).isEqualTo("Onboarding");
        assertThat(CategoryMapper.map("Halstead")).isEqualTo("Halstead Marketing");
    }

    @Test
    void lookupIgnoresCaseAndSurroundingWhitespace() {
        assertThat(CategoryMapper.map("  social MEDIA ")).isEqualTo("Social Posting");
        assertThat(CategoryMapper.map("content &  creative")).isEqualTo("Graphic Design Support");
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "   ", "\t\n"})
    void blankCategoryMapsToOther(String input) {
        assertThat(CategoryMapper.map(input)).isEqualTo("Other");
    }

    @Test
    void unknownCategoryMapsToOtherWithoutGuessing() {
        assertThat(CategoryMapper.map("Website")).isEqualTo("Other");
        assertThat(CategoryMapper.map("SEO-ish work")).isEqualTo("Other");
        assertThat(CategoryMapper.isKnown("Website")).isFalse();
    }

    @Test
    void tableIsReadOnly() {
        assertThat(CategoryMapper.table()).containsEntry("OKRs", "Administrative - Internal");
        assertThat(CategoryMapper.table()).hasSizeGreaterThanOrEqualTo(44);
    }
}
