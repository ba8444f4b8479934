package com.address.resolution.domain.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PlusCodesTest {

    @Test
    void testIsPlusCode_LocatorShapes() {
        assertThat(PlusCodes.isPlusCode("8GXX+PH")).isTrue();
        assertThat(PlusCodes.isPlusCode(" 87G8+Q2R New York")).isTrue();
        assertThat(PlusCodes.isPlusCode("123 Main St")).isFalse();
        assertThat(PlusCodes.isPlusCode("8GXX+P")).isFalse();
        assertThat(PlusCodes.isPlusCode("8gxx+ph")).isFalse();
        assertThat(PlusCodes.isPlusCode(null)).isFalse();
    }

    @Test
    void testSegments_TrimsAndDropsBlankSegments() {
        assertThat(PlusCodes.segments(" Main St, , Springfield ,IL")).containsExactly("Main St", "Springfield", "IL");
        assertThat(PlusCodes.segments(null)).isEmpty();
    }

    @Test
    void testFirstReadableSegment_DropsLeadingPlusCode() {
        assertThat(PlusCodes.firstReadableSegment("8GXX+PH, Springfield, IL")).isEqualTo("Springfield");
        assertThat(PlusCodes.firstReadableSegment("Springfield, IL")).isEqualTo("Springfield");
        assertThat(PlusCodes.leadingSegment("8GXX+PH, Springfield, IL")).isEqualTo("8GXX+PH");
        assertThat(PlusCodes.leadingSegment("")).isEmpty();
    }
}
