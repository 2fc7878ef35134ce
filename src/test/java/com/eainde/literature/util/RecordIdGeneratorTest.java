package com.eainde.literature.util;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecordIdGeneratorTest {

    private final RecordIdGenerator generator =
            new RecordIdGenerator(Clock.fixed(Instant.parse("2025-06-01T00:00:00Z"), ZoneOffset.UTC));

    @Test
    void generate_shouldCombineAuthorYearAndSequence() {
        assertThat(generator.generate("Smith", 2019, 3)).isEqualTo("Smith2019-o3");
    }

    @Test
    void prefix_shouldStripNonLetters_whenAuthorHasPunctuationOrSpaces() {
        assertThat(generator.prefix("O'Brien-Jones", 2001)).isEqualTo("OBrienJones2001");
    }

    @Test
    void prefix_shouldFallBackToAuthorAndClockYear_whenMetadataMissing() {
        assertThat(generator.prefix(null, null)).isEqualTo("Author2025");
        assertThat(generator.prefix("  ", 1999)).isEqualTo("Author1999");
    }

    @Test
    void maxSequence_shouldReturnHighestSuffix() {
        List<String> ids = Arrays.asList("Smith2019-o1", "Smith2019-o12", null, "Smith2019-o7", "custom-id");

        assertThat(RecordIdGenerator.maxSequence(ids)).isEqualTo(12);
    }

    @Test
    void maxSequence_shouldReturnZero_whenNoIdParses() {
        assertThat(RecordIdGenerator.maxSequence(List.of("a", "b-o", "c-oX"))).isZero();
        assertThat(RecordIdGenerator.maxSequence(List.of())).isZero();
    }
}
