package com.eainde.literature.dedup;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.eainde.literature.support.Json.fields;
import static org.assertj.core.api.Assertions.assertThat;

class FieldwiseDuplicateDetectorTest {

    private static final List<String> UNIQUE = List.of("species", "host", "location");

    private final FieldwiseDuplicateDetector detector = new FieldwiseDuplicateDetector(new NgramJaccardSimilarity());

    @Test
    void findUnique_shouldDropNearDuplicateOfStoredRecord() {
        // Arrange
        List<Map<String, JsonNode>> existing = List.of(
                fields("species", "Myotis lucifugus", "host", "Culicidae", "location", "Ontario"));
        List<Map<String, JsonNode>> incoming = List.of(
                fields("species", "Myotis lucifugis", "host", "culicidae", "location", "Ontario"),
                fields("species", "Myotis yumanensis", "host", "Culicidae", "location", "Ontario"));

        // Act
        List<Integer> kept = detector.findUnique(incoming, existing, UNIQUE, 0.7);

        // Assert
        assertThat(kept).containsExactly(1);
    }

    @Test
    void findUnique_shouldSkipFieldsEmptyOnEitherSide() {
        List<Map<String, JsonNode>> existing = List.of(fields("species", "Eptesicus fuscus", "host", "Moth"));
        List<Map<String, JsonNode>> incoming = List.of(
                fields("species", "Eptesicus fuscus", "host", "Moth", "location", "Kansas"));

        assertThat(detector.findUnique(incoming, existing, UNIQUE, 0.9)).isEmpty();
    }

    @Test
    void findUnique_shouldKeepRecord_whenNoUniqueFieldIsComparable() {
        List<Map<String, JsonNode>> existing = List.of(fields("species", "Eptesicus fuscus"));
        List<Map<String, JsonNode>> incoming = List.of(fields("host", "Moth"));

        assertThat(detector.findUnique(incoming, existing, UNIQUE, 0.5)).containsExactly(0);
    }

    @Test
    void findUnique_shouldNotCompareNewRecordsWithEachOther() {
        List<Map<String, JsonNode>> existing = List.of(fields("species", "Tadarida brasiliensis", "host", "Moth"));
        List<Map<String, JsonNode>> incoming = List.of(
                fields("species", "Myotis velifer", "host", "Beetle"),
                fields("species", "Myotis velifer", "host", "Beetle"));

        assertThat(detector.findUnique(incoming, existing, UNIQUE, 0.8)).containsExactly(0, 1);
    }

    @Test
    void findUnique_shouldTreatEveryRecordAsDuplicate_whenThresholdZero() {
        List<Map<String, JsonNode>> existing = List.of(fields("species", "Tadarida brasiliensis", "host", "Moth"));
        List<Map<String, JsonNode>> incoming = List.of(fields("species", "Myotis velifer", "host", "Beetle"));

        assertThat(detector.findUnique(incoming, existing, UNIQUE, 0.0)).isEmpty();
    }
}
