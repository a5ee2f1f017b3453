package com.example.docstandards.compliance.model;

import com.example.docstandards.standard.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("Finding ordering")
class FindingTest {

    private static Finding at(String location, String message) {
        return new Finding("heading-hierarchy", Severity.ERROR, location, message);
    }

    @Test
    @DisplayName("should order indexed locations by index beyond four digits")
    void shouldOrderByIndex() {
        List<Finding> findings = new ArrayList<>(List.of(
                at("heading[10000]", "a"),
                at("heading[9999]", "a"),
                at("heading[0002]", "a"),
                at("heading[123456]", "a")));

        findings.sort(Finding.BY_LOCATION_THEN_MESSAGE);

        assertThat(findings).extracting(Finding::location)
                .containsExactly("heading[0002]", "heading[9999]", "heading[10000]", "heading[123456]");
    }

    @Test
    @DisplayName("should fall back to text for other locations and then order by message")
    void shouldFallBackToText() {
        List<Finding> findings = new ArrayList<>(List.of(
                at("style:Heading_20_1", "b"),
                at("meta:title", "z"),
                at("style:Heading_20_1", "a"),
                at("document", "x")));

        findings.sort(Finding.BY_LOCATION_THEN_MESSAGE);

        assertThat(findings).extracting(Finding::location, Finding::message)
                .containsExactly(
                        tuple("document", "x"),
                        tuple("meta:title", "z"),
                        tuple("style:Heading_20_1", "a"),
                        tuple("style:Heading_20_1", "b"));
    }
}
