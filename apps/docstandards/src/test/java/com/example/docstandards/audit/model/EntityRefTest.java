package com.example.docstandards.audit.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EntityRef")
class EntityRefTest {

    @Test
    @DisplayName("should parse TYPE:id case-insensitively")
    void shouldParse() {
        assertThat(EntityRef.parse("document:doc-1")).isEqualTo(EntityRef.document("doc-1"));
        assertThat(EntityRef.parse("FOLDER:finance")).isEqualTo(EntityRef.folder("finance"));
    }

    @Test
    @DisplayName("should keep colons inside the id")
    void shouldKeepColonsInId() {
        EntityRef ref = EntityRef.parse("JOB:abc:def");

        assertThat(ref.type()).isEqualTo(EntityType.JOB);
        assertThat(ref.id()).isEqualTo("abc:def");
    }

    @Test
    @DisplayName("should render as TYPE:id")
    void shouldRender() {
        assertThat(EntityRef.standard("std-1")).hasToString("STANDARD:std-1");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"document", ":doc-1", "document:", "widget:1"})
    @DisplayName("should reject malformed references")
    void shouldRejectMalformed(String value) {
        assertThatThrownBy(() -> EntityRef.parse(value))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should reject blank ids")
    void shouldRejectBlankId() {
        assertThatThrownBy(() -> EntityRef.document(" "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("id is required");
    }
}
