package com.example.docstandards.compliance.model;

public record Heading(
        int index,
        int level,
        String text
) {
}
