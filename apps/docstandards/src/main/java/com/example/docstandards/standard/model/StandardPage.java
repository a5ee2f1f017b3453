package com.example.docstandards.standard.model;

import com.example.docstandards.standard.document.StandardDoc;

import java.util.List;

public record StandardPage(
        List<StandardDoc> standards,
        int page,
        int size,
        long totalElements
) {}
