package com.example.docstandards.standard.model.response;

import com.example.docstandards.standard.model.StandardPage;

import java.util.List;

public record StandardListResponse(
        List<StandardResponse> standards,
        int page,
        int size,
        long totalElements,
        int totalPages
) {
    public static StandardListResponse from(StandardPage page) {
        int totalPages = (int) ((page.totalElements() + page.size() - 1) / page.size());
        return new StandardListResponse(
                page.standards().stream().map(StandardResponse::from).toList(),
                page.page(),
                page.size(),
                page.totalElements(),
                totalPages);
    }
}
