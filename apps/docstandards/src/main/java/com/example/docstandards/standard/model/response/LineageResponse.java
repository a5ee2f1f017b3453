package com.example.docstandards.standard.model.response;

import java.util.List;

public record LineageResponse(
        String lineageId,
        List<StandardResponse> versions
) {}
