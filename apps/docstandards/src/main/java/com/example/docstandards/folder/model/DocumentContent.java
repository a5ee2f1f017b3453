package com.example.docstandards.folder.model;

import com.example.docstandards.folder.document.DocumentDoc;

/**
 * Bytes of a document's current revision.
 */
public record DocumentContent(
        DocumentDoc document,
        byte[] content
) {}
