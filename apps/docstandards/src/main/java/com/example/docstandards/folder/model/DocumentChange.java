package com.example.docstandards.folder.model;

import com.example.docstandards.folder.document.DocumentDoc;
import com.example.docstandards.validation.document.ValidationJobDoc;

/**
 * A document after a mutation, with the validation job that covers it.
 * {@code job} is null when nothing was enqueued.
 */
public record DocumentChange(
        DocumentDoc document,
        ValidationJobDoc job
) {}
