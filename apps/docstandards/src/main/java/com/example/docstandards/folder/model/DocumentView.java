package com.example.docstandards.folder.model;

import com.example.docstandards.folder.document.DocumentDoc;
import com.example.docstandards.standard.document.StandardDoc;

public record DocumentView(
        DocumentDoc document,
        Resolution resolution,
        StandardDoc standard
) {}
