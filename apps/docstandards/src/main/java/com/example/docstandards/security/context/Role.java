package com.example.docstandards.security.context;

public enum Role {
    VIEWER,           // read folders, documents, reports, audit
    EDITOR,           // create/move folders, upload/revise/move/archive documents
    STANDARDS_ADMIN   // promote standards, assign standards, set overrides, retry jobs
}
