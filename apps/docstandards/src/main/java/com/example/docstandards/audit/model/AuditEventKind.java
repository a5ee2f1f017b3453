package com.example.docstandards.audit.model;

public enum AuditEventKind {
    UPLOAD,
    PROMOTE,
    ASSIGN,
    REASSIGN,
    VALIDATE_START,
    VALIDATE_COMPLETE,
    OVERRIDE_SET,
    OVERRIDE_CLEAR,
    FOLDER_CREATE,
    FOLDER_MOVE,
    FOLDER_RENAME,
    DOCUMENT_MOVE,
    DOCUMENT_RENAME,
    DOCUMENT_REVISE,
    DOCUMENT_ARCHIVE,
    JOB_RETRY
}
