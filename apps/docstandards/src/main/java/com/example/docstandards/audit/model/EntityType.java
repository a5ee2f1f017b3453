package com.example.docstandards.audit.model;

public enum EntityType {
    FOLDER,
    DOCUMENT,
    STANDARD,
    JOB
}
