package com.example.docstandards.compliance.model;

public enum Verdict {
    COMPLIANT,
    COMPLIANT_WITH_WARNINGS,
    NON_COMPLIANT
}
