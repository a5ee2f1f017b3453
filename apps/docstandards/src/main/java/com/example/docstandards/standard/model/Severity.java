package com.example.docstandards.standard.model;

public enum Severity {
    ERROR,
    WARNING
}
