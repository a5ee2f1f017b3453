package com.example.docstandards.compliance.parser;

/**
 * Raised by the parser for content that is not a readable ODF package.
 * Never crosses the evaluator boundary: evaluation turns it into a finding,
 * promotion into {@link com.example.docstandards.exception.InvalidSourceDocumentException}.
 */
public class MalformedDocumentException extends RuntimeException {

    public MalformedDocumentException(String message) {
        super(message);
    }

    public MalformedDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
