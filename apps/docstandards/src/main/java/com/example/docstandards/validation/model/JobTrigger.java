package com.example.docstandards.validation.model;

/**
 * What caused a validation job to be enqueued.
 */
public enum JobTrigger {
    UPLOAD,
    REVISE,
    MOVE,
    ASSIGN,
    OVERRIDE,
    /**
     * Enqueued on completion of a job whose inputs changed while it ran.
     */
    SUPERSEDE
}
