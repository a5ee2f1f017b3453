package com.example.docstandards.validation.model;

import com.example.docstandards.validation.document.ValidationJobDoc;

public record EnqueueResult(
        ValidationJobDoc job,
        Outcome outcome
) {
    public enum Outcome {
        CREATED,
        /** A queued job already covers the same content snapshot. */
        COALESCED,
        /** A running job covers the request through supersede-on-completion. */
        RUNNING
    }

    public static EnqueueResult created(ValidationJobDoc job) {
        return new EnqueueResult(job, Outcome.CREATED);
    }

    public static EnqueueResult coalesced(ValidationJobDoc job) {
        return new EnqueueResult(job, Outcome.COALESCED);
    }

    public static EnqueueResult running(ValidationJobDoc job) {
        return new EnqueueResult(job, Outcome.RUNNING);
    }

    public boolean isCreated() {
        return outcome == Outcome.CREATED;
    }
}
