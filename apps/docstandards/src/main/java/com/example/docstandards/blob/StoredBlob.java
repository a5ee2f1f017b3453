package com.example.docstandards.blob;

public record StoredBlob(
        String key,
        String sha256,
        long sizeBytes
) {
}
