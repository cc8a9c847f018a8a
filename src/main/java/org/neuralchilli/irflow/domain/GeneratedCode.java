package org.neuralchilli.irflow.domain;

/**
 * Output of a code generator backend.
 */
public record GeneratedCode(String source, Metadata metadata) {

    public GeneratedCode {
        if (source == null) {
            throw new IllegalArgumentException("Generated source cannot be null");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("Generated code metadata cannot be null");
        }
    }

    /**
     * @param size      source length in UTF-8 bytes
     * @param checksum  SHA-256 of the source, hex encoded
     * @param timestamp ISO-8601 generation instant
     */
    public record Metadata(String target, int size, String checksum, String timestamp) {
    }
}
