package com.example.jobscheduler.exception;

/**
 * Exception for job metadata blobs that cannot be decoded
 */
public class MetadataDeserializationException extends RuntimeException {

    public MetadataDeserializationException(String message) {
        super("Cannot deserialize job metadata: " + message);
    }

    public MetadataDeserializationException(String message, Exception cause) {
        super("Cannot deserialize job metadata: " + message, cause);
    }
}
