package com.raditha.magpie.embedding;

/**
 * Raised when an embedding cannot be produced or the produced vectors are inconsistent.
 */
public class EmbeddingException extends RuntimeException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
