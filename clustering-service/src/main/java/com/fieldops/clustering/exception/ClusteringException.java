package com.fieldops.clustering.exception;

/**
 * Raised for caller errors the engine refuses to guess around, such as a
 * capacity below one. {@code code} is returned to HTTP clients verbatim.
 */
public class ClusteringException extends RuntimeException {

    private final String code;

    public ClusteringException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
