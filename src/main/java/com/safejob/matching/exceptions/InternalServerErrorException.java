package com.safejob.matching.exceptions;

/**
 * Exception thrown when an internal error occurs.
 * <p>
 * Used for failures that are not caused by the caller's input, for example an event payload that
 * cannot be serialised.
 * </p>
 */
public class InternalServerErrorException extends RuntimeException {

    /**
     * Constructs a new {@link InternalServerErrorException} with the specified error message.
     *
     * @param m the detail message explaining the error.
     */
    public InternalServerErrorException(String m) {
        super(m);
    }

    public InternalServerErrorException(String m, Throwable cause) {
        super(m, cause);
    }
}
