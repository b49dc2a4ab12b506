package com.safejob.matching.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when a caller asks for something the matching rules do not allow, such as a second active
 * application to the same job or a couple application to a job that does not take couples.
 * <p>
 * Annotated with {@link ResponseStatus} so a web layer built on top of the engine answers with
 * HTTP 400 without extra mapping.
 * </p>
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class BadRequestException extends RuntimeException {

    /**
     * Constructs a new BadRequestException with the specified detail message.
     *
     * @param message the detail message which explains the cause of the exception.
     */
    public BadRequestException(String message) {
        super(message);
    }
}
