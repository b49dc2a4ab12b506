package com.safejob.matching.exceptions;

import com.safejob.matching.dto.enums.ActorType;
import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * A requested status change is not in the transition table. The record it was aimed at is left
 * untouched; callers report the conflict instead of retrying.
 */
@Getter
@ResponseStatus(HttpStatus.CONFLICT)
public class InvalidTransitionException extends RuntimeException {

    private final String from;
    private final String to;
    private final ActorType actorType;

    public InvalidTransitionException(Enum<?> from, Enum<?> to, ActorType actorType) {
        super("Transition " + from + " -> " + to + " is not allowed for actor " + actorType);
        this.from = from.name();
        this.to = to.name();
        this.actorType = actorType;
    }
}
