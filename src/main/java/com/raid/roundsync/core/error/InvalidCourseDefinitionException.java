package com.raid.roundsync.core.error;

public class InvalidCourseDefinitionException extends RuntimeException {

    public InvalidCourseDefinitionException(String message) {
        super(message);
    }
}
