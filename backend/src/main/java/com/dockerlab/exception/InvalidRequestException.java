package com.dockerlab.exception;

/**
 * Input that passed field validation but is still not acceptable as a whole.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
