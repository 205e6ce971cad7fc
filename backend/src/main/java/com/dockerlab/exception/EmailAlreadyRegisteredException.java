package com.dockerlab.exception;

import lombok.Getter;

@Getter
public class EmailAlreadyRegisteredException extends RuntimeException {

    private final String email;

    public EmailAlreadyRegisteredException(String email, Throwable cause) {
        super("Email '" + email + "' is already registered", cause);
        this.email = email;
    }
}
