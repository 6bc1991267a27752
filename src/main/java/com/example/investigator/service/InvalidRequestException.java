package com.example.investigator.service;

/** The request cannot be investigated at all; reported to the caller as a client error. */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
