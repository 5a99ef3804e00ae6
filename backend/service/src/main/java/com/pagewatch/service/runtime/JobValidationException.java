package com.pagewatch.service.runtime;

public class JobValidationException extends IllegalArgumentException {
    public JobValidationException(String message) {
        super(message);
    }
}
