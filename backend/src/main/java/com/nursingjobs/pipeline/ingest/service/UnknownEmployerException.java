package com.nursingjobs.pipeline.ingest.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class UnknownEmployerException extends RuntimeException {
    private final String employerSlug;

    public UnknownEmployerException(String employerSlug) {
        super("No source binding configured for employer '" + employerSlug + "'");
        this.employerSlug = employerSlug;
    }

    public String getEmployerSlug() {
        return employerSlug;
    }
}
