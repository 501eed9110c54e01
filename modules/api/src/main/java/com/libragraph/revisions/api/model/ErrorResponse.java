package com.libragraph.revisions.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String message, List<String> violations) {

    public ErrorResponse(String error, String message) {
        this(error, message, null);
    }
}
