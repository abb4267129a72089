package com.di.phaselink.exception;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/** Structured error body for the REST endpoints. */
@Data
public class ErrorResponse {
    private String timestamp;
    private int status;
    private String error;
    private String message;
    private String errorKind;
    private String errorKindLabel;
    private String path;
    private Map<String, Object> details = new LinkedHashMap<>();

    public void addDetail(String key, Object value) {
        this.details.put(key, value);
    }
}
