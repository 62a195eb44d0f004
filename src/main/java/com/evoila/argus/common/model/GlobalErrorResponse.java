package com.evoila.argus.common.model;

/** Error body returned for every failed request. */
public record GlobalErrorResponse(
    String error, String message, int status, String errorCode, String timestamp, String path) {}
