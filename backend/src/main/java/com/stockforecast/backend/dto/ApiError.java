package com.stockforecast.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Error body for every failed forecast call. {@code errorKind} is the stable machine-readable
 * kind (e.g. {@code MODEL_NOT_FOUND}); ids are absent when the request carried none.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    Instant timestamp;
    String path;
    int status;
    String error;
    String errorKind;
    String message;
    String requestId;
    String correlationId;
    @Builder.Default
    List<ApiErrorDetail> details = List.of();
}
