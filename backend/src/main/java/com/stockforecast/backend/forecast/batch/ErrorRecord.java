package com.stockforecast.backend.forecast.batch;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ErrorRecord {
    String symbol;
    String errorKind;
    String message;
}
