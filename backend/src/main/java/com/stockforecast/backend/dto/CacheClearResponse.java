package com.stockforecast.backend.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CacheClearResponse {
    String message;
    int clearedEntries;
}
