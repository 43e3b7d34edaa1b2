package com.apex.resilience.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LeaderStatusResponse {
    private String key;
    private String holderId;
    private boolean leader;
    private String currentHolder;
    private String role;
    private long lastTickMs;
}
