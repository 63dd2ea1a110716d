package com.example.driftmonitor.monitor.behavior;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RefusalSample {
    String query;
    String response;
    Instant timestamp;
    /** Refusal phrase found in the response, if any. */
    String pattern;
}
