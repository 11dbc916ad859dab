package com.spiderhub.crawler.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ComponentHealth {
    private String name;
    private boolean healthy;
    private String message;
    @JsonProperty("latency_ms")
    private Double latencyMs;
}
