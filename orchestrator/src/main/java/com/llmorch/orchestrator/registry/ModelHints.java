package com.llmorch.orchestrator.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional sizing and image hints published alongside a model version.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelHints {
    private Double cpuMultiplier;
    private Double memoryMultiplier;
    private String defaultImage;
}
