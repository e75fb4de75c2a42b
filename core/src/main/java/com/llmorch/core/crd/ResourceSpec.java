package com.llmorch.core.crd;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Textual resource appetite of one replica, in platform quantity notation
 * ({@code 2000m}, {@code 8Gi}, {@code 1}).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResourceSpec {
    private String cpu;
    private String memory;
    private String gpu;
    private String storage;
    private String networkBandwidth;
}
