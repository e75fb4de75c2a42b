package com.llmorch.core.crd;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Desired state of an {@link LlmWorkload}.
 * <p>
 * Fields the orchestrator does not know are kept in {@link #getAdditionalProperties()}
 * so that a read-modify-write of the resource never drops them.
 * </p>
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LlmWorkloadSpec {
    public static final String LATEST = "latest";

    private String modelName;
    private String modelVersion;
    private String modelType;
    private String modelSize;
    private Map<String, String> parameters;

    private ResourceSpec resources;
    private ScalingSpec scaling;
    private SlaSpec sla;
    private SecuritySpec security;
    private PlacementSpec placement;

    @JsonIgnore
    private Map<String, Object> additionalProperties = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getAdditionalProperties() {
        return additionalProperties;
    }

    @JsonAnySetter
    public void setAdditionalProperty(String name, Object value) {
        additionalProperties.put(name, value);
    }

    /**
     * @return the requested model version, {@code latest} when unset or blank
     */
    @JsonIgnore
    public String getEffectiveModelVersion() {
        return modelVersion == null || modelVersion.isBlank() ? LATEST : modelVersion;
    }

    /**
     * @return the model size, {@code medium} when unset
     */
    @JsonIgnore
    public String getEffectiveModelSize() {
        return modelSize == null || modelSize.isBlank() ? "medium" : modelSize;
    }
}
