package com.llmorch.core.crd;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hard placement constraints and soft node preferences.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlacementSpec {
    /**
     * Node labels that must match exactly.
     */
    private Map<String, String> nodeSelector = new LinkedHashMap<>();

    /**
     * Node label pairs that exclude a node.
     */
    private List<LabelTerm> antiAffinity = new ArrayList<>();

    /**
     * Taint keys the workload tolerates.
     */
    private List<String> tolerations = new ArrayList<>();

    private List<NodePreference> preferences = new ArrayList<>();

    /**
     * Upper bound on a node's CPU and memory utilisation ratio for it to be eligible.
     */
    private Double maxNodeUtilization;

    /**
     * Prefer nodes that already host the same model. Defaults to true.
     */
    private Boolean localityPreference;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LabelTerm {
        private String key;
        private String value;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NodePreference {
        private String key;
        private String value;
        private Integer weight;
    }
}
