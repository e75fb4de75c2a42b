package com.llmorch.core.crd;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

/**
 * Security hints. Opaque to placement; forwarded to the pod template.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SecuritySpec {
    private Boolean encryption;
    private String complianceLevel;
    private String dataClassification;
}
