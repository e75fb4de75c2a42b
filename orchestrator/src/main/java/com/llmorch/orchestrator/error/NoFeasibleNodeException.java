package com.llmorch.orchestrator.error;

import java.util.Map;
import java.util.TreeMap;

/**
 * No node has room for the workload's envelope. Retried after back-off.
 */
public class NoFeasibleNodeException extends OrchestratorException {
    public static final String REASON = "Unschedulable";

    private final Map<String, String> rejections;

    public NoFeasibleNodeException(String message, Map<String, String> rejections) {
        super(REASON, true, message);
        this.rejections = new TreeMap<>(rejections);
    }

    /**
     * @return node name to rejection reason
     */
    public Map<String, String> getRejections() {
        return rejections;
    }
}
