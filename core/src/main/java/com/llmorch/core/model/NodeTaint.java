package com.llmorch.core.model;

/**
 * A node taint as seen by placement.
 */
public record NodeTaint(String key, String value, String effect) {
    public static final String NO_SCHEDULE = "NoSchedule";
    public static final String NO_EXECUTE = "NoExecute";

    /**
     * @return true when the taint keeps new pods off the node
     */
    public boolean blocksScheduling() {
        return NO_SCHEDULE.equals(effect) || NO_EXECUTE.equals(effect);
    }
}
