package com.llmorch.core.model;

import java.util.Objects;

/**
 * Immutable workload identity {@code (namespace, name)}.
 */
public record WorkloadKey(String namespace, String name) implements Comparable<WorkloadKey> {

    public WorkloadKey {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(name, "name");
    }

    public static WorkloadKey of(String namespace, String name) {
        return new WorkloadKey(namespace, name);
    }

    @Override
    public int compareTo(WorkloadKey other) {
        int byNamespace = namespace.compareTo(other.namespace);
        return byNamespace != 0 ? byNamespace : name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
