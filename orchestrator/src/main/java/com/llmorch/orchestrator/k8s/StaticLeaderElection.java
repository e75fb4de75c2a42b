package com.llmorch.orchestrator.k8s;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Used when leader election is disabled: this instance always leads once started.
 */
public class StaticLeaderElection implements ILeaderElection {
    private static final Logger log = LoggerFactory.getLogger(StaticLeaderElection.class);

    private final List<Consumer<Boolean>> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean leader;

    @Override
    public void start() {
        log.info("Leader election disabled; this instance acts as leader");
        leader = true;
        listeners.forEach(l -> l.accept(true));
    }

    @Override
    public void stop() {
        if (leader) {
            leader = false;
            listeners.forEach(l -> l.accept(false));
        }
    }

    @Override
    public boolean isLeader() {
        return leader;
    }

    @Override
    public void addListener(Consumer<Boolean> listener) {
        listeners.add(listener);
    }
}
