package com.flagpole.registry;

import java.util.List;

/**
 * Bindings one build executes, in execution order, and the flags it effectively requests:
 * the caller's flags plus every dependency flag pulled in. Produced without running any handler.
 */
public record BuildPlan(
        long requestedFlags,
        long effectiveFlags,
        List<HandlerBinding> executionOrder
) {
    public BuildPlan {
        executionOrder = executionOrder != null ? List.copyOf(executionOrder) : List.of();
    }

    public boolean isEmpty() {
        return executionOrder.isEmpty();
    }

    /** True if the binding (same instance) runs in this plan. */
    public boolean includes(HandlerBinding binding) {
        for (HandlerBinding b : executionOrder) {
            if (b == binding) return true;
        }
        return false;
    }
}
