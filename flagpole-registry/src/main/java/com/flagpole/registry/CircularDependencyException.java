package com.flagpole.registry;

import com.flagpole.flags.FlagpoleException;

import java.util.List;

/**
 * Thrown when the dependency edges among the bindings selected for a build form a cycle.
 * Raised before any handler runs, so the result map is left untouched.
 */
public final class CircularDependencyException extends FlagpoleException {

    private final long cycleFlags;
    private final List<String> cycleNames;

    public CircularDependencyException(long cycleFlags, List<String> cycleNames) {
        super("Circular dependency between " + String.join(" -> ", cycleNames));
        this.cycleFlags = cycleFlags;
        this.cycleNames = List.copyOf(cycleNames);
    }

    /** Union of the trigger flags of every binding on the cycle. */
    public long getCycleFlags() {
        return cycleFlags;
    }

    /** Bindings on the cycle, each rendered by its trigger flags, in dependency order; the first entry is repeated at the end. */
    public List<String> getCycleNames() {
        return cycleNames;
    }
}
