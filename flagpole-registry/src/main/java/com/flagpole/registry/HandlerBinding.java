package com.flagpole.registry;

import java.util.List;

/**
 * Registered association of trigger flag(s), dependency flags, output keys and a handler.
 * Returned by the registry's register methods as the handle of the registration; immutable.
 *
 * @see SingleOutputBinding
 * @see MultiOutputBinding
 */
public abstract class HandlerBinding {

    private final List<OutputSlot> slots;
    private final long triggerFlags;
    private final long dependsOn;

    HandlerBinding(List<OutputSlot> slots, long dependsOn) {
        this.slots = List.copyOf(slots);
        long mask = 0L;
        for (OutputSlot slot : this.slots) {
            mask |= slot.flag();
        }
        this.triggerFlags = mask;
        this.dependsOn = dependsOn;
    }

    public abstract BindingKind getKind();

    /**
     * Invokes the handler and returns its values aligned with {@link #getSlots()}.
     * Exceptions thrown by the handler propagate unchanged.
     */
    abstract List<Object> invoke(HandlerCall call);

    /** Return slots in registration order. */
    public List<OutputSlot> getSlots() {
        return slots;
    }

    /** Union of the trigger flags of every slot. */
    public long getTriggerFlags() {
        return triggerFlags;
    }

    /** Flags of the bindings that must run first; 0 = none. */
    public long getDependsOn() {
        return dependsOn;
    }

    public boolean hasDependencies() {
        return dependsOn != 0L;
    }

    /** True if any trigger flag is set in the mask. */
    public boolean isTriggeredBy(long flags) {
        return (triggerFlags & flags) != 0L;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{triggerFlags=" + triggerFlags + ", dependsOn=" + dependsOn + ", slots=" + slots + "}";
    }
}
