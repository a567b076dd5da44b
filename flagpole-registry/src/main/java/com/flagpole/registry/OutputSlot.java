package com.flagpole.registry;

/**
 * One return slot of a binding: the trigger flag that selects it, the key its value is stored under
 * ({@code null} = the value is a map merged into the result), and its position in the handler's return value.
 */
public record OutputSlot(long flag, String key, int position) {

    /** True if the slot's value is merged key-by-key instead of stored under {@link #key()}. */
    public boolean mergesMap() {
        return key == null;
    }
}
