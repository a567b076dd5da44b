package com.flagpole.registry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Binding whose handler returns one value per registered flag/key pair, positionally aligned.
 */
public final class MultiOutputBinding extends HandlerBinding {

    private final MultiOutputHandler handler;

    MultiOutputBinding(List<OutputSlot> slots, long dependsOn, MultiOutputHandler handler) {
        super(slots, dependsOn);
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    public BindingKind getKind() {
        return BindingKind.MULTI;
    }

    @Override
    List<Object> invoke(HandlerCall call) {
        List<?> values = handler.handle(call);
        int expected = getSlots().size();
        if (values == null || values.size() != expected) {
            throw new IllegalStateException(String.format(
                    "Multi-output handler returned %s values; %d flags are registered",
                    values == null ? "null instead of" : String.valueOf(values.size()), expected));
        }
        return new ArrayList<>(values);
    }
}
