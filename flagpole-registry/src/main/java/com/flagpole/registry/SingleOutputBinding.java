package com.flagpole.registry;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Binding with one trigger flag and one return value.
 */
public final class SingleOutputBinding extends HandlerBinding {

    private final SingleOutputHandler handler;

    SingleOutputBinding(long flag, String key, long dependsOn, SingleOutputHandler handler) {
        super(List.of(new OutputSlot(flag, key, 0)), dependsOn);
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    public BindingKind getKind() {
        return BindingKind.SINGLE;
    }

    /** Output key; null when the returned map is merged into the result. */
    public String getKey() {
        return getSlots().get(0).key();
    }

    @Override
    List<Object> invoke(HandlerCall call) {
        return Collections.singletonList(handler.handle(call));
    }
}
