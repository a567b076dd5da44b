package com.flagpole.registry;

/**
 * Handler for a {@link BindingKind#SINGLE} binding. Without an output key the returned value must be a
 * {@code Map<String, ?>} (or null for nothing to merge).
 */
@FunctionalInterface
public interface SingleOutputHandler {

    /**
     * @param call build arguments, plus the result built so far when it is passed
     * @return value stored under the binding's key, or merged into the result when the binding has none
     */
    Object handle(HandlerCall call);
}
