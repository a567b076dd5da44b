package com.flagpole.registry;

import java.util.List;

/**
 * Handler for a {@link BindingKind#MULTI} binding. Returns one value per registered flag, in registration order;
 * values for flags that were not requested are discarded.
 */
@FunctionalInterface
public interface MultiOutputHandler {

    List<?> handle(HandlerCall call);
}
