/**
 * Handler registry: flag-triggered handlers, dependency resolution and result build-out.
 * <ul>
 *   <li>{@link com.flagpole.registry.HandlerRegistry} – register handlers per flag, then build a result map for a flag combination</li>
 *   <li>{@link com.flagpole.registry.SingleOutputHandler} / {@link com.flagpole.registry.MultiOutputHandler} – the two binding kinds</li>
 *   <li>{@link com.flagpole.registry.HandlerCall} – arguments passed to a handler, including the result map for dependents</li>
 *   <li>{@link com.flagpole.registry.BuildPlan} – bindings a build runs, in order</li>
 * </ul>
 * A handler that declares dependencies always receives the result map holding its dependencies' outputs.
 */
package com.flagpole.registry;
