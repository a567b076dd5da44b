package com.flagpole.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Arguments of one handler invocation during a build.
 * <p>
 * Positional arguments are the build's arguments, led by the result map when it is passed: the build asked
 * for it ({@code passFullStructure}) or the binding has dependencies. The result map is not prepended again
 * when the same instance is already one of the build's arguments. The result map is exposed read-only; the
 * registry alone writes handler outputs into it.
 */
public final class HandlerCall {

    private final Map<String, Object> structure;
    private final List<Object> arguments;
    private final Map<String, Object> namedArguments;
    private final long requestedFlags;

    HandlerCall(Map<String, Object> result, boolean passStructure, List<Object> buildArguments,
                Map<String, Object> namedArguments, long requestedFlags) {
        this.structure = passStructure ? Collections.unmodifiableMap(result) : null;
        List<Object> args = new ArrayList<>(buildArguments.size() + 1);
        if (passStructure && !containsInstance(buildArguments, result)) {
            args.add(structure);
        }
        args.addAll(buildArguments);
        this.arguments = Collections.unmodifiableList(args);
        this.namedArguments = Collections.unmodifiableMap(new LinkedHashMap<>(namedArguments));
        this.requestedFlags = requestedFlags;
    }

    private static boolean containsInstance(List<Object> values, Object target) {
        for (Object v : values) {
            if (v == target) return true;
        }
        return false;
    }

    /** True if the result map was passed to this handler. */
    public boolean hasStructure() {
        return structure != null;
    }

    /**
     * Result built so far (read-only), including the outputs of every dependency of this binding.
     *
     * @throws IllegalStateException if the result map was not passed to this handler
     */
    public Map<String, Object> getStructure() {
        if (structure == null) {
            throw new IllegalStateException("Result structure was not passed; register a dependency or build with passFullStructure");
        }
        return structure;
    }

    /** Positional arguments; the result map leads when passed. Unmodifiable, may contain nulls. */
    public List<Object> getArguments() {
        return arguments;
    }

    public Object getArgument(int index) {
        return arguments.get(index);
    }

    public Map<String, Object> getNamedArguments() {
        return namedArguments;
    }

    public Object getNamedArgument(String name) {
        return namedArguments.get(name);
    }

    /** Requested flags of the build, plus every dependency flag pulled in. */
    public long getRequestedFlags() {
        return requestedFlags;
    }
}
