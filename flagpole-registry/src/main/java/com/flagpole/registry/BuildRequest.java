package com.flagpole.registry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Options of one {@link HandlerRegistry#build(long, BuildRequest)} call: the map to mutate, whether every
 * handler receives the result map, and the positional and named arguments passed through to handlers.
 */
public final class BuildRequest {

    private static final BuildRequest EMPTY = builder().build();

    private final Map<String, Object> startWith;
    private final Boolean passFullStructure;
    private final List<Object> arguments;
    private final Map<String, Object> namedArguments;

    private BuildRequest(Builder b) {
        this.startWith = b.startWith;
        this.passFullStructure = b.passFullStructure;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(b.arguments));
        this.namedArguments = Collections.unmodifiableMap(new LinkedHashMap<>(b.namedArguments));
    }

    /** No start map, registry default for passing the structure, no arguments. */
    public static BuildRequest empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Map the build mutates and returns; null = a fresh map per build. */
    public Map<String, Object> getStartWith() {
        return startWith;
    }

    /** Explicit passFullStructure setting; null = registry default. */
    public Boolean getPassFullStructure() {
        return passFullStructure;
    }

    public List<Object> getArguments() {
        return arguments;
    }

    public Map<String, Object> getNamedArguments() {
        return namedArguments;
    }

    public static final class Builder {
        private Map<String, Object> startWith;
        private Boolean passFullStructure;
        private final List<Object> arguments = new ArrayList<>();
        private final Map<String, Object> namedArguments = new LinkedHashMap<>();

        private Builder() {
        }

        /** Map to mutate in place and return. Must be mutable. */
        public Builder startWith(Map<String, Object> startWith) {
            this.startWith = startWith;
            return this;
        }

        /** Pass the result map to every handler, not only to those with dependencies. */
        public Builder passFullStructure(boolean passFullStructure) {
            this.passFullStructure = passFullStructure;
            return this;
        }

        public Builder argument(Object argument) {
            this.arguments.add(argument);
            return this;
        }

        public Builder arguments(Object... arguments) {
            if (arguments != null) this.arguments.addAll(Arrays.asList(arguments));
            return this;
        }

        public Builder namedArgument(String name, Object value) {
            this.namedArguments.put(Objects.requireNonNull(name, "name"), value);
            return this;
        }

        public Builder namedArguments(Map<String, ?> namedArguments) {
            if (namedArguments != null) this.namedArguments.putAll(namedArguments);
            return this;
        }

        public BuildRequest build() {
            return new BuildRequest(this);
        }
    }
}
