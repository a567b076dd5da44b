package com.flagpole.flags;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Immutable enumeration of named bit flags. The i-th declared name maps to {@code 1L << i};
 * two synthetic members are always present: {@link #ALL} (union of every declared bit) and
 * {@link #NONE} (zero, also reachable as {@value #NONE_ALIAS}).
 * <p>
 * A flag space is safe to share by reference across any number of registries.
 */
public final class FlagSpace {

    public static final String ALL = "ALL";
    public static final String NONE = "NONE";
    /** Natural-case spelling of {@link #NONE}; resolves to the same zero value. */
    public static final String NONE_ALIAS = "None";
    /** Highest number of declared names; keeps every value, {@code ALL} included, non-negative. */
    public static final int MAX_FLAGS = Long.SIZE - 1;

    private final Map<String, Long> declared;
    private final long all;

    private FlagSpace(Map<String, Long> declared, long all) {
        this.declared = declared;
        this.all = all;
    }

    /**
     * Declares a flag space over the given names, in order.
     *
     * @param names distinct, non-blank names; at most {@link #MAX_FLAGS}
     * @return the flag space
     * @throws ConfigurationException if names is empty, has a blank, duplicate or reserved name, or is too long
     */
    public static FlagSpace define(String... names) {
        if (names == null) {
            throw new ConfigurationException("Flag space must declare at least one name");
        }
        return define(Arrays.asList(names));
    }

    /** Same as {@link #define(String...)} for a list. */
    public static FlagSpace define(List<String> names) {
        if (names == null || names.isEmpty()) {
            throw new ConfigurationException("Flag space must declare at least one name");
        }
        if (names.size() > MAX_FLAGS) {
            throw new ConfigurationException(String.format(
                    "Flag space declares %d names; at most %d fit in a long", names.size(), MAX_FLAGS));
        }
        Map<String, Long> byName = new LinkedHashMap<>();
        long all = 0L;
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("Flag name at position " + i + " must be non-blank");
            }
            if (isReserved(name)) {
                throw new ConfigurationException("Flag name is reserved: " + name);
            }
            long bit = 1L << i;
            if (byName.putIfAbsent(name, bit) != null) {
                throw new ConfigurationException("Duplicate flag name: " + name);
            }
            all |= bit;
        }
        return new FlagSpace(Collections.unmodifiableMap(byName), all);
    }

    private static boolean isReserved(String name) {
        return ALL.equals(name) || NONE.equals(name) || NONE_ALIAS.equals(name);
    }

    /**
     * Returns the bit value of the given name. {@code NONE} and {@code None} resolve to 0,
     * {@code ALL} to {@link #all()}. Lookup is case-sensitive.
     *
     * @throws UnknownFlagException if the name is neither declared nor synthetic
     */
    public long valueOf(String name) {
        Objects.requireNonNull(name, "name");
        Long bit = declared.get(name);
        if (bit != null) return bit;
        if (ALL.equals(name)) return all;
        if (NONE.equals(name) || NONE_ALIAS.equals(name)) return 0L;
        throw new UnknownFlagException(name);
    }

    /** True if the name is declared or synthetic. */
    public boolean contains(String name) {
        return name != null && (declared.containsKey(name) || isReserved(name));
    }

    public long all() {
        return all;
    }

    public long none() {
        return 0L;
    }

    /** Number of declared names (synthetic members excluded). */
    public int size() {
        return declared.size();
    }

    /** Declared names in declaration order. */
    public List<String> names() {
        return List.copyOf(declared.keySet());
    }

    /** True if the mask has no bit outside {@link #all()}. */
    public boolean isDeclared(long mask) {
        return (mask & ~all) == 0L;
    }

    /** Declared names whose bit is set in the mask, in declaration order. Undeclared bits are ignored. */
    public List<String> namesOf(long mask) {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, Long> e : declared.entrySet()) {
            if ((mask & e.getValue()) != 0L) out.add(e.getKey());
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Renders a mask for logs and error messages, e.g. {@code LISTENERS|RULES}. Zero renders as {@code NONE};
     * undeclared bits are appended in hex.
     */
    public String describe(long mask) {
        if (mask == 0L) return NONE;
        StringJoiner joiner = new StringJoiner("|");
        namesOf(mask).forEach(joiner::add);
        long undeclared = mask & ~all;
        if (undeclared != 0L) {
            joiner.add("0x" + Long.toHexString(undeclared));
        }
        return joiner.toString();
    }

    /**
     * Ordered view of every member: declared names, then {@code ALL}, {@code None} and {@code NONE}.
     */
    public Map<String, Long> asMap() {
        Map<String, Long> out = new LinkedHashMap<>(declared);
        out.put(ALL, all);
        out.put(NONE_ALIAS, 0L);
        out.put(NONE, 0L);
        return Collections.unmodifiableMap(out);
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
