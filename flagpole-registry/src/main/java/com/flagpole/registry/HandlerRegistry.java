package com.flagpole.registry;

import com.flagpole.config.DuplicatePolicy;
import com.flagpole.config.FlagpoleConfig;
import com.flagpole.flags.ConfigurationException;
import com.flagpole.flags.FlagSpace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of handler bindings over one {@link FlagSpace}. Register handlers at setup time, then
 * {@link #build(long, BuildRequest)} runs exactly the handlers needed for a flag combination, dependencies
 * first, and merges their outputs into one map.
 * <p>
 * Registration is synchronized and publishes an immutable snapshot, so builds never see a half-registered
 * binding; builds do not mutate the registry. Registering while other threads build is still not ordered
 * against those builds.
 */
public final class HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private static final Map<FlagSpace, HandlerRegistry> SHARED = new ConcurrentHashMap<>();

    private final FlagSpace flagSpace;
    private final FlagpoleConfig config;
    private volatile List<HandlerBinding> bindings = List.of();

    public HandlerRegistry(FlagSpace flagSpace) {
        this(flagSpace, FlagpoleConfig.defaults());
    }

    public HandlerRegistry(FlagSpace flagSpace, FlagpoleConfig config) {
        this.flagSpace = Objects.requireNonNull(flagSpace, "flagSpace");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Process-wide registry for the given flag space (one per flag space instance), created with default
     * configuration on first use. Optional convenience; registries can always be created directly.
     */
    public static HandlerRegistry shared(FlagSpace flagSpace) {
        Objects.requireNonNull(flagSpace, "flagSpace");
        return SHARED.computeIfAbsent(flagSpace, HandlerRegistry::new);
    }

    /** Drops every shared registry (mainly for tests). */
    public static void clearShared() {
        SHARED.clear();
    }

    public FlagSpace getFlagSpace() {
        return flagSpace;
    }

    public FlagpoleConfig getConfig() {
        return config;
    }

    /** Registers a handler whose returned map is merged into the result when the flag is requested. */
    public SingleOutputBinding register(long flag, SingleOutputHandler handler) {
        return register(flag, null, 0L, handler);
    }

    /** Registers a handler whose return value is stored under the key (null = merge the returned map). */
    public SingleOutputBinding register(long flag, String key, SingleOutputHandler handler) {
        return register(flag, key, 0L, handler);
    }

    /**
     * Registers a single-output handler.
     *
     * @param flag      trigger flag; exactly one bit
     * @param key       output key; null = the handler returns a map merged into the result
     * @param dependsOn flags of the bindings that must run first (0 = none); the handler then receives the result map
     * @param handler   handler
     * @return the registered binding
     * @throws ConfigurationException if the flag is not a single bit, or is already bound and duplicates are rejected
     */
    public synchronized SingleOutputBinding register(long flag, String key, long dependsOn, SingleOutputHandler handler) {
        Objects.requireNonNull(handler, "handler");
        requireSingleBit(flag);
        SingleOutputBinding binding = new SingleOutputBinding(flag, key, dependsOn, handler);
        add(binding);
        return binding;
    }

    /** Registers a multi-output handler without dependencies. */
    public MultiOutputBinding registerMulti(List<Long> flags, List<String> keys, MultiOutputHandler handler) {
        return registerMulti(flags, keys, 0L, handler);
    }

    /**
     * Registers a handler returning one value per flag, positionally aligned with {@code flags} and {@code keys}.
     *
     * @param flags     trigger flags; one bit each, no repeats
     * @param keys      output keys aligned with flags (null entries merge maps); null = every slot merges a map
     * @param dependsOn flags of the bindings that must run first (0 = none)
     * @param handler   handler
     * @return the registered binding
     * @throws ConfigurationException if flags is empty, lists differ in length, a flag is not a single bit or repeats,
     *                                or a flag is already bound and duplicates are rejected
     */
    public synchronized MultiOutputBinding registerMulti(List<Long> flags, List<String> keys, long dependsOn,
                                                         MultiOutputHandler handler) {
        Objects.requireNonNull(handler, "handler");
        if (flags == null || flags.isEmpty()) {
            throw new ConfigurationException("Multi-output binding needs at least one trigger flag");
        }
        if (keys != null && keys.size() != flags.size()) {
            throw new ConfigurationException(String.format(
                    "Flag and key lists differ in length: %d flags, %d keys", flags.size(), keys.size()));
        }
        List<OutputSlot> slots = new ArrayList<>(flags.size());
        long seen = 0L;
        for (int i = 0; i < flags.size(); i++) {
            Long flag = flags.get(i);
            if (flag == null) {
                throw new ConfigurationException("Trigger flag at position " + i + " is null");
            }
            requireSingleBit(flag);
            if ((seen & flag) != 0L) {
                throw new ConfigurationException("Trigger flag listed twice in one binding: " + flagSpace.describe(flag));
            }
            seen |= flag;
            slots.add(new OutputSlot(flag, keys != null ? keys.get(i) : null, i));
        }
        MultiOutputBinding binding = new MultiOutputBinding(slots, dependsOn, handler);
        add(binding);
        return binding;
    }

    private void requireSingleBit(long flag) {
        if (Long.bitCount(flag) != 1) {
            throw new ConfigurationException("Trigger flag must be a single bit: " + flagSpace.describe(flag));
        }
    }

    private void add(HandlerBinding binding) {
        List<HandlerBinding> current = bindings;
        List<Integer> clashing = new ArrayList<>();
        for (int i = 0; i < current.size(); i++) {
            if ((current.get(i).getTriggerFlags() & binding.getTriggerFlags()) != 0L) clashing.add(i);
        }
        List<HandlerBinding> next = new ArrayList<>(current);
        if (clashing.isEmpty()) {
            next.add(binding);
        } else if (config.getDuplicatePolicy() == DuplicatePolicy.REJECT) {
            long overlap = 0L;
            for (int i : clashing) {
                overlap |= current.get(i).getTriggerFlags() & binding.getTriggerFlags();
            }
            throw new ConfigurationException("Trigger flag already registered: " + flagSpace.describe(overlap));
        } else {
            for (int k = clashing.size() - 1; k >= 0; k--) {
                HandlerBinding replaced = next.remove((int) clashing.get(k));
                log.warn("Replacing binding | flags={} | replacedFlags={}",
                        flagSpace.describe(binding.getTriggerFlags()), flagSpace.describe(replaced.getTriggerFlags()));
            }
            next.add(clashing.get(0), binding);
        }
        bindings = List.copyOf(next);
    }

    /**
     * Unregisters the binding (same instance).
     *
     * @return true if it was registered
     */
    public synchronized boolean remove(HandlerBinding binding) {
        List<HandlerBinding> next = new ArrayList<>(bindings);
        for (int i = 0; i < next.size(); i++) {
            if (next.get(i) == binding) {
                next.remove(i);
                bindings = List.copyOf(next);
                return true;
            }
        }
        return false;
    }

    /** Clears all registrations. */
    public synchronized void clear() {
        bindings = List.of();
    }

    /** Registered bindings in registration order. */
    public List<HandlerBinding> getBindings() {
        return bindings;
    }

    public int size() {
        return bindings.size();
    }

    /** Bindings with at least one trigger flag in the mask, in registration order. */
    public List<HandlerBinding> findBindings(long flags) {
        List<HandlerBinding> out = new ArrayList<>();
        for (HandlerBinding b : bindings) {
            if (b.isTriggeredBy(flags)) out.add(b);
        }
        return out;
    }

    /**
     * Union of the binding's dependency flags and, transitively, those of the bindings owning them.
     *
     * @throws IllegalArgumentException    if the binding is not registered here
     * @throws CircularDependencyException if the dependency chain loops
     */
    public long dependencyClosure(HandlerBinding binding) {
        List<HandlerBinding> snapshot = bindings;
        for (int i = 0; i < snapshot.size(); i++) {
            if (snapshot.get(i) == binding) {
                return new DependencyResolver(flagSpace, snapshot).dependencyClosure(i);
            }
        }
        throw new IllegalArgumentException("Binding is not registered: " + binding);
    }

    /** Requested flags plus every dependency flag a build of them pulls in. */
    public long resolveFlags(long requestedFlags) {
        return plan(requestedFlags).effectiveFlags();
    }

    /**
     * Selects and orders the bindings a build of the flags would execute, without executing them.
     *
     * @throws CircularDependencyException if the selected bindings' dependencies form a cycle
     * @throws com.flagpole.flags.UnknownFlagException if a selected binding refers to an undeclared or unbound flag
     */
    public BuildPlan plan(long requestedFlags) {
        return new DependencyResolver(flagSpace, bindings).plan(requestedFlags);
    }

    /** Builds into a fresh map with no handler arguments. */
    public Map<String, Object> build(long requestedFlags) {
        return build(requestedFlags, BuildRequest.empty());
    }

    /**
     * Runs the bindings selected by the requested flags, dependencies first, and merges their outputs.
     * <p>
     * The plan is validated before any handler runs, so a cycle or unknown flag leaves the result untouched.
     * A handler exception propagates unchanged; outputs of handlers that already ran stay merged.
     *
     * @param requestedFlags flags to build, combined with {@code |}
     * @param request        start map, structure passing and handler arguments
     * @return the start map (mutated) or a fresh map
     */
    public Map<String, Object> build(long requestedFlags, BuildRequest request) {
        Objects.requireNonNull(request, "request");
        Map<String, Object> result = request.getStartWith() != null ? request.getStartWith() : new LinkedHashMap<>();
        boolean passFullStructure = request.getPassFullStructure() != null
                ? request.getPassFullStructure()
                : config.isPassStructureByDefault();

        BuildPlan plan = plan(requestedFlags);
        long effectiveFlags = plan.effectiveFlags();
        if (log.isDebugEnabled()) {
            List<String> order = new ArrayList<>();
            for (HandlerBinding b : plan.executionOrder()) {
                order.add(flagSpace.describe(b.getTriggerFlags()));
            }
            log.debug("Build plan | requested={} | effective={} | order={}",
                    flagSpace.describe(requestedFlags), flagSpace.describe(effectiveFlags), order);
        }

        for (HandlerBinding binding : plan.executionOrder()) {
            boolean passStructure = passFullStructure || binding.hasDependencies();
            HandlerCall call = new HandlerCall(result, passStructure, request.getArguments(),
                    request.getNamedArguments(), effectiveFlags);
            log.debug("Executing binding | flags={} | kind={} | passStructure={}",
                    flagSpace.describe(binding.getTriggerFlags()), binding.getKind(), passStructure);
            List<Object> values = binding.invoke(call);
            merge(binding, values, effectiveFlags, result);
        }
        return result;
    }

    private void merge(HandlerBinding binding, List<Object> values, long effectiveFlags, Map<String, Object> result) {
        for (OutputSlot slot : binding.getSlots()) {
            if ((effectiveFlags & slot.flag()) == 0L) continue;
            Object value = values.get(slot.position());
            if (!slot.mergesMap()) {
                result.put(slot.key(), value);
            } else if (value instanceof Map) {
                for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                    if (!(e.getKey() instanceof String)) {
                        throw new IllegalStateException("Handler for " + flagSpace.describe(slot.flag())
                                + " returned a map with non-string key: " + e.getKey());
                    }
                    result.put((String) e.getKey(), e.getValue());
                }
            } else if (value != null) {
                throw new IllegalStateException("Handler for " + flagSpace.describe(slot.flag())
                        + " has no output key and must return a map, got " + value.getClass().getName());
            }
        }
    }
}
