package com.flagpole.registry;

import com.flagpole.flags.FlagSpace;
import com.flagpole.flags.UnknownFlagException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.TreeSet;

/**
 * Selects, validates and orders the bindings of one build over a snapshot of the registry.
 * <p>
 * Selection starts from the bindings triggered by the requested flags and follows dependency flags to the
 * bindings owning them, whether or not those were requested. A dependency mask spanning several flags waits
 * for every binding owning one of them. Ordering is a topological sort where, among bindings that are ready,
 * the earliest registered runs first.
 */
final class DependencyResolver {

    private final FlagSpace flagSpace;
    private final List<HandlerBinding> bindings;
    /** single trigger bit → index of the owning binding */
    private final Map<Long, Integer> ownerByFlag = new HashMap<>();

    DependencyResolver(FlagSpace flagSpace, List<HandlerBinding> bindings) {
        this.flagSpace = flagSpace;
        this.bindings = bindings;
        for (int i = 0; i < bindings.size(); i++) {
            for (OutputSlot slot : bindings.get(i).getSlots()) {
                ownerByFlag.put(slot.flag(), i);
            }
        }
    }

    /**
     * Plans a build: selects the bindings for the requested flags and their transitive dependencies,
     * then orders them.
     *
     * @throws UnknownFlagException         if a selected binding's trigger or dependency flag is undeclared,
     *                                      or a dependency flag has no binding
     * @throws CircularDependencyException  if the selected bindings' dependencies form a cycle
     */
    BuildPlan plan(long requestedFlags) {
        int n = bindings.size();
        boolean[] selected = new boolean[n];
        List<TreeSet<Integer>> prerequisites = new ArrayList<>(Collections.nCopies(n, null));
        Deque<Integer> pending = new ArrayDeque<>();
        for (int i = 0; i < n; i++) {
            if (bindings.get(i).isTriggeredBy(requestedFlags)) {
                selected[i] = true;
                pending.add(i);
            }
        }

        long effectiveFlags = requestedFlags;
        int selectedCount = pending.size();
        while (!pending.isEmpty()) {
            int i = pending.poll();
            HandlerBinding binding = bindings.get(i);
            requireDeclaredTriggers(binding);
            TreeSet<Integer> required = new TreeSet<>();
            for (long bit : bits(binding.getDependsOn())) {
                int owner = ownerOf(bit, binding);
                required.add(owner);
                effectiveFlags |= bit;
                if (!selected[owner]) {
                    selected[owner] = true;
                    selectedCount++;
                    pending.add(owner);
                }
            }
            prerequisites.set(i, required);
        }

        List<HandlerBinding> order = order(selected, prerequisites, selectedCount);
        return new BuildPlan(requestedFlags, effectiveFlags, order);
    }

    private List<HandlerBinding> order(boolean[] selected, List<TreeSet<Integer>> prerequisites, int selectedCount) {
        int n = bindings.size();
        int[] waitingOn = new int[n];
        List<List<Integer>> dependents = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            dependents.add(new ArrayList<>());
        }
        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < n; i++) {
            if (!selected[i]) continue;
            waitingOn[i] = prerequisites.get(i).size();
            for (int p : prerequisites.get(i)) {
                dependents.get(p).add(i);
            }
            if (waitingOn[i] == 0) ready.add(i);
        }

        boolean[] done = new boolean[n];
        List<HandlerBinding> order = new ArrayList<>(selectedCount);
        while (!ready.isEmpty()) {
            int i = ready.poll();
            done[i] = true;
            order.add(bindings.get(i));
            for (int d : dependents.get(i)) {
                if (--waitingOn[d] == 0) ready.add(d);
            }
        }
        if (order.size() < selectedCount) {
            throw cycleAmong(selected, done, prerequisites);
        }
        return order;
    }

    /**
     * Every selected binding left unexecuted waits on at least one other unexecuted binding, so following
     * those edges from any of them must revisit a binding.
     */
    private CircularDependencyException cycleAmong(boolean[] selected, boolean[] done, List<TreeSet<Integer>> prerequisites) {
        int current = -1;
        for (int i = 0; i < selected.length; i++) {
            if (selected[i] && !done[i]) {
                current = i;
                break;
            }
        }
        Map<Integer, Integer> positionInPath = new LinkedHashMap<>();
        List<Integer> path = new ArrayList<>();
        while (!positionInPath.containsKey(current)) {
            positionInPath.put(current, path.size());
            path.add(current);
            int next = -1;
            for (int p : prerequisites.get(current)) {
                if (!done[p]) {
                    next = p;
                    break;
                }
            }
            current = next;
        }
        return cycleError(path.subList(positionInPath.get(current), path.size()), current);
    }

    /**
     * Transitive dependency mask of a binding, following dependency flags to their owners.
     *
     * @throws CircularDependencyException if the binding's dependency chain loops
     * @throws UnknownFlagException        if a dependency flag is undeclared or has no binding
     */
    long dependencyClosure(int index) {
        return closure(index, new ArrayList<>(), new HashMap<>());
    }

    private long closure(int index, List<Integer> path, Map<Integer, Long> memo) {
        Long known = memo.get(index);
        if (known != null) return known;
        path.add(index);
        HandlerBinding binding = bindings.get(index);
        long mask = binding.getDependsOn();
        for (long bit : bits(binding.getDependsOn())) {
            int owner = ownerOf(bit, binding);
            int at = path.indexOf(owner);
            if (at >= 0) {
                throw cycleError(path.subList(at, path.size()), owner);
            }
            mask |= closure(owner, path, memo);
        }
        path.remove(path.size() - 1);
        memo.put(index, mask);
        return mask;
    }

    private CircularDependencyException cycleError(List<Integer> cycle, int closingIndex) {
        long flags = 0L;
        List<String> names = new ArrayList<>(cycle.size() + 1);
        for (int i : cycle) {
            long trigger = bindings.get(i).getTriggerFlags();
            flags |= trigger;
            names.add(flagSpace.describe(trigger));
        }
        names.add(flagSpace.describe(bindings.get(closingIndex).getTriggerFlags()));
        return new CircularDependencyException(flags, names);
    }

    private void requireDeclaredTriggers(HandlerBinding binding) {
        long undeclared = binding.getTriggerFlags() & ~flagSpace.all();
        if (undeclared != 0L) {
            throw new UnknownFlagException(undeclared, "Trigger flag " + flagSpace.describe(undeclared)
                    + " of binding " + flagSpace.describe(binding.getTriggerFlags()) + " is not declared in the flag space");
        }
    }

    private int ownerOf(long dependencyBit, HandlerBinding dependent) {
        if (!flagSpace.isDeclared(dependencyBit)) {
            throw new UnknownFlagException(dependencyBit, "Dependency flag " + flagSpace.describe(dependencyBit)
                    + " of binding " + flagSpace.describe(dependent.getTriggerFlags()) + " is not declared in the flag space");
        }
        Integer owner = ownerByFlag.get(dependencyBit);
        if (owner == null) {
            throw new UnknownFlagException(dependencyBit, "No binding registered for dependency flag "
                    + flagSpace.describe(dependencyBit) + " required by " + flagSpace.describe(dependent.getTriggerFlags()));
        }
        return owner;
    }

    private static List<Long> bits(long mask) {
        List<Long> out = new ArrayList<>(Long.bitCount(mask));
        long rest = mask;
        while (rest != 0L) {
            long bit = Long.lowestOneBit(rest);
            out.add(bit);
            rest &= rest - 1;
        }
        return out;
    }
}
