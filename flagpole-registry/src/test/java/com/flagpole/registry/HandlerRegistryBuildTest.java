package com.flagpole.registry;

import com.flagpole.config.FlagpoleConfig;
import com.flagpole.flags.FlagSpace;
import com.flagpole.flags.UnknownFlagException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HandlerRegistryBuildTest {

    private static final Map<String, String> HOBBIES = Map.of(
            "123", "mountain biking",
            "234", "snail collecting");

    private static HandlerRegistry albRegistry(FlagSpace flags) {
        HandlerRegistry registry = new HandlerRegistry(flags);
        registry.register(flags.valueOf("BASE"), call -> {
            Map<String, Object> base = new LinkedHashMap<>();
            base.put("region", "us-east-1");
            base.put("_version", 1);
            return base;
        });
        registry.register(flags.valueOf("LISTENERS"), "listeners",
                call -> List.of(Map.of("ListenerArn", "x")));
        registry.register(flags.valueOf("RULES"), "rules", flags.valueOf("LISTENERS"), call -> {
            List<?> listeners = (List<?>) call.getStructure().get("listeners");
            assertEquals(1, listeners.size());
            return List.of(Map.of("rule", "y"));
        });
        return registry;
    }

    @Test
    void build_loadBalancerExample() {
        FlagSpace flags = FlagSpace.define("BASE", "LISTENERS", "RULES");
        assertEquals(1L, flags.valueOf("BASE"));
        assertEquals(2L, flags.valueOf("LISTENERS"));
        assertEquals(4L, flags.valueOf("RULES"));
        assertEquals(7L, flags.all());
        assertEquals(0L, flags.valueOf("NONE"));
        HandlerRegistry registry = albRegistry(flags);
        Map<String, Object> start = new HashMap<>();
        start.put("Arn", "abc");

        Map<String, Object> result = registry.build(flags.all(), BuildRequest.builder().startWith(start).build());

        assertSame(start, result);
        assertEquals(Map.of(
                "Arn", "abc",
                "region", "us-east-1",
                "_version", 1,
                "listeners", List.of(Map.of("ListenerArn", "x")),
                "rules", List.of(Map.of("rule", "y"))), result);
    }

    @Test
    void build_pullsInUnrequestedDependency() {
        FlagSpace flags = FlagSpace.define("BASE", "LISTENERS", "RULES");
        HandlerRegistry registry = albRegistry(flags);

        Map<String, Object> result = registry.build(flags.valueOf("RULES"));

        assertEquals(List.of("listeners", "rules"), new ArrayList<>(result.keySet()));
    }

    @Test
    void build_dependentReceivesDependencyOutputs() {
        FlagSpace flags = FlagSpace.define("PEOPLE", "HOBBIES");
        HandlerRegistry registry = new HandlerRegistry(flags);
        registry.register(flags.valueOf("PEOPLE"), "people", call -> {
            assertFalse(call.hasStructure());
            return Map.of("simon", "123", "george", "234");
        });
        registry.register(flags.valueOf("HOBBIES"), "hobbies", flags.valueOf("PEOPLE"), call -> {
            Map<String, Object> hobbies = new LinkedHashMap<>();
            Map<?, ?> people = (Map<?, ?>) call.getStructure().get("people");
            people.forEach((person, uid) -> hobbies.put((String) person, HOBBIES.get(uid)));
            return hobbies;
        });

        assertEquals(Map.of("people", Map.of("simon", "123", "george", "234")), registry.build(flags.valueOf("PEOPLE")));

        Map<String, Object> expected = Map.of(
                "people", Map.of("simon", "123", "george", "234"),
                "hobbies", Map.of("simon", "mountain biking", "george", "snail collecting"));
        assertEquals(expected, registry.build(flags.valueOf("HOBBIES")));
        assertEquals(expected, registry.build(flags.valueOf("PEOPLE") | flags.valueOf("HOBBIES")));
    }

    @Test
    void build_dependencyRegisteredAfterDependentStillRunsFirst() {
        FlagSpace flags = FlagSpace.define("ONE", "TWO");
        HandlerRegistry registry = new HandlerRegistry(flags);
        List<String> calls = new ArrayList<>();
        registry.register(flags.valueOf("TWO"), "two", flags.valueOf("ONE"), call -> {
            calls.add("two");
            return call.getStructure().get("one");
        });
        registry.register(flags.valueOf("ONE"), "one", call -> {
            calls.add("one");
            return 1;
        });

        Map<String, Object> result = registry.build(flags.all());

        assertEquals(List.of("one", "two"), calls);
        assertEquals(Map.of("one", 1, "two", 1), result);
    }

    @Test
    void build_independentBindingsRunInRegistrationOrderAndLastWriteWins() {
        FlagSpace flags = FlagSpace.define("FIRST", "SECOND", "THIRD");
        HandlerRegistry registry = new HandlerRegistry(flags);
        registry.register(flags.valueOf("THIRD"), call -> Map.of("owner", "third", "third", 3));
        registry.register(flags.valueOf("FIRST"), call -> Map.of("owner", "first"));
        registry.register(flags.valueOf("SECOND"), "owner", call -> "second");

        Map<String, Object> result = registry.build(flags.all());

        assertEquals(Map.of("owner", "second", "third", 3), result);
    }

    @Test
    void build_multiOutputMergesOnlyRequestedSlots() {
        FlagSpace flags = FlagSpace.define("PETS", "FARM_ANIMALS", "WILD_ANIMALS");
        HandlerRegistry registry = new HandlerRegistry(flags);
        registry.registerMulti(
                List.of(flags.valueOf("PETS"), flags.valueOf("FARM_ANIMALS"), flags.valueOf("WILD_ANIMALS")),
                List.of("pets", "farm", "wild"),
                call -> List.of("cat", "pig", "rhino"));

        Map<String, Object> result = registry.build(flags.valueOf("PETS") | flags.valueOf("FARM_ANIMALS"));

        assertEquals(Map.of("pets", "cat", "farm", "pig"), result);
    }

    @Test
    void build_multiOutputSlotPulledInByDependency() {
        FlagSpace flags = FlagSpace.define("PETS", "FARM_ANIMALS", "OTHER");
        HandlerRegistry registry = new HandlerRegistry(flags);
        registry.registerMulti(
                List.of(flags.valueOf("PETS"), flags.valueOf("FARM_ANIMALS")),
                List.of("pets", "farm"),
                call -> List.of("cat", "pig"));
        registry.register(flags.valueOf("OTHER"), "other", flags.valueOf("PETS"),
                call -> "likes " + call.getStructure().get("pets"));

        Map<String, Object> result = registry.build(flags.valueOf("OTHER"));

        assertEquals(Map.of("pets", "cat", "other", "likes cat"), result);
    }

    @Test
    void build_multiOutputWithWrongValueCountFails() {
        FlagSpace flags = FlagSpace.define("A", "B");
        HandlerRegistry registry = new HandlerRegistry(flags);
        registry.registerMulti(List.of(flags.valueOf("A"), flags.valueOf("B")), List.of("a", "b"), call -> List.of(1));

        assertThrows(IllegalStateException.class, () -> registry.build(flags.all()));
    }

    @Test
    void build_mergesReturnedMapIntoFreshOrGivenMap() {
        FlagSpace flags = FlagSpace.define("ONE");
        HandlerRegistry registry = new HandlerRegistry(flags);
        registry.register(flags.valueOf("ONE"), call -> Map.of("tanya", "redAlert"));

        assertEquals(Map.of("tanya", "redAlert"), registry.build(flags.valueOf("ONE")));

        Map<String, Object> somedict = new HashMap<>(Map.of("somekey", "asdf", "anotherkey", "defg"));
        Map<String, Object> result = registry.build(flags.valueOf("ONE"), BuildRequest.builder().startWith(somedict).build());
        assertEquals(Map.of("tanya", "redAlert", "somekey", "asdf", "anotherkey", "defg"), result);
    }

    @Test
    void build_unkeyedHandlerMustReturnMap() {
        FlagSpace flags = FlagSpace.define("ONE", "TWO");
        HandlerRegistry registry = new HandlerRegistry(flags);
        registry.register(flags.valueOf("ONE"), call -> null);
        registry.register(flags.valueOf("TWO"), call -> "not a map");

        assertTrue(registry.build(flags.valueOf("ONE")).isEmpty());
        assertThrows(IllegalStateException.class, () -> registry.build(flags.valueOf("TWO")));
    }

    @Test
    void build_passFullStructureGivesEveryHandlerTheResult() {
        FlagSpace flags = FlagSpace.define("WINNER");
        HandlerRegistry registry = new HandlerRegistry(flags);
        registry.register(flags.valueOf("WINNER"), call -> Map.of("winner", call.getStructure().get("name")));
        Map<String, Object> somedict = new HashMap<>(Map.of("name", "george"));

        Map<String, Object> result = registry.build(flags.valueOf("WINNER"),
                BuildRequest.builder().startWith(somedict).passFullStructure(true).build());

        assertEquals(Map.of("winner", "george", "name", "george"), result);
    }

    @Test
    void build_passFullStructureWithFreshMap() {
        FlagSpace flags = FlagSpace.define("Cookies");
        HandlerRegistry registry = new HandlerRegistry(flags);
        registry.register(flags.valueOf("Cookies"),
                call -> Map.of("cookies_remaining", call.getStructure().size()));

        Map<String, Object> result = registry.build(flags.all(), BuildRequest.builder().passFullStructure(true).build());

        assertEquals(Map.of("cookies_remaining", 0), result);
    }

    @Test
    void build_passStructureDefaultComesFromConfig() {
        FlagSpace flags = FlagSpace.define("ONE");
        HandlerRegistry registry = new HandlerRegistry(flags,
                FlagpoleConfig.builder().passStructureByDefault(true).build());
        registry.register(flags.valueOf("ONE"), "passed", call -> call.hasStructure());

        assertEquals(true, registry.build(flags.all()).get("passed"));
        assertEquals(false, registry.build(flags.all(),
                BuildRequest.builder().passFullStructure(false).build()).get("passed"));
    }

    @Test
    void build_structureAlreadyInArgumentsIsNotPassedTwice() {
        FlagSpace flags = FlagSpace.define("PEOPLE", "HOBBIES");
        HandlerRegistry registry = new HandlerRegistry(flags);
        registry.register(flags.valueOf("PEOPLE"), "people", call -> {
            assertEquals(1, call.getArguments().size());
            return Map.of("simon", "123");
        });
        registry.register(flags.valueOf("HOBBIES"), "hobbies", flags.valueOf("PEOPLE"), call -> {
            assertEquals(1, call.getArguments().size());
            Map<?, ?> data = (Map<?, ?>) call.getArgument(0);
            return HOBBIES.get(((Map<?, ?>) data.get("people")).get("simon"));
        });
        Map<String, Object> startingDict = new HashMap<>(Map.of("hello", "goodbye"));

        Map<String, Object> result = registry.build(flags.all(), BuildRequest.builder()
                .argument(startingDict)
                .passFullStructure(true)
                .startWith(startingDict)
                .build());

        assertEquals(Map.of(
                "hello", "goodbye",
                "people", Map.of("simon", "123"),
                "hobbies", "mountain biking"), result);
    }

    @Test
    void build_structureLeadsPassedArguments() {
        FlagSpace flags = FlagSpace.define("ONE", "TWO");
        HandlerRegistry registry = new HandlerRegistry(flags);
        registry.register(flags.valueOf("ONE"), "one", call -> call.getArguments());
        registry.register(flags.valueOf("TWO"), "two", flags.valueOf("ONE"), call -> {
            assertTrue(call.getArgument(0) instanceof Map);
            return call.getArguments().subList(1, call.getArguments().size());
        });

        Map<String, Object> result = registry.build(flags.all(), BuildRequest.builder()
                .arguments("lb-name", null)
                .namedArgument("region", "us-west-2")
                .build());

        List<Object> expected = new ArrayList<>();
        expected.add("lb-name");
        expected.add(null);
        assertEquals(expected, result.get("one"));
        assertEquals(expected, result.get("two"));
    }

    @Test
    void build_namedArgumentsAndEffectiveFlagsReachHandlers() {
        FlagSpace flags = FlagSpace.define("BASE", "TAGS");
        HandlerRegistry registry = new HandlerRegistry(flags);
        registry.register(flags.valueOf("BASE"), "region", call -> call.getNamedArgument("region"));
        registry.register(flags.valueOf("TAGS"), "flags", flags.valueOf("BASE"), call -> call.getRequestedFlags());

        Map<String, Object> result = registry.build(flags.valueOf("TAGS"),
                BuildRequest.builder().namedArguments(Map.of("region", "eu-west-1")).build());

        assertEquals("eu-west-1", result.get("region"));
        assertEquals(flags.all(), result.get("flags"));
    }

    @Test
    void build_handlerCannotWriteThroughStructure() {
        FlagSpace flags = FlagSpace.define("ONE", "TWO");
        HandlerRegistry registry = new HandlerRegistry(flags);
        registry.register(flags.valueOf("ONE"), "one", call -> 1);
        registry.register(flags.valueOf("TWO"), "two", flags.valueOf("ONE"),
                call -> call.getStructure().put("sneaky", true));

        assertThrows(UnsupportedOperationException.class, () -> registry.build(flags.all()));
    }

    @Test
    void build_withoutStructureAccessFails() {
        FlagSpace flags = FlagSpace.define("ONE");
        HandlerRegistry registry = new HandlerRegistry(flags);
        registry.register(flags.valueOf("ONE"), "one", call -> call.getStructure());

        assertThrows(IllegalStateException.class, () -> registry.build(flags.all()));
    }

    @Test
    void build_cycleFailsBeforeAnyHandlerRuns() {
        FlagSpace flags = FlagSpace.define("BASE", "ONE", "TWO");
        HandlerRegistry registry = new HandlerRegistry(flags);
        List<String> calls = new ArrayList<>();
        registry.register(flags.valueOf("BASE"), "base", call -> calls.add("base"));
        registry.register(flags.valueOf("ONE"), "one", flags.valueOf("TWO"), call -> calls.add("one"));
        registry.register(flags.valueOf("TWO"), "two", flags.valueOf("ONE"), call -> calls.add("two"));
        Map<String, Object> start = new HashMap<>(Map.of("Arn", "abc"));

        CircularDependencyException e = assertThrows(CircularDependencyException.class,
                () -> registry.build(flags.all(), BuildRequest.builder().startWith(start).build()));

        assertEquals(flags.valueOf("ONE") | flags.valueOf("TWO"), e.getCycleFlags());
        assertTrue(calls.isEmpty());
        assertEquals(Map.of("Arn", "abc"), start);
        assertEquals(Map.of("base", true), registry.build(flags.valueOf("BASE")));
    }

    @Test
    void build_handlerExceptionPropagatesAfterPartialMerge() {
        FlagSpace flags = FlagSpace.define("ONE", "TWO", "THREE");
        HandlerRegistry registry = new HandlerRegistry(flags);
        IllegalArgumentException failure = new IllegalArgumentException("describe failed");
        List<String> calls = new ArrayList<>();
        registry.register(flags.valueOf("ONE"), "one", call -> 1);
        registry.register(flags.valueOf("TWO"), "two", call -> {
            throw failure;
        });
        registry.register(flags.valueOf("THREE"), "three", call -> calls.add("three"));
        Map<String, Object> start = new HashMap<>();

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
                () -> registry.build(flags.all(), BuildRequest.builder().startWith(start).build()));

        assertSame(failure, thrown);
        assertEquals(Map.of("one", 1), start);
        assertTrue(calls.isEmpty());
    }

    @Test
    void build_unboundDependencyIsUnknownFlag() {
        FlagSpace flags = FlagSpace.define("ONE", "TWO");
        HandlerRegistry registry = new HandlerRegistry(flags);
        registry.register(flags.valueOf("TWO"), "two", flags.valueOf("ONE"), call -> 2);

        UnknownFlagException e = assertThrows(UnknownFlagException.class, () -> registry.build(flags.all()));

        assertEquals(flags.valueOf("ONE"), e.getFlagValue());
    }

    @Test
    void build_undeclaredTriggerIsUnknownFlagWhenSelected() {
        FlagSpace flags = FlagSpace.define("ONE", "TWO");
        HandlerRegistry registry = new HandlerRegistry(flags);
        registry.register(flags.valueOf("ONE"), "one", call -> 1);
        registry.register(8L, "stray", call -> 8);

        assertEquals(Map.of("one", 1), registry.build(flags.all()));
        assertThrows(UnknownFlagException.class, () -> registry.build(flags.all() | 8L));
    }

    @Test
    void build_isRepeatableWithFreshMaps() {
        FlagSpace flags = FlagSpace.define("BASE", "LISTENERS", "RULES");
        HandlerRegistry registry = albRegistry(flags);

        Map<String, Object> first = registry.build(flags.all());
        Map<String, Object> second = registry.build(flags.all());

        assertEquals(first, second);
        assertEquals(List.copyOf(first.keySet()), List.copyOf(second.keySet()));
    }

    @Test
    void build_noneRunsNothing() {
        FlagSpace flags = FlagSpace.define("BASE", "LISTENERS", "RULES");
        HandlerRegistry registry = albRegistry(flags);

        assertTrue(registry.build(flags.valueOf("NONE")).isEmpty());
        assertTrue(registry.plan(flags.none()).isEmpty());
    }
}
