package org.dxworks.pageframe.converter;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdGeneratorTest {

    private static List<String> take(IdGenerator generator, int count) {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            ids.add(generator.next());
        }
        return ids;
    }

    private static void assertFormat(Supplier<IdGenerator> factory, String regex) {
        List<String> ids = take(factory.get(), 500);
        Set<String> unique = new HashSet<>(ids);

        assertEquals(ids.size(), unique.size());
        assertTrue(ids.stream().allMatch(id -> id.matches(regex)), () -> "unexpected id in " + ids);
        assertEquals(ids, take(factory.get(), 500));
    }

    @Test
    void elementorIds_areEightHexCharacters() {
        assertFormat(IdGenerator::hex8, "[0-9a-f]{8}");
    }

    @Test
    void beaverIds_areThirteenHexCharacters() {
        assertFormat(IdGenerator::hex13, "[0-9a-f]{13}");
    }

    @Test
    void bricksIds_areSixAlphanumerics() {
        assertFormat(IdGenerator::base36, "[0-9a-z]{6}");
    }

    @Test
    void oxygenIds_countFromOne() {
        assertEquals(List.of("1", "2", "3"), take(IdGenerator.sequential(), 3));
    }

    @Test
    void prefixedIds_carryThePrefix() {
        assertEquals(List.of("block-1", "block-2"), take(IdGenerator.prefixed("block"), 2));
    }
}
