package org.dxworks.surveyreports.analyzer;

import org.dxworks.surveyreports.model.Block;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.surveyreports.TestUtils.block;
import static org.junit.jupiter.api.Assertions.*;

public class BlockOrderResolverTest {

    private final List<Block> blocks = List.of(block("b1", "First"), block("b2", "Second"), block("b3", "Third"));

    @Test
    void withoutFlow_usesDeclarationOrder() {
        assertEquals(List.of(0, 1, 2), BlockOrderResolver.resolve(blocks, null));
    }

    @Test
    void withFlow_followsFlowOrder() {
        assertEquals(List.of(1, 0), BlockOrderResolver.resolve(blocks.subList(0, 2), List.of("b2", "b1")));
        assertEquals(List.of(2, 0, 1), BlockOrderResolver.resolve(blocks, List.of("b3", "b1", "b2")));
    }

    @Test
    void withFlow_unknownIdentifierIsDropped() {
        assertEquals(List.of(1), BlockOrderResolver.resolve(blocks, List.of("missing", "b2")));
    }

    @Test
    void withFlow_ambiguousIdentifierIsDropped() {
        List<Block> duplicated = List.of(block("b1", "One"), block("b1", "Also one"), block("b2", "Two"));

        assertEquals(List.of(2), BlockOrderResolver.resolve(duplicated, List.of("b1", "b2")));
    }

    @Test
    void withFlow_blocksWithoutIdNeverMatch() {
        List<Block> anonymous = List.of(block(null, "No id"), block("b1", "One"));

        assertEquals(List.of(1), BlockOrderResolver.resolve(anonymous, List.of("b1")));
    }

    @Test
    void withEmptyFlow_nothingIsWalked() {
        assertTrue(BlockOrderResolver.resolve(blocks, List.of()).isEmpty());
    }
}
