package com.vibeforge.core.generation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RepairStrategyTest {

    @Test
    void testSingleRuntimeErrorGetsTargetedFix() {
        assertEquals(RepairStrategy.TARGETED_FIX,
                RepairStrategy.choose(List.of("TypeError: data.map is not a function")));
    }

    @Test
    void testSingleStructuralIssueGetsBroadRepair() {
        assertEquals(RepairStrategy.BROAD_REPAIR,
                RepairStrategy.choose(List.of("Export 'selection' never set with model.set()")));
    }

    @Test
    void testSeveralRuntimeErrorsGetBroadRepair() {
        assertEquals(RepairStrategy.BROAD_REPAIR, RepairStrategy.choose(List.of(
                "TypeError: data.map is not a function",
                "ReferenceError: d3 is not defined")));
    }
}
