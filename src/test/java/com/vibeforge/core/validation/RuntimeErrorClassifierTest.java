package com.vibeforge.core.validation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RuntimeErrorClassifierTest {

    @Test
    void testEngineMessages() {
        assertEquals(RuntimeErrorType.TYPE_ERROR,
                RuntimeErrorClassifier.classify("TypeError: Cannot read properties of undefined (reading 'map')"));
        assertEquals(RuntimeErrorType.REFERENCE_ERROR,
                RuntimeErrorClassifier.classify("Uncaught ReferenceError: d3 is not defined"));
        assertEquals(RuntimeErrorType.SYNTAX_ERROR,
                RuntimeErrorClassifier.classify("SyntaxError: Unexpected token '}' (line 12)"));
        assertEquals(RuntimeErrorType.RANGE_ERROR,
                RuntimeErrorClassifier.classify("RangeError: Maximum call stack size exceeded"));
        assertEquals(RuntimeErrorType.MODULE_ERROR,
                RuntimeErrorClassifier.classify("Failed to fetch dynamically imported module: https://esm.sh/d3"));
    }

    @Test
    void testGenericErrorShape() {
        assertEquals(RuntimeErrorType.GENERIC_ERROR, RuntimeErrorClassifier.classify("Error: boom"));
    }

    @Test
    void testValidatorFindingsAreNotRuntimeShaped() {
        assertFalse(RuntimeErrorClassifier.isRuntimeShaped("Export 'selection' never set with model.set()"));
        assertFalse(RuntimeErrorClassifier.isRuntimeShaped("Missing 'export default function' declaration"));
        assertFalse(RuntimeErrorClassifier.isRuntimeShaped(null));
    }

    @Test
    void testEveryRuntimeTypeHasHint() {
        for (RuntimeErrorType type : RuntimeErrorType.values()) {
            if (type != RuntimeErrorType.NONE) assertFalse(type.getRepairHint().isBlank(), type.name());
        }
    }
}
