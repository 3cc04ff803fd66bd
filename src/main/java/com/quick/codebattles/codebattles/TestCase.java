package com.quick.codebattles.codebattles;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One hidden test: named arguments for the call and the expected return value.
 * Expected values are compared structurally.
 */
public record TestCase(Map<String, Object> input, Object expectedOutput) {

    public TestCase {
        input = input == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(input));
    }
}
