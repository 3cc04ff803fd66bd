package com.quick.codebattles.codebattles;

import java.util.List;
import java.util.Objects;

public record Problem(String title,
                      String description,
                      Difficulty difficulty,
                      FunctionSignature signature,
                      List<TestCase> testCases) {

    public Problem {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(signature, "signature");
        testCases = testCases == null ? List.of() : List.copyOf(testCases);
    }
}
