package com.quick.codebattles.codebattles;

import java.util.List;

/**
 * Runs untrusted code against test cases. Implementations never throw for bad submissions;
 * every failure comes back as a failed {@link GradingReport}.
 */
public interface GradingSandbox {

    GradingReport execute(String code, FunctionSignature signature, List<TestCase> testCases);
}
