package com.quick.codebattles.codebattles;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Canonical signature a submission has to define: the function name and its ordered parameters.
 */
public record FunctionSignature(String name, List<Parameter> parameters, String returnType) {

    public FunctionSignature {
        Objects.requireNonNull(name, "name");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public List<String> parameterNames() {
        return parameters.stream().map(Parameter::name).toList();
    }

    /**
     * Declaration line shown to players, e.g. {@code def twoSum(nums: list, target: int) -> list:}.
     */
    public String declaration() {
        String params = parameters.stream()
                .map(p -> p.type() == null ? p.name() : p.name() + ": " + p.type())
                .collect(Collectors.joining(", "));
        String returns = returnType == null ? "" : " -> " + returnType;
        return "def " + name + "(" + params + ")" + returns + ":";
    }

    public record Parameter(String name, String type) {
        public Parameter {
            Objects.requireNonNull(name, "name");
        }
    }
}
