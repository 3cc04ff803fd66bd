package com.quick.codebattles.codebattles;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TestCaseResult(boolean passed,
                             Object input,
                             Object expected,
                             Object actual,
                             @JsonInclude(JsonInclude.Include.NON_NULL) String error) {
}
