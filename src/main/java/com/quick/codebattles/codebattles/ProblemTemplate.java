package com.quick.codebattles.codebattles;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProblemTemplate(Problem problem, Reward reward, Challenge challenge) {
}
