package com.quick.codebattles.codebattles;

import lombok.Data;

@Data
public class SubmitSolutionMessage {
    private String cardId;
    private String code;
}
