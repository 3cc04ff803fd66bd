package com.quick.codebattles.codebattles;

import lombok.Data;

@Data
public class TargetedDebuffMessage {
    private String targetPlayerId;
}
