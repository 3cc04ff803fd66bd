package com.quick.codebattles.codebattles;

import lombok.Data;

@Data
public class DebugRewardMessage {
    private Reward reward;
}
