package com.quick.codebattles.codebattles;

import lombok.Data;

@Data
public class SelectCardMessage {
    private String cardId;
}
