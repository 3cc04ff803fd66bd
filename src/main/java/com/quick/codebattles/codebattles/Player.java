package com.quick.codebattles.codebattles;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Player {
    @ToString.Include
    private final String id;
    @ToString.Include
    private final String username;
    private String connectionId;
    private Long timerEndTime;        // epoch ms, null until the game starts
    private boolean eliminated;
    private Long eliminatedAt;
    private String selectedCardId;
    private List<Card> cards = new ArrayList<>();
    private PendingReward pendingReward;
    private boolean grading;          // a submission is in flight

    public Player(String id, String username, String connectionId) {
        this.id = id;
        this.username = username;
        this.connectionId = connectionId;
    }

    public Optional<Card> findCard(String cardId) {
        if (cardId == null) {
            return Optional.empty();
        }
        return cards.stream().filter(c -> cardId.equals(c.id())).findFirst();
    }

    public Optional<Card> removeCard(String cardId) {
        Optional<Card> card = findCard(cardId);
        card.ifPresent(cards::remove);
        return card;
    }

    public void addCard(Card card) {
        cards.add(card);
    }

    public boolean hasPendingReward() {
        return pendingReward != null;
    }

    public void extendDeadline(long millis) {
        if (timerEndTime != null) {
            timerEndTime += millis;
        }
    }

    /**
     * Pulls the deadline closer by {@code millis} but never before {@code nowMs}.
     */
    public void reduceDeadline(long millis, long nowMs) {
        if (timerEndTime != null) {
            timerEndTime = Math.max(nowMs, timerEndTime - millis);
        }
    }

    public long remainingSeconds(long nowMs) {
        if (timerEndTime == null) {
            return 0;
        }
        return Math.max(0, (timerEndTime - nowMs) / 1000);
    }
}
