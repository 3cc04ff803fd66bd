package com.quick.codebattles.codebattles;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Component
public class CardFactory {

    private final ProblemCatalog catalog;
    private final RandomSource random;

    public CardFactory(ProblemCatalog catalog, RandomSource random) {
        this.catalog = catalog;
        this.random = random;
    }

    /**
     * Draws a random template and wraps it in a card with a fresh id.
     */
    public Card draw() {
        ProblemTemplate template = random.pick(catalog.templates());
        return new Card(UUID.randomUUID().toString(), template.problem(), template.reward(), template.challenge());
    }

    public List<Card> deal(int count) {
        List<Card> cards = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            cards.add(draw());
        }
        return cards;
    }
}
