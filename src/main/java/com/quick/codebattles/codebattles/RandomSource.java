package com.quick.codebattles.codebattles;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

public interface RandomSource {
    int nextIntInclusive(int minInclusive, int maxInclusive);

    default <T> T pick(List<T> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("cannot pick from an empty list");
        }
        return items.get(nextIntInclusive(0, items.size() - 1));
    }

    static RandomSource threadLocal() {
        return (minInclusive, maxInclusive) -> {
            if (maxInclusive < minInclusive) {
                throw new IllegalArgumentException("maxInclusive must be >= minInclusive");
            }
            return ThreadLocalRandom.current().nextInt(minInclusive, maxInclusive + 1);
        };
    }
}
