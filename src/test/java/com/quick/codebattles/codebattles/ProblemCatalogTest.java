package com.quick.codebattles.codebattles;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProblemCatalogTest {

    private final ProblemCatalog catalog =
            new ProblemCatalog(new ObjectMapper(), new ClassPathResource("catalog/problems.json"));

    @Test
    void bundledCatalogLoads() {
        assertEquals(9, catalog.size());
        for (ProblemTemplate template : catalog.templates()) {
            Problem problem = template.problem();
            assertNotNull(problem.signature());
            assertFalse(problem.signature().name().isBlank());
            assertFalse(problem.testCases().isEmpty(), problem.title());
            assertNotNull(template.reward(), problem.title());
            for (TestCase testCase : problem.testCases()) {
                assertEquals(Set.copyOf(problem.signature().parameterNames()), testCase.input().keySet(), problem.title());
            }
        }
    }

    @Test
    void catalogCoversEveryRewardKind() {
        Set<RewardKind> kinds = catalog.templates().stream()
                .map(t -> t.reward().kind())
                .collect(Collectors.toSet());

        assertEquals(Set.of(RewardKind.values()), kinds);
    }

    @Test
    void twoSumTemplateMatchesWireFormat() {
        ProblemTemplate twoSum = catalog.templates().get(0);

        assertEquals("Two Sum", twoSum.problem().title());
        assertEquals(Difficulty.EASY, twoSum.problem().difficulty());
        assertEquals("def twoSum(nums: list, target: int) -> list:", twoSum.problem().signature().declaration());
        assertEquals(List.of(0, 1), twoSum.problem().testCases().get(0).expectedOutput());
        assertEquals(new Reward(RewardKind.ADD_TIME, 30), twoSum.reward());
    }

    @Test
    void challengesAreOptional() {
        long withChallenge = catalog.templates().stream().filter(t -> t.challenge() != null).count();

        assertTrue(withChallenge > 0);
        assertTrue(withChallenge < catalog.size());
    }

    @Test
    void emptyCatalogIsRejected() {
        assertThrows(IllegalStateException.class, () -> new ProblemCatalog(List.of()));
    }

    @Test
    void cardFactoryDealsDistinctCards() {
        CardFactory factory = new CardFactory(catalog, new SeededRandomSource(4L));

        List<Card> hand = factory.deal(5);

        assertEquals(5, hand.size());
        assertEquals(5, hand.stream().map(Card::id).distinct().count());
    }
}
