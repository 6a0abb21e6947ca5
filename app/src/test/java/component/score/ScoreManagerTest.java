package component.score;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Before;
import org.junit.Test;

import component.config.DifficultyProfile;

import static org.junit.Assert.*;

public class ScoreManagerTest {

    private ScoreManager score;

    @Before
    public void setUp() {
        score = new ScoreManager(new DifficultyProfile.Score());
    }

    @Test
    public void testSingleMatch() {
        assertEquals(45, score.addMatch(Collections.singletonList(3), 1, 0));
        assertEquals(45, score.getScore());
        assertEquals(3, score.getTilesCleared());
    }

    @Test
    public void testCascadeAddsChainAndSizeBonus() {
        // 4 × 10 × (1 + 2 × 0.5) = 80, 체인 2 → 50, 4개 보너스 20
        assertEquals(150, score.addMatch(Collections.singletonList(4), 2, 2));
        assertEquals(2, score.getHighestChain());
    }

    @Test
    public void testMultipleGroupsInOneStep() {
        int points = score.addMatch(Arrays.asList(3, 6), 1, 0);
        assertEquals(Math.round(9 * 10 * 1.5f) + 100, points);
    }

    @Test
    public void testSizeBonusTable() {
        assertEquals(0, ScoreManager.sizeBonus(3));
        assertEquals(20, ScoreManager.sizeBonus(4));
        assertEquals(50, ScoreManager.sizeBonus(5));
        assertEquals(100, ScoreManager.sizeBonus(9));
    }

    @Test
    public void testReset() {
        score.addMatch(Collections.singletonList(5), 3, 3);
        score.reset();
        assertEquals(0, score.getScore());
        assertEquals(0, score.getHighestCombo());
    }
}
