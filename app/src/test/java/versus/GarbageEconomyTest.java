package versus;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import component.config.BlockCost;
import component.config.DifficultyProfile;

import static org.junit.Assert.*;

public class GarbageEconomyTest {

    private DifficultyProfile.Economy tables;
    private GarbageEconomy economy;

    @Before
    public void setUp() {
        tables = new DifficultyProfile.Economy();
        economy = new GarbageEconomy(tables);
    }

    @Test
    public void testAttackScoreFromTables() {
        // 50 + 100 + 콤보 2 → 100 + 체인 2 → 100
        assertEquals(350, economy.calculateAttackScore(Arrays.asList(3, 4), 2, 2));
        assertEquals("단일 매치는 크기 점수만", 50, economy.calculateAttackScore(Arrays.asList(3), 1, 0));
    }

    @Test
    public void testLookupClampsIndex() {
        int[] table = { 0, 10, 20 };
        assertEquals(20, GarbageEconomy.lookup(table, 99));
        assertEquals(0, GarbageEconomy.lookup(table, -1));
        assertEquals(0, GarbageEconomy.lookup(null, 1));
    }

    @Test
    public void testGreedyConversion() {
        List<BlockCost> blocks = economy.convertScoreToBlocks(10250);
        assertEquals(2, blocks.size());
        assertEquals(10000, blocks.get(0).cost);
        assertEquals(250, blocks.get(1).cost);

        assertTrue(economy.convertScoreToBlocks(249).isEmpty());
    }

    @Test
    public void testSingleCostTable() {
        tables.blockCosts = new ArrayList<>(Arrays.asList(new BlockCost(1, 1, 250)));
        economy = new GarbageEconomy(tables);
        assertEquals(41, economy.convertScoreToBlocks(10250).size());
    }

    @Test
    public void testTotalNeverExceedsScore() {
        for (int score = 0; score <= 20000; score += 37) {
            List<BlockCost> blocks = economy.convertScoreToBlocks(score);
            int total = GarbageEconomy.totalCost(blocks);
            assertTrue(total <= score);
            assertTrue("남은 점수는 가장 싼 블록보다 작다", score - total < 250);
        }
    }

    @Test
    public void testCostTieBreaksOnArea() {
        tables.blockCosts = new ArrayList<>(Arrays.asList(
                new BlockCost(1, 2, 500), new BlockCost(2, 2, 500), new BlockCost(3, 3, 0)));
        economy = new GarbageEconomy(tables);
        List<BlockCost> costs = economy.getCosts();
        assertEquals("비용 0 은 비활성", 2, costs.size());
        assertEquals(2, costs.get(0).width);
    }
}
