package versus;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import component.config.BlockCost;
import component.config.DifficultyProfile;

/**
 * 공격 점수 계산과 점수 → 가비지 블록 변환
 * - 점수 = Σ matchSizeScores[size] + comboBonusScores[combo] + chainBonusScores[maxChain]
 *   (범위를 넘으면 마지막 값, 음수면 0)
 * - 변환은 비싼 블록부터 탐욕적으로, 남는 점수는 버린다
 */
public class GarbageEconomy {
    private final DifficultyProfile.Economy tables;
    private final List<BlockCost> sortedCosts;

    public GarbageEconomy(DifficultyProfile.Economy tables) {
        this.tables = tables;
        this.sortedCosts = new ArrayList<>();
        for (BlockCost c : tables.blockCosts) {
            if (c != null && c.isEnabled()) sortedCosts.add(c);
        }
        // 비용 내림차순, 같으면 넓은 블록 먼저
        sortedCosts.sort(Comparator.comparingInt((BlockCost c) -> c.cost).reversed()
                .thenComparing(Comparator.comparingInt((BlockCost c) -> c.width * c.height).reversed()));
    }

    public int calculateAttackScore(List<Integer> matchSizes, int combo, int maxChain) {
        int score = 0;
        for (int size : matchSizes) score += lookup(tables.matchSizeScores, size);
        score += lookup(tables.comboBonusScores, combo);
        score += lookup(tables.chainBonusScores, maxChain);
        return score;
    }

    static int lookup(int[] table, int index) {
        if (table == null || table.length == 0 || index < 0) return 0;
        return table[Math.min(index, table.length - 1)];
    }

    /**
     * 점수를 블록 목록으로. 총 비용은 점수를 넘지 않는다
     */
    public List<BlockCost> convertScoreToBlocks(int score) {
        List<BlockCost> blocks = new ArrayList<>();
        int remaining = score;
        for (BlockCost c : sortedCosts) {
            while (remaining >= c.cost) {
                blocks.add(c);
                remaining -= c.cost;
            }
        }
        if (remaining > 0 && score > 0) {
            System.out.println("[Economy] " + score + " → " + blocks.size() + " blocks, wasted " + remaining);
        }
        return blocks;
    }

    public static int totalCost(List<BlockCost> blocks) {
        int sum = 0;
        for (BlockCost c : blocks) sum += c.cost;
        return sum;
    }

    public List<BlockCost> getCosts() {
        return new ArrayList<>(sortedCosts);
    }
}
