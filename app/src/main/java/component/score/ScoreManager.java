package component.score;

import java.util.List;

import component.config.DifficultyProfile;

/**
 * 점수 계산
 * - 타일 수 × pointsPerTile × (1 + combo × comboMultiplier)
 * - 체인 보너스 (chain-1) × chainBonusPerLevel
 * - 그룹 크기 보너스 4:20, 5:50, 6+:100
 */
public class ScoreManager {
    private final DifficultyProfile.Score settings;

    private int score = 0;
    private int highestCombo = 0;
    private int highestChain = 0;
    private int tilesCleared = 0;

    public ScoreManager(DifficultyProfile.Score settings) {
        this.settings = settings;
    }

    /**
     * 한 매치 단계의 점수를 더하고 이번에 더한 점수를 돌려준다
     */
    public int addMatch(List<Integer> groupSizes, int combo, int chain) {
        int tiles = 0;
        int sizeBonus = 0;
        for (int size : groupSizes) {
            tiles += size;
            sizeBonus += sizeBonus(size);
        }
        int base = Math.round(tiles * settings.pointsPerTile * (1f + combo * settings.comboMultiplier));
        int chainBonus = (chain > 1) ? (chain - 1) * settings.chainBonusPerLevel : 0;
        int points = base + chainBonus + sizeBonus;

        score += points;
        tilesCleared += tiles;
        highestCombo = Math.max(highestCombo, combo);
        highestChain = Math.max(highestChain, chain);
        return points;
    }

    static int sizeBonus(int size) {
        if (size >= 6) return 100;
        if (size == 5) return 50;
        if (size == 4) return 20;
        return 0;
    }

    public int getScore() { return score; }
    public int getHighestCombo() { return highestCombo; }
    public int getHighestChain() { return highestChain; }
    public int getTilesCleared() { return tilesCleared; }

    public void reset() {
        score = 0;
        highestCombo = 0;
        highestChain = 0;
        tilesCleared = 0;
    }

    @Override
    public String toString() {
        return "Score{" + score + ", combo=" + highestCombo + ", chain=" + highestChain + "}";
    }
}
