package component;

import component.config.DifficultyProfile;

/**
 * 상승 속도 레벨 관리
 * - speed(level) = base * 80^((level-1)/(max-1))
 * - speedLevelInterval 초마다 레벨 +1 (최대 maxSpeedLevel)
 */
public class SpeedManager {
    private final DifficultyProfile.Rise rise;
    private int level;
    private float levelTimer;

    public SpeedManager(DifficultyProfile.Rise rise) {
        this.rise = rise;
        resetLevel();
    }

    public int getLevel() {
        return level;
    }

    public void setLevel(int level) {
        this.level = Math.max(1, Math.min(level, rise.maxSpeedLevel));
    }

    public int getMaxLevel() {
        return rise.maxSpeedLevel;
    }

    /** 기본 속도 (행/초), 난이도 배율 포함 */
    public float getBaseSpeed() {
        return rise.baseRiseSpeed * rise.riseSpeedMultiplier;
    }

    /**
     * 현재 레벨의 상승 속도 (행/초)
     */
    public float getRiseSpeed() {
        return speedForLevel(level);
    }

    public float speedForLevel(int lvl) {
        int max = Math.max(2, rise.maxSpeedLevel);
        int clamped = Math.max(1, Math.min(lvl, max));
        double exponent = (clamped - 1) / (double) (max - 1);
        return (float) (getBaseSpeed() * Math.pow(rise.maxSpeedFactor, exponent));
    }

    /**
     * 시간 경과 → 일정 간격마다 레벨업. 레벨이 올랐으면 true
     */
    public boolean advance(float dt) {
        if (level >= rise.maxSpeedLevel || rise.speedLevelInterval <= 0f) return false;
        levelTimer += dt;
        boolean leveled = false;
        while (levelTimer >= rise.speedLevelInterval && level < rise.maxSpeedLevel) {
            levelTimer -= rise.speedLevelInterval;
            increaseLevel();
            leveled = true;
        }
        return leveled;
    }

    /**
     * 레벨업 (최대치에서는 변화 없음)
     */
    public void increaseLevel() {
        if (level < rise.maxSpeedLevel) {
            level++;
            System.out.println("[Speed] Level=" + level + " → " + getRiseSpeed() + " rows/s");
        }
    }

    /**
     * 레벨/속도 리셋
     */
    public void resetLevel() {
        this.level = 1;
        this.levelTimer = 0f;
    }

    @Override
    public String toString() {
        return "SpeedManager{level=" + level + ", speed=" + getRiseSpeed() + "}";
    }
}
