package component;

import component.config.ConfigLoader;
import component.config.DifficultyProfile;

/**
 * 세션 설정 (그리드 생성 시점에 명시적으로 전달, 전역 싱글톤 없음)
 */
public final class GameConfig {
    public enum Mode { ENDLESS, VERSUS }

    public enum Difficulty { EASY, NORMAL, HARD }

    private final Mode mode;
    private final Difficulty difficulty;
    private final long seed;
    private final boolean verbose;
    private final DifficultyProfile profile;

    public GameConfig(Mode mode, Difficulty difficulty, long seed) {
        this(mode, difficulty, seed, false, ConfigLoader.load(difficulty));
    }

    public GameConfig(Mode mode, Difficulty difficulty, long seed, boolean verbose, DifficultyProfile profile) {
        if (profile == null) {
            throw new IllegalArgumentException("profile must not be null");
        }
        if (profile.grid.width < 2 || profile.grid.height < 2) {
            throw new IllegalArgumentException("grid must be at least 2x2: "
                    + profile.grid.width + "x" + profile.grid.height);
        }
        if (profile.grid.tileTypeCount < 2) {
            throw new IllegalArgumentException("tileTypeCount must be >= 2");
        }
        this.mode = mode;
        this.difficulty = difficulty;
        this.seed = seed;
        this.verbose = verbose;
        this.profile = profile;
    }

    /** 테스트용: 기본값 프로필 */
    public static GameConfig defaults(long seed) {
        return new GameConfig(Mode.ENDLESS, Difficulty.NORMAL, seed, false, new DifficultyProfile());
    }

    public Mode mode() { return mode; }
    public Difficulty difficulty() { return difficulty; }
    public long seed() { return seed; }
    public boolean verbose() { return verbose; }
    public DifficultyProfile profile() { return profile; }

    /** 같은 설정에 시드만 바꾼 사본 (대전에서 플레이어별) */
    public GameConfig withSeed(long newSeed) {
        return new GameConfig(mode, difficulty, newSeed, verbose, profile);
    }

    @Override public String toString() {
        return "GameConfig{mode=" + mode + ", diff=" + difficulty + ", seed=" + seed + ", " + profile + "}";
    }
}
