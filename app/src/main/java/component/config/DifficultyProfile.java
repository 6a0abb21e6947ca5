package component.config;

import java.util.ArrayList;
import java.util.List;

/**
 * DifficultyProfile
 * -----------------------
 * - 한 세션에서 사용하는 모든 수치(그리드 크기, 타이밍, 상승 속도, 가비지, 점수표)
 * - ConfigLoader가 /difficulty/*.json 에서 Gson으로 읽어온다
 * - JSON에 없는 키는 아래 필드 초기값이 그대로 유지됨
 */
public class DifficultyProfile {

    public String displayName = "Normal";

    public Grid grid = new Grid();
    public Timing timing = new Timing();
    public Rise rise = new Rise();
    public Garbage garbage = new Garbage();
    public Economy economy = new Economy();
    public Score score = new Score();
    public Status status = new Status();

    /** 그리드 크기 / 타일 종류 */
    public static class Grid {
        public int width = 6;
        public int height = 14;
        public int preloadRows = 2;
        public int initialFillRows = 4;
        public int tileTypeCount = 6;
    }

    /** 애니메이션/연출 시간 (초) */
    public static class Timing {
        public float swapDuration = 0.15f;
        public float dropDurationPerUnit = 0.15f;
        public float matchHighlightDuration = 1.5f;
        public float popStagger = 0.25f;
        public float popSettleDelay = 0.1f;
        public float settlePadding = 0.05f;
    }

    /** 그리드 상승 */
    public static class Rise {
        public float baseRiseSpeed = 0.1f;          // 행/초 (레벨 1)
        public float riseSpeedMultiplier = 1.0f;    // 난이도 배율
        public float fastRiseMultiplier = 4f;
        public float speedLevelInterval = 60f;
        public int maxSpeedLevel = 99;
        public float maxSpeedFactor = 80f;
        public float gracePeriod = 1.5f;
        public float breathingRoomPerTile = 0.2f;
        public float maxBreathingRoom = 5f;
        public float catchUpMultiplier = 1.5f;
    }

    /** 가비지 큐 / 변환 / 라우팅 */
    public static class Garbage {
        public int maxPendingGarbage = 10;
        public int maxGarbageWidth = 6;
        public float garbageDropDelay = 1f;
        public float conversionDelay = 0.4f;
        public boolean propagateToCluster = true;
        public float sendDelay = 0.5f;
        public boolean allowCountering = true;
        public String targetingMode = "SEQUENTIAL";
    }

    /** 공격 점수표 + 블록 비용표 */
    public static class Economy {
        public int[] matchSizeScores = { 0, 0, 0, 50, 100, 175, 300, 400, 500, 550, 600 };
        public int[] comboBonusScores = { 0, 0, 100, 150, 200, 250, 300, 350, 400, 450, 500 };
        public int[] chainBonusScores = { 0, 0, 100, 200, 300, 400, 500, 600, 700, 800, 900 };
        public List<BlockCost> blockCosts = defaultBlockCosts();
    }

    /** 화면 표시용 점수 */
    public static class Score {
        public int pointsPerTile = 10;
        public float comboMultiplier = 0.5f;
        public int chainBonusPerLevel = 50;
    }

    /** 상태 이상 지속시간 / 독 전염 */
    public static class Status {
        public float frozenDuration = 5f;
        public float burningDuration = 10f;
        public float poisonedDuration = 8f;
        public float lockedDuration = 3f;
        public float chargedDuration = 5f;
        public float poisonSpreadInterval = 2f;
        public float poisonSpreadChance = 0.3f;
    }

    public static List<BlockCost> defaultBlockCosts() {
        List<BlockCost> list = new ArrayList<>();
        list.add(new BlockCost(6, 6, 10000));
        list.add(new BlockCost(6, 5, 8000));
        list.add(new BlockCost(6, 4, 7000));
        list.add(new BlockCost(6, 3, 6000));
        list.add(new BlockCost(6, 2, 4000));
        list.add(new BlockCost(6, 1, 1500));
        list.add(new BlockCost(5, 2, 1000));
        list.add(new BlockCost(4, 2, 800));
        list.add(new BlockCost(3, 2, 700));
        list.add(new BlockCost(5, 1, 600));
        list.add(new BlockCost(2, 2, 500));
        list.add(new BlockCost(1, 2, 400));
        list.add(new BlockCost(1, 1, 250));
        return list;
    }

    @Override
    public String toString() {
        return "DifficultyProfile{" + displayName + ", " + grid.width + "x" + grid.height
                + ", types=" + grid.tileTypeCount + ", rise=" + rise.riseSpeedMultiplier + "}";
    }
}
