package logic;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import tiles.GarbageBlock;
import tiles.Occupant;
import tiles.Tile;

/**
 * AnimationManager
 * -----------------
 * - 진행 중인 애니메이션 기록 테이블 (점유자 ID → 기록)
 * - ID 마다 단조 증가하는 버전. 취소/교체 시 버전이 올라가서 이전 기록의 완료 콜백은 무시된다
 * - tick(dt) 한 번에 모든 기록을 진행시키고, 끝난 기록을 정리한다
 * - 타일별 "재조준 소유자" 잠금: 한 프레임 안에서는 먼저 잡은 쪽만 목표를 바꿀 수 있다
 */
public class AnimationManager {

    public enum AnimationType {
        SWAP,
        FALL,
        NUDGE,
        GARBAGE_FALL
    }

    /** 경로 장애물 검사 (낙하 기록 한 건에 대해 매 스텝 호출) */
    public interface ObstructionCheck {
        void onStep(Record record);
    }

    /** 진행 중인 애니메이션 한 건 */
    public static final class Record {
        private final int id;
        private final AnimationType type;
        private final Occupant occupant;
        private final int version;
        private final boolean obstructionCheck;
        private final Runnable onFinish;

        private float fromX, fromY, toX, toY;
        private float duration;
        private float elapsed;
        private boolean retargeted;

        private Record(int id, AnimationType type, Occupant occupant, int version,
                float fromX, float fromY, float toX, float toY,
                float duration, boolean obstructionCheck, Runnable onFinish) {
            this.id = id;
            this.type = type;
            this.occupant = occupant;
            this.version = version;
            this.fromX = fromX;
            this.fromY = fromY;
            this.toX = toX;
            this.toY = toY;
            this.duration = duration;
            this.obstructionCheck = obstructionCheck;
            this.onFinish = onFinish;
        }

        public int getId() { return id; }
        public AnimationType getType() { return type; }
        public Occupant getOccupant() { return occupant; }
        public int getVersion() { return version; }
        public boolean isObstructionCheck() { return obstructionCheck; }
        public boolean isRetargeted() { return retargeted; }
        public float getToY() { return toY; }
        public float getDuration() { return duration; }
        public float getElapsed() { return elapsed; }

        public float progress() {
            return duration > 0f ? Math.min(1f, elapsed / duration) : 1f;
        }

        public float currentX() { return fromX + (toX - fromX) * progress(); }
        public float currentY() { return fromY + (toY - fromY) * progress(); }

        /** 남은 세로 거리 (칸) */
        public float remainingDistance() {
            return Math.abs(currentY() - toY);
        }
    }

    private final Map<Integer, Record> records = new LinkedHashMap<>();
    private final Map<Integer, Integer> versions = new HashMap<>();

    // 재조준 잠금: frame 이 바뀌면 초기화
    private final Map<Integer, String> retargetOwners = new HashMap<>();
    private long frame = 0;
    private long lockFrame = -1;

    private final boolean verbose;

    public AnimationManager() {
        this(false);
    }

    public AnimationManager(boolean verbose) {
        this.verbose = verbose;
    }

    /**
     * 애니메이션 시작. 같은 ID의 기존 기록은 취소된다 (버전 증가)
     */
    public Record start(int id, AnimationType type, Occupant occupant,
            float fromX, float fromY, float toX, float toY,
            float duration, boolean obstructionCheck, Runnable onFinish) {
        int version = bumpVersion(id);
        Record r = new Record(id, type, occupant, version, fromX, fromY, toX, toY,
                Math.max(0f, duration), obstructionCheck, onFinish);
        records.remove(id);
        records.put(id, r);
        applyVisual(r);
        if (verbose) {
            System.out.println("[AnimMgr] " + type + " started id=" + id + " v=" + version
                    + " (" + fromX + "," + fromY + ")->(" + toX + "," + toY + ") d=" + duration);
        }
        return r;
    }

    /**
     * 애니메이션 취소. 기록을 지우고 버전을 올린다
     */
    public boolean cancel(int id) {
        Record removed = records.remove(id);
        bumpVersion(id);
        if (removed != null && verbose) {
            System.out.println("[AnimMgr] " + removed.type + " cancelled id=" + id);
        }
        return removed != null;
    }

    /**
     * 진행 중인 낙하의 목표를 바꾼다. 현재 시각 위치에서 다시 출발, 경과 시간 0.
     * 버전은 그대로 (같은 낙하의 연장)
     */
    public void retarget(int id, float newToY, float duration) {
        Record r = records.get(id);
        if (r == null) return;
        float cx = r.currentX();
        float cy = r.currentY();
        r.fromX = cx;
        r.fromY = cy;
        r.toY = newToY;
        r.duration = Math.max(0f, duration);
        r.elapsed = 0f;
        r.retargeted = true;
    }

    public void markRetargeted(int id) {
        Record r = records.get(id);
        if (r != null) r.retargeted = true;
    }

    /**
     * 모든 기록을 dt 만큼 진행
     */
    public void tick(float dt, ObstructionCheck check) {
        List<Record> snapshot = new ArrayList<>(records.values());
        for (Record r : snapshot) {
            if (records.get(r.id) != r) continue;   // 이번 tick 중에 취소/교체됨
            if (r.obstructionCheck && check != null && r.remainingDistance() > 0.5f) {
                check.onStep(r);
                if (records.get(r.id) != r) continue;
            }
            r.elapsed += dt;
            applyVisual(r);
            if (r.elapsed >= r.duration) {
                records.remove(r.id);
                if (getVersion(r.id) == r.version && r.onFinish != null) {
                    r.onFinish.run();
                }
            }
        }
        frame++;
    }

    private void applyVisual(Record r) {
        if (r.occupant instanceof Tile) {
            ((Tile) r.occupant).setVisual(r.currentX(), r.currentY());
        } else if (r.occupant instanceof GarbageBlock) {
            ((GarbageBlock) r.occupant).setVisualY(r.currentY());
        }
    }

    /**
     * 그리드가 한 줄 올라갈 때 모든 기록 좌표도 같이 이동
     */
    public void shiftAll(int dy) {
        for (Record r : records.values()) {
            r.fromY += dy;
            r.toY += dy;
            applyVisual(r);
        }
    }

    // ============================================
    // 재조준 잠금
    // ============================================

    /**
     * 이번 프레임에 이 타일의 목표를 바꿀 권한을 요청. 이미 다른 소유자가 잡았으면 false
     */
    public boolean tryClaimRetarget(int id, String owner) {
        if (lockFrame != frame) {
            retargetOwners.clear();
            lockFrame = frame;
        }
        String current = retargetOwners.get(id);
        if (current == null) {
            retargetOwners.put(id, owner);
            return true;
        }
        return current.equals(owner);
    }

    public String getRetargetOwner(int id) {
        return (lockFrame == frame) ? retargetOwners.get(id) : null;
    }

    // ============================================
    // 조회
    // ============================================

    public int getVersion(int id) {
        return versions.getOrDefault(id, 0);
    }

    private int bumpVersion(int id) {
        int v = getVersion(id) + 1;
        versions.put(id, v);
        return v;
    }

    public Record get(int id) {
        return records.get(id);
    }

    public boolean isAnimating(int id) {
        return records.containsKey(id);
    }

    public boolean isAnimating(AnimationType type) {
        for (Record r : records.values()) {
            if (r.type == type) return true;
        }
        return false;
    }

    public boolean isAnimating() {
        return !records.isEmpty();
    }

    public int count(AnimationType type) {
        int n = 0;
        for (Record r : records.values()) {
            if (r.type == type) n++;
        }
        return n;
    }

    /** 완료된 기록의 버전 정보 정리 (점유자가 사라질 때) */
    public void forget(int id) {
        records.remove(id);
        bumpVersion(id);
    }

    /**
     * 강제 종료
     */
    public void forceStop() {
        for (Integer id : new ArrayList<>(records.keySet())) {
            bumpVersion(id);
        }
        records.clear();
        retargetOwners.clear();
        System.out.println("[AnimMgr] Force stopped all animations");
    }
}
