package logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

import component.config.DifficultyProfile;
import tiles.Occupant;
import tiles.Tile;

/**
 * 중력 처리
 * - 열마다 아래→위로 빈 칸을 찾고, 그 위 첫 점유자가 떨어질 수 있으면 즉시 배열에서 옮긴다
 * - 낙하 중 / 매치 처리 중 / 교환 중 타일, 가비지 칸에서는 그 열 탐색을 멈춘다
 * - 한 패스의 목적지는 모두 달라야 한다 (위반 시 롤백 후 중단)
 * - 기록이 0개가 될 때까지 패스 반복 (MAX_ITERATIONS 상한)
 */
public class DropResolver {
    static final int MAX_ITERATIONS = 100;

    /** resolve() 결과 */
    public static class DropResult {
        public final List<DropRecord> records;
        public final int maxDistance;
        public final float settleTime;
        public final int passes;

        DropResult(List<DropRecord> records, int maxDistance, float settleTime, int passes) {
            this.records = Collections.unmodifiableList(records);
            this.maxDistance = maxDistance;
            this.settleTime = settleTime;
            this.passes = passes;
        }

        public boolean isEmpty() {
            return records.isEmpty();
        }
    }

    private final GridState grid;
    private final AnimationManager anim;
    private final DifficultyProfile.Timing timing;
    private final Consumer<Tile> onLanded;
    private final boolean verbose;

    private int lastPassCount = 0;

    public DropResolver(GridState grid, AnimationManager anim, DifficultyProfile.Timing timing,
            Consumer<Tile> onLanded, boolean verbose) {
        this.grid = grid;
        this.anim = anim;
        this.timing = timing;
        this.onLanded = onLanded;
        this.verbose = verbose;
    }

    /**
     * 떨어질 수 있는 타일이 없어질 때까지 패스를 반복하고 낙하 애니메이션을 시작한다
     */
    public DropResult resolve() {
        List<DropRecord> all = new ArrayList<>();
        int maxDistance = 0;
        int passes = 0;

        for (int iter = 0; iter < MAX_ITERATIONS; iter++) {
            List<DropRecord> pass = computePass();
            if (pass.isEmpty()) break;
            passes++;

            if (!hasDistinctDestinations(pass)) {
                System.err.println("[ERROR][Drop] duplicate drop destinations, rolling back pass: " + pass);
                rollback(pass);
                break;
            }

            for (DropRecord r : pass) {
                beginFall(r.tile, r.tile.getVisualY(), r.toY, false);
                maxDistance = Math.max(maxDistance, r.distance());
            }
            all.addAll(pass);

            if (iter == MAX_ITERATIONS - 1) {
                System.out.println("[Drop] MAX_ITERATIONS reached, stopping gravity");
            }
        }
        lastPassCount = passes;

        float settle = (maxDistance > 0) ? timing.dropDurationPerUnit * maxDistance + timing.settlePadding : 0f;
        if (verbose && !all.isEmpty()) {
            System.out.println("[Drop] " + all.size() + " tiles, maxDist=" + maxDistance + ", passes=" + passes);
        }
        return new DropResult(all, maxDistance, settle, passes);
    }

    /**
     * 한 패스: 배열을 바로 갱신하며 기록을 만든다
     */
    List<DropRecord> computePass() {
        List<DropRecord> records = new ArrayList<>();
        int w = grid.getWidth();
        int h = grid.getHeight();

        for (int x = 0; x < w; x++) {
            column:
            for (int y = 0; y < h; y++) {
                if (grid.get(x, y) != null) continue;

                for (int above = y + 1; above < h; above++) {
                    Occupant o = grid.get(x, above);
                    if (o == null) continue;
                    if (!canFall(o)) {
                        // 막힌 칸 위쪽은 다음 빈 칸에서 다시 탐색
                        y = above;
                        continue column;
                    }
                    Tile t = (Tile) o;
                    grid.clear(x, above);
                    grid.place(t, x, y);
                    records.add(new DropRecord(t, x, above, x, y));
                    break;
                }
            }
        }
        return records;
    }

    private boolean canFall(Occupant o) {
        if (o.isGarbage()) return false;
        Tile t = (Tile) o;
        return t.isIdle() && !t.isProcessing();
    }

    static boolean hasDistinctDestinations(List<DropRecord> records) {
        Set<Long> seen = new HashSet<>();
        for (DropRecord r : records) {
            long key = ((long) r.toX << 32) | (r.toY & 0xffffffffL);
            if (!seen.add(key)) return false;
        }
        return true;
    }

    private void rollback(List<DropRecord> pass) {
        for (int i = pass.size() - 1; i >= 0; i--) {
            DropRecord r = pass.get(i);
            grid.removeIfSame(r.tile, r.toX, r.toY);
            grid.place(r.tile, r.fromX, r.fromY);
        }
    }

    /**
     * 낙하 시작. 배열은 이미 목표 칸으로 커밋되어 있어야 한다.
     * 시작 높이는 현재 시각 위치 (재조준 시 끊김 없이 이어지도록)
     */
    public void beginFall(Tile tile, float fromVisualY, int toY, boolean obstructionCheck) {
        tile.startFalling(tile.getX(), toY);
        float distance = Math.abs(fromVisualY - toY);
        float duration = timing.dropDurationPerUnit * distance;
        anim.start(tile.getId(), AnimationManager.AnimationType.FALL, tile,
                tile.getX(), fromVisualY, tile.getX(), toY, duration, obstructionCheck,
                () -> land(tile));
    }

    /** 낙하 완료 처리 (버전이 맞을 때만 호출됨) */
    void land(Tile tile) {
        tile.finishMovement();
        tile.snapVisual();
        if (onLanded != null) onLanded.accept(tile);
    }

    public float fallDuration(float distance) {
        return timing.dropDurationPerUnit * Math.abs(distance);
    }

    int getLastPassCount() {
        return lastPassCount;
    }
}
