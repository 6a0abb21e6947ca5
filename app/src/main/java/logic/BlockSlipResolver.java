package logic;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import component.config.DifficultyProfile;
import tiles.Occupant;
import tiles.Tile;

/**
 * Block Slip
 * -----------------------
 * - 낙하 중인 타일 아래/옆으로 정지 타일을 밀어 넣는 기술
 * - 계획(분류/목표 계산)을 먼저 끝내고, 문제가 없을 때만 배열에 커밋한다
 * - 커밋은 2단계: 옛 칸을 모두 비운 다음 새 칸을 쓴다
 * - 교환 직후 공중 가로채기, 낙하 경로 장애물 재조준도 여기서 처리
 */
public class BlockSlipResolver implements AnimationManager.ObstructionCheck {
    static final String OWNER_SLIP = "slip";
    static final String OWNER_OBSTRUCTION = "obstruction";
    static final String OWNER_INTERCEPT = "intercept";

    /** 목표 칸 깊이의 절반 */
    static final float LATE_THRESHOLD = 0.5f;
    static final float NUDGE_SPEED_FACTOR = 0.5f;

    private final GridState grid;
    private final AnimationManager anim;
    private final DropResolver drops;
    private final DifficultyProfile.Timing timing;
    private final Consumer<Tile> onMotionFinished;
    private final boolean verbose;

    public BlockSlipResolver(GridState grid, AnimationManager anim, DropResolver drops,
            DifficultyProfile.Timing timing, Consumer<Tile> onMotionFinished, boolean verbose) {
        this.grid = grid;
        this.anim = anim;
        this.drops = drops;
        this.timing = timing;
        this.onMotionFinished = onMotionFinished;
        this.verbose = verbose;
    }

    // ============================================
    // 판정
    // ============================================

    /** 낙하 타일이 목표 칸 깊이의 50% 이상 들어갔는지 */
    public boolean isLate(Tile t) {
        return t != null && t.isFalling() && (t.getVisualY() - t.getY()) < LATE_THRESHOLD;
    }

    /** 칸 (x, y) 의 타일이 이미 절반 넘게 착지했는지 */
    public boolean isSlipTooLate(int x, int y) {
        return isLate(grid.getTile(x, y));
    }

    /** 교환 후보로 쓸 수 있는 정지 타일 */
    static boolean isKickable(Tile t) {
        return t != null && t.isIdle() && !t.isProcessing() && t.canSwap();
    }

    /**
     * 열 col 에서 row 를 지나갈 낙하 타일 (현재 row 보다 위, 목표는 row 이하). 가장 가까운 것
     */
    public Tile findFallingPassingRow(int col, int row) {
        Tile best = null;
        float bestDistance = Float.MAX_VALUE;
        for (Tile t : fallingInColumn(col)) {
            int currentRow = Math.round(t.getVisualY());
            if (currentRow <= row) continue;
            if (t.getY() > row) continue;
            float distance = currentRow - row;
            if (distance < bestDistance) {
                bestDistance = distance;
                best = t;
            }
        }
        return best;
    }

    private List<Tile> fallingInColumn(int col) {
        List<Tile> list = new ArrayList<>();
        for (int y = 0; y < grid.getHeight(); y++) {
            Tile t = grid.getTile(col, y);
            if (t != null && t.isFalling()) list.add(t);
        }
        return list;
    }

    // ============================================
    // 커서 진입점
    // ============================================

    /**
     * 커서 한쪽만 낙하 중, 다른 쪽은 정지 → 정지 타일을 낙하 열로 차 넣는다.
     * 처리했으면 대기 시간(>=0), 해당 없음/거부면 -1
     */
    public float tryKickUnder(int cx, int cy) {
        Tile left = grid.getTile(cx, cy);
        Tile right = grid.getTile(cx + 1, cy);
        boolean leftFalling = left != null && left.isFalling();
        boolean rightFalling = right != null && right.isFalling();

        if (leftFalling && isKickable(right)) {
            return handleBlockSlip(right, cx, cy);
        }
        if (rightFalling && isKickable(left)) {
            return handleBlockSlip(left, cx + 1, cy);
        }
        return -1f;
    }

    /**
     * 커서 두 칸 모두 정지/빈칸이고, 한 열 위에서 커서 줄을 지나갈 낙하 타일이 있을 때
     */
    public float trySlip(int cx, int cy) {
        Occupant lo = grid.get(cx, cy);
        Occupant ro = grid.get(cx + 1, cy);
        if ((lo != null && lo.isGarbage()) || (ro != null && ro.isGarbage())) return -1f;
        Tile left = (Tile) lo;
        Tile right = (Tile) ro;
        boolean leftIdle = left == null || left.isIdle();
        boolean rightIdle = right == null || right.isIdle();
        if (!leftIdle || !rightIdle) return -1f;

        if (isKickable(right) && findFallingPassingRow(cx, cy) != null) {
            return handleBlockSlip(right, cx, cy);
        }
        if (isKickable(left) && findFallingPassingRow(cx + 1, cy) != null) {
            return handleBlockSlip(left, cx + 1, cy);
        }
        return -1f;
    }

    // ============================================
    // Block Slip 본체
    // ============================================

    /**
     * kicked 를 (col, row) 로 밀어 넣는다.
     * - 정지 타일(row 이상): 한 칸 위로 넛지
     * - 낙하 타일: row 아래면 무시, row 칸 안에서 절반 미만 진행이면 row+1 로 넛지,
     *   절반 이상이거나 row 칸보다 위면 재조준 (낮은 것부터 row+1 위로 쌓임)
     * 성공 시 가장 느린 애니메이션 시간, 실패 시 -1 (배열 변경 없음)
     */
    public float handleBlockSlip(Tile kicked, int col, int row) {
        int h = grid.getHeight();
        int fromX = kicked.getX();
        int fromY = kicked.getY();

        Map<Tile, Integer> nudges = new LinkedHashMap<>();
        List<Tile> retargets = new ArrayList<>();
        Set<Tile> processed = new HashSet<>();

        // 1. 이 열의 낙하 타일 분류
        for (Tile t : fallingInColumn(col)) {
            if (t == kicked) continue;
            float vy = t.getVisualY();
            if (vy < row) continue;                   // 슬립 줄 아래
            if (vy < row + 1) {
                if (vy < row + LATE_THRESHOLD) {
                    retargets.add(t);                 // 절반 이상 지나감
                } else {
                    nudges.put(t, row + 1);
                }
            } else {
                retargets.add(t);                     // 슬립 줄 위
            }
            processed.add(t);
        }

        // 2. 정지 타일 (row 이상) → +1
        for (int y = row; y < h; y++) {
            Occupant o = grid.get(col, y);
            if (o == null || o == kicked) continue;
            if (o.isGarbage()) {
                log("slip blocked by garbage at (" + col + "," + y + ")");
                return -1f;
            }
            Tile t = (Tile) o;
            if (processed.contains(t)) continue;
            if (t.isProcessing() || t.isSwapping()) {
                log("slip blocked by busy tile " + t);
                return -1f;
            }
            if (y + 1 >= h) {
                System.err.println("[WARN][Slip] nudge would overflow the top at column " + col + ", aborting");
                return -1f;
            }
            nudges.put(t, y + 1);
        }

        // 3. 목표 칸 계획
        Set<Integer> taken = new HashSet<>();
        taken.add(row);
        for (Map.Entry<Tile, Integer> e : nudges.entrySet()) {
            if (!taken.add(e.getValue())) {
                System.err.println("[ERROR][Slip] two nudges target row " + e.getValue() + " in column " + col);
                return -1f;
            }
        }
        retargets.sort(Comparator.comparingDouble(Tile::getVisualY));
        Map<Tile, Integer> retargetRows = new LinkedHashMap<>();
        int next = row + 1;
        for (Tile t : retargets) {
            while (taken.contains(next)) next++;
            if (next >= h) {
                System.err.println("[WARN][Slip] retarget would overflow the top at column " + col + ", aborting");
                return -1f;
            }
            retargetRows.put(t, next);
            taken.add(next);
            next++;
        }

        // 4. 재조준 소유권 (같은 프레임에 장애물 검사가 먼저 잡았으면 포기)
        for (Tile t : processed) {
            if (!anim.tryClaimRetarget(t.getId(), OWNER_SLIP)) {
                log("retarget lock held by " + anim.getRetargetOwner(t.getId()) + " for " + t);
                return -1f;
            }
        }

        // 5. 커밋: 옛 칸 전부 비우기 → 새 칸 쓰기
        grid.removeIfSame(kicked, fromX, fromY);
        for (Tile t : nudges.keySet()) grid.removeIfSame(t, t.getX(), t.getY());
        for (Tile t : retargetRows.keySet()) grid.removeIfSame(t, t.getX(), t.getY());

        grid.set(col, row, kicked);
        kicked.startSwapping(col, row);
        for (Map.Entry<Tile, Integer> e : nudges.entrySet()) {
            Tile t = e.getKey();
            anim.cancel(t.getId());
            grid.set(col, e.getValue(), t);
            t.startSwapping(col, e.getValue());
        }
        for (Map.Entry<Tile, Integer> e : retargetRows.entrySet()) {
            Tile t = e.getKey();
            grid.set(col, e.getValue(), t);
            t.setPosition(col, e.getValue());
        }

        // 6. 애니메이션
        float wait = timing.swapDuration;
        beginSwap(kicked, fromX, fromY, col, row, timing.swapDuration);
        for (Map.Entry<Tile, Integer> e : nudges.entrySet()) {
            wait = Math.max(wait, beginNudge(e.getKey(), e.getValue()));
        }
        for (Map.Entry<Tile, Integer> e : retargetRows.entrySet()) {
            Tile t = e.getKey();
            float from = t.getVisualY();
            drops.beginFall(t, from, e.getValue(), true);
            anim.markRetargeted(t.getId());
            wait = Math.max(wait, drops.fallDuration(from - e.getValue()));
        }

        System.out.println("[Slip] kicked " + kicked + " into (" + col + "," + row + ") nudged="
                + nudges.size() + " retargeted=" + retargetRows.size() + " wait=" + wait);
        return wait;
    }

    // ============================================
    // 공중 가로채기 (일반 교환 직후)
    // ============================================

    /**
     * 교환된 타일 위(시각적으로 같은 칸 이상)에 있는 낙하 타일을 멈추고 한 줄씩 위로 올린다.
     * 가장 긴 밀어올림 시간을 돌려준다. 아무것도 안 했으면 -1
     */
    public float handleMidAirInterception(Tile a, Tile b) {
        return Math.max(interceptColumn(a), interceptColumn(b));
    }

    private float interceptColumn(Tile swapped) {
        if (swapped == null) return -1f;
        int x = swapped.getX();
        int y = swapped.getY();
        int h = grid.getHeight();

        List<Tile> above = new ArrayList<>();
        for (Tile t : fallingInColumn(x)) {
            if (t != swapped && t.getVisualY() >= y) above.add(t);
        }
        if (above.isEmpty()) return -1f;
        above.sort(Comparator.comparingDouble(Tile::getVisualY));

        // 계획: 아래부터 한 줄 위, 교환 칸 위로 쌓이게
        Map<Tile, Integer> plan = new LinkedHashMap<>();
        int last = y;
        for (Tile t : above) {
            int ny = Math.max(Math.max(t.getY() + 1, last + 1), y + 1);
            if (ny >= h) {
                System.err.println("[WARN][Slip] interception cascade overflows column " + x + ", skipped");
                return -1f;
            }
            Occupant there = grid.get(x, ny);
            if (there != null && !above.contains(there)) {
                System.err.println("[ERROR][Slip] interception target (" + x + "," + ny + ") occupied by " + there);
                return -1f;
            }
            plan.put(t, ny);
            last = ny;
        }
        for (Tile t : above) {
            if (!anim.tryClaimRetarget(t.getId(), OWNER_INTERCEPT)) {
                log("interception lock held by " + anim.getRetargetOwner(t.getId()) + " for " + t);
                return -1f;
            }
        }

        // 위에서부터 커밋 (옛 칸 모두 비운 뒤 새 칸)
        for (Tile t : above) {
            anim.cancel(t.getId());
            grid.removeIfSame(t, t.getX(), t.getY());
        }
        for (Map.Entry<Tile, Integer> e : plan.entrySet()) {
            Tile t = e.getKey();
            grid.set(x, e.getValue(), t);
            t.startSwapping(x, e.getValue());
        }
        float wait = 0f;
        for (Map.Entry<Tile, Integer> e : plan.entrySet()) {
            wait = Math.max(wait, beginNudge(e.getKey(), e.getValue()));
        }
        System.out.println("[Slip] mid-air interception in column " + x + ": " + plan.size() + " tiles, wait=" + wait);
        return wait;
    }

    // ============================================
    // 이동 애니메이션
    // ============================================

    /** 가로 교환 이동. 배열은 이미 커밋되어 있어야 함 */
    public void beginSwap(Tile tile, float fromX, float fromY, int toX, int toY, float duration) {
        tile.startSwapping(toX, toY);
        anim.start(tile.getId(), AnimationManager.AnimationType.SWAP, tile,
                fromX, fromY, toX, toY, duration, false, () -> finishMotion(tile));
    }

    /** 빠른 넛지 (중력 속도의 두 배). 걸리는 시간 반환 */
    public float beginNudge(Tile tile, int toY) {
        float from = tile.getVisualY();
        float duration = Math.max(timing.swapDuration * NUDGE_SPEED_FACTOR,
                timing.dropDurationPerUnit * Math.abs(toY - from) * NUDGE_SPEED_FACTOR);
        anim.start(tile.getId(), AnimationManager.AnimationType.NUDGE, tile,
                tile.getVisualX(), from, tile.getX(), toY, duration, false, () -> finishMotion(tile));
        return duration;
    }

    private void finishMotion(Tile tile) {
        tile.finishMovement();
        tile.snapVisual();
        if (onMotionFinished != null) onMotionFinished.accept(tile);
    }

    // ============================================
    // 낙하 경로 장애물 (슬립 재조준 낙하만)
    // ============================================

    @Override
    public void onStep(AnimationManager.Record record) {
        if (record.getType() != AnimationManager.AnimationType.FALL) return;
        if (!(record.getOccupant() instanceof Tile)) return;
        Tile t = (Tile) record.getOccupant();
        String owner = anim.getRetargetOwner(t.getId());
        if (owner != null && !owner.equals(OWNER_OBSTRUCTION)) return;

        int x = t.getX();
        int target = t.getY();
        int h = grid.getHeight();
        int current = Math.max(0, Math.min(h - 1, Math.round(record.currentY())));

        for (int y = current - 1; y >= target; y--) {
            Occupant o = grid.get(x, y);
            if (o == null || o == t) continue;
            if (!isSolid(o, y)) continue;

            int ny = y + 1;
            if (ny >= h || ny == target) return;
            Occupant landing = grid.get(x, ny);
            if (landing != null && landing != t) return;
            if (!anim.tryClaimRetarget(t.getId(), OWNER_OBSTRUCTION)) return;

            float from = record.currentY();
            grid.removeIfSame(t, x, target);
            grid.set(x, ny, t);
            t.startFalling(x, ny);
            anim.retarget(t.getId(), ny, drops.fallDuration(from - ny));
            log("obstruction at (" + x + "," + y + "), " + t + " retargeted " + target + " -> " + ny);
            return;
        }
    }

    /** 대기/가비지는 항상 막힘. 낙하 타일은 자기 목표(=저장 칸)가 검사 줄 이상이면 막힘 */
    private boolean isSolid(Occupant o, int y) {
        if (o.isGarbage()) return true;
        Tile other = (Tile) o;
        return !other.isFalling() || other.getY() >= y;
    }

    private void log(String msg) {
        if (verbose) System.out.println("[Slip] " + msg);
    }
}
