package logic;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

import component.GameConfig;
import component.config.DifficultyProfile;
import component.score.ScoreManager;
import tiles.GarbageBlock;
import tiles.Occupant;
import tiles.Tile;
import tiles.TileStatus;

/**
 * GridCoordinator
 * -----------------------
 * - 그리드 한 개의 소유자. 상태(GridState, 애니메이션, 상승, 콤보)를 갖고
 *   하위 리졸버에는 참조만 넘긴다
 * - tick(dt) 순서: 상태 이상 → 애니메이션(+장애물 검사) → 교환/슬립 연산
 *   → 연쇄 루프 → 가비지 → 밀린 낙하/스캔 → 상승
 * - 입력은 CursorCommands 로만 받는다
 */
public class GridCoordinator implements CursorCommands {

    /** 외부 알림 (필요한 것만 설정) */
    public static class Events {
        public Consumer<Tile> onTilePopped;
        public Consumer<Tile> onTileLanded;
        public Runnable onComboStarted;
        public Consumer<ComboState> onComboEnded;          // 최종 콤보
        public BiConsumer<Integer, ComboState> onMatchScored; // 이번 단계 점수
        public Runnable onRowSpawned;
        public Runnable onGraceStarted;
        public Consumer<Integer> onGameOver;               // 최종 점수
    }

    /** 교환/슬립 잠금 (끝나면 onComplete) */
    private static final class Operation {
        final String name;
        float remaining;
        final Runnable onComplete;

        Operation(String name, float remaining, Runnable onComplete) {
            this.name = name;
            this.remaining = remaining;
            this.onComplete = onComplete;
        }
    }

    private final GameConfig config;
    private final DifficultyProfile profile;
    private final boolean verbose;
    public final Events events;

    private final GridState grid;
    private final AnimationManager anim;
    private final TileSpawner spawner;
    private final MatchDetector detector;
    private final DropResolver drops;
    private final BlockSlipResolver slip;
    private final MatchResolver matches;
    private final GarbageManager garbage;
    private final StatusEffectManager status;
    private final RiseController rise;
    private final ScoreManager score;
    private final Cursor cursor;

    private Operation operation;
    private boolean dropDirty = false;
    private boolean scanDirty = false;
    private boolean gameOver = false;
    private long tickCount = 0;

    public GridCoordinator(GameConfig config) {
        this(config, new Events());
    }

    public GridCoordinator(GameConfig config, Events events) {
        if (config == null) throw new IllegalArgumentException("config must not be null");
        this.config = config;
        this.profile = config.profile();
        this.verbose = config.verbose();
        this.events = (events != null) ? events : new Events();

        DifficultyProfile.Grid g = profile.grid;
        this.grid = new GridState(g.width, g.height, g.preloadRows);
        this.anim = new AnimationManager(verbose);
        this.spawner = new TileSpawner(grid, g.tileTypeCount, config.seed());
        this.detector = new MatchDetector(grid);
        this.drops = new DropResolver(grid, anim, profile.timing, this::handleTileLanded, verbose);
        this.slip = new BlockSlipResolver(grid, anim, drops, profile.timing, this::handleMotionFinished, verbose);
        this.matches = new MatchResolver(grid, detector, anim, profile.timing, new CascadeListener(), verbose);
        this.garbage = new GarbageManager(grid, anim, spawner, profile.garbage, profile.timing,
                new GarbageListener(), verbose);
        this.status = new StatusEffectManager(grid, profile.status, config.seed() * 31 + 7);
        this.rise = new RiseController(profile.rise);
        this.score = new ScoreManager(profile.score);
        this.cursor = new Cursor(g.width, g.height);

        rise.setOnGraceStarted(() -> {
            if (this.events.onGraceStarted != null) this.events.onGraceStarted.run();
        });
        rise.setOnGameOver(this::handleGameOver);
    }

    /** 초기 보드 + 대기줄 생성 */
    public void start() {
        spawner.fillInitial(profile.grid.initialFillRows);
        spawner.fillPreload();
        System.out.println("[Grid] started " + config);
    }

    // ============================================
    // tick
    // ============================================

    public void tick(float dt) {
        if (gameOver) return;
        tickCount++;

        status.tick(dt);
        anim.tick(dt, slip);
        tickOperation(dt);
        matches.tick(dt);
        garbage.tick(dt);

        if (dropDirty) {
            dropDirty = false;
            runGravity();
        }
        if (scanDirty) {
            scanDirty = false;
            matches.requestScan();
        }

        boolean processing = matches.isProcessing() || garbage.isConversionInProgress();
        if (rise.tick(dt, operation != null, processing, isTopRowBlocked())) {
            spawnRow();
        }

        if (verbose) {
            List<String> problems = grid.validate();
            if (!problems.isEmpty()) {
                System.err.println("[ERROR][Grid] invariant violated at tick " + tickCount + ": " + problems);
            }
        }
    }

    private void tickOperation(float dt) {
        if (operation == null) return;
        operation.remaining -= dt;
        if (operation.remaining > 0f) return;
        Operation done = operation;
        operation = null;
        if (verbose) System.out.println("[Grid] operation finished: " + done.name);
        done.onComplete.run();
    }

    private void beginOperation(String name, float duration, Runnable onComplete) {
        operation = new Operation(name, duration, onComplete);
    }

    /** 낙하 + 가비지 블록 낙하. 정착 대기 시간 반환 */
    float runGravity() {
        DropResolver.DropResult result = drops.resolve();
        garbage.dropUnsupported();
        return result.settleTime;
    }

    private boolean isTopRowBlocked() {
        int top = grid.getHeight() - 1;
        for (int x = 0; x < grid.getWidth(); x++) {
            Occupant o = grid.get(x, top);
            if (o == null) continue;
            if (o.isGarbage()) {
                if (((GarbageBlock) o.owner()).isSettled()) return true;
            } else if (((Tile) o).isIdle()) {
                return true;
            }
        }
        return false;
    }

    // ============================================
    // 입력 (CursorCommands)
    // ============================================

    @Override
    public void moveLeft() { cursor.moveBy(-1, 0); }

    @Override
    public void moveRight() { cursor.moveBy(1, 0); }

    @Override
    public void moveUp() { cursor.moveBy(0, 1); }

    @Override
    public void moveDown() { cursor.moveBy(0, -1); }

    @Override
    public void fastRise() { rise.requestFastRise(); }

    /**
     * 커서 위치 교환. 순서: 잠금/게임오버/미노출 줄 → 늦은 슬립 → 킥언더 → 이동 중 거부 → 슬립 → 일반 교환
     */
    @Override
    public boolean swap() {
        if (gameOver || operation != null) return false;
        int cx = cursor.getX();
        int cy = cursor.getY();
        if (!rise.isRowActive(cy)) return false;

        if (slip.isSlipTooLate(cx, cy) || slip.isSlipTooLate(cx + 1, cy)) {
            if (verbose) System.out.println("[Grid] swap rejected: tile already landing at " + cursor);
            return false;
        }

        float wait = slip.tryKickUnder(cx, cy);
        if (wait >= 0f) {
            beginOperation("kick-under", wait, this::afterSlip);
            return true;
        }

        if (isMoving(grid.get(cx, cy)) || isMoving(grid.get(cx + 1, cy))) return false;

        wait = slip.trySlip(cx, cy);
        if (wait >= 0f) {
            beginOperation("slip", wait, this::afterSlip);
            return true;
        }
        return plainSwap(cx, cy);
    }

    private static boolean isMoving(Occupant o) {
        if (!(o instanceof Tile)) return false;
        Tile t = (Tile) o;
        return t.isFalling() || t.isSwapping();
    }

    private boolean plainSwap(int cx, int cy) {
        Occupant lo = grid.get(cx, cy);
        Occupant ro = grid.get(cx + 1, cy);
        if (lo == null && ro == null) return false;
        if ((lo != null && lo.isGarbage()) || (ro != null && ro.isGarbage())) return false;
        Tile left = (Tile) lo;
        Tile right = (Tile) ro;
        if ((left != null && !BlockSlipResolver.isKickable(left))
                || (right != null && !BlockSlipResolver.isKickable(right))) {
            return false;
        }

        float duration = profile.timing.swapDuration;
        grid.set(cx, cy, right);
        grid.set(cx + 1, cy, left);
        if (left != null) {
            left.setMomentumDirection(1);
            slip.beginSwap(left, cx, cy, cx + 1, cy, duration);
        }
        if (right != null) {
            right.setMomentumDirection(-1);
            slip.beginSwap(right, cx + 1, cy, cx, cy, duration);
        }
        beginOperation("swap", duration, () -> afterPlainSwap(left, right));
        return true;
    }

    private void afterPlainSwap(Tile left, Tile right) {
        float nudge = slip.handleMidAirInterception(left, right);
        if (nudge >= 0f) {
            beginOperation("intercept", nudge, this::afterSlip);
            return;
        }
        afterSlip();
    }

    private void afterSlip() {
        runGravity();
        matches.requestScan();
    }

    // ============================================
    // 콜백
    // ============================================

    private void handleTileLanded(Tile tile) {
        dropDirty = true;
        scanDirty = true;
        if (events.onTileLanded != null) events.onTileLanded.accept(tile);
    }

    /** 교환/넛지 종료. 관성(FROZEN)이 있으면 막힐 때까지 계속 미끄러진다 */
    private void handleMotionFinished(Tile tile) {
        int dir = tile.getMomentumDirection();
        if (tile.hasMomentum() && dir != 0 && grid.get(tile.getX(), tile.getY()) == tile) {
            int nx = tile.getX() + dir;
            int y = tile.getY();
            if (grid.isEmpty(nx, y)) {
                int fromX = tile.getX();
                grid.clear(fromX, y);
                grid.set(nx, y, tile);
                slip.beginSwap(tile, fromX, y, nx, y, profile.timing.swapDuration);
                return;
            }
        }
        tile.setMomentumDirection(0);
        dropDirty = true;
        scanDirty = true;
    }

    private void handleGameOver() {
        if (gameOver) return;
        gameOver = true;
        operation = null;
        System.out.println("[Grid] GAME OVER score=" + score.getScore());
        if (events.onGameOver != null) events.onGameOver.accept(score.getScore());
    }

    /** 연쇄 루프 → 코디네이터 */
    private final class CascadeListener implements MatchResolver.Listener {
        @Override
        public void onMatchHighlighted(List<MatchGroup> groups) {
            status.onMatchHighlighted(groups);
            garbage.notifyAdjacentMatch(groups);
        }

        @Override
        public void onComboStarted() {
            if (events.onComboStarted != null) events.onComboStarted.run();
        }

        @Override
        public void onStepScored(List<MatchGroup> groups, ComboState combo, boolean cascade) {
            List<Integer> sizes = new ArrayList<>();
            int tiles = 0;
            for (MatchGroup g : groups) {
                sizes.add(g.size());
                tiles += g.size();
            }
            int points = score.addMatch(sizes, combo.getCombo(), combo.getChain());
            if (cascade) rise.grantBreathingRoom(tiles);
            if (events.onMatchScored != null) events.onMatchScored.accept(points, combo.snapshot());
        }

        @Override
        public void onTilePopped(Tile tile, ComboState combo) {
            if (events.onTilePopped != null) events.onTilePopped.accept(tile);
        }

        @Override
        public void onComboEnded(ComboState finalCombo) {
            if (events.onComboEnded != null) events.onComboEnded.accept(finalCombo);
        }

        @Override
        public boolean isConversionInProgress() {
            return garbage.isConversionInProgress();
        }

        @Override
        public float runGravity() {
            return GridCoordinator.this.runGravity();
        }

        @Override
        public boolean isFalling() {
            return anim.isAnimating(AnimationManager.AnimationType.FALL)
                    || anim.isAnimating(AnimationManager.AnimationType.GARBAGE_FALL);
        }
    }

    /** 가비지 → 코디네이터 */
    private final class GarbageListener implements GarbageManager.Listener {
        @Override
        public void onGarbageLanded(GarbageBlock block) {
            dropDirty = true;
        }

        @Override
        public void onGarbageConverted(GarbageBlock block, List<Tile> tiles) {
            dropDirty = true;
            scanDirty = true;
        }
    }

    // ============================================
    // 줄 삽입
    // ============================================

    /**
     * 모든 점유자/애니메이션/가비지/커서를 한 줄 올리고, 대기줄 맨 위를 row 0 으로
     */
    void spawnRow() {
        if (!grid.shiftUp()) {
            rise.holdAtTop();
            if (verbose) System.out.println("[Grid] row spawn blocked, top row busy");
            return;
        }
        for (int y = 0; y < grid.getHeight(); y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                Occupant o = grid.get(x, y);
                if (o instanceof Tile) {
                    Tile t = (Tile) o;
                    t.setPosition(x, y);
                    if (!anim.isAnimating(t.getId())) t.snapVisual();
                } else if (o instanceof GarbageBlock) {
                    GarbageBlock b = (GarbageBlock) o;
                    b.setAnchor(x, y);
                    if (!anim.isAnimating(b.getId())) b.setVisualY(y);
                }
            }
        }
        anim.shiftAll(1);
        cursor.shiftUp();

        int rows = grid.getPreloadRows();
        for (int r = 0; r < rows - 1; r++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                Tile t = grid.getPreload(r, x);
                if (t != null) {
                    t.setPosition(x, -(r + 1));
                    t.snapVisual();
                }
            }
        }
        if (rows > 0) spawner.fillPreloadRow(rows - 1);

        System.out.println("[Grid] row spawned (level " + rise.getSpeedManager().getLevel() + ")");
        if (events.onRowSpawned != null) events.onRowSpawned.run();
        matches.requestScan();
    }

    // ============================================
    // 가비지 / 상태 진입점
    // ============================================

    public boolean queueGarbage(int width, int height) {
        if (gameOver) return false;
        return garbage.queueGarbage(width, height);
    }

    public int cancelGarbage(int n) {
        return garbage.cancelGarbage(n);
    }

    public int getPendingGarbageCount() {
        return garbage.getPendingGarbageCount();
    }

    public void applyStatus(int x, int y, TileStatus s) {
        status.apply(grid.getTile(x, y), s);
    }

    /** 보드 구성용: 타일 하나를 바로 놓는다 */
    public Tile placeTile(int type, int x, int y) {
        Tile t = spawner.createTile(type, x, y);
        grid.place(t, x, y);
        return t;
    }

    /** 외부에서 낙하/스캔을 요청 (보드를 직접 고친 뒤) */
    public void requestSettle() {
        dropDirty = true;
        scanDirty = true;
    }

    // ============================================
    // 조회
    // ============================================

    public Occupant getOccupant(int x, int y) { return grid.get(x, y); }
    public GridState getGrid() { return grid; }
    public AnimationManager getAnimationManager() { return anim; }
    public MatchResolver getMatchResolver() { return matches; }
    public GarbageManager getGarbageManager() { return garbage; }
    public StatusEffectManager getStatusEffects() { return status; }
    public RiseController getRise() { return rise; }
    public ScoreManager getScoreManager() { return score; }
    public Cursor getCursor() { return cursor; }
    public GameConfig getConfig() { return config; }

    public int getScore() { return score.getScore(); }
    public int getStackHeight() { return grid.getStackHeight(); }
    public boolean isGameOver() { return gameOver; }
    public boolean isSwapping() { return operation != null; }
    public boolean isInCombo() { return matches.isProcessing(); }
    public long getTickCount() { return tickCount; }

    public List<String> validate() {
        return grid.validate();
    }

    public void reset() {
        anim.forceStop();
        grid.reset();
        matches.reset();
        garbage.reset();
        rise.reset();
        score.reset();
        cursor.setPosition((grid.getWidth() - 2) / 2, 0);
        operation = null;
        dropDirty = false;
        scanDirty = false;
        gameOver = false;
        tickCount = 0;
        System.out.println("[Grid] reset");
    }
}
