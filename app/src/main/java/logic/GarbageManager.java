package logic;

import java.awt.Point;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import component.config.DifficultyProfile;
import tiles.GarbageBlock;
import tiles.Tile;

/**
 * 그리드 한 개의 가비지 처리
 * -----------------------
 * - 대기열: 최대 maxPendingGarbage 개, 폭은 maxGarbageWidth / 그리드 폭으로 제한
 * - garbageDropDelay 후 스폰: 가운데 열 먼저, 그 다음 왼쪽부터
 * - 받침이 없으면 블록 단위로 낙하
 * - 인접 매치 → 변환 (클러스터 전파), conversionDelay 후 덮은 칸 전부를 한 번에 타일로 교체
 */
public class GarbageManager {

    /** 대기 중인 가비지 요청 */
    public static class GarbageRequest {
        public final int width;
        public final int height;
        float timer;

        GarbageRequest(int width, int height, float timer) {
            this.width = width;
            this.height = height;
            this.timer = timer;
        }

        @Override
        public String toString() {
            return width + "x" + height;
        }
    }

    public interface Listener {
        default void onGarbageSpawned(GarbageBlock block) {}

        default void onGarbageLanded(GarbageBlock block) {}

        /** 변환 완료. 새 타일들은 이미 배열에 들어가 있음 */
        default void onGarbageConverted(GarbageBlock block, List<Tile> tiles) {}
    }

    private final GridState grid;
    private final AnimationManager anim;
    private final TileSpawner spawner;
    private final DifficultyProfile.Garbage settings;
    private final DifficultyProfile.Timing timing;
    private final Listener listener;
    private final boolean verbose;

    private final List<GarbageRequest> queue = new ArrayList<>();

    public GarbageManager(GridState grid, AnimationManager anim, TileSpawner spawner,
            DifficultyProfile.Garbage settings, DifficultyProfile.Timing timing,
            Listener listener, boolean verbose) {
        this.grid = grid;
        this.anim = anim;
        this.spawner = spawner;
        this.settings = settings;
        this.timing = timing;
        this.listener = (listener != null) ? listener : new Listener() {};
        this.verbose = verbose;
    }

    // ============================================
    // 대기열
    // ============================================

    /**
     * 가비지 요청 추가. 대기열이 가득 차면 경고 후 버림 (false)
     */
    public boolean queueGarbage(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("garbage size must be positive: " + width + "x" + height);
        }
        if (queue.size() >= settings.maxPendingGarbage) {
            System.err.println("[WARN][Garbage] queue full (" + settings.maxPendingGarbage
                    + "), dropping " + width + "x" + height);
            return false;
        }
        int w = Math.min(width, Math.min(settings.maxGarbageWidth, grid.getWidth()));
        int h = Math.min(height, grid.getHeight());
        queue.add(new GarbageRequest(w, h, settings.garbageDropDelay));
        System.out.println("[Garbage] queued " + w + "x" + h + " (pending=" + queue.size() + ")");
        return true;
    }

    /**
     * 최근 요청부터 최대 n 개 취소. 실제로 취소한 개수 반환
     */
    public int cancelGarbage(int n) {
        int removed = 0;
        while (removed < n && !queue.isEmpty()) {
            queue.remove(queue.size() - 1);
            removed++;
        }
        if (removed > 0) System.out.println("[Garbage] cancelled " + removed + " request(s)");
        return removed;
    }

    /** 대기 중인 가비지 줄 수 (높이 합) */
    public int getPendingGarbageCount() {
        int sum = 0;
        for (GarbageRequest r : queue) sum += r.height;
        return sum;
    }

    public int getQueuedRequestCount() {
        return queue.size();
    }

    public List<GarbageRequest> getQueue() {
        return new ArrayList<>(queue);
    }

    // ============================================
    // tick
    // ============================================

    public void tick(float dt) {
        tickQueue(dt);
        tickConversions(dt);
    }

    private void tickQueue(float dt) {
        while (!queue.isEmpty()) {
            GarbageRequest head = queue.get(0);
            head.timer -= dt;
            if (head.timer > 0f) break;
            queue.remove(0);
            spawn(head);
            dt = 0f;
        }
    }

    /**
     * 맨 위에 스폰. 가운데 열부터, 그 다음 왼쪽→오른쪽.
     * 맨 윗줄만 비어 있으면 되고, 그 아래 빈 줄이 모자라면 높이를 잘라서 놓는다
     */
    GarbageBlock spawn(GarbageRequest req) {
        int x = findSpawnColumn(req.width, req.height);
        if (x < 0) {
            System.err.println("[WARN][Garbage] no room for " + req + ", dropped");
            return null;
        }
        int height = freeRowsFromTop(x, req.width, req.height);
        if (height < req.height) {
            System.err.println("[WARN][Garbage] " + req + " clipped to height " + height);
        }
        int spawnY = grid.getHeight() - height;
        GarbageBlock block = new GarbageBlock(grid.allocateId(), x, spawnY, req.width, height);
        grid.placeGarbage(block, x, spawnY);
        block.setVisualY(spawnY);
        System.out.println("[Garbage] spawned " + block);
        listener.onGarbageSpawned(block);
        dropUnsupported();
        return block;
    }

    int findSpawnColumn(int width, int height) {
        int top = grid.getHeight() - 1;
        int centered = (grid.getWidth() - width) / 2;
        if (windowEmpty(centered, top, width, 1)) return centered;
        for (int x = 0; x + width <= grid.getWidth(); x++) {
            if (x != centered && windowEmpty(x, top, width, 1)) return x;
        }
        return -1;
    }

    /** 맨 윗줄부터 연속으로 비어 있는 줄 수 (최대 height) */
    int freeRowsFromTop(int x0, int width, int height) {
        int rows = 0;
        while (rows < height && windowEmpty(x0, grid.getHeight() - 1 - rows, width, 1)) {
            rows++;
        }
        return rows;
    }

    private boolean windowEmpty(int x0, int y0, int width, int height) {
        if (x0 < 0 || y0 < 0) return false;
        for (int y = y0; y < y0 + height; y++) {
            for (int x = x0; x < x0 + width; x++) {
                if (!grid.isEmpty(x, y)) return false;
            }
        }
        return true;
    }

    // ============================================
    // 낙하 (블록 단위)
    // ============================================

    /**
     * 바로 아래 줄이 비어 있는 가비지를 착지점까지 떨어뜨린다 (아래 블록부터).
     * 움직인 블록이 있으면 true
     */
    public boolean dropUnsupported() {
        List<GarbageBlock> blocks = grid.getGarbageBlocks();
        blocks.sort(Comparator.comparingInt(GarbageBlock::getY));
        boolean moved = false;
        for (GarbageBlock b : blocks) {
            if (b.isConverting()) continue;
            int distance = fallDistance(b);
            if (distance <= 0) continue;

            float fromY = b.getVisualY();
            grid.removeGarbage(b);
            grid.placeGarbage(b, b.getX(), b.getY() - distance);
            b.setFalling(true);
            float duration = timing.dropDurationPerUnit * Math.abs(fromY - b.getY());
            anim.start(b.getId(), AnimationManager.AnimationType.GARBAGE_FALL, b,
                    b.getX(), fromY, b.getX(), b.getY(), duration, false, () -> land(b));
            if (verbose) System.out.println("[Garbage] " + b + " falling " + distance);
            moved = true;
        }
        return moved;
    }

    private int fallDistance(GarbageBlock b) {
        int distance = 0;
        for (int y = b.getY() - 1; y >= 0; y--) {
            for (int x = b.getX(); x < b.getX() + b.getWidth(); x++) {
                if (grid.get(x, y) != null) return distance;
            }
            distance++;
        }
        return distance;
    }

    private void land(GarbageBlock b) {
        b.setFalling(false);
        b.setVisualY(b.getY());
        if (verbose) System.out.println("[Garbage] landed " + b);
        listener.onGarbageLanded(b);
    }

    public boolean isAnyFalling() {
        for (GarbageBlock b : grid.getGarbageBlocks()) {
            if (b.isFalling()) return true;
        }
        return false;
    }

    // ============================================
    // 변환
    // ============================================

    /**
     * 매치된 타일 옆의 정착한 가비지 변환 시작. 변환을 시작한 블록 수 반환
     */
    public int notifyAdjacentMatch(List<MatchGroup> groups) {
        Set<GarbageBlock> hit = new LinkedHashSet<>();
        for (MatchGroup g : groups) {
            for (Tile t : g.getTiles()) {
                for (Point p : neighbours(t.getX(), t.getY())) {
                    GarbageBlock b = grid.getGarbage(p.x, p.y);
                    if (b != null && b.isSettled()) hit.add(b);
                }
            }
        }
        if (settings.propagateToCluster) hit = expandCluster(hit);

        for (GarbageBlock b : hit) {
            b.startConversion(settings.conversionDelay);
            System.out.println("[Garbage] converting " + b);
        }
        return hit.size();
    }

    /** 맞닿은 정착 가비지로 전파 (BFS) */
    private Set<GarbageBlock> expandCluster(Set<GarbageBlock> seeds) {
        Set<GarbageBlock> visited = new LinkedHashSet<>(seeds);
        Deque<GarbageBlock> queue = new ArrayDeque<>(seeds);
        while (!queue.isEmpty()) {
            GarbageBlock cur = queue.poll();
            for (Point cell : cur.getOccupiedCells()) {
                for (Point p : neighbours(cell.x, cell.y)) {
                    GarbageBlock n = grid.getGarbage(p.x, p.y);
                    if (n == null || n == cur || visited.contains(n) || !n.isSettled()) continue;
                    visited.add(n);
                    queue.add(n);
                }
            }
        }
        return visited;
    }

    private List<Point> neighbours(int x, int y) {
        List<Point> list = new ArrayList<>(4);
        list.add(new Point(x + 1, y));
        list.add(new Point(x - 1, y));
        list.add(new Point(x, y + 1));
        list.add(new Point(x, y - 1));
        return list;
    }

    private void tickConversions(float dt) {
        for (GarbageBlock b : grid.getGarbageBlocks()) {
            if (b.tickConversion(dt)) convert(b);
        }
    }

    /** 덮은 칸 전부를 한 번에 새 타일로 */
    private void convert(GarbageBlock b) {
        List<Point> cells = b.getOccupiedCells();
        grid.removeGarbage(b);
        anim.forget(b.getId());
        List<Tile> tiles = new ArrayList<>(cells.size());
        for (Point p : cells) {
            Tile t = spawner.randomTile(p.x, p.y);
            grid.place(t, p.x, p.y);
            tiles.add(t);
        }
        System.out.println("[Garbage] converted " + b + " into " + tiles.size() + " tiles");
        listener.onGarbageConverted(b, tiles);
    }

    public boolean isConversionInProgress() {
        for (GarbageBlock b : grid.getGarbageBlocks()) {
            if (b.isConverting()) return true;
        }
        return false;
    }

    public void reset() {
        queue.clear();
    }
}
