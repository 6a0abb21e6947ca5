package logic;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import tiles.GarbageBlock;
import tiles.GarbageReference;
import tiles.Occupant;
import tiles.Tile;

/**
 * GridState
 * -----------------------
 * - 칸 배열(cells[y][x], y=0 이 맨 아래)과 아래쪽 대기줄(preload) 보관
 * - 한 칸에는 최대 하나의 점유자만 들어간다
 * - GridCoordinator 만 소유하고, 나머지 리졸버는 참조만 받는다
 */
public class GridState {
    private final int width;
    private final int height;
    private final int preloadRows;

    // === 핵심 필드 ===
    private final Occupant[][] cells;
    // preload[0] 이 row 0 바로 아래 줄
    private final Tile[][] preload;

    // 타일/가비지 ID
    private int nextId = 1;

    public GridState(int width, int height, int preloadRows) {
        if (width <= 0 || height <= 0 || preloadRows < 0) {
            throw new IllegalArgumentException("bad grid size " + width + "x" + height + " preload=" + preloadRows);
        }
        this.width = width;
        this.height = height;
        this.preloadRows = preloadRows;
        this.cells = new Occupant[height][width];
        this.preload = new Tile[preloadRows][width];
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public int getPreloadRows() { return preloadRows; }

    public boolean inBounds(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    public Occupant get(int x, int y) {
        return inBounds(x, y) ? cells[y][x] : null;
    }

    public boolean isEmpty(int x, int y) {
        return inBounds(x, y) && cells[y][x] == null;
    }

    /** 일반 타일일 때만 반환 */
    public Tile getTile(int x, int y) {
        Occupant o = get(x, y);
        return (o instanceof Tile) ? (Tile) o : null;
    }

    /** 칸에 있는 가비지 블록 (앵커든 참조든) */
    public GarbageBlock getGarbage(int x, int y) {
        Occupant o = get(x, y);
        if (o == null || !o.isGarbage()) return null;
        return (GarbageBlock) o.owner();
    }

    public void set(int x, int y, Occupant occupant) {
        if (!inBounds(x, y)) {
            throw new IndexOutOfBoundsException("cell (" + x + "," + y + ") outside " + width + "x" + height);
        }
        cells[y][x] = occupant;
    }

    public void clear(int x, int y) {
        if (inBounds(x, y)) cells[y][x] = null;
    }

    /** 타일을 칸에 놓고 좌표를 맞춘다 */
    public void place(Tile tile, int x, int y) {
        set(x, y, tile);
        tile.setPosition(x, y);
    }

    /** 칸을 비운다. 그 칸에 이 타일이 있을 때만 */
    public boolean removeIfSame(Tile tile, int x, int y) {
        if (get(x, y) == tile) {
            cells[y][x] = null;
            return true;
        }
        return false;
    }

    // ============================================
    // 가비지
    // ============================================

    /** 블록이 덮는 칸이 모두 비어 있는지 (자기 자신 칸은 허용) */
    public boolean canPlaceGarbage(GarbageBlock block, int ax, int ay) {
        for (int gy = ay; gy < ay + block.getHeight(); gy++) {
            for (int gx = ax; gx < ax + block.getWidth(); gx++) {
                if (!inBounds(gx, gy)) return false;
                Occupant o = cells[gy][gx];
                if (o != null && o.owner() != block) return false;
            }
        }
        return true;
    }

    public void placeGarbage(GarbageBlock block, int ax, int ay) {
        block.setAnchor(ax, ay);
        for (int gy = ay; gy < ay + block.getHeight(); gy++) {
            for (int gx = ax; gx < ax + block.getWidth(); gx++) {
                set(gx, gy, (gx == ax && gy == ay) ? block : new GarbageReference(block));
            }
        }
    }

    public void removeGarbage(GarbageBlock block) {
        for (int gy = block.getY(); gy < block.getY() + block.getHeight(); gy++) {
            for (int gx = block.getX(); gx < block.getX() + block.getWidth(); gx++) {
                if (inBounds(gx, gy) && cells[gy][gx] != null && cells[gy][gx].owner() == block) {
                    cells[gy][gx] = null;
                }
            }
        }
    }

    // ============================================
    // 대기줄 (preload)
    // ============================================

    public Tile getPreload(int row, int x) {
        return preload[row][x];
    }

    public void setPreload(int row, int x, Tile tile) {
        preload[row][x] = tile;
    }

    /**
     * 전체를 한 줄 위로 올린다. 맨 윗줄에 무언가 있으면 false (아무것도 바꾸지 않음).
     * row 0 에는 preload[0] 이 올라오고, 맨 아래 대기줄은 비워진다 (호출자가 채움)
     */
    public boolean shiftUp() {
        for (int x = 0; x < width; x++) {
            if (cells[height - 1][x] != null) return false;
        }
        for (int y = height - 1; y > 0; y--) {
            System.arraycopy(cells[y - 1], 0, cells[y], 0, width);
        }
        for (int x = 0; x < width; x++) {
            cells[0][x] = (preloadRows > 0) ? preload[0][x] : null;
        }
        for (int r = 0; r < preloadRows - 1; r++) {
            System.arraycopy(preload[r + 1], 0, preload[r], 0, width);
        }
        if (preloadRows > 0) {
            for (int x = 0; x < width; x++) preload[preloadRows - 1][x] = null;
        }
        return true;
    }

    public boolean isTopRowOccupied() {
        for (int x = 0; x < width; x++) {
            if (cells[height - 1][x] != null) return true;
        }
        return false;
    }

    /** 열에서 가장 높은 점유 칸의 y (+1), 비었으면 0 */
    public int getColumnHeight(int x) {
        for (int y = height - 1; y >= 0; y--) {
            if (cells[y][x] != null) return y + 1;
        }
        return 0;
    }

    /** 모든 열 중 가장 높은 스택 */
    public int getStackHeight() {
        int max = 0;
        for (int x = 0; x < width; x++) max = Math.max(max, getColumnHeight(x));
        return max;
    }

    public List<Tile> getTiles() {
        List<Tile> list = new ArrayList<>();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (cells[y][x] instanceof Tile) list.add((Tile) cells[y][x]);
            }
        }
        return list;
    }

    public List<GarbageBlock> getGarbageBlocks() {
        List<GarbageBlock> list = new ArrayList<>();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (cells[y][x] instanceof GarbageBlock) list.add((GarbageBlock) cells[y][x]);
            }
        }
        return list;
    }

    public int countOccupied() {
        int n = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (cells[y][x] != null) n++;
            }
        }
        return n;
    }

    public int allocateId() {
        if (nextId == Integer.MAX_VALUE) {
            nextId = 1;
        }
        return nextId++;
    }

    /**
     * 불변식 검사: 한 점유자는 한 칸에만, 타일 좌표 = 저장 위치, 가비지 칸은 블록 범위와 일치.
     * 위반 내용을 문자열로 돌려준다 (비어 있으면 정상)
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        Map<Occupant, String> seen = new IdentityHashMap<>();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                Occupant o = cells[y][x];
                if (o == null) continue;
                if (o instanceof Tile) {
                    Tile t = (Tile) o;
                    if (t.getX() != x || t.getY() != y) {
                        problems.add(t + " stored at (" + x + "," + y + ")");
                    }
                    String prev = seen.put(t, x + "," + y);
                    if (prev != null) problems.add(t + " stored twice: " + prev + " and " + x + "," + y);
                } else if (o instanceof GarbageBlock) {
                    GarbageBlock g = (GarbageBlock) o;
                    if (g.getX() != x || g.getY() != y) problems.add(g + " anchor stored at (" + x + "," + y + ")");
                    String prev = seen.put(g, x + "," + y);
                    if (prev != null) problems.add(g + " anchor stored twice");
                } else {
                    GarbageBlock g = (GarbageBlock) o.owner();
                    if (!g.covers(x, y)) problems.add("stray reference to " + g + " at (" + x + "," + y + ")");
                }
            }
        }
        return problems;
    }

    /**
     * 상태 전체 초기화
     */
    public void reset() {
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) cells[y][x] = null;
        }
        for (int r = 0; r < preloadRows; r++) {
            for (int x = 0; x < width; x++) preload[r][x] = null;
        }
        nextId = 1;
    }

    /** 디버그용 텍스트 덤프 (위쪽 행부터) */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        for (int y = height - 1; y >= 0; y--) {
            for (int x = 0; x < width; x++) {
                Occupant o = cells[y][x];
                if (o == null) sb.append('.');
                else if (o.isGarbage()) sb.append('#');
                else sb.append((char) ('0' + ((Tile) o).getType()));
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
