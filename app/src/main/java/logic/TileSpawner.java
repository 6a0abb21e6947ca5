package logic;

import java.util.Random;

import tiles.Tile;

/**
 * 타일 생성 (세션 시드 기반, 같은 시드면 같은 보드)
 * - 초기 채우기: 미리 만들어진 매치 없음
 * - 대기줄: 가로 3연속 없음
 * - 가비지 변환: 무작위 타일
 */
public class TileSpawner {
    private final GridState grid;
    private final int typeCount;
    private final Random random;

    public TileSpawner(GridState grid, int typeCount, long seed) {
        if (typeCount < 2) {
            throw new IllegalArgumentException("typeCount must be >= 2: " + typeCount);
        }
        this.grid = grid;
        this.typeCount = typeCount;
        this.random = new Random(seed);
    }

    public Tile createTile(int type, int x, int y) {
        Tile t = new Tile(grid.allocateId(), type, x, y);
        t.snapVisual();
        return t;
    }

    public Tile randomTile(int x, int y) {
        return createTile(random.nextInt(typeCount), x, y);
    }

    /**
     * 아래쪽 rows 줄을 채운다. 가로/세로 3연속이 생기지 않게 타입을 고른다
     */
    public void fillInitial(int rows) {
        int h = Math.min(rows, grid.getHeight());
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                int type = pickType(x, y);
                grid.place(createTile(type, x, y), x, y);
            }
        }
        System.out.println("[Spawner] initial fill " + grid.getWidth() + "x" + h);
    }

    /** 모든 대기줄 채우기 */
    public void fillPreload() {
        for (int r = 0; r < grid.getPreloadRows(); r++) fillPreloadRow(r);
    }

    /**
     * 대기줄 한 줄 (preload[row]) 생성. 좌표 y 는 -(row+1)
     */
    public void fillPreloadRow(int row) {
        int y = -(row + 1);
        int prev1 = -1, prev2 = -1;
        for (int x = 0; x < grid.getWidth(); x++) {
            int type = random.nextInt(typeCount);
            if (type == prev1 && type == prev2) {
                type = (type + 1 + random.nextInt(typeCount - 1)) % typeCount;
            }
            grid.setPreload(row, x, createTile(type, x, y));
            prev2 = prev1;
            prev1 = type;
        }
    }

    private int pickType(int x, int y) {
        for (int attempt = 0; attempt < typeCount * 4; attempt++) {
            int type = random.nextInt(typeCount);
            if (!makesTriple(x, y, type)) return type;
        }
        // 무작위로 못 찾으면 순서대로
        for (int type = 0; type < typeCount; type++) {
            if (!makesTriple(x, y, type)) return type;
        }
        return random.nextInt(typeCount);
    }

    private boolean makesTriple(int x, int y, int type) {
        Tile l1 = grid.getTile(x - 1, y), l2 = grid.getTile(x - 2, y);
        if (l1 != null && l2 != null && l1.getType() == type && l2.getType() == type) return true;
        Tile d1 = grid.getTile(x, y - 1), d2 = grid.getTile(x, y - 2);
        return d1 != null && d2 != null && d1.getType() == type && d2.getType() == type;
    }

    public int getTypeCount() {
        return typeCount;
    }
}
