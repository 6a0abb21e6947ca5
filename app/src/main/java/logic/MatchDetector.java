package logic;

import java.awt.Point;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import tiles.Occupant;
import tiles.Tile;

/**
 * 3개 이상 가로/세로 매치 검출 + 연결 그룹화
 * - 매치 가능한 타일: IDLE, 처리 중 아님, canMatch
 * - 그룹은 "매치된 타일 집합 안에서만" 4방향 flood fill (모서리만 닿는 평행 매치는 별도 그룹)
 */
public class MatchDetector {
    private static final int[][] DIRS = { { 1, 0 }, { -1, 0 }, { 0, 1 }, { 0, -1 } };

    private final GridState grid;

    public MatchDetector(GridState grid) {
        this.grid = grid;
    }

    /** 전체 그리드 매치 그룹 */
    public List<MatchGroup> findMatchGroups() {
        return groupMatchedTiles(findMatchedTiles());
    }

    /**
     * 사각 영역(x0..x1, y0..y1)에 타일이 하나라도 걸친 그룹만
     */
    public List<MatchGroup> findMatchGroupsInArea(int x0, int y0, int x1, int y1) {
        List<MatchGroup> result = new ArrayList<>();
        for (MatchGroup g : findMatchGroups()) {
            for (Tile t : g.getTiles()) {
                if (t.getX() >= x0 && t.getX() <= x1 && t.getY() >= y0 && t.getY() <= y1) {
                    result.add(g);
                    break;
                }
            }
        }
        return result;
    }

    public boolean hasMatches() {
        return !findMatchedTiles().isEmpty();
    }

    /**
     * 가로/세로 3연속을 이루는 모든 타일 (삽입 순서 = 스캔 순서)
     */
    public Set<Tile> findMatchedTiles() {
        Set<Tile> matched = new LinkedHashSet<>();
        int w = grid.getWidth();
        int h = grid.getHeight();

        // 가로
        for (int y = 0; y < h; y++) {
            for (int x = 0; x + 2 < w; x++) {
                Tile a = matchable(x, y), b = matchable(x + 1, y), c = matchable(x + 2, y);
                if (a != null && b != null && c != null
                        && a.getType() == b.getType() && b.getType() == c.getType()) {
                    matched.add(a);
                    matched.add(b);
                    matched.add(c);
                }
            }
        }
        // 세로
        for (int x = 0; x < w; x++) {
            for (int y = 0; y + 2 < h; y++) {
                Tile a = matchable(x, y), b = matchable(x, y + 1), c = matchable(x, y + 2);
                if (a != null && b != null && c != null
                        && a.getType() == b.getType() && b.getType() == c.getType()) {
                    matched.add(a);
                    matched.add(b);
                    matched.add(c);
                }
            }
        }
        return matched;
    }

    /**
     * 매치 타일 집합을 연결 요소로 나눈다. 같은 타입 + 매치 집합 안의 이웃만 따라간다
     */
    public List<MatchGroup> groupMatchedTiles(Set<Tile> matched) {
        List<MatchGroup> groups = new ArrayList<>();
        Set<Tile> visited = new LinkedHashSet<>();

        for (Tile start : matched) {
            if (visited.contains(start)) continue;

            List<Tile> component = new ArrayList<>();
            Deque<Tile> queue = new ArrayDeque<>();
            queue.add(start);
            visited.add(start);

            while (!queue.isEmpty()) {
                Tile cur = queue.poll();
                component.add(cur);
                for (int[] d : DIRS) {
                    Tile n = grid.getTile(cur.getX() + d[0], cur.getY() + d[1]);
                    if (n == null || visited.contains(n) || !matched.contains(n)) continue;
                    if (n.getType() != cur.getType()) continue;
                    visited.add(n);
                    queue.add(n);
                }
            }
            // 아래→위, 왼→오 순서로 정렬 (팝 순서 고정)
            component.sort(Comparator.comparingInt(Tile::getY).thenComparingInt(Tile::getX));
            groups.add(new MatchGroup(component));
        }
        return groups;
    }

    /** 상하좌우 점유자 (빈 칸 제외) */
    public List<Occupant> getAdjacentOccupants(int x, int y) {
        List<Occupant> list = new ArrayList<>(4);
        for (int[] d : DIRS) {
            Occupant o = grid.get(x + d[0], y + d[1]);
            if (o != null) list.add(o);
        }
        return list;
    }

    /** 상하좌우 칸 좌표 (범위 안) */
    public List<Point> getAdjacentCells(int x, int y) {
        List<Point> list = new ArrayList<>(4);
        for (int[] d : DIRS) {
            if (grid.inBounds(x + d[0], y + d[1])) list.add(new Point(x + d[0], y + d[1]));
        }
        return list;
    }

    private Tile matchable(int x, int y) {
        Tile t = grid.getTile(x, y);
        if (t == null) return null;
        if (!t.isSettled() || !t.canMatch()) return null;
        return t;
    }
}
