package logic;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import tiles.GarbageBlock;
import tiles.Tile;

import static org.junit.Assert.*;

public class MatchDetectorTest {

    private GridState grid;
    private MatchDetector detector;

    @Before
    public void setUp() {
        grid = new GridState(6, 14, 0);
        detector = new MatchDetector(grid);
    }

    private Tile put(int type, int x, int y) {
        Tile t = new Tile(grid.allocateId(), type, x, y);
        grid.place(t, x, y);
        return t;
    }

    @Test
    public void testNoMatchForPair() {
        put(1, 0, 0);
        put(1, 1, 0);
        put(2, 2, 0);
        assertTrue(detector.findMatchGroups().isEmpty());
        assertFalse(detector.hasMatches());
    }

    @Test
    public void testHorizontalTriple() {
        put(1, 0, 0);
        put(1, 1, 0);
        put(1, 2, 0);
        put(2, 3, 0);

        List<MatchGroup> groups = detector.findMatchGroups();
        assertEquals(1, groups.size());
        assertEquals(3, groups.get(0).size());
        assertEquals(1, groups.get(0).getType());
    }

    @Test
    public void testVerticalTriple() {
        put(3, 4, 0);
        put(3, 4, 1);
        put(3, 4, 2);
        put(3, 4, 3);

        List<MatchGroup> groups = detector.findMatchGroups();
        assertEquals(1, groups.size());
        assertEquals("4개 연속은 한 그룹", 4, groups.get(0).size());
    }

    @Test
    public void testLShapeIsOneGroup() {
        put(2, 0, 0);
        put(2, 1, 0);
        put(2, 2, 0);
        put(2, 0, 1);
        put(2, 0, 2);

        List<MatchGroup> groups = detector.findMatchGroups();
        assertEquals(1, groups.size());
        assertEquals(5, groups.get(0).size());
    }

    @Test
    public void testCornerTouchingMatchesStaySeparate() {
        // 가로 (0..2, 0) 와 가로 (3..5, 1): 모서리만 닿음
        put(1, 0, 0);
        put(1, 1, 0);
        put(1, 2, 0);
        put(4, 3, 0);
        put(5, 0, 1);
        put(5, 1, 1);
        put(4, 2, 1);
        put(1, 3, 1);
        put(1, 4, 1);
        put(1, 5, 1);

        List<MatchGroup> groups = detector.findMatchGroups();
        assertEquals(2, groups.size());
        for (MatchGroup g : groups) assertEquals(3, g.size());
    }

    @Test
    public void testGroupsAreDisjoint() {
        put(1, 0, 0);
        put(1, 1, 0);
        put(1, 2, 0);
        put(2, 3, 0);
        put(2, 4, 0);
        put(2, 5, 0);

        List<MatchGroup> groups = detector.findMatchGroups();
        assertEquals(2, groups.size());
        for (Tile t : groups.get(0).getTiles()) {
            assertFalse(groups.get(1).contains(t));
        }
    }

    @Test
    public void testBusyTilesDoNotMatch() {
        put(1, 0, 0);
        Tile falling = put(1, 1, 0);
        put(1, 2, 0);
        falling.startFalling(1, 0);
        assertTrue("낙하 중 타일은 매치 안 됨", detector.findMatchGroups().isEmpty());

        falling.finishMovement();
        falling.setProcessing(true);
        assertTrue("처리 중 타일은 매치 안 됨", detector.findMatchGroups().isEmpty());

        falling.setProcessing(false);
        falling.setCanMatch(false);
        assertTrue("canMatch=false 타일은 매치 안 됨", detector.findMatchGroups().isEmpty());
    }

    @Test
    public void testGarbageBreaksRun() {
        put(1, 0, 0);
        put(1, 1, 0);
        GarbageBlock g = new GarbageBlock(grid.allocateId(), 2, 0, 1, 1);
        grid.placeGarbage(g, 2, 0);
        put(1, 3, 0);
        assertTrue(detector.findMatchGroups().isEmpty());
    }

    @Test
    public void testFindInAreaFilters() {
        put(1, 0, 0);
        put(1, 1, 0);
        put(1, 2, 0);
        put(2, 5, 5);
        put(2, 5, 6);
        put(2, 5, 7);

        assertEquals(2, detector.findMatchGroups().size());
        List<MatchGroup> area = detector.findMatchGroupsInArea(4, 4, 5, 8);
        assertEquals(1, area.size());
        assertEquals(2, area.get(0).getType());
    }

    @Test
    public void testAdjacentOccupants() {
        put(1, 2, 2);
        put(2, 1, 2);
        put(3, 2, 3);
        assertEquals(2, detector.getAdjacentOccupants(2, 2).size());
        assertEquals("모서리 칸은 이웃이 2개", 2, detector.getAdjacentCells(0, 0).size());
    }
}
