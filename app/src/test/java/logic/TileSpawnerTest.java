package logic;

import org.junit.Test;

import tiles.Tile;

import static org.junit.Assert.*;

public class TileSpawnerTest {

    @Test(expected = IllegalArgumentException.class)
    public void testTooFewTypes() {
        new TileSpawner(new GridState(6, 14, 2), 1, 1L);
    }

    @Test
    public void testInitialFillHasNoMatches() {
        for (long seed = 0; seed < 20; seed++) {
            GridState grid = new GridState(6, 14, 2);
            new TileSpawner(grid, 3, seed).fillInitial(6);
            assertEquals(36, grid.countOccupied());
            assertTrue("seed " + seed + "\n" + grid.dump(),
                    !new MatchDetector(grid).hasMatches());
        }
    }

    @Test
    public void testSameSeedSameBoard() {
        GridState a = new GridState(6, 14, 2);
        GridState b = new GridState(6, 14, 2);
        new TileSpawner(a, 6, 99L).fillInitial(4);
        new TileSpawner(b, 6, 99L).fillInitial(4);
        assertEquals(a.dump(), b.dump());
    }

    @Test
    public void testPreloadRowsHaveNegativeYAndNoHorizontalTriple() {
        GridState grid = new GridState(6, 14, 2);
        TileSpawner spawner = new TileSpawner(grid, 2, 5L);
        spawner.fillPreload();
        for (int r = 0; r < 2; r++) {
            int run = 0;
            int prev = -1;
            for (int x = 0; x < 6; x++) {
                Tile t = grid.getPreload(r, x);
                assertNotNull(t);
                assertEquals(-(r + 1), t.getY());
                run = (t.getType() == prev) ? run + 1 : 1;
                prev = t.getType();
                assertTrue("대기줄 가로 3연속 금지", run < 3);
            }
        }
    }

    @Test
    public void testCreateTileUsesFreshIds() {
        GridState grid = new GridState(6, 14, 0);
        TileSpawner spawner = new TileSpawner(grid, 4, 1L);
        Tile a = spawner.createTile(0, 1, 2);
        Tile b = spawner.randomTile(1, 2);
        assertNotEquals(a.getId(), b.getId());
        assertEquals(2f, a.getVisualY(), 0f);
        assertTrue(b.getType() >= 0 && b.getType() < 4);
    }
}
