package logic;

import java.util.Collections;

import org.junit.Before;
import org.junit.Test;

import component.config.DifficultyProfile;
import tiles.Tile;
import tiles.TileStatus;

import static org.junit.Assert.*;

public class StatusEffectManagerTest {

    private GridState grid;
    private TileSpawner spawner;
    private DifficultyProfile.Status settings;
    private StatusEffectManager status;

    @Before
    public void setUp() {
        grid = new GridState(6, 14, 0);
        spawner = new TileSpawner(grid, 6, 1L);
        settings = new DifficultyProfile.Status();
        status = new StatusEffectManager(grid, settings, 11L);
    }

    private Tile put(int type, int x, int y) {
        Tile t = spawner.createTile(type, x, y);
        grid.place(t, x, y);
        return t;
    }

    @Test
    public void testApplySetsCapabilityFlags() {
        Tile t = put(0, 0, 0);

        status.apply(t, TileStatus.LOCKED);
        assertFalse(t.canSwap());
        assertFalse(t.canMatch());

        status.apply(t, TileStatus.BURNING);
        assertTrue(t.canSwap());
        assertFalse(t.canMatch());

        status.apply(t, TileStatus.FROZEN);
        assertTrue("얼음은 교환 가능", t.canSwap());
        assertTrue(t.hasMomentum());

        status.apply(t, TileStatus.NONE);
        assertFalse(t.hasStatus());
        assertTrue(t.canMatch());
        assertFalse(t.hasMomentum());
    }

    @Test
    public void testStatusExpires() {
        Tile t = put(0, 0, 0);
        status.apply(t, TileStatus.LOCKED);
        status.tick(2f);
        assertEquals(TileStatus.LOCKED, t.getStatus());
        status.tick(1.5f);
        assertEquals(TileStatus.NONE, t.getStatus());
        assertTrue(t.canSwap());
    }

    @Test
    public void testPoisonSpreadsOnInterval() {
        settings.poisonSpreadChance = 1f;
        Tile p = put(0, 1, 0);
        Tile left = put(1, 0, 0);
        Tile right = put(2, 2, 0);
        Tile far = put(3, 5, 0);
        status.apply(p, TileStatus.POISONED);

        status.tick(1f);
        assertFalse(left.hasStatus());
        status.tick(1f);
        assertEquals(TileStatus.POISONED, left.getStatus());
        assertEquals(TileStatus.POISONED, right.getStatus());
        assertFalse("떨어진 타일은 그대로", far.hasStatus());
    }

    @Test
    public void testPoisonNeverSpreadsWithZeroChance() {
        settings.poisonSpreadChance = 0f;
        Tile p = put(0, 1, 0);
        Tile left = put(1, 0, 0);
        status.apply(p, TileStatus.POISONED);
        status.tick(2f);
        assertFalse(left.hasStatus());
    }

    @Test
    public void testMatchNextToBurningTileCuresIt() {
        Tile a = put(1, 0, 0);
        Tile fire = put(2, 0, 1);
        Tile away = put(3, 4, 4);
        status.apply(fire, TileStatus.BURNING);
        status.apply(away, TileStatus.BURNING);

        int cured = status.onMatchHighlighted(
                Collections.singletonList(new MatchGroup(Collections.singletonList(a))));
        assertEquals(1, cured);
        assertFalse(fire.hasStatus());
        assertTrue(fire.canMatch());
        assertEquals(TileStatus.BURNING, away.getStatus());
    }
}
