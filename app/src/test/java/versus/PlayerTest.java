package versus;

import org.junit.Before;
import org.junit.Test;

import component.GameConfig;

import static org.junit.Assert.*;

public class PlayerTest {

    private Player player;

    @Before
    public void setUp() {
        player = new Player(1, GameConfig.defaults(5L), null);
    }

    @Test
    public void testPendingIncoming() {
        player.addPendingIncoming(300);
        player.addPendingIncoming(-50);
        assertEquals(300, player.getPendingIncoming());

        assertEquals("가진 것보다 많이 줄일 수 없음", 300, player.reducePendingIncoming(500));
        assertEquals(0, player.getPendingIncoming());

        player.addPendingIncoming(120);
        assertEquals(120, player.takePendingIncoming());
        assertEquals(0, player.getPendingIncoming());
    }

    @Test
    public void testGridBridge() {
        assertEquals(1, player.index());
        player.start();
        assertTrue(player.getStackHeight() > 0);
        assertFalse(player.isGameOver());
        assertEquals(0, player.getScore());
    }
}
