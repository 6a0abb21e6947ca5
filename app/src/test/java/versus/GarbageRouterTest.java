package versus;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import component.GameConfig;
import component.config.DifficultyProfile;
import logic.ComboState;
import logic.GridCoordinator;
import logic.MatchGroup;
import tiles.Tile;

import static org.junit.Assert.*;

public class GarbageRouterTest {

    private static GameConfig stillConfig() {
        DifficultyProfile p = new DifficultyProfile();
        p.rise.baseRiseSpeed = 0f;
        return new GameConfig(GameConfig.Mode.VERSUS, GameConfig.Difficulty.NORMAL, 42L, false, p);
    }

    private static ComboState combo(int... sizes) {
        ComboState c = new ComboState();
        int id = 0;
        for (int size : sizes) {
            List<Tile> tiles = new ArrayList<>();
            for (int i = 0; i < size; i++) tiles.add(new Tile(id++, 0, i, 0));
            List<MatchGroup> step = new ArrayList<>();
            step.add(new MatchGroup(tiles));
            c.recordStep(step);
        }
        return c;
    }

    private static void run(GarbageRouter router, int ticks) {
        for (int i = 0; i < ticks; i++) router.tick(1f / 60f);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNeedsTwoPlayers() {
        new GarbageRouter(stillConfig(), 1, null);
    }

    @Test
    public void testModeFromProfile() {
        assertEquals(TargetingMode.SEQUENTIAL, new GarbageRouter(stillConfig(), 2, null).getMode());
    }

    @Test
    public void testSequentialTargetsRotateAndSkipSender() {
        GarbageRouter.Events ev = new GarbageRouter.Events();
        List<Integer> targets = new ArrayList<>();
        ev.onGarbageSent = msg -> targets.add(msg.target);
        GarbageRouter router = new GarbageRouter(stillConfig(), 3, TargetingMode.SEQUENTIAL, ev);

        Player p0 = router.getPlayer(0);
        router.manualSend(p0, 250);
        router.manualSend(p0, 250);
        router.manualSend(p0, 250);

        assertEquals(3, targets.size());
        assertEquals(Integer.valueOf(1), targets.get(0));
        assertEquals(Integer.valueOf(2), targets.get(1));
        assertEquals(Integer.valueOf(1), targets.get(2));
        assertEquals("1x1 두 개", 2, router.getPlayer(1).getGrid().getGarbageManager().getQueuedRequestCount());
    }

    @Test
    public void testSequentialSkipsEliminatedPlayer() {
        GarbageRouter.Events ev = new GarbageRouter.Events();
        List<Integer> targets = new ArrayList<>();
        ev.onGarbageSent = msg -> targets.add(msg.target);
        GarbageRouter router = new GarbageRouter(stillConfig(), 3, TargetingMode.SEQUENTIAL, ev);

        router.getPlayer(1).getGrid().getRise().forceGameOver();
        router.manualSend(router.getPlayer(0), 250);
        router.manualSend(router.getPlayer(0), 250);

        assertEquals(2, targets.size());
        assertEquals(Integer.valueOf(2), targets.get(0));
        assertEquals(Integer.valueOf(2), targets.get(1));
    }

    @Test
    public void testSplitEvenlySpreadsRemainderOnePerTarget() {
        GarbageRouter.Events ev = new GarbageRouter.Events();
        List<GarbageMessage> sent = new ArrayList<>();
        ev.onGarbageSent = sent::add;
        GarbageRouter router = new GarbageRouter(stillConfig(), 4, TargetingMode.SPLIT_EVENLY, ev);

        router.manualSend(router.getPlayer(0), 752);
        assertEquals(3, sent.size());
        assertEquals(251, sent.get(0).score);
        assertEquals(251, sent.get(1).score);
        assertEquals(250, sent.get(2).score);
    }

    @Test
    public void testAllOpponentsGetFullScore() {
        GarbageRouter.Events ev = new GarbageRouter.Events();
        List<GarbageMessage> sent = new ArrayList<>();
        ev.onGarbageSent = sent::add;
        GarbageRouter router = new GarbageRouter(stillConfig(), 3, TargetingMode.ALL_OPPONENTS, ev);

        router.manualSend(router.getPlayer(0), 250);
        assertEquals(2, sent.size());
        assertEquals(1, sent.get(0).target);
        assertEquals(2, sent.get(1).target);
        for (GarbageMessage m : sent) assertEquals("나누지 않음", 250, m.score);
    }

    private static void stack(Player p, int height) {
        for (int y = 0; y < height; y++) p.getGrid().placeTile(y % 2 + 1, 0, y);
    }

    @Test
    public void testLowestStackTargetsShortestGrid() {
        GarbageRouter.Events ev = new GarbageRouter.Events();
        List<Integer> targets = new ArrayList<>();
        ev.onGarbageSent = msg -> targets.add(msg.target);
        GarbageRouter router = new GarbageRouter(stillConfig(), 3, TargetingMode.LOWEST_STACK, ev);

        stack(router.getPlayer(1), 3);
        stack(router.getPlayer(2), 1);
        router.manualSend(router.getPlayer(0), 250);
        assertEquals(1, targets.size());
        assertEquals(Integer.valueOf(2), targets.get(0));
    }

    @Test
    public void testHighestStackTargetsTallestGrid() {
        GarbageRouter.Events ev = new GarbageRouter.Events();
        List<Integer> targets = new ArrayList<>();
        ev.onGarbageSent = msg -> targets.add(msg.target);
        GarbageRouter router = new GarbageRouter(stillConfig(), 3, TargetingMode.HIGHEST_STACK, ev);

        stack(router.getPlayer(1), 1);
        stack(router.getPlayer(2), 4);
        router.manualSend(router.getPlayer(0), 250);
        assertEquals(1, targets.size());
        assertEquals(Integer.valueOf(2), targets.get(0));
    }

    @Test
    public void testRandomPicksOneLivingOpponentReproducibly() {
        List<Integer> first = randomTargets();
        assertEquals(20, first.size());
        for (int t : first) {
            assertTrue("보낸 사람과 탈락자는 제외", t == 1 || t == 3);
        }
        assertEquals("같은 시드면 같은 순서", first, randomTargets());
    }

    private static List<Integer> randomTargets() {
        GarbageRouter.Events ev = new GarbageRouter.Events();
        List<Integer> targets = new ArrayList<>();
        ev.onGarbageSent = msg -> targets.add(msg.target);
        GarbageRouter router = new GarbageRouter(stillConfig(), 4, TargetingMode.RANDOM, ev);
        router.getPlayer(2).getGrid().getRise().forceGameOver();
        for (int i = 0; i < 20; i++) router.manualSend(router.getPlayer(0), 250);
        return targets;
    }

    private static Player startCombo(GarbageRouter router, int index) {
        Player p = router.getPlayer(index);
        GridCoordinator g = p.getGrid();
        g.placeTile(1, 0, 0);
        g.placeTile(1, 1, 0);
        g.placeTile(1, 2, 0);
        g.requestSettle();
        run(router, 2);
        return p;
    }

    @Test
    public void testForceDeliverIgnoresCombo() {
        GarbageRouter.Events ev = new GarbageRouter.Events();
        List<GarbageMessage> received = new ArrayList<>();
        ev.onGarbageReceived = received::add;
        GarbageRouter router = new GarbageRouter(stillConfig(), 2, TargetingMode.SEQUENTIAL, ev);

        Player p1 = startCombo(router, 1);
        assertTrue(p1.isInCombo());
        router.manualSend(router.getPlayer(0), 500);
        assertEquals(500, p1.getPendingIncoming());

        router.forceDeliver(p1);
        assertEquals(0, p1.getPendingIncoming());
        assertEquals(1, received.size());
        assertEquals(500, received.get(0).score);
        assertTrue("바로 대기열에 들어감", p1.getGrid().getGarbageManager().getQueuedRequestCount() > 0);
    }

    @Test
    public void testClearPendingDropsIncomingAttack() {
        GarbageRouter.Events ev = new GarbageRouter.Events();
        List<GarbageMessage> received = new ArrayList<>();
        ev.onGarbageReceived = received::add;
        GarbageRouter router = new GarbageRouter(stillConfig(), 2, TargetingMode.SEQUENTIAL, ev);

        Player p1 = startCombo(router, 1);
        router.manualSend(router.getPlayer(0), 500);
        router.clearPending(p1);

        assertEquals(0, p1.getPendingIncoming());
        router.forceDeliver(p1);
        assertTrue("받을 것이 없음", received.isEmpty());
        assertEquals(0, p1.getGrid().getGarbageManager().getQueuedRequestCount());
    }

    @Test
    public void testComboEndSendsAfterDelay() {
        GarbageRouter.Events ev = new GarbageRouter.Events();
        List<GarbageMessage> received = new ArrayList<>();
        ev.onGarbageReceived = received::add;
        GarbageRouter router = new GarbageRouter(stillConfig(), 2, TargetingMode.SEQUENTIAL, ev);

        // 50 + 50 + 콤보 2 → 100 + 체인 2 → 100
        router.onComboEnded(router.getPlayer(0), combo(3, 3));
        assertEquals(1, router.getPendingSendCount());
        assertTrue(received.isEmpty());

        run(router, 31);
        assertEquals(0, router.getPendingSendCount());
        assertEquals(1, received.size());
        assertEquals(300, received.get(0).score);
        assertEquals("300 → 1x1 하나, 50 버림", 1, received.get(0).blocks.size());
        assertEquals(1, router.getPlayer(1).getGrid().getPendingGarbageCount());
    }

    @Test
    public void testDeliveryWaitsForTargetComboThenCounters() {
        GarbageRouter.Events ev = new GarbageRouter.Events();
        List<GarbageMessage> countered = new ArrayList<>();
        List<GarbageMessage> received = new ArrayList<>();
        ev.onGarbageCountered = countered::add;
        ev.onGarbageReceived = received::add;
        GarbageRouter router = new GarbageRouter(stillConfig(), 2, TargetingMode.SEQUENTIAL, ev);

        Player p1 = router.getPlayer(1);
        GridCoordinator g1 = p1.getGrid();
        g1.placeTile(1, 0, 0);
        g1.placeTile(1, 1, 0);
        g1.placeTile(1, 2, 0);
        g1.requestSettle();
        run(router, 2);
        assertTrue("콤보 진행 중", p1.isInCombo());

        router.manualSend(router.getPlayer(0), 500);
        assertEquals("콤보 중에는 대기", 500, p1.getPendingIncoming());
        assertEquals(0, g1.getGarbageManager().getQueuedRequestCount());

        run(router, 300);
        assertFalse(p1.isInCombo());
        // 3개 매치 → 공격 50, 대기 500 에서 상쇄
        assertEquals(1, countered.size());
        assertEquals(50, countered.get(0).score);
        assertEquals(1, received.size());
        assertEquals(450, received.get(0).score);
        assertEquals(0, p1.getPendingIncoming());
    }

    @Test
    public void testLastSurvivorWins() {
        GarbageRouter.Events ev = new GarbageRouter.Events();
        List<GarbageRouter.GameResult> results = new ArrayList<>();
        ev.onMatchFinished = results::add;
        GarbageRouter router = new GarbageRouter(stillConfig(), 2, TargetingMode.SEQUENTIAL, ev);

        router.getPlayer(1).getGrid().getRise().forceGameOver();
        assertTrue(router.isFinished());
        assertEquals(1, results.size());
        assertEquals(0, router.getResult().winner);
        assertEquals(2, router.getResult().scores.length);
    }

    @Test
    public void testTimeLimitTieIsDraw() {
        GarbageRouter router = new GarbageRouter(stillConfig(), 2, null);
        assertNull(router.getResult());
        GarbageRouter.GameResult result = router.finishByTime();
        assertEquals(-1, result.winner);
        assertTrue(router.isFinished());
        assertTrue(result.toString().contains("DRAW"));
    }
}
