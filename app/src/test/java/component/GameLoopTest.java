package component;

import org.junit.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class GameLoopTest {

    @Test
    public void testStepPassesFixedDt() {
        float[] last = new float[1];
        GameLoop loop = new GameLoop(dt -> last[0] = dt, null, 0.02f);
        loop.step();
        assertEquals(0.02f, last[0], 0f);
        assertEquals(1, loop.getSteps());
    }

    @Test
    public void testRunStopsWhenFinished() {
        AtomicInteger ticks = new AtomicInteger();
        GameLoop loop = new GameLoop(dt -> ticks.incrementAndGet(), () -> ticks.get() >= 10);

        assertEquals("종료 조건에서 멈춤", 10, loop.run(100));
        assertEquals(10, ticks.get());
        assertEquals(0, loop.run(5));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNonPositiveStep() {
        new GameLoop(dt -> {}, null, 0f);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNullTick() {
        new GameLoop(null, null);
    }

    @Test
    public void testScheduledLoopRunsUntilFinished() throws Exception {
        CountDownLatch latch = new CountDownLatch(5);
        AtomicInteger ticks = new AtomicInteger();
        GameLoop loop = new GameLoop(dt -> {
            ticks.incrementAndGet();
            latch.countDown();
        }, () -> ticks.get() >= 5, 0.005f);

        loop.start();
        assertTrue("스케줄러가 tick 을 돌려야 함", latch.await(2, TimeUnit.SECONDS));
        Thread.sleep(100);
        assertFalse("끝나면 스스로 멈춤", loop.isRunning());
        assertEquals(5, ticks.get());
        loop.cleanup();
    }

    @Test
    public void testPauseSkipsTicks() throws Exception {
        AtomicInteger ticks = new AtomicInteger();
        GameLoop loop = new GameLoop(dt -> ticks.incrementAndGet(), null, 0.005f);
        loop.start();
        loop.pause();
        assertTrue(loop.isPaused());
        Thread.sleep(50);
        int frozen = ticks.get();
        Thread.sleep(100);
        assertEquals("일시정지 중에는 진행 없음", frozen, ticks.get());

        loop.resume();
        Thread.sleep(100);
        assertTrue(ticks.get() > frozen);
        loop.stop();
        assertFalse(loop.isRunning());
    }
}
