package logic;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Before;
import org.junit.Test;

import component.config.DifficultyProfile;

import static org.junit.Assert.*;

public class RiseControllerTest {

    private DifficultyProfile.Rise settings;
    private RiseController rise;

    @Before
    public void setUp() {
        settings = new DifficultyProfile.Rise();
        settings.baseRiseSpeed = 1f;          // 1 줄/초
        settings.speedLevelInterval = 0f;     // 레벨 고정
        rise = new RiseController(settings);
    }

    @Test
    public void testOffsetAccumulatesAndSpawnsRow() {
        assertFalse(rise.tick(0.5f, false, false, false));
        assertEquals(0.5f, rise.getOffset(), 1e-5f);
        assertTrue(rise.tick(0.6f, false, false, false));
        assertEquals("남은 만큼 이어짐", 0.1f, rise.getOffset(), 1e-4f);
    }

    @Test
    public void testSwappingAccumulatesDebtThenCatchesUp() {
        assertFalse(rise.tick(0.4f, true, false, false));
        assertEquals(0f, rise.getOffset(), 0f);
        assertEquals(0.4f, rise.getDebt(), 1e-5f);

        // 1.5배 속도로 갚는다: extra 0.5 줄/초 → debt 0.05 감소
        rise.tick(0.1f, false, false, false);
        assertEquals(0.15f, rise.getOffset(), 1e-5f);
        assertEquals(0.35f, rise.getDebt(), 1e-5f);

        for (int i = 0; i < 20; i++) rise.tick(0.05f, false, false, false);
        assertEquals(0f, rise.getDebt(), 1e-5f);
    }

    @Test
    public void testDebtRepaymentDoesNotDependOnLevel() {
        rise.getSpeedManager().setLevel(99);
        rise.tick(0.4f, true, false, false);
        assertEquals(0.4f, rise.getDebt(), 1e-5f);

        // 빠른 레벨에서도 실제 시간 기준으로 (배율-1)*dt 만큼만 줄어든다
        rise.tick(0.1f, false, false, false);
        assertEquals(0.35f, rise.getDebt(), 1e-5f);
    }

    @Test
    public void testProcessingPausesRise() {
        assertFalse(rise.tick(2f, false, true, false));
        assertEquals(0f, rise.getOffset(), 0f);
        assertEquals("연쇄 중에는 지연이 쌓이지 않음", 0f, rise.getDebt(), 0f);
    }

    @Test
    public void testBreathingRoomIsCappedAndConsumed() {
        rise.grantBreathingRoom(10);
        assertEquals(2f, rise.getBreathingRoom(), 1e-5f);
        rise.grantBreathingRoom(100);
        assertEquals(5f, rise.getBreathingRoom(), 1e-5f);

        rise.tick(1f, false, false, false);
        assertEquals(4f, rise.getBreathingRoom(), 1e-5f);
        assertEquals(0f, rise.getOffset(), 0f);
    }

    @Test
    public void testBreathingRoomCountsDownWhileSwapping() {
        rise.grantBreathingRoom(10);
        rise.tick(0.5f, true, false, false);
        assertEquals("교환 중에도 줄어든다", 1.5f, rise.getBreathingRoom(), 1e-5f);

        rise.tick(0.5f, false, true, false);
        assertEquals("연쇄 처리 중에는 그대로", 1.5f, rise.getBreathingRoom(), 1e-5f);

        rise.tick(0.5f, false, false, false);
        assertEquals(1f, rise.getBreathingRoom(), 1e-5f);
        assertEquals("남아 있는 동안은 상승 없음", 0f, rise.getOffset(), 0f);
    }

    @Test
    public void testFastRiseIsConsumedBySpawn() {
        rise.requestFastRise();
        assertTrue(rise.isFastRise());
        assertTrue("4배 속도", rise.tick(0.3f, false, false, false));
        assertFalse(rise.isFastRise());
    }

    @Test
    public void testGraceExpiresIntoGameOver() {
        AtomicInteger grace = new AtomicInteger();
        AtomicInteger over = new AtomicInteger();
        rise.setOnGraceStarted(grace::incrementAndGet);
        rise.setOnGameOver(over::incrementAndGet);

        rise.tick(0.5f, false, false, true);
        assertTrue(rise.isGraceActive());
        assertEquals(1, grace.get());

        // 연쇄 중에는 유예 시간이 줄지 않음
        rise.tick(5f, false, true, true);
        assertFalse(rise.isGameOver());

        rise.tick(1.1f, false, false, true);
        assertTrue(rise.isGameOver());
        assertEquals(1, over.get());
        assertFalse(rise.tick(1f, false, false, false));
    }

    @Test
    public void testGraceClearsWhenTopRowFrees() {
        rise.tick(0.5f, false, false, true);
        assertTrue(rise.isGraceActive());
        rise.tick(0.1f, false, false, false);
        assertFalse(rise.isGraceActive());
        assertFalse(rise.isGameOver());
    }

    @Test
    public void testHoldAtTopAndRowActivity() {
        rise.holdAtTop();
        assertEquals(0.999f, rise.getOffset(), 1e-6f);
        assertTrue(rise.isRowActive(0));
        assertFalse("대기줄은 아직 비활성", rise.isRowActive(-1));
    }

    @Test
    public void testReset() {
        rise.grantBreathingRoom(3);
        rise.forceGameOver();
        rise.reset();
        assertFalse(rise.isGameOver());
        assertEquals(0f, rise.getBreathingRoom(), 0f);
        assertEquals(1, rise.getSpeedManager().getLevel());
    }
}
