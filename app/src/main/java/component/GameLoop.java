package component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * GameLoop (고정 스텝)
 * - 스케줄러 스레드 하나에서 tick(dt) 을 일정 간격으로 호출
 * - pause 중에는 tick 자체가 스킵됨
 * - 테스트/헤드리스 실행은 step() 으로 직접 진행
 */
public class GameLoop {
    public static final float DEFAULT_STEP = 1f / 60f;

    private final Consumer<Float> tick;
    private final BooleanSupplier finished;
    private final float step;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> future;

    private volatile boolean running = false;
    private volatile boolean paused  = false;
    private long steps = 0;

    /**
     * @param tick     한 스텝 진행 (dt 초)
     * @param finished true 가 되면 루프 정지 (게임 종료)
     */
    public GameLoop(Consumer<Float> tick, BooleanSupplier finished, float step) {
        if (tick == null) throw new IllegalArgumentException("tick must not be null");
        if (step <= 0f) throw new IllegalArgumentException("step must be positive: " + step);
        this.tick = tick;
        this.finished = (finished != null) ? finished : () -> false;
        this.step = step;
    }

    public GameLoop(Consumer<Float> tick, BooleanSupplier finished) {
        this(tick, finished, DEFAULT_STEP);
    }

    /* ===== 메인 제어 ===== */
    public synchronized void start() {
        if (running) return;
        running = true;
        paused  = false;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "game-loop");
            t.setDaemon(true);
            return t;
        });
        long periodMicros = Math.max(1L, (long) (step * 1_000_000L));
        future = scheduler.scheduleAtFixedRate(this::runOnce, 0L, periodMicros, TimeUnit.MICROSECONDS);
        System.out.println("[GameLoop] started (step=" + step + "s)");
    }

    public synchronized void stop() {
        running = false;
        paused  = false;
        if (future != null) future.cancel(false);
        if (scheduler != null) scheduler.shutdown();
        future = null;
        scheduler = null;
    }

    public void pause()  { paused = true;  }
    public void resume() { paused = false; }

    private void runOnce() {
        if (paused) return;
        try {
            step();
        } catch (RuntimeException e) {
            System.err.println("[ERROR][GameLoop] tick failed: " + e);
            e.printStackTrace();
            stop();
            return;
        }
        if (finished.getAsBoolean()) {
            System.out.println("[GameLoop] finished after " + steps + " steps");
            stop();
        }
    }

    /** 한 스텝 직접 진행 */
    public void step() {
        tick.accept(step);
        steps++;
    }

    /** n 스텝 직접 진행 (종료 조건이 되면 멈춤). 실제로 진행한 스텝 수 반환 */
    public int run(int n) {
        int done = 0;
        while (done < n && !finished.getAsBoolean()) {
            step();
            done++;
        }
        return done;
    }

    /* ===== 유틸 ===== */
    public float getStep() { return step; }
    public long getSteps() { return steps; }
    public boolean isRunning() { return running; }
    public boolean isPaused()  { return paused;  }
    public synchronized void cleanup() {
        stop();
        System.out.println("[GameLoop] Cleanup completed");
    }
}
