package versus;

import java.util.function.Consumer;

import component.GameConfig;
import logic.ComboState;
import logic.GridCoordinator;

/** 대전 참가자 한 명 (그리드 하나 + 들어올 예정인 공격 점수) */
public class Player {

    public static class Events {
        public Consumer<Integer> onGameOver;       // 최종 점수
        public Consumer<ComboState> onComboEnded;  // 콤보 종료 → 라우터가 공격 계산
    }

    private final int index;
    private final GridCoordinator grid;
    public final Events events;

    // 상대에게서 받았지만 아직 블록으로 바꾸지 않은 점수 (콤보 중이면 대기)
    private int pendingIncoming = 0;

    public Player(int index, GameConfig config, Events events) {
        this.index = index;
        this.events = (events != null) ? events : new Events();

        GridCoordinator.Events gridEvents = new GridCoordinator.Events();
        gridEvents.onComboEnded = combo -> {
            if (this.events.onComboEnded != null) this.events.onComboEnded.accept(combo);
        };
        gridEvents.onGameOver = score -> {
            if (this.events.onGameOver != null) this.events.onGameOver.accept(score);
        };
        this.grid = new GridCoordinator(config, gridEvents);
    }

    public void start() {
        grid.start();
    }

    public void tick(float dt) {
        grid.tick(dt);
    }

    /* ===== 대기 공격 점수 ===== */

    public void addPendingIncoming(int score) {
        if (score <= 0) return;
        pendingIncoming += score;
        System.out.printf("[PLAYER %d] incoming +%d pending=%d%n", index, score, pendingIncoming);
    }

    /** 최대 amount 만큼 줄이고 실제로 줄인 양 반환 */
    public int reducePendingIncoming(int amount) {
        int reduced = Math.max(0, Math.min(amount, pendingIncoming));
        pendingIncoming -= reduced;
        return reduced;
    }

    /** 전부 꺼내고 0 으로 */
    public int takePendingIncoming() {
        int taken = pendingIncoming;
        pendingIncoming = 0;
        return taken;
    }

    public int getPendingIncoming() { return pendingIncoming; }

    /* ===== 편의 조회 ===== */
    public int index() { return index; }
    public GridCoordinator getGrid() { return grid; }
    public boolean isGameOver() { return grid.isGameOver(); }
    public boolean isInCombo() { return grid.isInCombo(); }
    public int getStackHeight() { return grid.getStackHeight(); }
    public int getScore() { return grid.getScore(); }

    @Override
    public String toString() {
        return "Player" + index + "{score=" + getScore() + ", pending=" + pendingIncoming
                + (isGameOver() ? ", OUT" : "") + "}";
    }
}
