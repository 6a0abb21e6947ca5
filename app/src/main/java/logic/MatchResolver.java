package logic;

import java.util.Collections;
import java.util.List;

import component.config.DifficultyProfile;
import tiles.Tile;

/**
 * 연쇄(캐스케이드) 루프
 * -----------------------
 * IDLE → SCANNING → HIGHLIGHTING → SCORING → POPPING → SETTLING → SCANNING ...
 * - 빈 스캔이면 콤보 종료 이벤트 후 IDLE
 * - 단계 수가 width × height 를 넘으면 에러 로그 후 강제 종료
 * - 실제 제거/낙하/가비지 변환은 Listener(코디네이터)를 통해 요청
 */
public class MatchResolver {

    public enum Phase {
        IDLE,
        SCANNING,
        HIGHLIGHTING,
        SCORING,
        POPPING,
        SETTLING
    }

    /** SETTLING 세부 단계 */
    private enum Settle {
        DELAY,
        CONVERSION,
        GRAVITY
    }

    public interface Listener {
        /** 하이라이트 시작: 주변 칸 알림 (상태 치료, 가비지 변환) */
        default void onMatchHighlighted(List<MatchGroup> groups) {}

        default void onComboStarted() {}

        /** 한 단계 점수 처리. cascade 는 두 번째 단계부터 true */
        default void onStepScored(List<MatchGroup> groups, ComboState combo, boolean cascade) {}

        default void onTilePopped(Tile tile, ComboState combo) {}

        default void onComboEnded(ComboState finalCombo) {}

        default boolean isConversionInProgress() { return false; }

        /** 중력 실행 후 정착 시간 반환 */
        default float runGravity() { return 0f; }

        /** 낙하 중인 타일/가비지가 남아 있는지 */
        default boolean isFalling() { return false; }
    }

    private final GridState grid;
    private final MatchDetector detector;
    private final AnimationManager anim;
    private final DifficultyProfile.Timing timing;
    private final Listener listener;
    private final boolean verbose;
    private final int stepCeiling;

    private final ComboState combo = new ComboState();

    private Phase phase = Phase.IDLE;
    private Settle settle = Settle.DELAY;
    private boolean scanRequested = false;
    private int steps = 0;
    private float timer = 0f;
    private float popElapsed = 0f;

    private List<MatchGroup> current = Collections.emptyList();
    private int[] popped = new int[0];

    public MatchResolver(GridState grid, MatchDetector detector, AnimationManager anim,
            DifficultyProfile.Timing timing, Listener listener, boolean verbose) {
        this.grid = grid;
        this.detector = detector;
        this.anim = anim;
        this.timing = timing;
        this.listener = (listener != null) ? listener : new Listener() {};
        this.verbose = verbose;
        this.stepCeiling = grid.getWidth() * grid.getHeight();
    }

    /** 다음 tick 에서 스캔 (연쇄 진행 중이면 무시, 루프가 알아서 다시 스캔함) */
    public void requestScan() {
        if (phase == Phase.IDLE) scanRequested = true;
    }

    public void tick(float dt) {
        if (phase == Phase.IDLE) {
            if (!scanRequested) return;
            scanRequested = false;
            phase = Phase.SCANNING;
        }

        switch (phase) {
            case SCANNING:
                scan();
                break;
            case HIGHLIGHTING:
                timer -= dt;
                if (timer <= 0f) {
                    phase = Phase.SCORING;
                    score();
                }
                break;
            case POPPING:
                popElapsed += dt;
                pop();
                break;
            case SETTLING:
                settle(dt);
                break;
            default:
                break;
        }
    }

    private void scan() {
        List<MatchGroup> groups = detector.findMatchGroups();
        if (groups.isEmpty()) {
            endCombo();
            return;
        }
        steps++;
        if (steps > stepCeiling) {
            System.err.println("[ERROR][Match] cascade step ceiling " + stepCeiling + " exceeded, ending combo");
            endCombo();
            return;
        }

        current = groups;
        popped = new int[groups.size()];
        for (MatchGroup g : groups) {
            for (Tile t : g.getTiles()) t.setProcessing(true);
        }
        if (!combo.isActive()) listener.onComboStarted();

        phase = Phase.HIGHLIGHTING;
        timer = timing.matchHighlightDuration;
        if (verbose) System.out.println("[Match] step " + steps + ": " + groups);
        listener.onMatchHighlighted(groups);
    }

    private void score() {
        boolean cascade = combo.isActive();
        combo.recordStep(current);
        listener.onStepScored(current, combo, cascade);

        phase = Phase.POPPING;
        popElapsed = 0f;
        pop();
    }

    /** 그룹마다 popStagger 간격으로 한 개씩, 그룹끼리는 동시에 */
    private void pop() {
        boolean done = true;
        for (int g = 0; g < current.size(); g++) {
            List<Tile> tiles = current.get(g).getTiles();
            while (popped[g] < tiles.size() && popped[g] * timing.popStagger <= popElapsed) {
                Tile t = tiles.get(popped[g]++);
                grid.removeIfSame(t, t.getX(), t.getY());
                anim.forget(t.getId());
                listener.onTilePopped(t, combo);
            }
            if (popped[g] < tiles.size()) done = false;
        }
        if (done) {
            phase = Phase.SETTLING;
            settle = Settle.DELAY;
            timer = timing.popSettleDelay;
        }
    }

    private void settle(float dt) {
        switch (settle) {
            case DELAY:
                timer -= dt;
                if (timer > 0f) return;
                for (MatchGroup g : current) {
                    for (Tile t : g.getTiles()) t.setProcessing(false);
                }
                settle = Settle.CONVERSION;
                // fall through
            case CONVERSION:
                if (listener.isConversionInProgress()) return;
                timer = listener.runGravity();
                settle = Settle.GRAVITY;
                return;
            case GRAVITY:
                timer -= dt;
                if (timer > 0f || listener.isFalling()) return;
                phase = Phase.SCANNING;
                scan();
                return;
            default:
                break;
        }
    }

    private void endCombo() {
        if (combo.isActive()) {
            ComboState result = combo.snapshot();
            System.out.println("[Match] combo ended: " + result);
            listener.onComboEnded(result);
        }
        combo.reset();
        steps = 0;
        current = Collections.emptyList();
        phase = Phase.IDLE;
    }

    /** 연쇄 진행 중 (상승 정지 조건) */
    public boolean isProcessing() {
        return phase != Phase.IDLE;
    }

    public Phase getPhase() {
        return phase;
    }

    public ComboState getCombo() {
        return combo;
    }

    public int getSteps() {
        return steps;
    }

    public void reset() {
        combo.reset();
        steps = 0;
        current = Collections.emptyList();
        scanRequested = false;
        phase = Phase.IDLE;
    }
}
