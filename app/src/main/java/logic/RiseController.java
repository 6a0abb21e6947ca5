package logic;

import component.SpeedManager;
import component.config.DifficultyProfile;

/**
 * 스택 상승
 * -----------------------
 * 매 tick 우선순위:
 *   게임오버 → 유예(grace) → 교환 중(지연 누적) → 연쇄 처리 중 → 숨 돌릴 시간 → 상승
 * - offset 이 1 이상이 되면 true 반환 → 코디네이터가 한 줄 올린다
 * - 지연(debt)이 남아 있으면 catchUpMultiplier 배로 올라가며 갚는다
 */
public class RiseController {
    private final DifficultyProfile.Rise rise;
    private final SpeedManager speed;

    private float offset = 0f;
    private float breathingRoom = 0f;
    private float debt = 0f;

    private boolean graceActive = false;
    private float graceTimer = 0f;

    private boolean fastRise = false;
    private boolean gameOver = false;

    // 콜백
    private Runnable onGraceStarted;
    private Runnable onGameOver;

    public RiseController(DifficultyProfile.Rise rise) {
        this.rise = rise;
        this.speed = new SpeedManager(rise);
    }

    public void setOnGraceStarted(Runnable cb) { this.onGraceStarted = cb; }
    public void setOnGameOver(Runnable cb) { this.onGameOver = cb; }

    /**
     * @param swapping       교환/슬립 연산 진행 중
     * @param processing     연쇄 처리 중
     * @param topRowBlocked  맨 윗줄에 정지 타일 또는 정착한 가비지가 있음
     * @return 새 줄을 올려야 하면 true
     */
    public boolean tick(float dt, boolean swapping, boolean processing, boolean topRowBlocked) {
        if (gameOver) return false;
        speed.advance(dt);

        // 숨 돌리기는 연쇄 처리 중이 아니면 매 프레임 줄어든다
        if (!processing && breathingRoom > 0f) {
            breathingRoom = Math.max(0f, breathingRoom - dt);
        }

        // 유예
        if (topRowBlocked && !graceActive) {
            graceActive = true;
            graceTimer = rise.gracePeriod;
            System.out.println("[Rise] grace started (" + rise.gracePeriod + "s)");
            if (onGraceStarted != null) onGraceStarted.run();
        } else if (!topRowBlocked && graceActive) {
            graceActive = false;
            graceTimer = 0f;
            System.out.println("[Rise] grace cleared");
        }
        if (graceActive) {
            if (!processing) graceTimer -= dt;
            if (graceTimer <= 0f) triggerGameOver();
            return false;
        }

        if (swapping) {
            debt += dt;
            return false;
        }
        if (processing) return false;
        if (breathingRoom > 0f) return false;

        float s = speed.getRiseSpeed();
        if (fastRise) s *= rise.fastRiseMultiplier;
        if (debt > 0f) {
            // 초과분 (배율-1) 만큼 빚을 갚는다
            s *= rise.catchUpMultiplier;
            debt = Math.max(0f, debt - (rise.catchUpMultiplier - 1f) * dt);
        }
        offset += s * dt;

        if (offset >= 1f) {
            offset = Math.min(offset - 1f, 0.999f);
            fastRise = false;
            return true;
        }
        return false;
    }

    /** 줄 삽입이 실패했을 때 (맨 윗줄이 움직이는 중) 꼭대기에서 대기 */
    public void holdAtTop() {
        offset = 0.999f;
    }

    private void triggerGameOver() {
        if (gameOver) return;
        gameOver = true;
        graceActive = false;
        System.out.println("[Rise] grace expired → GAME OVER");
        if (onGameOver != null) onGameOver.run();
    }

    /** 외부 요인(강제 종료 등)으로 게임오버 */
    public void forceGameOver() {
        triggerGameOver();
    }

    /** 매치로 지운 타일 수만큼 상승 정지 시간 추가 */
    public void grantBreathingRoom(int tiles) {
        breathingRoom = Math.min(rise.maxBreathingRoom, breathingRoom + tiles * rise.breathingRoomPerTile);
    }

    public void requestFastRise() {
        if (!gameOver) fastRise = true;
    }

    public boolean isRowActive(int y) {
        return y + offset >= 0f;
    }

    public float getOffset() { return offset; }
    public float getBreathingRoom() { return breathingRoom; }
    public float getDebt() { return debt; }
    public boolean isGraceActive() { return graceActive; }
    public float getGraceTimer() { return graceTimer; }
    public boolean isFastRise() { return fastRise; }
    public boolean isGameOver() { return gameOver; }
    public SpeedManager getSpeedManager() { return speed; }

    public void reset() {
        offset = 0f;
        breathingRoom = 0f;
        debt = 0f;
        graceActive = false;
        graceTimer = 0f;
        fastRise = false;
        gameOver = false;
        speed.resetLevel();
    }
}
