package tiles;

/**
 * Tile
 * -----------------------
 * - 그리드의 일반 타일 하나 (타입, 논리 좌표, 이동 상태, 시각 좌표)
 * - 논리 좌표(x, y)는 항상 배열에 저장된 칸과 같다. 이동 중에는 목표 칸이 커밋되어 있고
 *   visualX/visualY 만 보간된다
 */
public class Tile implements Occupant {
    private final int id;
    private final int type;

    private int x;
    private int y;
    private float visualX;
    private float visualY;

    private TileState state = TileState.IDLE;
    private boolean processing = false;   // 매치 연출 중

    // 상태 이상 시스템이 설정하는 능력 플래그
    private boolean canMatch = true;
    private boolean canSwap = true;
    private boolean momentum = false;
    private int momentumDirection = 0;    // 마지막 교환 방향 (-1, 0, +1)

    private TileStatus status = TileStatus.NONE;
    private float statusTimer = 0f;

    public Tile(int id, int type, int x, int y) {
        this.id = id;
        this.type = type;
        this.x = x;
        this.y = y;
        this.visualX = x;
        this.visualY = y;
    }

    @Override
    public boolean isGarbage() {
        return false;
    }

    public int getId() { return id; }
    public int getType() { return type; }

    public int getX() { return x; }
    public int getY() { return y; }
    public void setPosition(int x, int y) { this.x = x; this.y = y; }

    public float getVisualX() { return visualX; }
    public float getVisualY() { return visualY; }
    public void setVisual(float vx, float vy) { this.visualX = vx; this.visualY = vy; }

    /** 논리 좌표로 시각 좌표를 맞춘다 */
    public void snapVisual() {
        this.visualX = x;
        this.visualY = y;
    }

    public TileState getState() { return state; }
    public boolean isIdle() { return state == TileState.IDLE; }
    public boolean isFalling() { return state == TileState.FALLING; }
    public boolean isSwapping() { return state == TileState.SWAPPING; }

    public void startSwapping(int targetX, int targetY) {
        this.state = TileState.SWAPPING;
        this.x = targetX;
        this.y = targetY;
    }

    public void startFalling(int targetX, int targetY) {
        this.state = TileState.FALLING;
        this.x = targetX;
        this.y = targetY;
    }

    public void finishMovement() {
        this.state = TileState.IDLE;
    }

    public boolean isProcessing() { return processing; }
    public void setProcessing(boolean processing) { this.processing = processing; }

    public boolean canMatch() { return canMatch; }
    public void setCanMatch(boolean canMatch) { this.canMatch = canMatch; }

    public boolean canSwap() { return canSwap; }
    public void setCanSwap(boolean canSwap) { this.canSwap = canSwap; }

    public boolean hasMomentum() { return momentum; }
    public void setMomentum(boolean momentum) { this.momentum = momentum; }

    public int getMomentumDirection() { return momentumDirection; }
    public void setMomentumDirection(int dir) { this.momentumDirection = Integer.signum(dir); }

    public TileStatus getStatus() { return status; }
    public float getStatusTimer() { return statusTimer; }
    public boolean hasStatus() { return status != TileStatus.NONE; }

    public void setStatus(TileStatus status, float duration) {
        this.status = (status != null) ? status : TileStatus.NONE;
        this.statusTimer = duration;
    }

    /** 남은 시간 감소. 이번 호출로 만료되었으면 true */
    public boolean tickStatus(float dt) {
        if (status == TileStatus.NONE || statusTimer <= 0f) return false;
        statusTimer -= dt;
        return statusTimer <= 0f;
    }

    /** 타일이 매치/교환/낙하 등 어떤 처리에도 묶여 있지 않은지 */
    public boolean isSettled() {
        return state == TileState.IDLE && !processing;
    }

    @Override
    public String toString() {
        return "Tile#" + id + "[t=" + type + " (" + x + "," + y + ") " + state
                + (processing ? " P" : "") + (status != TileStatus.NONE ? " " + status : "") + "]";
    }
}
