package tiles;

import java.awt.Point;
import java.util.ArrayList;
import java.util.List;

/**
 * 여러 칸을 덮는 가비지 블록.
 * 앵커(x, y) = 왼쪽 아래 칸. 앵커 칸에는 블록 자체가, 나머지 칸에는 GarbageReference 가 들어간다.
 * 상태는 앵커만 가진다.
 */
public class GarbageBlock implements Occupant {
    private final int id;
    private final int width;
    private final int height;

    private int x;
    private int y;
    private float visualY;

    private boolean falling = false;
    private boolean converting = false;
    private float conversionTimer = 0f;

    public GarbageBlock(int id, int x, int y, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("garbage size must be positive: " + width + "x" + height);
        }
        this.id = id;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.visualY = y;
    }

    @Override
    public boolean isGarbage() {
        return true;
    }

    public int getId() { return id; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }

    public int getX() { return x; }
    public int getY() { return y; }
    public void setAnchor(int x, int y) { this.x = x; this.y = y; }

    public float getVisualY() { return visualY; }
    public void setVisualY(float visualY) { this.visualY = visualY; }

    public boolean isFalling() { return falling; }
    public void setFalling(boolean falling) { this.falling = falling; }

    public boolean isConverting() { return converting; }

    public void startConversion(float delay) {
        this.converting = true;
        this.conversionTimer = delay;
    }

    /** 변환 대기시간 감소. 변환할 차례가 되면 true */
    public boolean tickConversion(float dt) {
        if (!converting) return false;
        conversionTimer -= dt;
        return conversionTimer <= 0f;
    }

    /** 착지 완료 + 변환 중 아님 */
    public boolean isSettled() {
        return !falling && !converting;
    }

    public boolean covers(int cx, int cy) {
        return cx >= x && cx < x + width && cy >= y && cy < y + height;
    }

    public List<Point> getOccupiedCells() {
        List<Point> cells = new ArrayList<>(width * height);
        for (int gy = y; gy < y + height; gy++) {
            for (int gx = x; gx < x + width; gx++) {
                cells.add(new Point(gx, gy));
            }
        }
        return cells;
    }

    @Override
    public String toString() {
        return "Garbage#" + id + "[" + width + "x" + height + " @(" + x + "," + y + ")"
                + (falling ? " F" : "") + (converting ? " C" : "") + "]";
    }
}
