package logic;

/**
 * 2칸 가로 커서. (x, y) 가 왼쪽 칸, 오른쪽 칸은 (x+1, y)
 */
public class Cursor {
    private final int width;
    private final int height;
    private int x;
    private int y;

    public Cursor(int width, int height) {
        if (width < 2) throw new IllegalArgumentException("cursor needs width >= 2");
        this.width = width;
        this.height = height;
        this.x = (width - 2) / 2;
        this.y = 0;
    }

    public int getX() { return x; }
    public int getY() { return y; }

    public void moveBy(int dx, int dy) {
        setPosition(x + dx, y + dy);
    }

    public void setPosition(int nx, int ny) {
        this.x = Math.max(0, Math.min(nx, width - 2));
        this.y = Math.max(0, Math.min(ny, height - 1));
    }

    /** 줄 삽입 시 같은 타일을 가리키도록 한 칸 위로 */
    public void shiftUp() {
        moveBy(0, 1);
    }

    @Override
    public String toString() {
        return "Cursor(" + x + "," + y + ")";
    }
}
