package logic;

import tiles.Tile;

/** 한 번의 낙하 패스에서 나온 이동 기록 */
public class DropRecord {
    public final Tile tile;
    public final int fromX;
    public final int fromY;
    public final int toX;
    public final int toY;

    public DropRecord(Tile tile, int fromX, int fromY, int toX, int toY) {
        this.tile = tile;
        this.fromX = fromX;
        this.fromY = fromY;
        this.toX = toX;
        this.toY = toY;
    }

    public int distance() {
        return fromY - toY;
    }

    @Override
    public String toString() {
        return "Drop{" + tile.getId() + " (" + fromX + "," + fromY + ")->(" + toX + "," + toY + ")}";
    }
}
