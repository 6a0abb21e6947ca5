package logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import tiles.Tile;

/** 연결된 매치 타일 묶음 (3개 이상, 같은 타입) */
public class MatchGroup {
    private final List<Tile> tiles;

    public MatchGroup(List<Tile> tiles) {
        this.tiles = Collections.unmodifiableList(new ArrayList<>(tiles));
    }

    public List<Tile> getTiles() {
        return tiles;
    }

    public int size() {
        return tiles.size();
    }

    public int getType() {
        return tiles.isEmpty() ? -1 : tiles.get(0).getType();
    }

    public boolean contains(Tile tile) {
        return tiles.contains(tile);
    }

    @Override
    public String toString() {
        return "MatchGroup{type=" + getType() + ", size=" + tiles.size() + "}";
    }
}
