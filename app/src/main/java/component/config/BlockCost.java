package component.config;

/** 가비지 블록 한 종류의 크기와 비용 (cost <= 0 이면 비활성) */
public class BlockCost {
    public int width = 1;
    public int height = 1;
    public int cost = 0;

    public BlockCost() {}

    public BlockCost(int width, int height, int cost) {
        this.width = width;
        this.height = height;
        this.cost = cost;
    }

    public boolean isEnabled() {
        return cost > 0 && width > 0 && height > 0;
    }

    @Override
    public String toString() {
        return width + "x" + height + ":" + cost;
    }
}
