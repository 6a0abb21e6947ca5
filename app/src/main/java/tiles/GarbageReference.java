package tiles;

/** 가비지 블록이 덮는 앵커 이외의 칸. 상태는 없고 블록만 가리킨다 */
public class GarbageReference implements Occupant {
    private final GarbageBlock block;

    public GarbageReference(GarbageBlock block) {
        this.block = block;
    }

    public GarbageBlock getBlock() {
        return block;
    }

    @Override
    public boolean isGarbage() {
        return true;
    }

    @Override
    public Occupant owner() {
        return block;
    }

    @Override
    public String toString() {
        return "Ref->" + block.getId();
    }
}
