package tiles;

/**
 * 그리드 한 칸을 차지하는 대상 (일반 타일, 가비지 앵커, 가비지 참조)
 */
public interface Occupant {

    boolean isGarbage();

    /** 상태를 가진 본체. GarbageReference 는 자신이 가리키는 블록을 돌려준다 */
    default Occupant owner() {
        return this;
    }
}
