package tiles;

/** 타일 이동 상태 */
public enum TileState {
    IDLE,       // 정지, 위치 확정
    SWAPPING,   // 인접 칸 교환 / 넛지 중
    FALLING     // 낙하 중 (목표 칸은 이미 배열에 커밋됨)
}
