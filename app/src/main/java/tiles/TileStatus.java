package tiles;

/** 상태 이상. 능력 플래그(canMatch/canSwap)는 StatusEffectManager 가 타일에 직접 설정 */
public enum TileStatus {
    NONE,
    FROZEN,     // 얼음: 교환 후 막힐 때까지 같은 방향으로 미끄러짐
    BURNING,    // 매치 불가, 인접 매치로 해제
    POISONED,   // 주변으로 전염
    LOCKED,     // 교환/매치 불가
    CHARGED;

    public boolean blocksSwap() {
        return this == LOCKED;
    }

    public boolean blocksMatch() {
        return this == BURNING || this == LOCKED;
    }

    public boolean hasMomentum() {
        return this == FROZEN;
    }
}
