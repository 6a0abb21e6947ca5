package versus;

/** 공격 대상 선택 방식 */
public enum TargetingMode {
    SEQUENTIAL,      // 보낸 사람 다음부터 돌아가며
    SPLIT_EVENLY,    // 살아 있는 상대 모두에게 나눠서
    ALL_OPPONENTS,   // 모두에게 전액
    RANDOM,
    LOWEST_STACK,
    HIGHEST_STACK;

    public static TargetingMode parse(String name) {
        if (name == null) return SEQUENTIAL;
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown targeting mode: " + name, e);
        }
    }
}
