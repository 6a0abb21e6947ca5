package versus;

/**
 * 가비지 라우팅 메시지 타입
 */
public enum MessageType {
    GARBAGE_SENT,        // 대상의 대기 점수에 추가됨
    GARBAGE_RECEIVED,    // 블록으로 바뀌어 대상 그리드 대기열에 들어감
    GARBAGE_COUNTERED    // 콤보 종료 시 들어올 점수를 상쇄
}
