package logic;

/**
 * 플레이어 입력 명령. 거부된 교환은 false
 */
public interface CursorCommands {
    void moveLeft();

    void moveRight();

    void moveUp();

    void moveDown();

    boolean swap();

    void fastRise();
}
