package versus;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import component.config.BlockCost;

/**
 * 라우팅 이벤트 한 건. 프로세스 안에서는 (sender, target, score) 로 쓰이고,
 * GarbageMessageCodec 으로 JSON 직렬화할 수 있다
 */
public class GarbageMessage implements Serializable {
    private static final long serialVersionUID = 1L;

    public MessageType type;
    public int sender = -1;
    public int target = -1;
    public int score;
    public List<BlockCost> blocks = new ArrayList<>();

    public GarbageMessage() {}

    public GarbageMessage(MessageType type, int sender, int target, int score) {
        this.type = type;
        this.sender = sender;
        this.target = target;
        this.score = score;
    }

    @Override
    public String toString() {
        return "GarbageMessage{type=" + type + ", " + sender + "->" + target + ", score=" + score
                + (blocks.isEmpty() ? "" : ", blocks=" + blocks) + "}";
    }
}
