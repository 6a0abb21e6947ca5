package logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 한 번의 연쇄 루프 동안 누적되는 콤보/체인 정보
 * - combo: 이번 루프의 매치 단계 수
 * - chain: 첫 단계 0, 첫 캐스케이드 2, 이후 +1
 */
public class ComboState {
    private int combo = 0;
    private int chain = 0;
    private int maxChain = 0;
    private int totalTiles = 0;
    private final List<Integer> matchSizes = new ArrayList<>();

    /** 한 단계 기록. 이번 단계의 체인 레벨을 돌려준다 */
    public int recordStep(List<MatchGroup> groups) {
        combo++;
        chain = (combo == 1) ? 0 : combo;
        maxChain = Math.max(maxChain, chain);
        for (MatchGroup g : groups) {
            matchSizes.add(g.size());
            totalTiles += g.size();
        }
        return chain;
    }

    public int getCombo() { return combo; }
    public int getChain() { return chain; }
    public int getMaxChain() { return maxChain; }
    public int getTotalTiles() { return totalTiles; }

    public boolean isActive() {
        return combo > 0;
    }

    public List<Integer> getMatchSizes() {
        return Collections.unmodifiableList(matchSizes);
    }

    /** 콜백에 넘길 복사본 */
    public ComboState snapshot() {
        ComboState copy = new ComboState();
        copy.combo = combo;
        copy.chain = chain;
        copy.maxChain = maxChain;
        copy.totalTiles = totalTiles;
        copy.matchSizes.addAll(matchSizes);
        return copy;
    }

    public void reset() {
        combo = 0;
        chain = 0;
        maxChain = 0;
        totalTiles = 0;
        matchSizes.clear();
    }

    @Override
    public String toString() {
        return "Combo{combo=" + combo + ", chain=" + chain + ", maxChain=" + maxChain + ", sizes=" + matchSizes + "}";
    }
}
