package logic;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import component.config.DifficultyProfile;
import tiles.Tile;
import tiles.TileStatus;

/**
 * 타일 상태 이상 관리
 * - 상태 부여 시 능력 플래그(canSwap/canMatch/momentum)를 직접 설정하고, 만료 시 되돌린다
 * - BURNING 은 인접 매치로 해제
 * - POISONED 는 poisonSpreadInterval 마다 poisonSpreadChance 확률로 주변에 전염
 */
public class StatusEffectManager {
    private final GridState grid;
    private final DifficultyProfile.Status settings;
    private final Random random;

    private float spreadTimer = 0f;

    public StatusEffectManager(GridState grid, DifficultyProfile.Status settings, long seed) {
        this.grid = grid;
        this.settings = settings;
        this.random = new Random(seed);
    }

    public void apply(Tile tile, TileStatus status) {
        if (tile == null) return;
        if (status == null || status == TileStatus.NONE) {
            clear(tile);
            return;
        }
        tile.setStatus(status, durationOf(status));
        tile.setCanSwap(!status.blocksSwap());
        tile.setCanMatch(!status.blocksMatch());
        tile.setMomentum(status.hasMomentum());
        System.out.println("[Status] " + status + " → " + tile);
    }

    public void clear(Tile tile) {
        tile.setStatus(TileStatus.NONE, 0f);
        tile.setCanSwap(true);
        tile.setCanMatch(true);
        tile.setMomentum(false);
        tile.setMomentumDirection(0);
    }

    float durationOf(TileStatus status) {
        switch (status) {
            case FROZEN: return settings.frozenDuration;
            case BURNING: return settings.burningDuration;
            case POISONED: return settings.poisonedDuration;
            case LOCKED: return settings.lockedDuration;
            case CHARGED: return settings.chargedDuration;
            default: return 0f;
        }
    }

    public void tick(float dt) {
        List<Tile> tiles = grid.getTiles();
        for (Tile t : tiles) {
            if (t.tickStatus(dt)) {
                System.out.println("[Status] expired " + t.getStatus() + " on " + t);
                clear(t);
            }
        }

        spreadTimer += dt;
        if (spreadTimer >= settings.poisonSpreadInterval) {
            spreadTimer -= settings.poisonSpreadInterval;
            spreadPoison(tiles);
        }
    }

    private void spreadPoison(List<Tile> tiles) {
        List<Tile> infected = new ArrayList<>();
        for (Tile t : tiles) {
            if (t.getStatus() != TileStatus.POISONED) continue;
            for (Tile n : neighbours(t)) {
                if (n.hasStatus() || infected.contains(n)) continue;
                if (random.nextFloat() < settings.poisonSpreadChance) infected.add(n);
            }
        }
        for (Tile t : infected) apply(t, TileStatus.POISONED);
    }

    /** 매치 하이라이트 시: 인접 BURNING 타일 해제 */
    public int onMatchHighlighted(List<MatchGroup> groups) {
        int cured = 0;
        for (MatchGroup g : groups) {
            for (Tile t : g.getTiles()) {
                for (Tile n : neighbours(t)) {
                    if (n.getStatus() == TileStatus.BURNING && !g.contains(n)) {
                        clear(n);
                        cured++;
                    }
                }
            }
        }
        if (cured > 0) System.out.println("[Status] cured " + cured + " burning tile(s)");
        return cured;
    }

    private List<Tile> neighbours(Tile t) {
        List<Tile> list = new ArrayList<>(4);
        Tile n;
        if ((n = grid.getTile(t.getX() + 1, t.getY())) != null) list.add(n);
        if ((n = grid.getTile(t.getX() - 1, t.getY())) != null) list.add(n);
        if ((n = grid.getTile(t.getX(), t.getY() + 1)) != null) list.add(n);
        if ((n = grid.getTile(t.getX(), t.getY() - 1)) != null) list.add(n);
        return list;
    }
}
