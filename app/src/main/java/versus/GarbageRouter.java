package versus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Random;
import java.util.function.Consumer;

import component.GameConfig;
import component.config.BlockCost;
import component.config.DifficultyProfile;
import logic.ComboState;

/**
 * GarbageRouter
 * - N 명의 Player 를 생성/보유하고 tick 을 돌린다
 * - 콤보 종료 → 공격 점수 계산 → (상쇄) → sendDelay 후 대상에게 전송
 * - 대상이 콤보 중이면 대기 점수로만 쌓고, 콤보가 끝날 때 블록으로 바꿔 넣는다
 * - 게임오버 그리드는 대상에서 제외
 */
public class GarbageRouter {

    public static class Events {
        public Consumer<GarbageMessage> onGarbageSent;
        public Consumer<GarbageMessage> onGarbageReceived;
        public Consumer<GarbageMessage> onGarbageCountered;
        public Consumer<Player> onPlayerEliminated;
        public Consumer<GameResult> onMatchFinished;
    }

    public static class GameResult {
        public final int winner;   // 무승부면 -1
        public final int[] scores;

        public GameResult(int winner, int[] scores) {
            this.winner = winner;
            this.scores = scores;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("GameResult{winner=");
            sb.append(winner < 0 ? "DRAW" : "P" + winner).append(", scores=[");
            for (int i = 0; i < scores.length; i++) {
                if (i > 0) sb.append(", ");
                sb.append(scores[i]);
            }
            return sb.append("]}").toString();
        }
    }

    /** sendDelay 대기 중인 공격 */
    private static final class PendingSend {
        final Player sender;
        final int score;
        float timer;

        PendingSend(Player sender, int score, float timer) {
            this.sender = sender;
            this.score = score;
            this.timer = timer;
        }
    }

    private final List<Player> players = new ArrayList<>();
    private final GarbageEconomy economy;
    private final DifficultyProfile.Garbage settings;
    private final TargetingMode mode;
    private final Random random;
    public final Events events;

    private final int[] nextTarget;
    private final List<PendingSend> pendingSends = new ArrayList<>();
    private boolean finished = false;
    private GameResult result;

    public GarbageRouter(GameConfig config, int playerCount, Events events) {
        this(config, playerCount, TargetingMode.parse(config.profile().garbage.targetingMode), events);
    }

    public GarbageRouter(GameConfig config, int playerCount, TargetingMode mode, Events events) {
        if (playerCount < 2) {
            throw new IllegalArgumentException("versus needs at least 2 players: " + playerCount);
        }
        this.economy = new GarbageEconomy(config.profile().economy);
        this.settings = config.profile().garbage;
        this.mode = mode;
        this.random = new Random(config.seed());
        this.events = (events != null) ? events : new Events();
        this.nextTarget = new int[playerCount];

        for (int i = 0; i < playerCount; i++) {
            Player p = new Player(i, config.withSeed(config.seed() + i), new Player.Events());
            p.events.onComboEnded = combo -> onComboEnded(p, combo);
            p.events.onGameOver = score -> onPlayerOver(p);
            players.add(p);
            nextTarget[i] = (i + 1) % playerCount;
        }
        System.out.println("[Router] " + playerCount + " players, targeting=" + mode);
    }

    public void start() {
        for (Player p : players) p.start();
    }

    /** 모든 그리드 진행 + 지연 전송 처리 */
    public void tick(float dt) {
        if (finished) return;
        for (Player p : players) {
            if (!p.isGameOver()) p.tick(dt);
        }
        Iterator<PendingSend> it = pendingSends.iterator();
        List<PendingSend> due = new ArrayList<>();
        while (it.hasNext()) {
            PendingSend s = it.next();
            s.timer -= dt;
            if (s.timer <= 0f) {
                it.remove();
                due.add(s);
            }
        }
        for (PendingSend s : due) route(s.sender, s.score);
    }

    // ============================================
    // 콤보 종료 → 공격
    // ============================================

    void onComboEnded(Player player, ComboState combo) {
        int score = economy.calculateAttackScore(combo.getMatchSizes(), combo.getCombo(), combo.getMaxChain());
        System.out.printf("[Router] P%d combo=%d maxChain=%d → attack %d%n",
                player.index(), combo.getCombo(), combo.getMaxChain(), score);

        if (score > 0 && settings.allowCountering && player.getPendingIncoming() > 0) {
            int countered = player.reducePendingIncoming(score);
            score -= countered;
            GarbageMessage msg = new GarbageMessage(MessageType.GARBAGE_COUNTERED,
                    player.index(), player.index(), countered);
            System.out.println("[Router] " + msg);
            if (events.onGarbageCountered != null) events.onGarbageCountered.accept(msg);
        }
        if (score > 0) {
            pendingSends.add(new PendingSend(player, score, settings.sendDelay));
        }
        // 콤보 동안 막혀 있던 공격을 이제 받는다
        deliver(player);
    }

    /** 지연 없이 바로 전송 */
    public void manualSend(Player sender, int score) {
        if (score <= 0) return;
        route(sender, score);
    }

    void route(Player sender, int score) {
        if (finished || sender.isGameOver()) return;
        List<Player> targets = selectTargets(sender);
        if (targets.isEmpty()) {
            System.out.println("[Router] no target for P" + sender.index() + ", attack dropped");
            return;
        }
        if (mode == TargetingMode.SPLIT_EVENLY) {
            int share = score / targets.size();
            int rest = score % targets.size();
            for (int i = 0; i < targets.size(); i++) {
                send(sender, targets.get(i), share + (i < rest ? 1 : 0));
            }
        } else {
            for (Player t : targets) send(sender, t, score);
        }
    }

    private void send(Player sender, Player target, int score) {
        if (score <= 0) return;
        target.addPendingIncoming(score);
        GarbageMessage msg = new GarbageMessage(MessageType.GARBAGE_SENT, sender.index(), target.index(), score);
        System.out.println("[Router] " + msg);
        if (events.onGarbageSent != null) events.onGarbageSent.accept(msg);
        if (!target.isInCombo()) deliver(target);
    }

    /**
     * 대기 점수를 블록으로 바꿔 그리드 대기열에 넣는다
     */
    void deliver(Player target) {
        if (target.isGameOver() || target.getPendingIncoming() <= 0) return;
        int score = target.takePendingIncoming();
        List<BlockCost> blocks = economy.convertScoreToBlocks(score);
        for (BlockCost b : blocks) {
            target.getGrid().queueGarbage(b.width, b.height);
        }
        GarbageMessage msg = new GarbageMessage(MessageType.GARBAGE_RECEIVED, -1, target.index(), score);
        msg.blocks.addAll(blocks);
        System.out.println("[Router] " + msg);
        if (events.onGarbageReceived != null) events.onGarbageReceived.accept(msg);
    }

    /** 콤보 여부와 상관없이 바로 받게 한다 */
    public void forceDeliver(Player target) {
        deliver(target);
    }

    public void clearPending(Player target) {
        int dropped = target.takePendingIncoming();
        if (dropped > 0) System.out.println("[Router] cleared " + dropped + " pending for P" + target.index());
    }

    // ============================================
    // 대상 선택
    // ============================================

    List<Player> selectTargets(Player sender) {
        List<Player> alive = new ArrayList<>();
        for (Player p : players) {
            if (p != sender && !p.isGameOver()) alive.add(p);
        }
        if (alive.isEmpty()) return Collections.emptyList();

        switch (mode) {
            case SPLIT_EVENLY:
            case ALL_OPPONENTS:
                return alive;
            case RANDOM:
                return Collections.singletonList(alive.get(random.nextInt(alive.size())));
            case LOWEST_STACK: {
                Player best = alive.get(0);
                for (Player p : alive) {
                    if (p.getStackHeight() < best.getStackHeight()) best = p;
                }
                return Collections.singletonList(best);
            }
            case HIGHEST_STACK: {
                Player best = alive.get(0);
                for (Player p : alive) {
                    if (p.getStackHeight() > best.getStackHeight()) best = p;
                }
                return Collections.singletonList(best);
            }
            case SEQUENTIAL:
            default:
                return Collections.singletonList(nextSequential(sender));
        }
    }

    /** 보낸 사람 다음부터 돌아가며, 실제 대상 다음 칸으로 인덱스를 옮긴다 */
    private Player nextSequential(Player sender) {
        int n = players.size();
        int start = nextTarget[sender.index()];
        for (int i = 0; i < n; i++) {
            int idx = (start + i) % n;
            Player p = players.get(idx);
            if (p == sender || p.isGameOver()) continue;
            nextTarget[sender.index()] = (idx + 1) % n;
            return p;
        }
        return null;
    }

    // ============================================
    // 승패
    // ============================================

    private void onPlayerOver(Player loser) {
        System.out.println("[Router] P" + loser.index() + " eliminated");
        if (events.onPlayerEliminated != null) events.onPlayerEliminated.accept(loser);

        List<Player> alive = new ArrayList<>();
        for (Player p : players) {
            if (!p.isGameOver()) alive.add(p);
        }
        if (alive.size() <= 1 && !finished) {
            finish(alive.isEmpty() ? -1 : alive.get(0).index());
        }
    }

    /** 시간 제한 종료: 점수가 가장 높은 생존자 (동점이면 무승부) */
    public GameResult finishByTime() {
        int best = -1;
        int bestScore = Integer.MIN_VALUE;
        boolean tie = false;
        for (Player p : players) {
            if (p.isGameOver()) continue;
            if (p.getScore() > bestScore) {
                bestScore = p.getScore();
                best = p.index();
                tie = false;
            } else if (p.getScore() == bestScore) {
                tie = true;
            }
        }
        return finish(tie ? -1 : best);
    }

    private GameResult finish(int winner) {
        finished = true;
        int[] scores = new int[players.size()];
        for (int i = 0; i < scores.length; i++) scores[i] = players.get(i).getScore();
        result = new GameResult(winner, scores);
        System.out.println("[Router] match finished " + result);
        if (events.onMatchFinished != null) events.onMatchFinished.accept(result);
        return result;
    }

    // ─── 조회 ───

    public List<Player> getPlayers() {
        return Collections.unmodifiableList(players);
    }

    public Player getPlayer(int index) {
        return players.get(index);
    }

    public GarbageEconomy getEconomy() {
        return economy;
    }

    public TargetingMode getMode() {
        return mode;
    }

    public int getPendingSendCount() {
        return pendingSends.size();
    }

    public boolean isFinished() {
        return finished;
    }

    /** 끝나지 않았으면 null */
    public GameResult getResult() {
        return result;
    }
}
