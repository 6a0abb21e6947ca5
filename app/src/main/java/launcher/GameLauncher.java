package launcher;

import java.util.Random;

import component.GameConfig;
import component.GameLoop;
import logic.CursorCommands;
import versus.GarbageMessageCodec;
import versus.GarbageRouter;
import versus.Player;

/**
 * 헤드리스 대전 데모
 * 사용법: GameLauncher [players=2] [seconds=60] [difficulty=NORMAL] [seed=42]
 * 각 플레이어는 시드 고정 스크립트 입력으로 움직인다
 */
public class GameLauncher {

    /** 일정 간격으로 커서를 움직이고 교환하는 입력 */
    static final class ScriptedInput {
        private final CursorCommands commands;
        private final Random random;
        private final int interval;
        private int counter = 0;

        ScriptedInput(CursorCommands commands, long seed, int interval) {
            this.commands = commands;
            this.random = new Random(seed);
            this.interval = interval;
        }

        void step() {
            if (++counter < interval) return;
            counter = 0;
            switch (random.nextInt(6)) {
                case 0: commands.moveLeft(); break;
                case 1: commands.moveRight(); break;
                case 2: commands.moveUp(); break;
                case 3: commands.moveDown(); break;
                case 4: commands.fastRise(); break;
                default: commands.swap(); break;
            }
        }
    }

    public static void main(String[] args) {
        int players = (args.length > 0) ? Integer.parseInt(args[0]) : 2;
        int seconds = (args.length > 1) ? Integer.parseInt(args[1]) : 60;
        GameConfig.Difficulty difficulty = (args.length > 2)
                ? GameConfig.Difficulty.valueOf(args[2].toUpperCase())
                : GameConfig.Difficulty.NORMAL;
        long seed = (args.length > 3) ? Long.parseLong(args[3]) : 42L;

        GarbageRouter.GameResult result = run(players, seconds, difficulty, seed);
        System.out.println("[MAIN] " + result);
    }

    static GarbageRouter.GameResult run(int playerCount, int seconds, GameConfig.Difficulty difficulty, long seed) {
        GameConfig config = new GameConfig(GameConfig.Mode.VERSUS, difficulty, seed);
        System.out.println("[MAIN] " + config);

        GarbageRouter.Events events = new GarbageRouter.Events();
        // 전송 포맷 그대로 기록
        events.onGarbageReceived = msg -> System.out.println("[MAIN] recv " + GarbageMessageCodec.encode(msg));
        GarbageRouter router = new GarbageRouter(config, playerCount, events);
        ScriptedInput[] inputs = new ScriptedInput[playerCount];
        for (Player p : router.getPlayers()) {
            inputs[p.index()] = new ScriptedInput(p.getGrid(), seed * 17 + p.index(), 6);
        }
        router.start();

        GameLoop loop = new GameLoop(dt -> {
            for (Player p : router.getPlayers()) {
                if (!p.isGameOver()) inputs[p.index()].step();
            }
            router.tick(dt);
        }, router::isFinished);

        int steps = Math.round(seconds / loop.getStep());
        loop.run(steps);

        if (router.isFinished()) return router.getResult();
        return router.finishByTime();
    }
}
