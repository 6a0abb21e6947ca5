package component.config;

import com.google.gson.*;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import component.GameConfig;

/**
 * 난이도 프로필 로더
 * - /difficulty/easy.json, normal.json, hard.json (classpath)
 * - 블록 비용은 {"width":6,"height":2,"cost":4000} 또는 "6x2:4000" 둘 다 허용
 */
public class ConfigLoader {
    private static final Gson gson = new GsonBuilder()
            .registerTypeAdapter(BlockCost.class, new JsonSerializer<BlockCost>() {
                @Override
                public JsonElement serialize(BlockCost c, java.lang.reflect.Type typeOfSrc,
                        JsonSerializationContext context) {
                    if (c == null)
                        return JsonNull.INSTANCE;
                    return new JsonPrimitive(c.width + "x" + c.height + ":" + c.cost);
                }
            })
            .registerTypeAdapter(BlockCost.class, new JsonDeserializer<BlockCost>() {
                @Override
                public BlockCost deserialize(JsonElement json, java.lang.reflect.Type typeOfT,
                        JsonDeserializationContext context)
                        throws JsonParseException {
                    if (json.isJsonPrimitive()) {
                        return parseCompact(json.getAsString());
                    }
                    JsonObject obj = json.getAsJsonObject();
                    int w = obj.has("width") ? obj.get("width").getAsInt() : 1;
                    int h = obj.has("height") ? obj.get("height").getAsInt() : 1;
                    int cost = obj.has("cost") ? obj.get("cost").getAsInt() : 0;
                    return new BlockCost(w, h, cost);
                }
            })
            .setPrettyPrinting()
            .create();

    private ConfigLoader() {}

    /** 난이도 이름에 해당하는 프로필을 읽는다 */
    public static DifficultyProfile load(GameConfig.Difficulty difficulty) {
        return loadResource("/difficulty/" + difficulty.name().toLowerCase() + ".json");
    }

    public static DifficultyProfile loadResource(String path) {
        InputStream in = ConfigLoader.class.getResourceAsStream(path);
        if (in == null) {
            throw new IllegalArgumentException("difficulty resource not found: " + path);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            DifficultyProfile profile = gson.fromJson(reader, DifficultyProfile.class);
            if (profile == null) {
                throw new IllegalStateException("empty difficulty resource: " + path);
            }
            System.out.println("[Config] loaded " + path + " -> " + profile);
            return profile;
        } catch (JsonParseException e) {
            throw new IllegalStateException("malformed difficulty resource: " + path, e);
        } catch (java.io.IOException e) {
            throw new IllegalStateException("failed to read " + path, e);
        }
    }

    public static DifficultyProfile fromJson(String json) {
        DifficultyProfile profile = gson.fromJson(json, DifficultyProfile.class);
        return (profile != null) ? profile : new DifficultyProfile();
    }

    public static String toJson(DifficultyProfile profile) {
        return gson.toJson(profile);
    }

    /** 프로필 깊은 복사 (테스트/세션별 수정용) */
    public static DifficultyProfile copy(DifficultyProfile profile) {
        return fromJson(toJson(profile));
    }

    static BlockCost parseCompact(String text) {
        // "WxH:cost"
        String s = text.trim();
        int xIdx = s.indexOf('x');
        int cIdx = s.indexOf(':');
        if (xIdx <= 0 || cIdx <= xIdx) {
            throw new JsonParseException("bad block cost: " + text);
        }
        try {
            int w = Integer.parseInt(s.substring(0, xIdx));
            int h = Integer.parseInt(s.substring(xIdx + 1, cIdx));
            int cost = Integer.parseInt(s.substring(cIdx + 1));
            return new BlockCost(w, h, cost);
        } catch (NumberFormatException e) {
            throw new JsonParseException("bad block cost: " + text, e);
        }
    }
}
