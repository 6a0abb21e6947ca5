package versus;

import com.google.gson.*;

import component.config.BlockCost;

/**
 * GarbageMessage ↔ JSON (Gson)
 * - 블록은 "WxH" 문자열로 줄여서 보낸다 (비용은 수신 측에서 필요 없음)
 */
public final class GarbageMessageCodec {
    private static final Gson gson = new GsonBuilder()
            .registerTypeAdapter(BlockCost.class, new JsonSerializer<BlockCost>() {
                @Override
                public JsonElement serialize(BlockCost c, java.lang.reflect.Type typeOfSrc,
                        JsonSerializationContext context) {
                    if (c == null)
                        return JsonNull.INSTANCE;
                    return new JsonPrimitive(c.width + "x" + c.height);
                }
            })
            .registerTypeAdapter(BlockCost.class, new JsonDeserializer<BlockCost>() {
                @Override
                public BlockCost deserialize(JsonElement json, java.lang.reflect.Type typeOfT,
                        JsonDeserializationContext context)
                        throws JsonParseException {
                    String s = json.getAsString();
                    int xIdx = s.indexOf('x');
                    if (xIdx <= 0) throw new JsonParseException("bad block size: " + s);
                    try {
                        return new BlockCost(Integer.parseInt(s.substring(0, xIdx)),
                                Integer.parseInt(s.substring(xIdx + 1)), 0);
                    } catch (NumberFormatException e) {
                        throw new JsonParseException("bad block size: " + s, e);
                    }
                }
            })
            .create();

    private GarbageMessageCodec() {}

    public static String encode(GarbageMessage msg) {
        return gson.toJson(msg);
    }

    public static GarbageMessage decode(String json) {
        if (json == null || json.isEmpty()) {
            throw new IllegalArgumentException("empty message");
        }
        // 문자열로 한 번 더 감싼 JSON unwrap
        if (json.startsWith("\"") && json.endsWith("\"")) {
            json = json.substring(1, json.length() - 1).replace("\\\"", "\"");
        }
        try {
            GarbageMessage msg = gson.fromJson(json, GarbageMessage.class);
            if (msg == null || msg.type == null) {
                throw new IllegalArgumentException("message without type: " + json);
            }
            return msg;
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("malformed message: " + json, e);
        }
    }
}
