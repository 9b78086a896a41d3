package org.starledger.timeline.processors;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.starledger.parser.model.FloatValue;
import org.starledger.parser.model.IntValue;
import org.starledger.parser.model.Key;
import org.starledger.parser.model.ListValue;
import org.starledger.parser.model.MapValue;
import org.starledger.parser.model.StringValue;
import org.starledger.parser.model.Value;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Converts names and other value subtrees to JSON.
 * <p>
 * Names in snapshots are either plain strings or localization templates ({@code key} plus
 * {@code variables}). They are stored unresolved as JSON text with sorted keys, so that the same template
 * always yields the same text; resolving templates for display is left to consumers.
 */
public final class Names {

    private static final Gson GSON = new Gson();

    private Names() {}

    /**
     * @param name The name value, possibly absent.
     * @return The JSON text of the name, {@code "Unknown"} as JSON string if absent.
     */
    public static String render(Optional<Value> name) {
        return GSON.toJson(toJson(name.orElse(new StringValue("Unknown"))));
    }

    public static JsonElement toJson(Value value) {
        if (value instanceof IntValue i) {
            return new JsonPrimitive(i.value());
        } else if (value instanceof FloatValue f) {
            return new JsonPrimitive(f.value());
        } else if (value instanceof StringValue s) {
            return new JsonPrimitive(s.value());
        } else if (value instanceof ListValue list) {
            JsonArray array = new JsonArray();
            list.values().forEach(v -> array.add(toJson(v)));
            return array;
        } else if (value instanceof MapValue map) {
            Map<String, Value> sorted = new TreeMap<>();
            for (Map.Entry<Key, Value> entry : map.entries().entrySet()) {
                sorted.put(entry.getKey().text(), entry.getValue());
            }
            JsonObject object = new JsonObject();
            sorted.forEach((k, v) -> object.add(k, toJson(v)));
            return object;
        }
        return JsonNull.INSTANCE;
    }
}
