package com.github.acprelay.bridge;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Answers {@code session/request_permission} without a human in the loop.
 * <p>
 * The strategy is an option kind ({@code allow_once}, {@code allow_always}, {@code reject_once}, ...)
 * or the literal {@code cancelled}. The first option of the requested kind wins; when none matches,
 * the first offered option is selected.
 */
public final class PermissionStrategy {
    public static final String DEFAULT_STRATEGY = "allow_once";
    public static final String CANCELLED = "cancelled";

    private static final String OUTCOME = "outcome";
    private static final String OPTION_ID = "optionId";
    private static final String KIND = "kind";

    private PermissionStrategy() {
    }

    @NotNull
    public static JsonObject buildResponse(@Nullable JsonArray options, @Nullable String strategy) {
        if (options == null || options.isEmpty() || CANCELLED.equals(strategy)) {
            return cancelled();
        }

        String wanted = strategy == null || strategy.isBlank() ? DEFAULT_STRATEGY : strategy;
        JsonObject chosen = null;
        for (JsonElement opt : options) {
            if (!opt.isJsonObject()) continue;
            JsonObject option = opt.getAsJsonObject();
            String kind = option.has(KIND) ? option.get(KIND).getAsString() : "";
            if (wanted.equals(kind)) {
                chosen = option;
                break;
            }
        }
        if (chosen == null) {
            JsonElement first = options.get(0);
            if (!first.isJsonObject()) return cancelled();
            chosen = first.getAsJsonObject();
        }
        if (!chosen.has(OPTION_ID)) return cancelled();

        JsonObject outcome = new JsonObject();
        outcome.addProperty(OUTCOME, "selected");
        outcome.addProperty(OPTION_ID, chosen.get(OPTION_ID).getAsString());
        JsonObject result = new JsonObject();
        result.add(OUTCOME, outcome);
        return result;
    }

    private static JsonObject cancelled() {
        JsonObject outcome = new JsonObject();
        outcome.addProperty(OUTCOME, CANCELLED);
        JsonObject result = new JsonObject();
        result.add(OUTCOME, outcome);
        return result;
    }
}
