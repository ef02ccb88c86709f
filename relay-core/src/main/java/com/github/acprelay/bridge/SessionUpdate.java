package com.github.acprelay.bridge;

import com.google.gson.JsonObject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * One {@code session/update} notification, tagged by its {@code sessionUpdate} discriminator.
 *
 * @param text text content for message/thought chunks, {@code null} for other kinds or non-text content
 */
public record SessionUpdate(@NotNull Kind kind, @Nullable String text, @NotNull JsonObject raw) {

    public enum Kind {
        AGENT_MESSAGE_CHUNK("agent_message_chunk"),
        AGENT_THOUGHT_CHUNK("agent_thought_chunk"),
        TOOL_CALL("tool_call"),
        TOOL_CALL_UPDATE("tool_call_update"),
        PLAN("plan"),
        OTHER("");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        @NotNull
        static Kind fromWire(@Nullable String value) {
            for (Kind kind : values()) {
                if (kind != OTHER && kind.wireName.equals(value)) return kind;
            }
            return OTHER;
        }
    }

    @NotNull
    public static SessionUpdate parse(@NotNull JsonObject update) {
        String updateType = update.has("sessionUpdate") ? update.get("sessionUpdate").getAsString() : "";
        Kind kind = Kind.fromWire(updateType);

        String text = null;
        if (kind == Kind.AGENT_MESSAGE_CHUNK || kind == Kind.AGENT_THOUGHT_CHUNK) {
            JsonObject content = update.has("content") && update.get("content").isJsonObject()
                ? update.getAsJsonObject("content") : null;
            if (content != null && "text".equals(content.has("type") ? content.get("type").getAsString() : "")
                && content.has("text")) {
                text = content.get("text").getAsString();
            }
        }
        return new SessionUpdate(kind, text, update);
    }

    /** True for a visible text fragment of the agent's reply. */
    public boolean isMessageText() {
        return kind == Kind.AGENT_MESSAGE_CHUNK && text != null;
    }
}
