package com.github.acprelay.messaging;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Markdown-aware truncation and splitting for chat messages.
 * <p>
 * Cuts prefer a paragraph break, then a line break, then a space, and fall back to a hard cut.
 * A cut never lands inside an inline code span, a link or an image, and an open code fence
 * is closed at the end of a chunk and re-opened at the start of the next one.
 */
public final class MessageTruncator {

    public static final String DEFAULT_ELLIPSIS = "...";
    private static final String FENCE = "```";

    private MessageTruncator() {
    }

    @NotNull
    public static String smartTruncate(@NotNull String text, int maxLength) {
        return smartTruncate(text, maxLength, DEFAULT_ELLIPSIS);
    }

    /**
     * Shorten {@code text} to roughly {@code maxLength}, closing an open code fence and appending {@code ellipsis}.
     */
    @NotNull
    public static String smartTruncate(@NotNull String text, int maxLength, @NotNull String ellipsis) {
        if (text.length() <= maxLength) {
            return text;
        }
        int cutIndex = maxLength - (ellipsis.length() + 8);
        if (cutIndex <= 0) {
            return text.substring(0, Math.max(0, maxLength));
        }

        int splitIndex = preferredBreak(text.substring(0, cutIndex), cutIndex);
        StringBuilder result = new StringBuilder(text.substring(0, splitIndex).stripTrailing());
        if (countFences(result) % 2 != 0) {
            result.append('\n').append(FENCE);
        }
        return result.append(ellipsis).toString();
    }

    /**
     * Split {@code text} into chunks no longer than {@code maxLength}, keeping markdown constructs intact.
     * Always returns at least one element.
     */
    @NotNull
    public static List<String> splitIntoSmartChunks(@Nullable String text, int maxLength) {
        List<String> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            chunks.add("");
            return chunks;
        }
        if (text.length() <= maxLength) {
            chunks.add(text);
            return chunks;
        }

        int reserve = Math.min(20, (int) Math.floor(maxLength * 0.1));
        int limit = Math.max(maxLength - reserve, 1);
        String remaining = text;

        while (!remaining.isEmpty()) {
            if (remaining.length() <= maxLength) {
                chunks.add(remaining);
                break;
            }

            int splitPoint = preferredBreak(remaining.substring(0, limit), limit);
            if (splitPoint > 0 && remaining.charAt(splitPoint - 1) == '\\') {
                splitPoint--;
            }
            splitPoint = safeMarkdownSplitPoint(remaining, splitPoint);
            if (splitPoint <= 0) {
                splitPoint = limit;
            }

            String chunk = remaining.substring(0, splitPoint).stripTrailing();
            String rest = remaining.substring(splitPoint).stripLeading();

            if (countFences(chunk) % 2 != 0) {
                String language = fenceLanguage(chunk.substring(chunk.lastIndexOf(FENCE) + FENCE.length()));
                chunk += "\n" + FENCE;
                String reopened = FENCE + language + "\n" + rest;
                // Re-opening must still shrink what is left, or the loop would not terminate.
                remaining = reopened.length() >= remaining.length() ? rest : reopened;
            } else {
                remaining = rest;
            }
            chunks.add(chunk);
        }
        return chunks;
    }

    /**
     * Latest split point at or before {@code splitPoint} that does not fall inside an inline code span,
     * a link or an image. Fenced blocks are skipped over; their balancing happens in the splitter.
     */
    static int safeMarkdownSplitPoint(@NotNull String text, int splitPoint) {
        int limit = Math.min(splitPoint, text.length());
        int i = 0;
        while (i < limit) {
            char ch = text.charAt(i);

            if (ch == '\\' && i + 1 < text.length()) {
                i += 2;
                continue;
            }

            if (ch == '`') {
                if (text.startsWith(FENCE, i)) {
                    i += 3;
                    while (i < text.length() && text.charAt(i) != '\n') i++;
                    int close = text.indexOf(FENCE, i);
                    if (close == -1 || close >= limit) {
                        return limit;
                    }
                    i = close + 3;
                    continue;
                }
                int start = i;
                i++;
                while (i < text.length() && text.charAt(i) != '`') i++;
                if (i < limit) {
                    i++;
                } else {
                    return start;
                }
                continue;
            }

            boolean image = ch == '!' && i + 1 < text.length() && text.charAt(i + 1) == '[';
            if (image || ch == '[') {
                int start = i;
                i += image ? 2 : 1;
                i = skipTo(text, i, ']');
                if (i >= limit) {
                    return start;
                }
                i++;
                if (i < text.length() && text.charAt(i) == '(') {
                    i = skipTo(text, i + 1, ')');
                    if (i >= limit) {
                        return start;
                    }
                    i++;
                }
                continue;
            }

            i++;
        }
        return limit;
    }

    private static int skipTo(@NotNull String text, int from, char terminator) {
        int i = from;
        while (i < text.length() && text.charAt(i) != terminator) {
            if (text.charAt(i) == '\\' && i + 1 < text.length()) i++;
            i++;
        }
        return i;
    }

    private static int preferredBreak(@NotNull String window, int target) {
        int paragraph = window.lastIndexOf("\n\n");
        if (paragraph != -1 && paragraph > target * 0.5) return paragraph;
        int line = window.lastIndexOf('\n');
        if (line != -1 && line > target * 0.7) return line;
        int space = window.lastIndexOf(' ');
        if (space != -1 && space > target * 0.8) return space;
        return target;
    }

    static int countFences(@NotNull CharSequence text) {
        String s = text.toString();
        int count = 0;
        int idx = s.indexOf(FENCE);
        while (idx != -1) {
            count++;
            idx = s.indexOf(FENCE, idx + FENCE.length());
        }
        return count;
    }

    @NotNull
    private static String fenceLanguage(@NotNull String afterFence) {
        int end = 0;
        while (end < afterFence.length() && isAsciiLetterOrDigit(afterFence.charAt(end))) end++;
        return afterFence.substring(0, end);
    }

    private static boolean isAsciiLetterOrDigit(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }
}
