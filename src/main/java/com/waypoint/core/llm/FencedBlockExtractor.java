package com.waypoint.core.llm;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the body of a fenced code block (```xml ... ```) out of a generator answer.
 * Tolerates missing newlines, CRLF and an unterminated final fence.
 */
public final class FencedBlockExtractor {

    private FencedBlockExtractor() {}

    /**
     * Returns the first block tagged with any of {@code languages}, tried in order.
     *
     * @throws GeneratorOutputException if no such block exists or it is empty
     */
    public static String extract(String response, String... languages) {
        if (response == null || response.isBlank()) {
            throw new GeneratorOutputException("Generator returned an empty answer");
        }
        for (String language : languages) {
            Pattern pattern = Pattern.compile("```[ \\t]*" + Pattern.quote(language) + "[ \\t]*\\R?(.*?)(?:```|\\z)",
                    Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
            Matcher m = pattern.matcher(response);
            if (m.find()) {
                String body = m.group(1).strip();
                if (body.isEmpty()) {
                    throw new GeneratorOutputException("The ```" + language + " block in your answer is empty");
                }
                return body;
            }
        }
        throw new GeneratorOutputException("Your answer must contain a fenced code block tagged ```"
                + String.join(" or ```", languages));
    }
}
