package com.alertbridge.orchestrator.extraction;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the JSON payload out of a language-model reply.
 *
 * Models are asked to answer inside <result>...</result>, but in practice
 * they sometimes use a fenced ```json block or just emit a bare object, so
 * we accept all three, in that order of preference.
 */
public final class ResponseParser {

    // Matches <result>...</result> (the requested answer envelope)
    private static final Pattern RESULT_TAG = Pattern.compile(
            "<result>(.*?)</result>",
            Pattern.DOTALL
    );

    // Matches ```json ... ``` or ``` ... ``` (with optional language label)
    private static final Pattern CODE_BLOCK = Pattern.compile(
            "```(?:json)?\\s*\\n(.*?)\\n```",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    /**
     * Extract the content of the first <result>...</result> tag.
     */
    public static Optional<String> extractResult(String response) {
        if (response == null) return Optional.empty();
        Matcher m = RESULT_TAG.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }

    /**
     * Extract the JSON object the model produced, trying the result tag,
     * then a fenced block, then the outermost {...} span.
     *
     * Returns Optional.empty() when nothing object-shaped is present.
     */
    public static Optional<String> extractJsonObject(String response) {
        if (response == null || response.isBlank()) return Optional.empty();

        Optional<String> tagged = extractResult(response);
        if (tagged.isPresent()) return tagged;

        Matcher fenced = CODE_BLOCK.matcher(response);
        if (fenced.find()) return Optional.of(fenced.group(1).strip());

        int open  = response.indexOf('{');
        int close = response.lastIndexOf('}');
        return open >= 0 && close > open
                ? Optional.of(response.substring(open, close + 1))
                : Optional.empty();
    }
}
