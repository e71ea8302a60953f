package com.example.layerflow.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Strips markdown code fences that chat models like to wrap JSON answers in. */
public final class CodeFenceUtils {
    private static final Pattern CODE_FENCE = Pattern.compile("```(?:[a-zA-Z0-9_-]+)?\\s*([\\s\\S]*?)```");

    /** Content of the first fenced block, or the trimmed input when there is none. */
    public static String unwrap(String input) {
        if (input == null) return "";
        Matcher m = CODE_FENCE.matcher(input);
        if (m.find()) return m.group(1).strip();
        return input.strip();
    }

    /** First {...} object in the text, fences removed; empty string when none. */
    public static String firstJsonObject(String input) {
        String text = unwrap(input);
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) return "";
        return text.substring(start, end + 1);
    }

    private CodeFenceUtils(){}
}
