package com.eainde.literature.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text helpers shared by the LLM-backed stages.
 *
 * <p>OCR output marks the end of every page with a {@code --- PAGE N ---} line,
 * so page N's content sits <em>before</em> its marker.</p>
 */
public final class TextUtils {

    private static final Logger log = LoggerFactory.getLogger(TextUtils.class);

    /** Marker the OCR stage writes after each page */
    public static final Pattern PAGE_MARKER = Pattern.compile("--- PAGE \\d+ ---");

    /** Heuristic: one token per four characters */
    private static final int CHARS_PER_TOKEN = 4;

    private TextUtils() {
    }

    // =========================================================================
    //  Token estimate
    // =========================================================================

    /**
     * Rough token estimate used for logging before LLM calls.
     *
     * @param text any text, may be null
     * @return {@code ceil(length / 4)}, 0 for null
     */
    public static int estimateTokens(String text) {
        if (text == null || text.isEmpty()) return 0;
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    // =========================================================================
    //  Page limiting
    // =========================================================================

    /**
     * Keeps only the first {@code maxPages} pages, cutting right after the
     * marker of page {@code maxPages}. Text without markers is one page.
     *
     * @param content  OCR text
     * @param maxPages number of pages to keep, must be positive
     * @return the truncated text, or the input when it already fits
     */
    public static String limitToFirstPages(String content, int maxPages) {
        if (maxPages < 1) {
            throw new IllegalArgumentException("maxPages must be positive, got " + maxPages);
        }
        if (content == null || content.isEmpty()) return content;

        Matcher matcher = PAGE_MARKER.matcher(content);
        int seen = 0;
        while (matcher.find()) {
            seen++;
            if (seen == maxPages) {
                int end = matcher.end();
                if (end >= content.length() || !PAGE_MARKER.matcher(content).region(end, content.length()).find()) {
                    return content;
                }
                log.debug("Limiting content to first {} pages ({} of {} chars)", maxPages, end, content.length());
                return content.substring(0, end);
            }
        }
        return content;
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
