package com.eainde.literature.util;

import java.time.Clock;
import java.time.Year;
import java.util.Collection;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds human-readable record ids of the form {@code {Author}{Year}-o{N}}.
 *
 * <p>Ids are assigned once at insert time and never recomputed. The sequence
 * continues after the highest suffix already stored for the document, so ids of
 * soft-deleted or re-admitted rows are never reused.</p>
 */
public class RecordIdGenerator {

    private static final Pattern SEQUENCE_SUFFIX = Pattern.compile("-o(\\d{1,9})$");
    private static final Pattern NON_LETTERS = Pattern.compile("[^A-Za-z]");

    private final Clock clock;

    public RecordIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String prefix(String firstAuthorLastname, Integer publicationYear) {
        String author = firstAuthorLastname == null ? "" : NON_LETTERS.matcher(firstAuthorLastname).replaceAll("");
        if (author.isEmpty()) {
            author = "Author";
        }
        int year = publicationYear != null ? publicationYear : Year.now(clock).getValue();
        return author + year;
    }

    public String generate(String firstAuthorLastname, Integer publicationYear, int sequence) {
        return prefix(firstAuthorLastname, publicationYear) + "-o" + sequence;
    }

    /**
     * @return highest {@code -oN} suffix among the given ids, 0 when none parse
     */
    public static int maxSequence(Collection<String> recordIds) {
        int max = 0;
        for (String id : recordIds) {
            if (id == null) continue;
            Matcher m = SEQUENCE_SUFFIX.matcher(id);
            if (m.find()) {
                max = Math.max(max, Integer.parseInt(m.group(1)));
            }
        }
        return max;
    }
}
