package com.eainde.literature.dedup;

import java.text.Normalizer;
import java.util.Locale;

public final class TextCanonicalizer {

    private TextCanonicalizer() {
    }

    /**
     * NFC-normalise, lowercase, trim. Null stays null.
     */
    public static String canonicalize(String text) {
        if (text == null) return null;
        return Normalizer.normalize(text, Normalizer.Form.NFC).toLowerCase(Locale.ROOT).trim();
    }
}
