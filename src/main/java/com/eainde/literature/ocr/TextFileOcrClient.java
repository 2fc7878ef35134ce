package com.eainde.literature.ocr;

import com.eainde.literature.util.TextUtils;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Default collaborator for inputs that are already text (markdown or plain text).
 * Files without page markers are treated as a single page and get a closing marker.
 */
@Log4j2
public class TextFileOcrClient implements OcrClient {

    static final String PROVIDER = "text";
    private static final Set<String> SUPPORTED_EXTENSIONS = Set.of("md", "markdown", "txt");

    @Override
    public OcrResult process(Path file) throws IOException {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String extension = dot >= 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
        if (!SUPPORTED_EXTENSIONS.contains(extension)) {
            throw new UnsupportedOperationException(
                    "No OCR provider configured for '" + extension + "' files: " + name);
        }

        String text = Files.readString(file, StandardCharsets.UTF_8);
        if (text.isBlank()) {
            throw new IllegalStateException("File has no text content: " + name);
        }
        if (!TextUtils.PAGE_MARKER.matcher(text).find()) {
            text = text.stripTrailing() + "\n\n--- PAGE 1 ---\n";
        }
        log.debug("Read {} characters from {}", text.length(), name);
        return new OcrResult(text, null, PROVIDER);
    }
}
