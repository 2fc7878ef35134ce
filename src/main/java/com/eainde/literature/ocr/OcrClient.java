package com.eainde.literature.ocr;

import java.nio.file.Path;

/**
 * OCR collaborator: turns a source file into page-marked text.
 *
 * <p>Implementations must return non-empty text on success and throw otherwise.
 * Each page is followed by a {@code --- PAGE N ---} marker.</p>
 */
public interface OcrClient {

    OcrResult process(Path file) throws Exception;
}
