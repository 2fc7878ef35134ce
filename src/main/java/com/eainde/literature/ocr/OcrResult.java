package com.eainde.literature.ocr;

/**
 * @param text       page-marked text content
 * @param imagesJson provider image payload as JSON, may be null
 * @param provider   name of the OCR provider that produced the text
 */
public record OcrResult(String text, String imagesJson, String provider) {
}
