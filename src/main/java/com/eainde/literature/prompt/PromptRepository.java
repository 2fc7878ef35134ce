package com.eainde.literature.prompt;

import com.eainde.literature.config.ConfigFileResolver;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt texts, overridable per project through the config directory.
 */
@Component
public class PromptRepository {

    public static final String OCR_AUDIT = "ocr_audit_prompt.md";
    public static final String METADATA = "metadata_prompt.md";
    public static final String EXTRACTION = "extraction_prompt.md";
    public static final String REFINEMENT = "refinement_prompt.md";
    public static final String DEDUPLICATION = "deduplication_prompt.md";

    private final ConfigFileResolver resolver;
    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public PromptRepository(ConfigFileResolver resolver) {
        this.resolver = resolver;
    }

    public String get(String name) {
        return cache.computeIfAbsent(name, n -> resolver.read(null, n, "prompts/" + n));
    }

    /** MD5 of the prompt text, stored with every extracted record. */
    public static String hash(String prompt) {
        return DigestUtils.md5DigestAsHex(prompt.getBytes(StandardCharsets.UTF_8));
    }
}
