package com.eainde.literature.ocr;

import com.eainde.literature.config.ConfigFileResolver;
import com.eainde.literature.config.PipelineProperties;
import com.eainde.literature.llm.StructuredOutputClient;
import com.eainde.literature.llm.StructuredOutputException;
import com.eainde.literature.llm.StructuredRequest;
import com.eainde.literature.llm.StructuredResponse;
import com.eainde.literature.prompt.PromptRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Reviews fresh OCR text for errors that would mislead extraction and returns the
 * findings as JSON. Extraction and refinement pass the audit to the model next to
 * the text.
 *
 * <p>The audit is advisory. It is skipped when {@code pipeline.models.ocr-audit} is
 * empty, and a failed model call leaves the document without an audit instead of
 * failing OCR.</p>
 */
@Log4j2
@Component
public class OcrAuditor {

    static final String SCHEMA_FILE = "ocr_audit_schema.json";

    private final StructuredOutputClient client;
    private final PromptRepository prompts;
    private final ConfigFileResolver configFileResolver;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;

    public OcrAuditor(StructuredOutputClient client,
                      PromptRepository prompts,
                      ConfigFileResolver configFileResolver,
                      PipelineProperties properties,
                      ObjectMapper objectMapper) {
        this.client = client;
        this.prompts = prompts;
        this.configFileResolver = configFileResolver;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public boolean isEnabled() {
        List<String> models = properties.getModels().getOcrAudit();
        return models != null && !models.isEmpty();
    }

    /**
     * @return the {@code ocr_audit} object as JSON, or empty when disabled or the call failed
     */
    public Optional<String> audit(String ocrText) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            StructuredResponse response = client.call(new StructuredRequest(
                    "ocr_audit",
                    prompts.get(PromptRepository.OCR_AUDIT),
                    "Please review the following OCR output for errors:\n\n" + ocrText,
                    configFileResolver.read(null, SCHEMA_FILE, SCHEMA_FILE),
                    properties.getModels().getOcrAudit()));

            JsonNode audit = response.data() != null ? response.data().get("ocr_audit") : null;
            if (audit == null || !audit.isObject()) {
                log.warn("OCR audit by {} carried no 'ocr_audit' object, continuing without it", response.modelUsed());
                return Optional.empty();
            }
            log.info("OCR audit by {}: quality {}, {} issue(s)", response.modelUsed(),
                    audit.path("overall_quality").asText("unknown"), audit.path("issues").size());
            return Optional.of(objectMapper.writeValueAsString(audit));
        } catch (StructuredOutputException e) {
            log.warn("OCR audit failed, continuing without it: {}", e.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise OCR audit", e);
        }
    }
}
