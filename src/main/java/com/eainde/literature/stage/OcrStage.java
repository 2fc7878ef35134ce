package com.eainde.literature.stage;

import com.eainde.literature.model.Document;
import com.eainde.literature.model.Stage;
import com.eainde.literature.ocr.OcrAuditor;
import com.eainde.literature.ocr.OcrClient;
import com.eainde.literature.ocr.OcrResult;
import com.eainde.literature.store.DocumentRepository;
import com.eainde.literature.util.TextUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Runs OCR on the source file and stores the text, the image payload and the provider,
 * together with the quality audit of the new text when auditing is enabled.
 */
@Log4j2
@Component
public class OcrStage implements PipelineStage {

    static final String INLINE_IMAGE_FIELD = "image_base64";

    private final OcrClient ocrClient;
    private final OcrAuditor auditor;
    private final DocumentRepository documentRepository;
    private final ObjectMapper objectMapper;

    public OcrStage(OcrClient ocrClient,
                    OcrAuditor auditor,
                    DocumentRepository documentRepository,
                    ObjectMapper objectMapper) {
        this.ocrClient = ocrClient;
        this.auditor = auditor;
        this.documentRepository = documentRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    public Stage stage() {
        return Stage.OCR;
    }

    @Override
    public StageReport run(Document document, StageContext context) throws Exception {
        Path file = Paths.get(document.filePath());
        OcrResult result = ocrClient.process(file);
        if (result == null || TextUtils.isBlank(result.text())) {
            throw new IllegalStateException("OCR returned no text for " + document.fileName());
        }

        String images = stripInlineImages(result.imagesJson());
        String audit = auditor.audit(result.text()).orElse(null);
        context.commit(() -> {
            documentRepository.saveOcrResult(document.id(), result.text(), images, result.provider());
            // an audit of the previous text no longer applies
            documentRepository.saveOcrAudit(document.id(), audit);
        });
        return StageReport.of(result.text().length() + " characters via " + result.provider()
                + (audit != null ? ", audited" : ""));
    }

    /**
     * Removes inline base64 image blobs, keeping image references and coordinates.
     */
    String stripInlineImages(String imagesJson) throws JsonProcessingException {
        if (TextUtils.isBlank(imagesJson)) {
            return null;
        }
        JsonNode root = objectMapper.readTree(imagesJson);
        strip(root);
        return objectMapper.writeValueAsString(root);
    }

    private static void strip(JsonNode node) {
        if (node.isObject()) {
            ((ObjectNode) node).remove(INLINE_IMAGE_FIELD);
        }
        if (node.isContainerNode()) {
            node.forEach(OcrStage::strip);
        }
    }
}
