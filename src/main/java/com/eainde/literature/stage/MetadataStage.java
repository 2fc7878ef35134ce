package com.eainde.literature.stage;

import com.eainde.literature.config.ConfigFileResolver;
import com.eainde.literature.config.PipelineProperties;
import com.eainde.literature.crossref.CrossRefClient;
import com.eainde.literature.llm.StructuredOutputClient;
import com.eainde.literature.llm.StructuredRequest;
import com.eainde.literature.llm.StructuredResponse;
import com.eainde.literature.model.Document;
import com.eainde.literature.model.PublicationMetadata;
import com.eainde.literature.model.Stage;
import com.eainde.literature.prompt.PromptRepository;
import com.eainde.literature.store.DocumentRepository;
import com.eainde.literature.util.TextUtils;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Extracts bibliographic metadata from the first pages of the OCR text.
 *
 * <p>A new non-null value replaces the stored one; a null keeps it. The stage fails
 * when neither the response nor the stored row carries a title, first author or
 * publication year, since a completed status without them would read as a desync
 * on the next pass.</p>
 *
 * <p>With {@code pipeline.metadata.crossref.enabled} the extracted metadata is looked
 * up in CrossRef and its empty fields are filled from the match. A failed lookup is
 * logged and the extracted metadata is saved as it is.</p>
 */
@Log4j2
@Component
public class MetadataStage implements PipelineStage {

    static final String SCHEMA_FILE = "metadata_schema.json";

    private final StructuredOutputClient client;
    private final PromptRepository prompts;
    private final ConfigFileResolver configFileResolver;
    private final DocumentRepository documentRepository;
    private final CrossRefClient crossRefClient;
    private final PipelineProperties properties;

    public MetadataStage(StructuredOutputClient client,
                         PromptRepository prompts,
                         ConfigFileResolver configFileResolver,
                         DocumentRepository documentRepository,
                         CrossRefClient crossRefClient,
                         PipelineProperties properties) {
        this.client = client;
        this.prompts = prompts;
        this.configFileResolver = configFileResolver;
        this.documentRepository = documentRepository;
        this.crossRefClient = crossRefClient;
        this.properties = properties;
    }

    @Override
    public Stage stage() {
        return Stage.METADATA;
    }

    @Override
    public StageReport run(Document document, StageContext context) {
        if (!document.hasContent()) {
            throw new IllegalStateException("No document content found in database");
        }

        String content = TextUtils.limitToFirstPages(document.documentContent(), properties.getMetadata().getMaxPages());
        StructuredResponse response = client.call(new StructuredRequest(
                "publication_metadata",
                prompts.get(PromptRepository.METADATA),
                "# Document\n\n" + content,
                configFileResolver.read(null, SCHEMA_FILE, SCHEMA_FILE),
                properties.getModels().getMetadata()));

        JsonNode node = response.data() != null ? response.data().get("publication_metadata") : null;
        if (node == null || !node.isObject()) {
            throw new IllegalStateException("Missing 'publication_metadata' in result");
        }
        PublicationMetadata metadata = enrich(parse(node));
        if (!metadata.hasCoreFields() && !document.metadataOrEmpty().hasCoreFields()) {
            throw new IllegalStateException("no title, first author or publication year found");
        }

        context.commit(() -> documentRepository.saveMetadata(
                document.id(), metadata, response.modelUsed(), response.attemptLog()));
        log.info("Metadata: title='{}', first author='{}', year={}, doi={}",
                metadata.title(), metadata.firstAuthorLastname(), metadata.publicationYear(), metadata.doi());
        return new StageReport(response.modelUsed(), response.attemptLog(),
                metadata.bibliography() != null ? metadata.bibliography().size() + " references" : null);
    }

    PublicationMetadata enrich(PublicationMetadata extracted) {
        if (!properties.getMetadata().getCrossref().isEnabled()) {
            return extracted;
        }
        try {
            Optional<PublicationMetadata> found = crossRefClient.lookup(extracted);
            if (found.isEmpty()) {
                log.info("CrossRef: no match for doi={}, title='{}'", extracted.doi(), extracted.title());
                return extracted;
            }
            log.info("CrossRef: matched {}", found.get().doi());
            return extracted.fillGapsFrom(found.get());
        } catch (IOException e) {
            log.warn("CrossRef lookup failed, keeping extracted metadata: {}", e.getMessage());
            return extracted;
        }
    }

    static PublicationMetadata parse(JsonNode node) {
        return PublicationMetadata.builder()
                .title(text(node, "title"))
                .firstAuthorLastname(text(node, "first_author_lastname"))
                .authors(textList(node, "authors"))
                .publicationYear(year(node.get("publication_year")))
                .doi(text(node, "doi"))
                .journal(text(node, "journal"))
                .volume(text(node, "volume"))
                .issue(text(node, "issue"))
                .pages(text(node, "pages"))
                .issn(text(node, "issn"))
                .publisher(text(node, "publisher"))
                .bibliography(textList(node, "bibliography"))
                .language(text(node, "language"))
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static List<String> textList(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        List<String> values = new ArrayList<>();
        if (value.isArray()) {
            value.forEach(v -> {
                if (!v.isNull() && !v.asText().isBlank()) values.add(v.asText().trim());
            });
        } else if (!value.asText().isBlank()) {
            values.add(value.asText().trim());
        }
        return values.isEmpty() ? null : values;
    }

    private static Integer year(JsonNode value) {
        if (value == null || value.isNull()) return null;
        if (value.canConvertToInt()) return value.asInt();
        String digits = value.asText().replaceAll("\\D", "");
        return digits.length() == 4 ? Integer.valueOf(digits) : null;
    }
}
