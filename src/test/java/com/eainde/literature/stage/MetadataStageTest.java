package com.eainde.literature.stage;

import com.eainde.literature.config.ConfigFileResolver;
import com.eainde.literature.config.PipelineProperties;
import com.eainde.literature.crossref.CrossRefClient;
import com.eainde.literature.llm.StructuredOutputClient;
import com.eainde.literature.llm.StructuredRequest;
import com.eainde.literature.llm.StructuredResponse;
import com.eainde.literature.model.Document;
import com.eainde.literature.model.PublicationMetadata;
import com.eainde.literature.prompt.PromptRepository;
import com.eainde.literature.support.TestDatabase;
import com.eainde.literature.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static com.eainde.literature.support.Json.parse;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MetadataStageTest {

    private static final String CONTENT = "Page one text\n\n--- PAGE 1 ---\n"
            + "Page two text\n\n--- PAGE 2 ---\n"
            + "Page three text\n\n--- PAGE 3 ---\n"
            + "Page four text\n\n--- PAGE 4 ---\n";

    @TempDir
    Path tempDir;

    @Mock
    private StructuredOutputClient client;

    @Mock
    private CrossRefClient crossRefClient;

    private TestDatabase db;
    private PipelineProperties properties;
    private MetadataStage stage;
    private Document document;

    @BeforeEach
    void setUp() {
        db = new TestDatabase(tempDir);
        properties = TestProperties.create(tempDir);
        properties.getMetadata().setMaxPages(3);
        ConfigFileResolver resolver = new ConfigFileResolver(properties);
        stage = new MetadataStage(client, new PromptRepository(resolver), resolver, db.documents, crossRefClient, properties);

        long id = db.insertDocument("a.md", "/a.md").id();
        db.documents.saveOcrResult(id, CONTENT, null, "text");
        document = db.documents.findById(id).orElseThrow();
    }

    private void respond(String json) {
        when(client.call(any())).thenReturn(new StructuredResponse(parse(json), "meta-model", List.of()));
    }

    // =========================================================================
    //  run
    // =========================================================================

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        void shouldSaveParsedMetadata() {
            // Arrange
            respond("""
                    {"publication_metadata": {
                      "title": "  Diet of the little brown bat ",
                      "first_author_lastname": "Smith",
                      "authors": ["Smith, J.", "", "Doe, A."],
                      "publication_year": 1998,
                      "doi": "10.1000/xyz",
                      "bibliography": ["Ref A", "Ref B"]
                    }}
                    """);

            // Act
            StageReport report = stage.run(document, StageContext.open());

            // Assert
            PublicationMetadata stored = db.documents.findById(document.id()).orElseThrow().metadata();
            assertThat(stored.title()).isEqualTo("Diet of the little brown bat");
            assertThat(stored.authors()).containsExactly("Smith, J.", "Doe, A.");
            assertThat(stored.publicationYear()).isEqualTo(1998);
            assertThat(report.modelUsed()).isEqualTo("meta-model");
            assertThat(report.summary()).isEqualTo("2 references");
        }

        @Test
        void shouldSendOnlyFirstPagesAndMetadataSchema() {
            respond("{\"publication_metadata\": {\"title\": \"T\"}}");

            stage.run(document, StageContext.open());

            ArgumentCaptor<StructuredRequest> captor = ArgumentCaptor.forClass(StructuredRequest.class);
            verify(client).call(captor.capture());
            StructuredRequest request = captor.getValue();
            assertThat(request.name()).isEqualTo("publication_metadata");
            assertThat(request.userPrompt()).startsWith("# Document\n\n").contains("Page three text").doesNotContain("Page four text");
            assertThat(request.schemaJson()).contains("publication_metadata");
            assertThat(request.models()).containsExactly("meta-model");
        }

        @Test
        void shouldFail_whenResultLacksMetadataObject() {
            respond("{\"title\": \"T\"}");

            assertThatThrownBy(() -> stage.run(document, StageContext.open()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("Missing 'publication_metadata' in result");
        }

        @Test
        void shouldFail_whenNoCoreFieldAnywhere() {
            respond("{\"publication_metadata\": {\"journal\": \"Acta\"}}");

            assertThatThrownBy(() -> stage.run(document, StageContext.open())).isInstanceOf(IllegalStateException.class);
            assertThat(db.documents.findById(document.id()).orElseThrow().metadata().journal()).isNull();
        }

        @Test
        void shouldKeepStoredCoreFields_whenRerunReturnsNone() {
            // Arrange
            db.documents.saveMetadata(document.id(), PublicationMetadata.builder().title("Stored").build(), "m", null);
            Document withMetadata = db.documents.findById(document.id()).orElseThrow();
            respond("{\"publication_metadata\": {\"journal\": \"Acta\"}}");

            // Act
            stage.run(withMetadata, StageContext.open());

            // Assert
            PublicationMetadata stored = db.documents.findById(document.id()).orElseThrow().metadata();
            assertThat(stored.title()).isEqualTo("Stored");
            assertThat(stored.journal()).isEqualTo("Acta");
        }

        @Test
        void shouldFail_whenDocumentHasNoContent() {
            Document empty = db.insertDocument("b.md", "/b.md");

            assertThatThrownBy(() -> stage.run(empty, StageContext.open()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("No document content found in database");
        }
    }

    // =========================================================================
    //  CrossRef enrichment
    // =========================================================================

    @Nested
    @DisplayName("CrossRef enrichment")
    class CrossRefEnrichment {

        private static final String EXTRACTED = """
                {"publication_metadata": {
                  "title": "Diet of the little brown bat",
                  "first_author_lastname": "Smith",
                  "doi": "10.1000/xyz"
                }}
                """;

        @Test
        void shouldNotCallCrossRef_whenDisabled() {
            respond(EXTRACTED);

            stage.run(document, StageContext.open());

            verifyNoInteractions(crossRefClient);
        }

        @Test
        void shouldFillOnlyMissingFields_whenEnabled() throws Exception {
            // Arrange
            properties.getMetadata().getCrossref().setEnabled(true);
            respond(EXTRACTED);
            when(crossRefClient.lookup(any())).thenReturn(Optional.of(PublicationMetadata.builder()
                    .title("Diet of the Little Brown Bat (Myotis lucifugus)")
                    .firstAuthorLastname("Smith")
                    .publicationYear(1998)
                    .journal("Journal of Mammalogy")
                    .volume("79")
                    .build()));

            // Act
            stage.run(document, StageContext.open());

            // Assert
            PublicationMetadata stored = db.documents.findById(document.id()).orElseThrow().metadata();
            assertThat(stored.title()).isEqualTo("Diet of the little brown bat");
            assertThat(stored.publicationYear()).isEqualTo(1998);
            assertThat(stored.journal()).isEqualTo("Journal of Mammalogy");
            assertThat(stored.volume()).isEqualTo("79");
            assertThat(stored.doi()).isEqualTo("10.1000/xyz");
        }

        @Test
        void shouldSaveExtractedMetadata_whenLookupFails() throws Exception {
            // Arrange
            properties.getMetadata().getCrossref().setEnabled(true);
            respond(EXTRACTED);
            when(crossRefClient.lookup(any())).thenThrow(new IOException("connection refused"));

            // Act
            StageReport report = stage.run(document, StageContext.open());

            // Assert
            PublicationMetadata stored = db.documents.findById(document.id()).orElseThrow().metadata();
            assertThat(stored.title()).isEqualTo("Diet of the little brown bat");
            assertThat(stored.journal()).isNull();
            assertThat(report.modelUsed()).isEqualTo("meta-model");
        }
    }

    // =========================================================================
    //  parse
    // =========================================================================

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        void shouldReadYearFromText() {
            assertThat(MetadataStage.parse(parse("{\"publication_year\": \"1998\"}")).publicationYear()).isEqualTo(1998);
            assertThat(MetadataStage.parse(parse("{\"publication_year\": \"c. 2001\"}")).publicationYear()).isEqualTo(2001);
            assertThat(MetadataStage.parse(parse("{\"publication_year\": \"unknown\"}")).publicationYear()).isNull();
        }

        @Test
        void shouldTreatBlankTextAsMissing() {
            PublicationMetadata metadata = MetadataStage.parse(parse("{\"title\": \"   \", \"doi\": null, \"authors\": []}"));

            assertThat(metadata.title()).isNull();
            assertThat(metadata.doi()).isNull();
            assertThat(metadata.authors()).isNull();
            assertThat(metadata.hasCoreFields()).isFalse();
        }

        @Test
        void shouldWrapSingleAuthorString() {
            assertThat(MetadataStage.parse(parse("{\"authors\": \"Smith, J.\"}")).authors()).containsExactly("Smith, J.");
        }
    }
}
