package com.eainde.literature.schema;

import com.eainde.literature.exception.PipelineConfigurationException;
import com.eainde.literature.support.TestDatabase;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonSchemaConverterTest {

    @Test
    void toLangChainSchema_shouldConvertRecordSchema() {
        // Act
        JsonSchema result = JsonSchemaConverter.toLangChainSchema("records", TestDatabase.SCHEMA_JSON);

        // Assert
        assertThat(result.name()).isEqualTo("records");
        JsonObjectSchema root = (JsonObjectSchema) result.rootElement();
        assertThat(root.properties()).containsKey("records");

        JsonArraySchema records = (JsonArraySchema) root.properties().get("records");
        JsonObjectSchema item = (JsonObjectSchema) records.items();
        assertThat(item.properties()).containsKeys("species", "host", "location", "count", "sentences");
        assertThat(item.required()).containsExactly("species", "host");
    }

    @Test
    void toLangChainSchema_shouldResolveNullableUnionToNonNullType() {
        // Arrange
        String json = """
                {
                  "type": "object",
                  "properties": {
                    "year": { "type": ["null", "integer"], "description": "Publication year" }
                  }
                }
                """;

        // Act
        JsonObjectSchema root = (JsonObjectSchema) JsonSchemaConverter.toLangChainSchema("Meta", json).rootElement();

        // Assert
        JsonSchemaElement year = root.properties().get("year");
        assertThat(year).isInstanceOf(JsonIntegerSchema.class);
        assertThat(((JsonIntegerSchema) year).description()).isEqualTo("Publication year");
    }

    @Test
    void toLangChainSchema_shouldParseEnums() {
        // Arrange
        String json = """
                {
                  "type": "object",
                  "properties": {
                    "kind": { "type": "string", "enum": ["predation", "parasitism"] }
                  }
                }
                """;

        // Act
        JsonObjectSchema root = (JsonObjectSchema) JsonSchemaConverter.toLangChainSchema("Kind", json).rootElement();

        // Assert
        JsonEnumSchema kind = (JsonEnumSchema) root.properties().get("kind");
        assertThat(kind.enumValues()).containsExactly("predation", "parasitism");
    }

    @Test
    void toLangChainSchema_shouldDefaultArrayItemsToString_whenItemsMissing() {
        String json = """
                { "type": "object", "properties": { "tags": { "type": "array" } } }
                """;

        JsonObjectSchema root = (JsonObjectSchema) JsonSchemaConverter.toLangChainSchema("Tags", json).rootElement();

        assertThat(((JsonArraySchema) root.properties().get("tags")).items()).isInstanceOf(JsonStringSchema.class);
    }

    @Test
    void toLangChainSchema_shouldThrowConfigurationError_whenJsonInvalid() {
        assertThatThrownBy(() -> JsonSchemaConverter.toLangChainSchema("Bad", "{ invalid"))
                .isInstanceOf(PipelineConfigurationException.class)
                .hasMessageContaining("Bad");
    }
}
