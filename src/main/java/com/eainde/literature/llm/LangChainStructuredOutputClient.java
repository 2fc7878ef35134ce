package com.eainde.literature.llm;

import com.eainde.literature.schema.JsonSchemaConverter;
import com.eainde.literature.util.TextUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import lombok.extern.log4j.Log4j2;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * {@link StructuredOutputClient} over langchain4j chat models with ordered model fallback.
 *
 * <p>A model that refuses (finish reason {@code CONTENT_FILTER}), errors, or returns
 * unparseable JSON is logged with a timestamp and the next model is tried.</p>
 */
@Log4j2
public class LangChainStructuredOutputClient implements StructuredOutputClient {

    private final Function<String, ChatModel> modelResolver;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public LangChainStructuredOutputClient(Function<String, ChatModel> modelResolver,
                                           ObjectMapper objectMapper,
                                           Clock clock) {
        this.modelResolver = modelResolver;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public StructuredResponse call(StructuredRequest request) {
        if (request.models().isEmpty()) {
            throw new StructuredOutputException("No models configured for " + request.name());
        }

        JsonSchema schema = JsonSchemaConverter.toLangChainSchema(request.name(), request.schemaJson());
        ChatRequest chatRequest = ChatRequest.builder()
                .messages(List.<ChatMessage>of(
                        SystemMessage.from(request.systemPrompt()),
                        UserMessage.from(request.userPrompt())))
                .parameters(toRequestParameters(schema))
                .build();

        log.info("Structured call '{}': ~{} input tokens, models {}",
                request.name(),
                TextUtils.estimateTokens(request.systemPrompt()) + TextUtils.estimateTokens(request.userPrompt()),
                request.models());

        List<ModelAttempt> failures = new ArrayList<>();
        for (String modelId : request.models()) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            try {
                JsonNode data = callModel(modelId, chatRequest);
                if (!failures.isEmpty()) {
                    log.warn("'{}' succeeded with fallback model {} after {} failed attempt(s)",
                            request.name(), modelId, failures.size());
                }
                return new StructuredResponse(data, modelId, failures);
            } catch (ModelRefusalException e) {
                failures.add(new ModelAttempt(modelId, clock.instant(), e.getMessage(), true));
                log.warn("Model {} refused '{}': {}", modelId, request.name(), e.getMessage());
            } catch (RuntimeException e) {
                failures.add(new ModelAttempt(modelId, clock.instant(), describe(e), false));
                log.warn("Model {} failed for '{}': {}", modelId, request.name(), describe(e));
            }
        }

        String summary = failures.stream().map(ModelAttempt::describe).reduce((a, b) -> a + "; " + b).orElse("interrupted");
        if (!failures.isEmpty() && failures.stream().allMatch(ModelAttempt::refusal)) {
            throw new ModelRefusalException("All models refused: " + summary, failures);
        }
        throw new StructuredOutputException("All models failed: " + summary, failures);
    }

    private JsonNode callModel(String modelId, ChatRequest chatRequest) {
        ChatModel model = modelResolver.apply(modelId);
        ChatResponse response = model.chat(chatRequest);

        if (response == null || response.aiMessage() == null) {
            throw new StructuredOutputException("empty response");
        }
        if (response.finishReason() == FinishReason.CONTENT_FILTER) {
            throw new ModelRefusalException("content filtered by provider");
        }
        String text = response.aiMessage().text();
        if (text == null || text.isBlank()) {
            throw new StructuredOutputException("empty response text");
        }
        try {
            return objectMapper.readTree(stripCodeFence(text));
        } catch (JsonProcessingException e) {
            throw new StructuredOutputException("response is not valid JSON: " + e.getOriginalMessage());
        }
    }

    private static ChatRequestParameters toRequestParameters(JsonSchema schema) {
        return ChatRequestParameters.builder()
                .temperature(0.0)
                .responseFormat(ResponseFormat.builder()
                        .type(ResponseFormatType.JSON)
                        .jsonSchema(schema)
                        .build())
                .build();
    }

    static String stripCodeFence(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return trimmed;
    }

    private static String describe(Throwable e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        if (e.getCause() != null && e.getCause().getMessage() != null) {
            message += " (caused by: " + e.getCause().getMessage() + ")";
        }
        return message;
    }
}
