package com.thedigest.continuity.service.brief;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.thedigest.continuity.model.Depth;
import com.thedigest.continuity.service.ThrottledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.BedrockRuntimeException;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Narrative generation through Anthropic models on Amazon Bedrock.
 */
@Service
public class BedrockNarrativeClient implements NarrativeGenerationClient {

    private static final Logger logger = LoggerFactory.getLogger(BedrockNarrativeClient.class);

    private final BedrockRuntimeClient bedrockClient;
    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final String modelId;
    private final String fastModelId;
    private final int maxAttempts;

    /**
     * @param modelId     model used for medium and deep briefs
     * @param fastModelId cheaper model used for shallow briefs
     * @param maxAttempts attempts per call, including the first, before throttling is surfaced
     */
    public BedrockNarrativeClient(BedrockRuntimeClient bedrockClient,
                                  ObjectMapper objectMapper,
                                  @Value("${aws.bedrock.enabled:false}") boolean enabled,
                                  @Value("${aws.bedrock.modelId:anthropic.claude-3-5-sonnet-20240620-v1:0}") String modelId,
                                  @Value("${aws.bedrock.fastModelId:anthropic.claude-3-5-haiku-20241022-v1:0}") String fastModelId,
                                  @Value("${aws.bedrock.maxAttempts:3}") int maxAttempts) {
        this.bedrockClient = bedrockClient;
        this.objectMapper = objectMapper;
        this.enabled = enabled;
        this.modelId = modelId;
        this.fastModelId = fastModelId;
        this.maxAttempts = Math.max(1, maxAttempts);
        logger.info("BedrockNarrativeClient initialized (enabled: {}, model: {}, fast model: {})", enabled, modelId, fastModelId);
    }

    @Override
    public boolean isConfigured() {
        return enabled && modelId != null && !modelId.isBlank();
    }

    public String modelFor(Depth depth) {
        return depth == Depth.SHALLOW && fastModelId != null && !fastModelId.isBlank() ? fastModelId : modelId;
    }

    @Override
    public NarrativeResponse generate(String prompt, Depth depth, int maxTokens) {
        String effectiveModelId = modelFor(depth);
        try {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("anthropic_version", "bedrock-2023-05-31");
            payload.put("max_tokens", Math.max(64, maxTokens));
            List<ObjectNode> messages = new ArrayList<>();
            ObjectNode userMessage = objectMapper.createObjectNode();
            userMessage.put("role", "user");
            userMessage.put("content", prompt);
            messages.add(userMessage);
            payload.set("messages", objectMapper.valueToTree(messages));

            InvokeModelRequest request = InvokeModelRequest.builder()
                    .modelId(effectiveModelId)
                    .contentType("application/json")
                    .accept("application/json")
                    .body(SdkBytes.fromUtf8String(objectMapper.writeValueAsString(payload)))
                    .build();

            InvokeModelResponse response = invokeWithRetry(request);
            JsonNode responseJson = objectMapper.readTree(response.body().asUtf8String());
            JsonNode contentBlock = responseJson.path("content");
            if (!contentBlock.isArray() || contentBlock.size() == 0) {
                throw new IllegalStateException("Bedrock response missing content block");
            }

            String text = stripFences(contentBlock.get(0).path("text").asText("").trim());
            JsonNode usage = responseJson.path("usage");
            return new NarrativeResponse(
                    text,
                    effectiveModelId,
                    usage.path("input_tokens").asInt(0),
                    usage.path("output_tokens").asInt(0)
            );
        } catch (ThrottledException te) {
            throw te;
        } catch (BedrockRuntimeException e) {
            String detail = e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
            logger.error("Bedrock API error during brief generation for model {}: {}", effectiveModelId, detail);
            throw new IllegalStateException("Bedrock API error during brief generation", e);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable Bedrock response: " + e.getMessage(), e);
        }
    }

    static String stripFences(String text) {
        if (text.startsWith("```json")) {
            text = text.substring(7).trim();
            if (text.endsWith("```")) {
                text = text.substring(0, text.length() - 3).trim();
            }
        } else if (text.startsWith("```") && text.endsWith("```") && text.length() >= 6) {
            text = text.substring(3, text.length() - 3).trim();
        }
        return text;
    }

    /**
     * Invokes Bedrock with exponential backoff on throttling, surfacing exhaustion as
     * {@link ThrottledException}.
     */
    private InvokeModelResponse invokeWithRetry(InvokeModelRequest request) {
        final long baseBackoffMs = 400L;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return bedrockClient.invokeModel(request);
            } catch (BedrockRuntimeException e) {
                int statusCode = e.statusCode();
                String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
                boolean throttled = statusCode == 429
                        || "ThrottlingException".equalsIgnoreCase(code)
                        || "TooManyRequestsException".equalsIgnoreCase(code)
                        || "ProvisionedThroughputExceededException".equalsIgnoreCase(code);

                if (!throttled) {
                    throw e;
                }

                if (attempt == maxAttempts) {
                    logger.warn("Bedrock throttled after {} attempts; surfacing throttling.", maxAttempts);
                    throw new ThrottledException("Bedrock throttling after retries", e);
                }

                long jitter = ThreadLocalRandom.current().nextLong(50, 200);
                long sleepMs = (long) Math.min(4_000, baseBackoffMs * Math.pow(2, attempt - 1) + jitter);
                logger.warn("Bedrock throttled (attempt {}/{}). Backing off for {} ms.", attempt, maxAttempts, sleepMs);
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted during backoff", ie);
                }
            }
        }
        throw new IllegalStateException("Unreachable");
    }
}
