package com.thedigest.continuity.service.brief;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.thedigest.continuity.dto.Brief;
import com.thedigest.continuity.dto.Highlight;
import com.thedigest.continuity.model.Depth;
import com.thedigest.continuity.model.DepthConfig;
import com.thedigest.continuity.service.budget.BudgetGatekeeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Produces the since-last-read brief. The model path runs only when the generation
 * service is configured and the budget allows a call; any failure on that path falls
 * back to the deterministic brief.
 */
@Service
public class NarrativeBriefService {

    private static final Logger logger = LoggerFactory.getLogger(NarrativeBriefService.class);

    private final NarrativeGenerationClient generationClient;
    private final BudgetGatekeeper budgetGatekeeper;
    private final BriefResponseParser responseParser;
    private final Executor executor;
    private final long generationTimeoutMs;

    public NarrativeBriefService(NarrativeGenerationClient generationClient,
                                 BudgetGatekeeper budgetGatekeeper,
                                 ObjectMapper objectMapper,
                                 @Qualifier("continuityExecutor") Executor executor,
                                 @Value("${app.continuity.generation-timeout-ms:20000}") long generationTimeoutMs) {
        this.generationClient = generationClient;
        this.budgetGatekeeper = budgetGatekeeper;
        this.responseParser = new BriefResponseParser(objectMapper);
        this.executor = executor;
        this.generationTimeoutMs = Math.max(1, generationTimeoutMs);
    }

    /**
     * @param fallback deterministic brief for the same inputs; used whole or per field
     */
    public GeneratedBrief generate(Depth depth,
                                   List<Highlight> highlights,
                                   List<String> unchangedTitles,
                                   Brief fallback,
                                   OffsetDateTime lastSeenAt) {
        if (!generationClient.isConfigured()) {
            return GeneratedBrief.fallback(fallback);
        }
        if (!budgetGatekeeper.allowCall()) {
            return GeneratedBrief.fallback(fallback);
        }

        DepthConfig config = depth.config();
        String prompt = buildPrompt(config, highlights, unchangedTitles, lastSeenAt);

        NarrativeResponse response;
        try {
            response = CompletableFuture
                    .supplyAsync(() -> generationClient.generate(prompt, depth, config.maxTokens()), executor)
                    .orTimeout(generationTimeoutMs, TimeUnit.MILLISECONDS)
                    .join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Brief generation failed, using deterministic brief: {}", cause.toString());
            return GeneratedBrief.fallback(fallback);
        } catch (RuntimeException e) {
            logger.error("Brief generation failed, using deterministic brief: {}", e.toString());
            return GeneratedBrief.fallback(fallback);
        }

        budgetGatekeeper.recordUsage(response.inputTokens(), response.outputTokens());

        Brief brief = responseParser.toBrief(response.text(), fallback, config);
        return new GeneratedBrief(brief, response.modelId(), response.inputTokens(), response.outputTokens());
    }

    static String citationToken(int index) {
        return "[A" + (index + 1) + "]";
    }

    static String buildPrompt(DepthConfig config,
                              List<Highlight> highlights,
                              List<String> unchangedTitles,
                              OffsetDateTime lastSeenAt) {
        List<String> contextRows = new ArrayList<>();
        for (int i = 0; i < highlights.size() && i < config.maxSourceArticles(); i++) {
            Highlight item = highlights.get(i);
            StringBuilder row = new StringBuilder()
                    .append(citationToken(i)).append('\n')
                    .append("Title: ").append(item.title()).append('\n')
                    .append("Source: ").append(item.source()).append('\n')
                    .append("Published: ").append(item.publishedAt()).append('\n')
                    .append("Topic: ").append(item.topic()).append('\n')
                    .append("Reason: ").append(item.reason());
            if (!item.watchlistMatches().isEmpty()) {
                row.append("\nWatchlist hits: ").append(String.join(", ", item.watchlistMatches()));
            }
            if (item.watchForNext() != null) {
                row.append("\nWatch next: ").append(item.watchForNext());
            }
            contextRows.add(row.toString());
        }

        String unchangedContext;
        if (unchangedTitles.isEmpty()) {
            unchangedContext = "None";
        } else {
            List<String> numbered = new ArrayList<>();
            for (int i = 0; i < unchangedTitles.size(); i++) {
                numbered.add((i + 1) + ". " + unchangedTitles.get(i));
            }
            unchangedContext = String.join("\n", numbered);
        }

        String lastSeenInstruction = lastSeenAt != null
                ? "The reader last opened the app at: " + lastSeenAt.toInstant() + "."
                : "This looks like the reader's first visit, so summarize the last 24 hours.";

        String promptTemplate =
                "You are generating a \"Since You Last Read\" catch-up for a returning user.\n" +
                        "%s\n" +
                        "\n" +
                        "Use only the provided source set. Do not invent facts.\n" +
                        "\n" +
                        "Source updates:\n%s\n" +
                        "\n" +
                        "Potential ongoing threads without fresh updates:\n%s\n" +
                        "\n" +
                        "Return EXACTLY valid JSON (no markdown, no code fences):\n" +
                        "{\n" +
                        "  \"headline\": \"One sentence. Mention what changed since last read.\",\n" +
                        "  \"summary\": \"Two concise sentences with concrete context.\",\n" +
                        "  \"changed\": [\"Up to %d bullets. Every bullet must include at least one citation token like [A1].\"],\n" +
                        "  \"unchanged\": [\"0-3 bullets describing still-open threads.\"],\n" +
                        "  \"watchNext\": [\"Up to %d bullets with specific follow-ups and at least one citation token when supported.\"]\n" +
                        "}\n" +
                        "\n" +
                        "Keep bullets short and scannable. Preserve citation tokens exactly as [A#].";
        return String.format(promptTemplate,
                lastSeenInstruction,
                contextRows.isEmpty() ? "None" : String.join("\n\n", contextRows),
                unchangedContext,
                config.changedBulletLimit(),
                config.watchNextLimit());
    }
}
