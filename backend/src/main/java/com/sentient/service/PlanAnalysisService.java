package com.sentient.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentient.entity.DayPlan;
import com.sentient.entity.PlanRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Service for deriving emotion, sentiment and a weekly plan from a reflection.
 *
 * The model is asked for a strict JSON document:
 * <pre>{@code
 * {
 *   "emotion": "anxious",
 *   "sentiment_score": 35,
 *   "weekly_plan": [
 *     {"day": "Monday", "tasks": ["..."], "focus": "...", "self_care": "..."}
 *   ]
 * }
 * }</pre>
 *
 * Error Handling:
 * {@link #analyze(String, String)} never throws. A blank key, transport error,
 * empty response, malformed JSON or a document failing validation all yield
 * {@link FallbackPlan#PAYLOAD}, so ingestion always produces a plan.
 *
 * @see InferenceClientFactory
 * @see FallbackPlan
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PlanAnalysisService {

    private final InferenceClientFactory inferenceClientFactory;
    private final ObjectMapper objectMapper;

    /**
     * System prompt guiding the model toward the plan document format.
     */
    static final String SYSTEM_PROMPT = """
            You are an empathetic planning assistant. Read the user's reflection and
            work out how they are feeling.

            1. EMOTION: the single primary emotion, one lowercase word
               (e.g. anxious, hopeful, stressed, excited, sad, neutral)
            2. SENTIMENT_SCORE: integer from 0 (most negative) to 100 (most positive)
            3. WEEKLY_PLAN: seven entries, Monday to Sunday, each with three short
               practical tasks, a focus for the day and one self-care activity

            Rules:
            - Keep the plan supportive and realistic for the detected emotional state
            - Return ONLY valid JSON, no additional text or explanations

            Output format (JSON):
            {
              "emotion": "<emotion>",
              "sentiment_score": <integer>,
              "weekly_plan": [
                {
                  "day": "Monday",
                  "tasks": ["task1", "task2", "task3"],
                  "focus": "focus area",
                  "self_care": "self-care activity"
                }
              ]
            }
            """;

    /**
     * Analyse a reflection.
     *
     * @param text the user's reflection
     * @param apiKey inference API key, may be blank
     * @return model analysis, or the fallback plan when anything goes wrong
     */
    public PlanAnalysis analyze(String text, String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("No inference API key configured, using fallback plan");
            return FallbackPlan.PAYLOAD;
        }
        if (text == null || text.isBlank()) {
            log.warn("Attempted to analyze empty reflection, using fallback plan");
            return FallbackPlan.PAYLOAD;
        }

        log.info("Starting reflection analysis: model={}", inferenceClientFactory.getModel());
        log.debug("Reflection length: {} characters", text.length());

        try {
            String response = inferenceClientFactory.clientFor(apiKey)
                    .prompt()
                    .system(SYSTEM_PROMPT)
                    .user("User's thoughts:\n" + text)
                    .call()
                    .content();

            if (response == null || response.isBlank()) {
                log.warn("Model returned empty response, using fallback plan");
                return FallbackPlan.PAYLOAD;
            }

            log.debug("Raw JSON response from model: {}", response);

            PlanAnalysis analysis = toAnalysis(parseJsonResponse(response));

            log.info("Reflection analysis completed: emotion={}, score={}, days={}",
                    analysis.emotion(), analysis.sentimentScore(), analysis.weeklyPlan().size());
            return analysis;

        } catch (JsonProcessingException e) {
            log.error("Failed to parse JSON response from model: {}", e.getOriginalMessage());
            return FallbackPlan.PAYLOAD;
        } catch (InvalidAnalysisException e) {
            log.error("Model response failed validation: {}", e.getMessage());
            return FallbackPlan.PAYLOAD;
        } catch (Exception e) {
            log.error("Inference call failed: {}", e.getMessage(), e);
            return FallbackPlan.PAYLOAD;
        }
    }

    private JsonNode parseJsonResponse(String response) throws JsonProcessingException {
        // Strip markdown code fences if present
        String cleanedJson = response.trim();
        if (cleanedJson.startsWith("```json")) {
            cleanedJson = cleanedJson.substring(7);
        } else if (cleanedJson.startsWith("```")) {
            cleanedJson = cleanedJson.substring(3);
        }
        if (cleanedJson.endsWith("```")) {
            cleanedJson = cleanedJson.substring(0, cleanedJson.length() - 3);
        }
        return objectMapper.readTree(cleanedJson.trim());
    }

    private PlanAnalysis toAnalysis(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new InvalidAnalysisException("response is not a JSON object");
        }

        JsonNode emotion = root.get("emotion");
        if (emotion == null || !emotion.isTextual() || emotion.asText().isBlank()) {
            throw new InvalidAnalysisException("'emotion' must be a non-empty string");
        }

        int score = parseScore(root.get("sentiment_score"));

        JsonNode plan = root.get("weekly_plan");
        if (plan == null || !plan.isArray() || plan.isEmpty()) {
            throw new InvalidAnalysisException("'weekly_plan' must be a non-empty array");
        }

        List<DayPlan> days = new ArrayList<>();
        for (JsonNode day : plan) {
            days.add(toDayPlan(day));
        }

        return new PlanAnalysis(
                emotion.asText().trim().toLowerCase(Locale.ROOT),
                PlanRecord.clampScore(score),
                List.copyOf(days),
                false
        );
    }

    private int parseScore(JsonNode score) {
        if (score == null || score.isNull()) {
            throw new InvalidAnalysisException("missing 'sentiment_score' field");
        }
        if (score.isNumber()) {
            return (int) Math.round(score.asDouble());
        }
        if (score.isTextual()) {
            try {
                return (int) Math.round(Double.parseDouble(score.asText().trim()));
            } catch (NumberFormatException e) {
                throw new InvalidAnalysisException("'sentiment_score' must be a number");
            }
        }
        throw new InvalidAnalysisException("'sentiment_score' must be a number");
    }

    private DayPlan toDayPlan(JsonNode day) {
        if (!day.isObject()) {
            throw new InvalidAnalysisException("'weekly_plan' entries must be objects");
        }
        JsonNode name = day.get("day");
        if (name == null || !name.isTextual()) {
            throw new InvalidAnalysisException("'weekly_plan' entry is missing 'day'");
        }

        List<String> tasks = new ArrayList<>();
        JsonNode taskNodes = day.get("tasks");
        if (taskNodes != null && taskNodes.isArray()) {
            taskNodes.forEach(task -> tasks.add(task.asText()));
        } else if (taskNodes != null && !taskNodes.isNull()) {
            throw new InvalidAnalysisException("'tasks' must be an array");
        }

        return new DayPlan(
                name.asText(),
                List.copyOf(tasks),
                day.path("focus").asText(""),
                day.path("self_care").asText("")
        );
    }

    /**
     * Raised internally when a parsed response does not match the plan document.
     */
    static class InvalidAnalysisException extends RuntimeException {

        InvalidAnalysisException(String message) {
            super(message);
        }
    }
}
