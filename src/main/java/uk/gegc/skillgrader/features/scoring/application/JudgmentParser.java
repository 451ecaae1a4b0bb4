package uk.gegc.skillgrader.features.scoring.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.skillgrader.features.rubric.domain.model.CriterionJudgment;
import uk.gegc.skillgrader.features.scoring.domain.model.ParsedJudgment;
import uk.gegc.skillgrader.shared.exception.JudgmentParseException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parses the raw judge response into a {@link ParsedJudgment}.
 * <p>
 * Expected shape:
 * {@code {"score": 0-100, "feedback": "...", "rubricBreakdown": {"<criterion>": {"points": n, "maxPoints": n,
 * "reasoning": "..."}}, "strengths": [...], "improvements": [...]}}. Never throws: any schema violation is
 * reported through {@link ParsedJudgment#malformed()}.
 * </p>
 */
@Slf4j
@Component
public class JudgmentParser {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    public ParsedJudgment parse(String rawJudgment) {
        try {
            return parseStrict(rawJudgment);
        } catch (JudgmentParseException e) {
            log.warn("Malformed judgment: {}", e.getMessage());
            return ParsedJudgment.malformed(e.getMessage());
        }
    }

    private ParsedJudgment parseStrict(String rawJudgment) {
        if (rawJudgment == null || rawJudgment.isBlank()) {
            throw new JudgmentParseException("Judgment is empty");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(extractJsonObject(rawJudgment));
        } catch (JsonProcessingException e) {
            throw new JudgmentParseException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new JudgmentParseException("Judgment is not a JSON object");
        }

        List<String> problems = new ArrayList<>();

        Integer score = null;
        JsonNode scoreNode = root.get("score");
        if (scoreNode == null || scoreNode.isNull()) {
            problems.add("Missing score");
        } else if (!scoreNode.isNumber() || !Double.isFinite(scoreNode.asDouble())) {
            problems.add("Score is not numeric");
        } else {
            score = (int) Math.max(0, Math.min(100, Math.round(scoreNode.asDouble())));
        }

        JsonNode feedbackNode = root.get("feedback");
        String feedback = feedbackNode != null && feedbackNode.isTextual() ? feedbackNode.asText() : null;

        List<CriterionJudgment> breakdown = parseBreakdown(root.get("rubricBreakdown"), problems);

        ParsedJudgment judgment = new ParsedJudgment(
                score,
                feedback,
                breakdown,
                textList(root.get("strengths")),
                textList(root.get("improvements")),
                !problems.isEmpty(),
                problems.isEmpty() ? null : String.join("; ", problems)
        );
        if (judgment.malformed()) {
            log.warn("Judgment parsed with problems: {}", judgment.malformedReason());
        }
        return judgment;
    }

    /**
     * Strips markdown fences and keeps the text between the first '{' and the last '}'.
     */
    static String extractJsonObject(String rawJudgment) {
        String cleaned = rawJudgment.trim()
                .replaceAll("```json\\s*", "")
                .replaceAll("```\\s*", "");

        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new JudgmentParseException("No JSON object found in judgment");
        }
        return cleaned.substring(start, end + 1);
    }

    private static List<CriterionJudgment> parseBreakdown(JsonNode breakdownNode, List<String> problems) {
        if (breakdownNode == null || breakdownNode.isNull()) {
            return List.of();
        }
        if (!breakdownNode.isObject()) {
            problems.add("rubricBreakdown is not an object");
            return List.of();
        }

        List<CriterionJudgment> breakdown = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = breakdownNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode entry = field.getValue();
            JsonNode points = entry.get("points");
            if (!entry.isObject() || points == null || !points.isNumber()) {
                problems.add("Criterion '" + field.getKey() + "' has no numeric points");
                continue;
            }
            JsonNode maxPoints = entry.get("maxPoints");
            JsonNode reasoning = entry.get("reasoning");
            breakdown.add(new CriterionJudgment(
                    field.getKey(),
                    points.asDouble(),
                    maxPoints != null && maxPoints.isNumber() ? maxPoints.asDouble() : null,
                    reasoning != null && reasoning.isTextual() ? reasoning.asText() : ""
            ));
        }
        return breakdown;
    }

    private static List<String> textList(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        node.forEach(item -> {
            if (item.isTextual() && !item.asText().isBlank()) {
                values.add(item.asText());
            }
        });
        return values;
    }
}
