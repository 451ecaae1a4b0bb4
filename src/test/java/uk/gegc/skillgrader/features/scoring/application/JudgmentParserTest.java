package uk.gegc.skillgrader.features.scoring.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import uk.gegc.skillgrader.features.rubric.domain.model.CriterionJudgment;
import uk.gegc.skillgrader.features.scoring.domain.model.ParsedJudgment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("JudgmentParser")
class JudgmentParserTest {

    private final JudgmentParser parser = new JudgmentParser();

    @Test
    @DisplayName("parses a well-formed judgment inside a markdown fence")
    void wellFormed() {
        String raw = """
                Here is my evaluation:
                ```json
                {
                  "score": 82,
                  "feedback": "Solid use of operators.",
                  "rubricBreakdown": {
                    "Operator Usage": {"points": 35, "maxPoints": 40, "reasoning": "Correct AND/OR nesting"},
                    "Keyword Coverage": {"points": 27.5, "maxPoints": 35}
                  },
                  "strengths": ["Clear structure", ""],
                  "improvements": ["Add synonyms"]
                }
                ```
                """;

        ParsedJudgment judgment = parser.parse(raw);

        assertFalse(judgment.malformed());
        assertNull(judgment.malformedReason());
        assertEquals(82, judgment.score());
        assertEquals("Solid use of operators.", judgment.feedback());
        assertThat(judgment.breakdown()).containsExactly(
                new CriterionJudgment("Operator Usage", 35, 40.0, "Correct AND/OR nesting"),
                new CriterionJudgment("Keyword Coverage", 27.5, 35.0, "")
        );
        assertThat(judgment.strengths()).containsExactly("Clear structure");
        assertThat(judgment.improvements()).containsExactly("Add synonyms");
    }

    @Test
    @DisplayName("fractional and out-of-range scores are rounded and clamped")
    void scoreClamped() {
        assertEquals(100, parser.parse("{\"score\": 140}").score());
        assertEquals(0, parser.parse("{\"score\": -3}").score());
        assertEquals(78, parser.parse("{\"score\": 77.6}").score());
    }

    @Test
    @DisplayName("missing score keeps the rest of the judgment but marks it malformed")
    void missingScore() {
        ParsedJudgment judgment = parser.parse("{\"feedback\": \"ok\"}");

        assertTrue(judgment.malformed());
        assertFalse(judgment.hasScore());
        assertEquals("Missing score", judgment.malformedReason());
        assertEquals("ok", judgment.feedback());
    }

    @Test
    @DisplayName("field-level problems are collected together")
    void collectsProblems() {
        ParsedJudgment judgment = parser.parse(
                "{\"score\": \"high\", \"rubricBreakdown\": {\"Clarity\": {\"points\": \"many\"}, \"Accuracy\": {\"points\": 10}}}");

        assertTrue(judgment.malformed());
        assertEquals("Score is not numeric; Criterion 'Clarity' has no numeric points", judgment.malformedReason());
        assertThat(judgment.breakdown()).extracting(CriterionJudgment::criterionLabel).containsExactly("Accuracy");
    }

    @Test
    @DisplayName("breakdown given as an array is rejected")
    void breakdownNotObject() {
        ParsedJudgment judgment = parser.parse("{\"score\": 70, \"rubricBreakdown\": [1, 2]}");

        assertTrue(judgment.malformed());
        assertEquals(70, judgment.score());
        assertEquals("rubricBreakdown is not an object", judgment.malformedReason());
        assertThat(judgment.breakdown()).isEmpty();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    @DisplayName("empty input is malformed")
    void emptyInput(String raw) {
        ParsedJudgment judgment = parser.parse(raw);

        assertTrue(judgment.malformed());
        assertEquals("Judgment is empty", judgment.malformedReason());
    }

    @Test
    @DisplayName("text without a JSON object is malformed")
    void noJsonObject() {
        ParsedJudgment judgment = parser.parse("I think this deserves a 7/10.");

        assertTrue(judgment.malformed());
        assertEquals("No JSON object found in judgment", judgment.malformedReason());
    }

    @Test
    @DisplayName("broken JSON is malformed without throwing")
    void invalidJson() {
        ParsedJudgment judgment = parser.parse("{\"score\": 80,, }");

        assertTrue(judgment.malformed());
        assertThat(judgment.malformedReason()).startsWith("Invalid JSON:");
        assertNull(judgment.score());
    }
}
