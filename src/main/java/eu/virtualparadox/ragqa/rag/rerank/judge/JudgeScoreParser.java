package eu.virtualparadox.ragqa.rag.rerank.judge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.ragqa.rag.rerank.model.JudgeScore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a judge answer into a {@link JudgeScore}.
 * <ol>
 *   <li>Drop {@code <think>...</think>} reasoning blocks</li>
 *   <li>Take {@code score} from the first JSON object in the answer, if any</li>
 *   <li>Otherwise take the first number in the answer</li>
 *   <li>Accept the value only if it is finite and within [{@value #MIN_SCORE}, {@value #MAX_SCORE}]</li>
 * </ol>
 * Anything else is {@link JudgeScore#unparseable(String)}. This class never throws on input.
 */
@Component
public class JudgeScoreParser {

    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 10.0;

    private static final Pattern THINK_BLOCK = Pattern.compile("(?is)<think>.*?(</think>|$)");
    private static final Pattern JSON_OBJECT = Pattern.compile("(?s)\\{.*?}");
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");

    private final ObjectMapper objectMapper;

    public JudgeScoreParser() {
        this(new ObjectMapper());
    }

    @Autowired
    public JudgeScoreParser(final ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JudgeScore parse(final String raw) {
        if (raw == null || raw.isBlank()) {
            return JudgeScore.unparseable(raw);
        }
        final String answer = THINK_BLOCK.matcher(raw).replaceAll("").trim();

        final Matcher json = JSON_OBJECT.matcher(answer);
        if (json.find()) {
            final Double fromJson = scoreFromJson(json.group());
            if (fromJson != null) {
                return inRange(fromJson, raw);
            }
        }

        final Matcher number = NUMBER.matcher(answer);
        if (number.find()) {
            return inRange(Double.parseDouble(number.group()), raw);
        }
        return JudgeScore.unparseable(raw);
    }

    private Double scoreFromJson(final String candidate) {
        try {
            final JsonNode node = objectMapper.readTree(candidate);
            final JsonNode score = node == null ? null : node.get("score");
            if (score == null) {
                return null;
            }
            if (score.isNumber()) {
                return score.asDouble();
            }
            if (score.isTextual()) {
                final Matcher m = NUMBER.matcher(score.asText());
                return m.find() ? Double.parseDouble(m.group()) : null;
            }
            return null;
        } catch (final IOException e) {
            return null;
        }
    }

    private JudgeScore inRange(final double value, final String raw) {
        if (Double.isFinite(value) && value >= MIN_SCORE && value <= MAX_SCORE) {
            return JudgeScore.of(value, raw);
        }
        return JudgeScore.unparseable(raw);
    }
}
