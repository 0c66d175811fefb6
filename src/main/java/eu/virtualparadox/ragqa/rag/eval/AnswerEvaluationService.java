package eu.virtualparadox.ragqa.rag.eval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.ragqa.application.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks the chat model whether a generated answer agrees with a ground truth answer.
 * Used for offline evaluation runs, not by the query pipeline.
 */
@Service
@Slf4j
public class AnswerEvaluationService {

    static final String TEMPLATE = String.join("\n",
            "You compare a generated answer with the correct answer to a question.",
            "Numbers that differ only in rounding or units of presentation count as the same.",
            "",
            "QUESTION: %s",
            "CORRECT ANSWER: %s",
            "GENERATED ANSWER: %s",
            "",
            "Reply with JSON only, in this shape:",
            "{\"result\": \"true\" or \"false\", \"reasoning\": \"<one or two sentences>\"}"
    );

    private static final Pattern THINK_BLOCK = Pattern.compile("(?is)<think>.*?(</think>|$)");
    private static final Pattern JSON_OBJECT = Pattern.compile("(?s)\\{.*}");

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final ChatOptions options;

    public AnswerEvaluationService(final ChatModel chatModel,
                                   final ObjectMapper objectMapper,
                                   final PipelineProperties properties) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.options = ChatOptions.builder()
                .model(StringUtils.trimToNull(properties.getGenerationModel()))
                .temperature(0.0)
                .build();
    }

    /**
     * @throws EvaluationException when the chat model cannot be reached
     */
    public EvaluationResult evaluate(final String question, final String groundTruth, final String generatedAnswer) {
        final String message = String.format(TEMPLATE,
                StringUtils.defaultString(question),
                StringUtils.defaultString(groundTruth),
                StringUtils.defaultString(generatedAnswer));

        final ChatResponse response;
        try {
            response = chatModel.call(new Prompt(List.of(new UserMessage(message)), options));
        } catch (final RuntimeException e) {
            throw new EvaluationException("Evaluation model call failed", e);
        }

        final String text = response == null || response.getResult() == null || response.getResult().getOutput() == null
                ? ""
                : StringUtils.defaultString(response.getResult().getOutput().getText());
        return read(text);
    }

    EvaluationResult read(final String raw) {
        final String answer = THINK_BLOCK.matcher(raw).replaceAll("").trim();

        String result = answer;
        String reasoning = null;
        final Matcher json = JSON_OBJECT.matcher(answer);
        if (json.find()) {
            try {
                final JsonNode node = objectMapper.readTree(json.group());
                if (node != null && node.hasNonNull("result")) {
                    result = node.get("result").asText().strip();
                    reasoning = node.hasNonNull("reasoning") ? node.get("reasoning").asText() : null;
                }
            } catch (final IOException e) {
                log.debug("Evaluation answer is not JSON, using it verbatim: {}", answer);
            }
        }

        return new EvaluationResult(result, isSame(result), reasoning);
    }

    private static boolean isSame(final String result) {
        final String[] words = StringUtils.split(result);
        if (words == null || words.length == 0) {
            return false;
        }
        return StringUtils.strip(words[0], ".,:;!\"'").toLowerCase(Locale.ROOT).equals("true");
    }
}
