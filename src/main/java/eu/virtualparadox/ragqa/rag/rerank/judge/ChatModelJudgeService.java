package eu.virtualparadox.ragqa.rag.rerank.judge;

import eu.virtualparadox.ragqa.application.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * {@link JudgeService} that asks the chat model for a 0-10 relevance score.
 * <p>
 * The model runs with temperature 0; the judge model id comes from
 * {@code ragqa.pipeline.judge-model} (provider default when unset).
 */
@Service
@Slf4j
public class ChatModelJudgeService implements JudgeService {

    static final String INSTRUCTIONS = String.join("\n",
            "You are a relevance judge for a document question answering system.",
            "Rate how useful the CANDIDATE passage is for answering the QUESTION.",
            "0 means unrelated, 10 means the passage directly contains the answer.",
            "Judge only the information present in the CANDIDATE; do not use outside knowledge.",
            "Reply with JSON only, exactly in this shape: {\"score\": <number from 0 to 10>}"
    );

    private final ChatModel chatModel;
    private final ChatOptions options;

    public ChatModelJudgeService(final ChatModel chatModel, final PipelineProperties properties) {
        this.chatModel = chatModel;
        this.options = ChatOptions.builder()
                .model(StringUtils.trimToNull(properties.getJudgeModel()))
                .temperature(0.0)
                .build();
    }

    @Override
    public String score(final JudgeRequest request) {
        final Prompt prompt = new Prompt(
                List.of(new SystemMessage(INSTRUCTIONS), new UserMessage(describe(request))),
                options);

        final ChatResponse response;
        try {
            response = chatModel.call(prompt);
        } catch (final RuntimeException e) {
            throw new JudgeUnavailableException("Judge model call failed", e);
        }

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return "";
        }
        final String text = response.getResult().getOutput().getText();
        log.debug("Judge answered: {}", text);
        return text == null ? "" : text;
    }

    /**
     * Candidate description; every field is present, empty when the chunk lacks it.
     */
    static String describe(final JudgeRequest request) {
        return "QUESTION: " + request.question() + "\n\n" +
                "CANDIDATE:\n" +
                "section_title: " + request.sectionTitle() + "\n" +
                "type: " + request.elementType() + "\n" +
                "keywords: " + String.join(", ", request.keywords()) + "\n" +
                "summary: " + request.summary() + "\n" +
                "excerpt: " + request.chunkText();
    }
}
