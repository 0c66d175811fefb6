package eu.virtualparadox.ragqa.rag.answer;

import eu.virtualparadox.ragqa.rag.ErrorKind;
import eu.virtualparadox.ragqa.rag.config.PipelineConfig;
import eu.virtualparadox.ragqa.rag.index.model.Chunk;
import lombok.RequiredArgsConstructor;
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
 * {@link GeneratorService} over the Spring AI {@link ChatModel}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChatModelGeneratorService implements GeneratorService {

    static final String INSTRUCTIONS = String.join("\n",
            "You are a question answering system for financial and business documents. Follow these rules:",
            "0. Do not invent or fabricate facts; use ONLY the CONTEXT provided.",
            "1. Context passages are numbered [1], [2], ... in order of relevance.",
            "2. Cite every passage you rely on with its number in square brackets, e.g. [2] or [1, 3].",
            "3. Keep figures, units, periods and currencies exactly as written in the source.",
            "4. If the CONTEXT does not contain the answer, say so plainly.",
            "5. Start with a one-sentence direct answer, then add supporting detail if useful."
    );

    private final ChatModel chatModel;

    @Override
    public String complete(final String question, final List<Chunk> orderedContext, final PipelineConfig config) {
        final Prompt prompt = new Prompt(
                List.of(new SystemMessage(INSTRUCTIONS), new UserMessage(userMessage(question, orderedContext))),
                ChatOptions.builder()
                        .model(StringUtils.trimToNull(config.getGenerationModel()))
                        .temperature(config.getGenerationTemperature())
                        .build());

        log.debug("Generation prompt:\nSystem: {}\nUser: {}", INSTRUCTIONS, prompt.getContents());

        final ChatResponse response;
        try {
            response = chatModel.call(prompt);
        } catch (final RuntimeException e) {
            throw new GenerationException(ErrorKind.GENERATION_SERVICE_UNAVAILABLE, "Chat model call failed", e);
        }
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return "";
        }
        return StringUtils.defaultString(response.getResult().getOutput().getText());
    }

    static String userMessage(final String question, final List<Chunk> orderedContext) {
        final StringBuilder contextBuilder = new StringBuilder("CONTEXT:\n");
        int index = 1;
        for (final Chunk chunk : orderedContext) {
            contextBuilder.append('[').append(index++).append("] (")
                    .append(chunk.locator()).append(")\n")
                    .append(chunk.text().strip()).append("\n\n");
        }
        contextBuilder.append("QUESTION: ").append(question);
        return contextBuilder.toString();
    }
}
