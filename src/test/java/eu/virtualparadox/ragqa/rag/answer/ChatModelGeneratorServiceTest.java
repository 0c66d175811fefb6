package eu.virtualparadox.ragqa.rag.answer;

import eu.virtualparadox.ragqa.rag.ErrorKind;
import eu.virtualparadox.ragqa.rag.config.PipelineConfig;
import eu.virtualparadox.ragqa.rag.index.model.Chunk;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ChatModelGeneratorServiceTest {

    private final ChatModel chatModel = mock(ChatModel.class);
    private final ChatModelGeneratorService service = new ChatModelGeneratorService(chatModel);

    @Test
    @DisplayName("Context is numbered with locators in the given order")
    void testUserMessage() {
        String message = ChatModelGeneratorService.userMessage("What was revenue?", List.of(
                Chunk.of("a", "10-K-2023", " Revenue was 4.2bn. ", 3, 4),
                Chunk.of("b", "memo", "Costs fell.", 0, 0)));

        assertEquals("CONTEXT:\n"
                + "[1] (10-K-2023 p. 3-4)\nRevenue was 4.2bn.\n\n"
                + "[2] (memo)\nCosts fell.\n\n"
                + "QUESTION: What was revenue?", message);
    }

    @Test
    @DisplayName("Model and temperature come from the run config")
    void testOptions() {
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("Revenue was 4.2bn [1].")))));
        PipelineConfig config = PipelineConfig.defaults().toBuilder()
                .generationModel("qwen3:8b").generationTemperature(0.2).build();

        String text = service.complete("q", List.of(Chunk.of("a", "d", "t", 1, 1)), config);

        assertEquals("Revenue was 4.2bn [1].", text);
        ArgumentCaptor<Prompt> prompt = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(prompt.capture());
        assertEquals("qwen3:8b", prompt.getValue().getOptions().getModel());
        assertEquals(0.2, prompt.getValue().getOptions().getTemperature());
        assertThat(prompt.getValue().getContents()).contains("[1] (d p. 1)");
    }

    @Test
    @DisplayName("Model failures become GENERATION_SERVICE_UNAVAILABLE")
    void testFailure() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new IllegalStateException("timeout"));

        GenerationException ex = assertThrows(GenerationException.class,
                () -> service.complete("q", List.of(), PipelineConfig.defaults()));
        assertEquals(ErrorKind.GENERATION_SERVICE_UNAVAILABLE, ex.getKind());
    }
}
