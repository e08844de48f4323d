package ch.so.arp.assistant.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class ChatControllerTest {

    private final ChatService chatService = mock(ChatService.class);
    private final ChatController controller = new ChatController(chatService);

    @Test
    void returnsAnswerWithUsage() throws Exception {
        ModelAnswer answer = ModelAnswer.completed("Bitcoin is a currency.", new TokenUsage(12, 5, 17), 250L);
        when(chatService.answerAsync("dev", 1L, "What is Bitcoin?"))
                .thenReturn(CompletableFuture.completedFuture(Optional.of(answer)));

        ResponseEntity<ChatResponse> response = controller.chat("dev", new ChatRequest(1L, "What is Bitcoin?")).get();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(
                new ChatResponse(AnswerOutcome.COMPLETED, "Bitcoin is a currency.", 12, 5, 17, 250L));
    }

    @Test
    void returnsRateLimitedAnswerAsRegularResponse() throws Exception {
        when(chatService.answerAsync("dev", 1L, "again?"))
                .thenReturn(CompletableFuture.completedFuture(Optional.of(ModelAnswer.rateLimited())));

        ResponseEntity<ChatResponse> response = controller.chat("dev", new ChatRequest(1L, "again?")).get();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().outcome()).isEqualTo(AnswerOutcome.RATE_LIMITED);
        assertThat(response.getBody().totalTokens()).isZero();
    }

    @Test
    void returnsNoContentWhenAssistantIsSilent() throws Exception {
        when(chatService.answerAsync("ops", 1L, "Hello?"))
                .thenReturn(CompletableFuture.completedFuture(Optional.empty()));

        ResponseEntity<ChatResponse> response = controller.chat("ops", new ChatRequest(1L, "Hello?")).get();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
        assertThat(response.getBody()).isNull();
    }

    @Test
    void returnsUsageSummary() {
        when(chatService.usage("dev")).thenReturn(new UsageSummary("dev", 3L, 90L));

        assertThat(controller.usage("dev")).isEqualTo(new UsageSummary("dev", 3L, 90L));
    }
}
