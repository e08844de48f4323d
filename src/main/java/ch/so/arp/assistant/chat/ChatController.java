package ch.so.arp.assistant.chat;

import java.util.concurrent.CompletableFuture;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;

/**
 * REST endpoint to ask the community assistant and to read its usage.
 */
@RestController
@RequestMapping(path = "/api/communities/{community}", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class ChatController {

    private final ChatService chatService;

    public ChatController(ChatService chatService) {
        this.chatService = chatService;
    }

    /**
     * Answers with 204 when the assistant does not respond in this community.
     */
    @PostMapping(path = "/chat", consumes = MediaType.APPLICATION_JSON_VALUE)
    public CompletableFuture<ResponseEntity<ChatResponse>> chat(@PathVariable String community,
            @Valid @RequestBody ChatRequest request) {
        return chatService.answerAsync(community, request.userId(), request.question())
                .thenApply(answer -> answer
                        .map(value -> ResponseEntity.ok(ChatResponse.from(value)))
                        .orElseGet(() -> ResponseEntity.noContent().build()));
    }

    @GetMapping("/usage")
    public UsageSummary usage(@PathVariable String community) {
        return chatService.usage(community);
    }
}
