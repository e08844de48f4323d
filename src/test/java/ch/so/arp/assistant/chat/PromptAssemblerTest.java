package ch.so.arp.assistant.chat;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class PromptAssemblerTest {

    private static final AssistantSettings SETTINGS = new AssistantSettings("dev", true, "You are helpful.", 0.7d, 256);

    @Test
    void placesSystemHistoryAndQuestionInOrder() {
        PromptAssembler assembler = new PromptAssembler(6000, 10);
        List<ChatMessage> history = List.of(ChatMessage.user("Hi"), ChatMessage.assistant("Hello!"));

        List<ChatMessage> messages = assembler.assemble(
                new AnswerRequest("dev", 1L, "What is Bitcoin?", history, "[Source: a.md]\nBitcoin facts", SETTINGS));

        assertThat(messages).extracting(ChatMessage::role)
                .containsExactly(ChatRole.SYSTEM, ChatRole.USER, ChatRole.ASSISTANT, ChatRole.USER);
        assertThat(messages.get(0).content()).isEqualTo("You are helpful." + PromptAssembler.KNOWLEDGE_INTRO
                + "[Source: a.md]\nBitcoin facts" + PromptAssembler.KNOWLEDGE_OUTRO);
        assertThat(messages.get(3)).isEqualTo(ChatMessage.user("What is Bitcoin?"));
    }

    @Test
    void omitsKnowledgeSectionWithoutContext() {
        PromptAssembler assembler = new PromptAssembler(6000, 10);

        List<ChatMessage> messages = assembler.assemble(new AnswerRequest("dev", 1L, "Hi", List.of(), null, SETTINGS));

        assertThat(messages).containsExactly(ChatMessage.system("You are helpful."), ChatMessage.user("Hi"));
    }

    @Test
    void truncatesContextAndHistory() {
        PromptAssembler assembler = new PromptAssembler(20, 4);
        List<ChatMessage> history = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            history.add(ChatMessage.user("question " + i));
        }

        List<ChatMessage> messages = assembler.assemble(
                new AnswerRequest("dev", 1L, "Next", history, "x".repeat(50), SETTINGS));

        assertThat(messages.get(0).content()).contains(PromptAssembler.KNOWLEDGE_INTRO + "x".repeat(20)
                + PromptAssembler.KNOWLEDGE_OUTRO);
        assertThat(messages.subList(1, 5)).extracting(ChatMessage::content)
                .containsExactly("question 2", "question 3", "question 4", "question 5");
        assertThat(messages).hasSize(6);
    }

    @Test
    void doesNotCutSurrogatePairs() {
        PromptAssembler assembler = new PromptAssembler(3, 10);

        assertThat(assembler.truncate("ab😀cd")).isEqualTo("ab");
    }
}
