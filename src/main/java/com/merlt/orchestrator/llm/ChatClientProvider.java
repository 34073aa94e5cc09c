package com.merlt.orchestrator.llm;

import java.util.List;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.Prompt;

/**
 * Provider backed by a Spring AI {@link ChatClient}. Messages are passed as a prebuilt prompt so
 * JSON examples in the instructions are not treated as template variables.
 */
public class ChatClientProvider implements LanguageModelProvider {
    private final String name;
    private final ChatClient chatClient;

    public ChatClientProvider(String name, ChatClient chatClient) {
        this.name = name;
        this.chatClient = chatClient;
    }

    @Override
    public String name() {
        return this.name;
    }

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        Prompt prompt = new Prompt(List.of(new SystemMessage(systemPrompt), new UserMessage(userPrompt)));
        return this.chatClient.prompt(prompt).call().content();
    }
}
