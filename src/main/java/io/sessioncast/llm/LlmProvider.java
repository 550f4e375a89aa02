package io.sessioncast.llm;

import java.io.IOException;

public interface LlmProvider {
    String name();

    /**
     * @throws IOException on transport failure or a non-success HTTP status
     */
    ChatResult chat(ChatRequest request) throws IOException, InterruptedException;
}
