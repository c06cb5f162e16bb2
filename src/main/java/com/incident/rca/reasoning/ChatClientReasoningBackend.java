package com.incident.rca.reasoning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.incident.rca.exception.ReasoningBackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

import java.util.Map;

/**
 * {@link ReasoningBackend} over a Spring AI {@link ChatClient}. The context map is appended
 * to the prompt as JSON; the system prompt is configured on the client.
 */
public class ChatClientReasoningBackend implements ReasoningBackend {

    private static final Logger log = LoggerFactory.getLogger(ChatClientReasoningBackend.class);

    private final ChatClient chatClient;
    private final ObjectMapper objectMapper;

    public ChatClientReasoningBackend(ChatClient chatClient) {
        this.chatClient = chatClient;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public String complete(String prompt, Map<String, Object> context) throws ReasoningBackendException {
        String user;
        try {
            user = prompt + "\n\nCONTEXT (JSON):\n" + objectMapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new ReasoningBackendException("Could not serialize reasoning context", e);
        }

        long start = System.currentTimeMillis();
        try {
            String content = chatClient.prompt()
                    .user(user)
                    .call()
                    .content();
            log.debug("Reasoning backend answered in {}ms ({} chars)",
                    System.currentTimeMillis() - start, content == null ? 0 : content.length());
            return content;
        } catch (RuntimeException e) {
            throw new ReasoningBackendException("Reasoning backend call failed: " + e.getMessage(), e);
        }
    }
}
