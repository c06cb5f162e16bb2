package com.incident.rca.config;

import com.incident.rca.reasoning.ChatClientReasoningBackend;
import com.incident.rca.reasoning.ReasoningBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

/**
 * Wires the reasoning backend. Absent unless {@code rca.reasoning.enabled=true}; the
 * pipeline then runs fully offline.
 *
 * Endpoint, model and temperature come from {@code spring.ai.openai.*}.
 */
@Configuration
@ConditionalOnProperty(name = "rca.reasoning.enabled", havingValue = "true")
public class ReasoningConfig {

    private static final Logger log = LoggerFactory.getLogger(ReasoningConfig.class);

    @Value("classpath:prompts/system-prompt.st")
    private Resource systemPrompt;

    @Bean
    public ReasoningBackend reasoningBackend(ChatClient.Builder builder,
                                             @Value("${spring.ai.openai.chat.options.model:}") String model) {
        log.info("Reasoning backend enabled, model={}", model);
        return new ChatClientReasoningBackend(builder.defaultSystem(systemPrompt).build());
    }
}
