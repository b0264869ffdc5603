package com.eainde.xrf.config;

import com.eainde.xrf.agent.ColumnMappingAgent;
import com.eainde.xrf.agent.ComponentNormalizationAgent;
import com.eainde.xrf.agent.LeadInspectorAgent;
import com.eainde.xrf.agent.LlmColumnMapper;
import com.eainde.xrf.agent.LlmHazardAssessor;
import com.eainde.xrf.agent.LlmNameGrouper;
import com.eainde.xrf.agent.SubstrateNormalizationAgent;
import com.eainde.xrf.hazard.HazardAssessor;
import com.eainde.xrf.hazard.HazardReference;
import com.eainde.xrf.normalize.NameGrouper;
import com.eainde.xrf.parse.AiColumnMapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.service.AiServices;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Chat model and the AI collaborators built on it.
 *
 * <p>The chat model exists only when {@code xrf.ai.api-key} is set. Without it every
 * collaborator bean is still present but reports itself unavailable, and the pipeline
 * uses its deterministic fallbacks.</p>
 */
@Slf4j
@Configuration
public class XrfAiConfig {

    @Bean
    @ConditionalOnProperty(prefix = "xrf.ai", name = "api-key")
    public ChatModel xrfChatModel(
            @Value("${xrf.ai.api-key}") String apiKey,
            @Value("${xrf.ai.base-url:https://api.openai.com/v1}") String baseUrl,
            @Value("${xrf.ai.model-name:gpt-4o-mini}") String modelName,
            @Value("${xrf.ai.temperature:0.3}") double temperature,
            @Value("${xrf.ai.max-tokens:2000}") int maxTokens,
            @Value("${xrf.ai.timeout:60s}") Duration timeout) {
        log.info("Using chat model {} at {}", modelName, baseUrl);
        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .baseUrl(baseUrl)
                .modelName(modelName)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .timeout(timeout)
                .build();
    }

    @Bean
    public AiColumnMapper aiColumnMapper(ObjectProvider<ChatModel> chatModel, ObjectMapper objectMapper) {
        return new LlmColumnMapper(agent(chatModel, ColumnMappingAgent.class), objectMapper);
    }

    @Bean
    public NameGrouper componentNameGrouper(ObjectProvider<ChatModel> chatModel, ObjectMapper objectMapper) {
        return LlmNameGrouper.forComponents(agent(chatModel, ComponentNormalizationAgent.class), objectMapper);
    }

    @Bean
    public NameGrouper substrateNameGrouper(ObjectProvider<ChatModel> chatModel, ObjectMapper objectMapper) {
        return LlmNameGrouper.forSubstrates(agent(chatModel, SubstrateNormalizationAgent.class), objectMapper);
    }

    @Bean
    public HazardAssessor hazardAssessor(ObjectProvider<ChatModel> chatModel, HazardReference hazardReference,
                                         ObjectMapper objectMapper) {
        return new LlmHazardAssessor(agent(chatModel, LeadInspectorAgent.class), hazardReference, objectMapper);
    }

    private static <T> T agent(ObjectProvider<ChatModel> chatModel, Class<T> type) {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            log.info("No chat model configured, {} disabled", type.getSimpleName());
            return null;
        }
        return AiServices.builder(type)
                .chatModel(model)
                .build();
    }
}
