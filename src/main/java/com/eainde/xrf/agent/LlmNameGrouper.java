package com.eainde.xrf.agent;

import com.eainde.xrf.exception.AiResponseParseException;
import com.eainde.xrf.normalize.NameGrouper;
import com.eainde.xrf.normalize.NormalizationGroup;
import com.eainde.xrf.normalize.NormalizationKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * {@link NameGrouper} over one of the normalization agents.
 *
 * <p>The agent call is passed as a function from a JSON array of names to the raw reply, so
 * the component and substrate agents share the reply handling.</p>
 */
@Slf4j
public class LlmNameGrouper implements NameGrouper {

    private final NormalizationKind kind;
    private final UnaryOperator<String> agentCall;
    private final ObjectMapper objectMapper;

    /**
     * @param agentCall {@code null} when no chat model is configured
     */
    public LlmNameGrouper(NormalizationKind kind, UnaryOperator<String> agentCall, ObjectMapper objectMapper) {
        this.kind = kind;
        this.agentCall = agentCall;
        this.objectMapper = objectMapper;
    }

    public static LlmNameGrouper forComponents(ComponentNormalizationAgent agent, ObjectMapper objectMapper) {
        return new LlmNameGrouper(NormalizationKind.COMPONENT, agent == null ? null : agent::normalize, objectMapper);
    }

    public static LlmNameGrouper forSubstrates(SubstrateNormalizationAgent agent, ObjectMapper objectMapper) {
        return new LlmNameGrouper(NormalizationKind.SUBSTRATE, agent == null ? null : agent::normalize, objectMapper);
    }

    @Override
    public boolean isAvailable() {
        return agentCall != null;
    }

    @Override
    public List<NormalizationGroup> group(List<String> names) {
        if (agentCall == null) {
            throw new IllegalStateException("No " + kind.label() + " normalization agent configured");
        }
        log.debug("Sending {} {} name(s) for grouping", names.size(), kind.label());
        return parse(agentCall.apply(JsonReplies.toJson(objectMapper, names)));
    }

    List<NormalizationGroup> parse(String reply) {
        JsonNode root = JsonReplies.readTree(objectMapper, reply);
        JsonNode groups = root.isArray() ? root : root.get("normalizations");
        if (groups == null || !groups.isArray()) {
            throw new AiResponseParseException("Normalization reply has no 'normalizations' array");
        }
        List<NormalizationGroup> result = new ArrayList<>();
        for (JsonNode node : groups) {
            try {
                NormalizationGroup group = objectMapper.treeToValue(node, NormalizationGroup.class);
                if (group.canonical() != null && !group.canonical().isBlank()) {
                    result.add(group);
                }
            } catch (JsonProcessingException e) {
                throw new AiResponseParseException("Malformed normalization group: " + node, e);
            }
        }
        return result;
    }
}
