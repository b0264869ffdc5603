package com.eainde.xrf.agent;

import com.eainde.xrf.exception.AiResponseParseException;
import com.eainde.xrf.hazard.AssessedHazard;
import com.eainde.xrf.hazard.HazardAssessor;
import com.eainde.xrf.hazard.HazardReference;
import com.eainde.xrf.hazard.PositiveComponentInput;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link HazardAssessor} backed by {@link LeadInspectorAgent}.
 */
@Slf4j
public class LlmHazardAssessor implements HazardAssessor {

    private final LeadInspectorAgent agent;
    private final HazardReference hazardReference;
    private final ObjectMapper objectMapper;

    public LlmHazardAssessor(LeadInspectorAgent agent, HazardReference hazardReference, ObjectMapper objectMapper) {
        this.agent = agent;
        this.hazardReference = hazardReference;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isAvailable() {
        return agent != null;
    }

    @Override
    public List<AssessedHazard> assess(List<PositiveComponentInput> components) {
        if (agent == null) {
            throw new IllegalStateException("Lead inspector agent is not configured");
        }
        String reply = agent.assess(
                bulletList(hazardReference.abatementOptions()),
                bulletList(hazardReference.interimControlOptions()),
                JsonReplies.toJson(objectMapper, components));
        return parse(reply);
    }

    List<AssessedHazard> parse(String reply) {
        JsonNode root = JsonReplies.readTree(objectMapper, reply);
        if (!root.isArray()) {
            throw new AiResponseParseException("Lead inspector reply is not a JSON array");
        }
        List<AssessedHazard> hazards = new ArrayList<>();
        for (JsonNode node : root) {
            try {
                hazards.add(objectMapper.treeToValue(node, AssessedHazard.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed hazard entry: {}", node);
                hazards.add(null);
            }
        }
        return hazards;
    }

    private static String bulletList(List<String> lines) {
        return lines.stream().map(line -> "- " + line).collect(Collectors.joining("\n"));
    }
}
