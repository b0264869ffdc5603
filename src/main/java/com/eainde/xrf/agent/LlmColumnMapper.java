package com.eainde.xrf.agent;

import com.eainde.xrf.exception.AiResponseParseException;
import com.eainde.xrf.parse.AiColumnMapper;
import com.eainde.xrf.parse.AiColumnMapping;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link AiColumnMapper} backed by {@link ColumnMappingAgent}. Unavailable when no agent
 * was configured.
 */
@Slf4j
public class LlmColumnMapper implements AiColumnMapper {

    private final ColumnMappingAgent agent;
    private final ObjectMapper objectMapper;

    public LlmColumnMapper(ColumnMappingAgent agent, ObjectMapper objectMapper) {
        this.agent = agent;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isAvailable() {
        return agent != null;
    }

    @Override
    public AiColumnMapping mapColumns(List<String> headers, List<Map<String, Object>> sampleRows) {
        if (agent == null) {
            throw new IllegalStateException("AI column mapper is not configured");
        }
        String reply = agent.mapColumns(
                JsonReplies.toJson(objectMapper, headers),
                JsonReplies.toJson(objectMapper, textOnly(sampleRows)));
        return parse(reply);
    }

    AiColumnMapping parse(String reply) {
        JsonNode root = JsonReplies.readTree(objectMapper, reply);
        JsonNode mappings = root.get("mappings");
        if (mappings == null || !mappings.isArray()) {
            throw new AiResponseParseException("Column mapping reply has no 'mappings' array");
        }

        Map<String, String> assignments = new LinkedHashMap<>();
        for (JsonNode mapping : mappings) {
            String field = mapping.path("field").asText("");
            String column = mapping.path("column").asText("");
            if (!field.isEmpty() && !column.isEmpty()) {
                assignments.put(field, column);
            }
        }

        List<String> unmapped = new ArrayList<>();
        root.path("unmapped").forEach(node -> unmapped.add(node.asText()));
        double confidence = root.path("overallConfidence").asDouble(0.0);

        log.debug("AI proposed {} column assignment(s) with confidence {}", assignments.size(), confidence);
        return new AiColumnMapping(assignments, unmapped, confidence);
    }

    // Cells may be dates or doubles; the prompt only needs their text.
    private static List<Map<String, String>> textOnly(List<Map<String, Object>> rows) {
        List<Map<String, String>> out = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, String> text = new LinkedHashMap<>();
            row.forEach((header, cell) -> text.put(header, cell == null ? "" : cell.toString()));
            out.add(text);
        }
        return out;
    }
}
