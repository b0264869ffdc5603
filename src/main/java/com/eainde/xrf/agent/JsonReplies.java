package com.eainde.xrf.agent;

import com.eainde.xrf.exception.AiResponseParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the JSON payload out of a chat reply, tolerating markdown fences and chatter
 * around the JSON.
 */
final class JsonReplies {

    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");

    private JsonReplies() {
    }

    static String cleanJson(String reply) {
        if (reply == null) return "";
        String text = reply.trim();
        Matcher fenced = FENCED.matcher(text);
        if (fenced.find()) {
            return fenced.group(1).trim();
        }
        return text;
    }

    /**
     * @throws AiResponseParseException when no JSON can be read from the reply
     */
    static JsonNode readTree(ObjectMapper mapper, String reply) {
        String json = cleanJson(reply);
        if (json.isEmpty()) {
            throw new AiResponseParseException("Empty reply from chat model");
        }
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            String embedded = embeddedJson(json);
            if (embedded != null && !embedded.equals(json)) {
                try {
                    return mapper.readTree(embedded);
                } catch (JsonProcessingException inner) {
                    e.addSuppressed(inner);
                }
            }
            throw new AiResponseParseException("Reply is not valid JSON: " + abbreviate(json), e);
        }
    }

    static String toJson(ObjectMapper mapper, Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new AiResponseParseException("Failed to serialize prompt payload", e);
        }
    }

    /** The outermost {...} or [...] span, whichever starts first. */
    private static String embeddedJson(String text) {
        int object = text.indexOf('{');
        int array = text.indexOf('[');
        int start;
        char close;
        if (array >= 0 && (object < 0 || array < object)) {
            start = array;
            close = ']';
        } else if (object >= 0) {
            start = object;
            close = '}';
        } else {
            return null;
        }
        int end = text.lastIndexOf(close);
        return end > start ? text.substring(start, end + 1) : null;
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
