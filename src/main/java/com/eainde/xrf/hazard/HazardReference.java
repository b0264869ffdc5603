package com.eainde.xrf.hazard;

import com.eainde.xrf.exception.XrfProcessingException;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Abatement and interim control options from the standard HUD/EPA report template.
 * Abatement codes are letters ("d"), interim control codes are numbers ("5").
 */
public final class HazardReference {

    public static final String DEFAULT_RESOURCE = "haz-reference.json";

    private final Map<String, String> abatement;
    private final Map<String, String> interim;

    public HazardReference(Map<String, String> abatement, Map<String, String> interim) {
        this.abatement = new LinkedHashMap<>(abatement);
        this.interim = new LinkedHashMap<>(interim);
    }

    public static HazardReference load(ObjectMapper objectMapper) {
        return load(objectMapper, DEFAULT_RESOURCE);
    }

    public static HazardReference load(ObjectMapper objectMapper, String resource) {
        try (InputStream in = HazardReference.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new XrfProcessingException("Hazard reference not found on classpath: " + resource);
            }
            Tables tables = objectMapper.readValue(in, Tables.class);
            return new HazardReference(tables.abatement(), tables.interim());
        } catch (IOException e) {
            throw new XrfProcessingException("Failed to read hazard reference " + resource, e);
        }
    }

    public String abatementText(String code) {
        String key = code == null ? "" : code.trim().toLowerCase(Locale.ROOT);
        String text = abatement.get(key);
        return text != null ? text : "[Abatement option " + displayCode(code) + " not found]";
    }

    public String interimControlText(String code) {
        String key = code == null ? "" : code.trim();
        String text = interim.get(key);
        return text != null ? text : "[Interim control option " + displayCode(code) + " not found]";
    }

    /** "code: text" lines, for prompting. */
    public List<String> abatementOptions() {
        return abatement.entrySet().stream().map(e -> e.getKey() + ": " + e.getValue()).toList();
    }

    public List<String> interimControlOptions() {
        return interim.entrySet().stream().map(e -> e.getKey() + ": " + e.getValue()).toList();
    }

    private static String displayCode(String code) {
        return code == null || code.isEmpty() ? "?" : code;
    }

    record Tables(@JsonProperty("abatement") Map<String, String> abatement,
                  @JsonProperty("interim") Map<String, String> interim) {
        Tables {
            abatement = abatement == null ? Map.of() : abatement;
            interim = interim == null ? Map.of() : interim;
        }
    }
}
