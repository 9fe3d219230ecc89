package io.lintsignal.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lintsignal.rule.RuleKey;

import java.util.Map;

/**
 * Converts the untyped options blob read from YAML into a rule's options type.
 */
final class RuleOptionsConverter {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private RuleOptionsConverter() {
    }

    static <O> O convert(RuleKey rule, Map<String, Object> blob, Class<O> type) throws ConfigurationException {
        try {
            return MAPPER.convertValue(blob, type);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid options for rule '" + rule + "': " + e.getMessage(), e);
        }
    }
}
