package com.opsdesk.runner.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Renders a query result as text for display and for the audit log.
 * Scalars print as themselves, null prints as {@code NULL}, and records
 * and collections print as indented JSON.
 */
@Component
public class ResultFormatter {

    private static final Logger log = LoggerFactory.getLogger(ResultFormatter.class);

    private final ObjectMapper json;

    public ResultFormatter(ObjectMapper objectMapper) {
        this.json = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String format(Object value) {
        if (value == null)                 return "NULL";
        if (value instanceof Boolean b)    return b ? "true" : "false";
        if (value instanceof BigDecimal d) return d.toPlainString();
        if (value instanceof Number n)     return n.toString();
        if (value instanceof CharSequence) return value.toString();
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Falling back to toString() for {}: {}", value.getClass().getSimpleName(), e.getOriginalMessage());
            return String.valueOf(value);
        }
    }
}
