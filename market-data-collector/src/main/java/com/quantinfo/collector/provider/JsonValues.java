package com.quantinfo.collector.provider;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Lenient readers for the string-typed numbers vendor payloads use.
 * Missing, blank, "--" and "None" values read as null.
 */
final class JsonValues {

    private JsonValues() {
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        if (text.isEmpty() || "--".equals(text) || "None".equalsIgnoreCase(text) || "null".equals(text)) {
            return null;
        }
        return text;
    }

    static BigDecimal decimal(JsonNode node, String field) {
        String text = text(node, field);
        if (text == null) {
            return null;
        }
        if (text.endsWith("%")) {
            text = text.substring(0, text.length() - 1);
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Long whole(JsonNode node, String field) {
        BigDecimal value = decimal(node, field);
        return value == null ? null : value.longValue();
    }

    static Double real(JsonNode node, String field) {
        BigDecimal value = decimal(node, field);
        return value == null ? null : value.doubleValue();
    }

    static LocalDate date(JsonNode node, String field) {
        String text = text(node, field);
        if (text == null) {
            return null;
        }
        try {
            // intraday datetimes carry a time part after the date
            return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
