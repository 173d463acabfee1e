package com.anthem.billtriage.parser;

import com.anthem.billtriage.model.FailedBill;
import com.anthem.billtriage.model.FailureKind;
import com.anthem.billtriage.model.FailureReason;
import com.anthem.billtriage.model.ServiceLine;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link FailedBill} from a raw failed-bill payload.
 *
 * Reads the flat layout ({@code filename, provider, serviceLines, failureReasons}) and falls
 * back to the stored processing layout ({@code validation_info.failure_reasons},
 * {@code service_lines}, {@code filemaker.provider}). Missing or malformed fields degrade to
 * absent values; parsing a readable JSON object never throws.
 */
@Component
public class FailedBillParser {

    private static final Logger log = LoggerFactory.getLogger(FailedBillParser.class);

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("MM/dd/yyyy"),
            DateTimeFormatter.ofPattern("M/d/yyyy"),
            DateTimeFormatter.ofPattern("MM/dd/yy"),
            DateTimeFormatter.ofPattern("M/d/yy")
    );

    private final ObjectMapper objectMapper;

    public FailedBillParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parse stored JSON bytes. The object name is used when the payload carries no filename.
     *
     * @throws IOException when the bytes are not a JSON document
     */
    public FailedBill parse(String objectName, byte[] json) throws IOException {
        JsonNode payload = objectMapper.readTree(json);
        if (payload == null || !payload.isObject()) {
            throw new IOException("Failed bill payload is not a JSON object: " + objectName);
        }
        return parse(payload, objectName);
    }

    public FailedBill parse(JsonNode payload) {
        return parse(payload, null);
    }

    public FailedBill parse(JsonNode payload, String defaultFilename) {
        String filename = text(payload.path("filename"));
        if (filename == null) {
            filename = defaultFilename;
        }

        FailedBill.FailedBillBuilder bill = FailedBill.builder()
                .filename(filename)
                .provider(extractProvider(payload));

        for (JsonNode line : firstArray(payload, "serviceLines", "service_lines")) {
            bill.serviceLine(parseServiceLine(line));
        }

        JsonNode reasons = payload.path("failureReasons");
        if (!reasons.isArray()) {
            reasons = payload.path("validation_info").path("failure_reasons");
        }
        if (reasons.isArray()) {
            for (JsonNode reason : reasons) {
                if (reason.isTextual()) {
                    bill.failureReason(FailureReason.parse(reason.asText()));
                } else {
                    log.debug("Skipping non-text failure reason: filename={}, value={}", filename, reason);
                }
            }
        }

        return bill.build();
    }

    /**
     * Placeholder for a stored bill that could not be read at all.
     */
    public FailedBill readError(String filename) {
        return FailedBill.builder()
                .filename(filename)
                .failureReason(FailureReason.parse(FailureKind.READ_ERROR.name()))
                .build();
    }

    /**
     * Parse a date of service. Ranges ("01/02/24 - 01/05/24") use the first date.
     * Returns null when nothing matches.
     */
    public static LocalDate parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        int range = value.indexOf(" - ");
        if (range > 0) {
            value = value.substring(0, range).trim();
        }
        if (value.length() > 10 && value.charAt(4) == '-') {
            // ISO timestamp
            value = value.substring(0, 10);
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(value, format);
            } catch (DateTimeParseException e) {
                log.trace("Date '{}' does not match {}", value, format);
            }
        }
        return null;
    }

    private ServiceLine parseServiceLine(JsonNode line) {
        String rawDate = firstText(line, "dateOfService", "date_of_service", "DOS");
        ServiceLine.ServiceLineBuilder builder = ServiceLine.builder()
                .procedureCode(firstText(line, "procedureCode", "cpt_code", "CPT"))
                .rawDateOfService(rawDate)
                .dateOfService(parseDate(rawDate))
                .units(parseUnits(line));

        JsonNode modifiers = line.has("modifiers") ? line.path("modifiers") : line.path("modifier");
        if (modifiers.isArray()) {
            for (JsonNode modifier : modifiers) {
                String value = text(modifier);
                if (value != null) {
                    builder.modifier(value);
                }
            }
        } else {
            String value = text(modifiers);
            if (value != null) {
                builder.modifier(value);
            }
        }
        return builder.build();
    }

    private int parseUnits(JsonNode line) {
        JsonNode units = line.has("units") ? line.path("units") : line.path("Units");
        if (units.isNumber()) {
            return Math.max(units.asInt(), 1);
        }
        String value = text(units);
        if (value != null) {
            try {
                return Math.max((int) Double.parseDouble(value), 1);
            } catch (NumberFormatException e) {
                log.debug("Unreadable units value '{}', defaulting to 1", value);
            }
        }
        return 1;
    }

    private String extractProvider(JsonNode payload) {
        String provider = text(payload.path("provider"));
        if (provider != null) {
            return provider;
        }
        JsonNode fmProvider = payload.path("filemaker").path("provider");
        provider = firstText(fmProvider, "Billing Name", "DBA Name Billing Name");
        if (provider != null) {
            return provider;
        }
        return text(payload.path("billing_info").path("billing_provider_name"));
    }

    private static List<JsonNode> firstArray(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode candidate = node.path(name);
            if (candidate.isArray()) {
                List<JsonNode> items = new ArrayList<>();
                candidate.forEach(items::add);
                return items;
            }
        }
        return List.of();
    }

    private static String firstText(JsonNode node, String... names) {
        for (String name : names) {
            String value = text(node.path(name));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /** Trimmed text of a scalar node; null for missing, null, containers or blank. */
    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }
}
