package com.pandora.orchestrator.evidence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw connector-shaped objects into {@link EvidenceRecord}s.
 *
 * <p>Input may be a {@code Map} (the usual shape of step outputs) or any bean
 * or record Jackson can convert to one. Missing optional values fall back to
 * the default for their {@link FieldKind}: {@code 0}, {@code ""}, {@code null}
 * for dates, {@code false}. A value of the wrong shape is logged and defaulted;
 * one bad row never aborts an evidence pass.
 */
public final class RecordAdapters {

    private static final Logger log = LoggerFactory.getLogger(RecordAdapters.class);

    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    /** Where the identity of an entity lives in a raw object. */
    public record IdentityAliases(List<String> id, List<String> name,
                                  List<String> ownerEmail, List<String> ownerName,
                                  String fallbackName) {}

    public static final IdentityAliases DEAL_IDENTITY = new IdentityAliases(
            List.of("id", "deal_id", "dealId"),
            List.of("name", "deal_name", "dealName"),
            List.of("owner_email", "ownerEmail", "owner"),
            List.of("owner_name", "ownerName", "owner"),
            "Unnamed");

    public static final IdentityAliases REP_IDENTITY = new IdentityAliases(
            List.of("email", "rep_email", "owner"),
            List.of("name", "rep_name", "owner"),
            List.of("email", "rep_email", "owner"),
            List.of("name", "rep_name", "owner"),
            "Unknown");

    private RecordAdapters() {}

    public static EvidenceRecord dealToRecord(Object deal, FieldMapping mapping,
                                              Map<String, ?> derivedValues, Severity severity) {
        return toRecord(deal, EntityType.DEAL, DEAL_IDENTITY, mapping, derivedValues, severity);
    }

    public static EvidenceRecord repToRecord(Object rep, FieldMapping mapping,
                                             Map<String, ?> derivedValues, Severity severity) {
        return toRecord(rep, EntityType.REP, REP_IDENTITY, mapping, derivedValues, severity);
    }

    /**
     * Generic adapter.
     *
     * @param derivedValues values computed by the caller; they win over mapped derived fields
     * @param severity      passed through unchanged
     */
    public static EvidenceRecord toRecord(Object raw, EntityType type, IdentityAliases identity,
                                          FieldMapping mapping, Map<String, ?> derivedValues,
                                          Severity severity) {
        Map<String, Object> source = asMap(raw);

        String id = firstString(source, identity.id());
        if (id.isEmpty()) {
            log.warn("{} record has no id (looked for {}); recording it with an empty id",
                    type.wireName(), identity.id());
        }
        String name = firstString(source, identity.name());
        if (name.isEmpty()) name = identity.fallbackName();
        String ownerEmail = emptyToNull(firstString(source, identity.ownerEmail()));
        String ownerName = emptyToNull(firstString(source, identity.ownerName()));

        Map<String, Object> canonical = new LinkedHashMap<>();
        for (FieldMapping.Field field : mapping.canonicalFields()) {
            canonical.put(field.target(), extract(source, field, id));
        }
        Map<String, Object> derived = new LinkedHashMap<>();
        for (FieldMapping.Field field : mapping.derivedFields()) {
            derived.put(field.target(), extract(source, field, id));
        }
        if (derivedValues != null) {
            derived.putAll(derivedValues);
        }
        return new EvidenceRecord(id, type, name, ownerEmail, ownerName, canonical, derived, severity);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static Map<String, Object> asMap(Object raw) {
        if (raw == null) {
            log.warn("Null source object passed to evidence adapter; using defaults");
            return Map.of();
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        try {
            return MAPPER.convertValue(raw, MAP_TYPE);
        } catch (IllegalArgumentException e) {
            log.warn("Cannot read {} as a field map; using defaults: {}",
                    raw.getClass().getSimpleName(), e.getMessage());
            return Map.of();
        }
    }

    private static Object extract(Map<String, Object> source, FieldMapping.Field field, String entityId) {
        Object value = firstPresent(source, field.aliases());
        if (value == null) {
            return defaultFor(field.kind());
        }
        try {
            return switch (field.kind()) {
                case NUMBER  -> toNumber(value);
                case STRING  -> value.toString();
                case DATE    -> toDate(value);
                case BOOLEAN -> toBoolean(value);
            };
        } catch (IllegalArgumentException | DateTimeParseException e) {
            log.warn("Malformed value for '{}' on entity '{}' ({}); using default",
                    field.target(), entityId, e.getMessage());
            return defaultFor(field.kind());
        }
    }

    static Object defaultFor(FieldKind kind) {
        return switch (kind) {
            case NUMBER  -> 0;
            case STRING  -> "";
            case DATE    -> null;
            case BOOLEAN -> false;
        };
    }

    private static Object firstPresent(Map<String, Object> source, List<String> aliases) {
        for (String alias : aliases) {
            Object value = source.get(alias);
            if (value != null && !(value instanceof String s && s.isBlank())) {
                return value;
            }
        }
        return null;
    }

    private static String firstString(Map<String, Object> source, List<String> aliases) {
        Object value = firstPresent(source, aliases);
        return value == null ? "" : value.toString();
    }

    private static String emptyToNull(String s) {
        return s.isEmpty() ? null : s;
    }

    private static Number toNumber(Object value) {
        if (value instanceof Number n) return n;
        String text = value.toString().trim();
        try {
            BigDecimal parsed = new BigDecimal(text);
            return parsed.scale() <= 0 ? (Number) parsed.longValueExact() : (Number) parsed.doubleValue();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("not a number: '" + text + "'");
        }
    }

    private static LocalDate toDate(Object value) {
        if (value instanceof LocalDate d) return d;
        if (value instanceof Instant i) return i.atZone(ZoneOffset.UTC).toLocalDate();
        if (value instanceof OffsetDateTime o) return o.toLocalDate();
        if (value instanceof ZonedDateTime z) return z.toLocalDate();
        if (value instanceof LocalDateTime l) return l.toLocalDate();
        if (value instanceof Date d) return d.toInstant().atZone(ZoneOffset.UTC).toLocalDate();
        String text = value.toString().trim();
        if (text.length() == 10) {
            return LocalDate.parse(text);
        }
        try {
            return OffsetDateTime.parse(text).toLocalDate();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(text).toLocalDate();
        }
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0;
        String text = value.toString().trim().toLowerCase();
        if (text.equals("true") || text.equals("yes")) return true;
        if (text.equals("false") || text.equals("no")) return false;
        throw new IllegalArgumentException("not a boolean: '" + text + "'");
    }
}
