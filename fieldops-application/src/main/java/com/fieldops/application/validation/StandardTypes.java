package com.fieldops.application.validation;

import com.fieldops.domain.error.ViolationKind;
import com.fieldops.domain.metadata.FieldDef;
import com.fieldops.domain.metadata.SemanticType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Base rules for the built-in semantic types.
 *
 * Numeric types coerce to {@link Long} (integer) or {@link BigDecimal} (decimal, currency); dates to
 * {@link LocalDate}; timestamps to {@link OffsetDateTime}. String input is accepted for all of them.
 */
final class StandardTypes {

    static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    // digits, spaces, dots, dashes, parentheses, optional leading plus
    static final Pattern PHONE = Pattern.compile("^\\+?[0-9 ().-]+$");
    static final Pattern TIME = Pattern.compile("^([01]\\d|2[0-3]):[0-5]\\d(:[0-5]\\d)?$");

    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    private StandardTypes() {
    }

    static void registerAll(TypeBuilderRegistry r) {
        r.register(TypeBuilder.of(SemanticType.STRING, TypeFamily.STRING, d -> string(), ValueNormalizer.TRIM));
        r.register(TypeBuilder.of(SemanticType.TEXT, TypeFamily.STRING, d -> string(), ValueNormalizer.TRIM));
        r.register(TypeBuilder.of(SemanticType.EMAIL, TypeFamily.STRING, d -> email(), ValueNormalizer.TRIM_LOWERCASE));
        r.register(TypeBuilder.of(SemanticType.PHONE, TypeFamily.STRING, d -> phone(), ValueNormalizer.TRIM));
        r.register(TypeBuilder.of(SemanticType.URL, TypeFamily.STRING, d -> url(), ValueNormalizer.TRIM));
        r.register(TypeBuilder.of(SemanticType.TIME, TypeFamily.STRING, d -> time(), ValueNormalizer.TRIM));
        r.register(TypeBuilder.of(SemanticType.ENUM, TypeFamily.STRING, StandardTypes::enumeration,
                ValueNormalizer.TRIM_LOWERCASE));
        r.register(TypeBuilder.of(SemanticType.INTEGER, TypeFamily.NUMERIC, d -> integer(), ValueNormalizer.IDENTITY));
        r.register(TypeBuilder.of(SemanticType.DECIMAL, TypeFamily.NUMERIC, d -> decimal(), ValueNormalizer.IDENTITY));
        r.register(TypeBuilder.of(SemanticType.CURRENCY, TypeFamily.NUMERIC, d -> currency(), ValueNormalizer.IDENTITY));
        r.register(TypeBuilder.of(SemanticType.BOOLEAN, TypeFamily.OTHER, d -> bool(), ValueNormalizer.IDENTITY));
        r.register(TypeBuilder.of(SemanticType.DATE, TypeFamily.OTHER, d -> date(), ValueNormalizer.IDENTITY));
        r.register(TypeBuilder.of(SemanticType.TIMESTAMP, TypeFamily.OTHER, d -> timestamp(), ValueNormalizer.IDENTITY));
        r.register(TypeBuilder.of(SemanticType.OBJECT, TypeFamily.OTHER, d -> object(), ValueNormalizer.IDENTITY));
    }

    static FieldRule string() {
        return (field, v) -> v instanceof String
                ? RuleOutcome.ok(v)
                : RuleOutcome.fail(ViolationKind.TYPE, field + " must be a string");
    }

    static FieldRule email() {
        return string().andThen((field, v) -> EMAIL.matcher((String) v).matches()
                ? RuleOutcome.ok(v)
                : RuleOutcome.fail(ViolationKind.FORMAT, field + " must be a valid email address"));
    }

    static FieldRule phone() {
        return string().andThen((field, v) -> {
            String s = (String) v;
            long digits = s.chars().filter(Character::isDigit).count();
            if (!PHONE.matcher(s).matches() || digits < 7 || digits > 15) {
                return RuleOutcome.fail(ViolationKind.FORMAT, field + " must be a valid phone number");
            }
            return RuleOutcome.ok(s);
        });
    }

    static FieldRule url() {
        return string().andThen((field, v) -> {
            RuleOutcome invalid = RuleOutcome.fail(ViolationKind.FORMAT, field + " must be a valid http(s) URL");
            URI uri;
            try {
                uri = new URI((String) v);
            } catch (URISyntaxException e) {
                return invalid;
            }
            String scheme = uri.getScheme();
            boolean web = "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
            return web && uri.getHost() != null ? RuleOutcome.ok(v) : invalid;
        });
    }

    static FieldRule time() {
        return string().andThen((field, v) -> TIME.matcher((String) v).matches()
                ? RuleOutcome.ok(v)
                : RuleOutcome.fail(ViolationKind.FORMAT, field + " must be a valid time (HH:MM or HH:MM:SS)"));
    }

    static FieldRule enumeration(FieldDef def) {
        List<String> allowed = def.values();
        return string().andThen((field, v) -> allowed.contains(v)
                ? RuleOutcome.ok(v)
                : RuleOutcome.fail(ViolationKind.ENUM, field + " must be one of: " + String.join(", ", allowed)));
    }

    static FieldRule integer() {
        return (field, v) -> {
            BigDecimal n = toDecimal(v);
            if (n == null) return RuleOutcome.fail(ViolationKind.TYPE, field + " must be a number");
            if (n.stripTrailingZeros().scale() > 0) {
                return RuleOutcome.fail(ViolationKind.TYPE, field + " must be an integer");
            }
            if (n.compareTo(LONG_MIN) < 0 || n.compareTo(LONG_MAX) > 0) {
                return RuleOutcome.fail(ViolationKind.RANGE, field + " is out of range");
            }
            return RuleOutcome.ok(n.longValueExact());
        };
    }

    static FieldRule decimal() {
        return (field, v) -> {
            BigDecimal n = toDecimal(v);
            return n == null
                    ? RuleOutcome.fail(ViolationKind.TYPE, field + " must be a number")
                    : RuleOutcome.ok(n);
        };
    }

    static FieldRule currency() {
        return decimal().andThen((field, v) -> {
            BigDecimal n = (BigDecimal) v;
            if (n.stripTrailingZeros().scale() > 2) {
                return RuleOutcome.fail(ViolationKind.FORMAT, field + " must have at most 2 decimal places");
            }
            return RuleOutcome.ok(n);
        });
    }

    static FieldRule bool() {
        return (field, v) -> {
            if (v instanceof Boolean) return RuleOutcome.ok(v);
            if (v instanceof String s) {
                String t = s.trim().toLowerCase(Locale.ROOT);
                if (t.equals("true")) return RuleOutcome.ok(Boolean.TRUE);
                if (t.equals("false")) return RuleOutcome.ok(Boolean.FALSE);
            }
            return RuleOutcome.fail(ViolationKind.TYPE, field + " must be a boolean");
        };
    }

    static FieldRule date() {
        return (field, v) -> {
            if (v instanceof LocalDate) return RuleOutcome.ok(v);
            if (v instanceof String s) {
                try {
                    return RuleOutcome.ok(LocalDate.parse(s.trim()));
                } catch (DateTimeParseException e) {
                    return RuleOutcome.fail(ViolationKind.FORMAT, field + " must be a valid date (YYYY-MM-DD)");
                }
            }
            return RuleOutcome.fail(ViolationKind.TYPE, field + " must be a date");
        };
    }

    static FieldRule timestamp() {
        return (field, v) -> {
            if (v instanceof OffsetDateTime) return RuleOutcome.ok(v);
            if (v instanceof Instant i) return RuleOutcome.ok(i.atOffset(ZoneOffset.UTC));
            if (v instanceof String s) {
                OffsetDateTime parsed = parseTimestamp(s.trim());
                return parsed != null
                        ? RuleOutcome.ok(parsed)
                        : RuleOutcome.fail(ViolationKind.FORMAT, field + " must be a valid ISO-8601 timestamp");
            }
            return RuleOutcome.fail(ViolationKind.TYPE, field + " must be a timestamp");
        };
    }

    static FieldRule object() {
        return (field, v) -> v instanceof Map || v instanceof List
                ? RuleOutcome.ok(v)
                : RuleOutcome.fail(ViolationKind.TYPE, field + " must be an object");
    }

    /** Null when the value is not numeric. */
    static BigDecimal toDecimal(Object v) {
        if (v instanceof BigDecimal d) return d;
        if (v instanceof BigInteger bi) return new BigDecimal(bi);
        if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) {
            return BigDecimal.valueOf(((Number) v).longValue());
        }
        if (v instanceof Double || v instanceof Float) {
            double d = ((Number) v).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return null;
            return new BigDecimal(Double.toString(d));
        }
        if (v instanceof String s) {
            String t = s.trim();
            if (t.isEmpty()) return null;
            try {
                return new BigDecimal(t);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static OffsetDateTime parseTimestamp(String s) {
        try {
            return OffsetDateTime.parse(s);
        } catch (DateTimeParseException e) {
            return parseLocalAsUtc(s);
        }
    }

    // no offset given: read as UTC
    private static OffsetDateTime parseLocalAsUtc(String s) {
        try {
            return LocalDateTime.parse(s).atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
