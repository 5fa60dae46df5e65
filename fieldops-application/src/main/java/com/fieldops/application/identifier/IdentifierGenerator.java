package com.fieldops.application.identifier;

import com.fieldops.application.ports.IdentifierSequencePort;
import com.fieldops.domain.error.ConfigurationException;
import com.fieldops.domain.metadata.EntityMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Mints {@code PREFIX-YYYY-NNNN} identifiers.
 *
 * <p>The next sequence is read from storage and incremented in memory. Two concurrent callers can get the same
 * candidate; the unique constraint on the identity column rejects the loser, who must regenerate.
 * See {@code EntityWriteService} for the retry loop.
 *
 * <p>The sequence is zero-padded to four digits and keeps growing past 9999 ({@code -10000}).
 */
public class IdentifierGenerator {

    private static final Logger log = LoggerFactory.getLogger(IdentifierGenerator.class);

    public static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Z]+-\\d{4}-\\d{4,}$");

    private final IdentifierSequencePort sequences;
    private final Clock clock;

    public IdentifierGenerator(IdentifierSequencePort sequences, Clock clock) {
        this.sequences = Objects.requireNonNull(sequences, "sequences");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @throws ConfigurationException when the entity has no prefix, table or identity field
     */
    public String generateIdentifier(EntityMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        List<String> missing = new ArrayList<>();
        if (blank(metadata.identifierPrefix())) missing.add("identifierPrefix");
        if (blank(metadata.tableName())) missing.add("tableName");
        if (blank(metadata.identityField())) missing.add("identityField");
        if (!missing.isEmpty()) {
            throw new ConfigurationException(
                    "Identifier generation is not configured for entity '" + metadata.entityName() + "'", missing);
        }

        int year = Year.now(clock).getValue();
        String yearPrefix = metadata.identifierPrefix() + "-" + year + "-";
        Optional<String> max = sequences.findMaxIdentifier(metadata.tableName(), metadata.identityField(), yearPrefix);
        long next = max.map(m -> parseSequence(m, yearPrefix)).orElse(0L) + 1;
        String id = format(metadata.identifierPrefix(), year, next);
        log.debug("[IDENT] candidate entity={} max={} next={}", metadata.entityName(), max.orElse("-"), id);
        return id;
    }

    public static String format(String prefix, int year, long sequence) {
        return String.format(Locale.ROOT, "%s-%04d-%04d", prefix, year, sequence);
    }

    /** Trailing sequence of an identifier that starts with {@code yearPrefix}. */
    static long parseSequence(String identifier, String yearPrefix) {
        if (!identifier.startsWith(yearPrefix)) {
            throw new IllegalStateException("Identifier " + identifier + " does not start with " + yearPrefix);
        }
        String tail = identifier.substring(yearPrefix.length());
        if (tail.isEmpty() || !tail.chars().allMatch(Character::isDigit)) {
            throw new IllegalStateException("Identifier " + identifier + " has a non-numeric sequence");
        }
        try {
            return Long.parseLong(tail);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Identifier " + identifier + " has a sequence out of range", e);
        }
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }
}
