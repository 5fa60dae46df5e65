package com.fieldops.application.ports;

import java.util.Optional;

/**
 * Read side of identifier minting.
 *
 * Returns the highest identifier starting with {@code yearPrefix} (e.g. {@code WO-2026-}), ordered numerically by
 * its sequence part, across live rows and retired identifiers. Uniqueness is not guaranteed by this lookup;
 * storage enforces it.
 */
public interface IdentifierSequencePort {
    Optional<String> findMaxIdentifier(String tableName, String identifierField, String yearPrefix);
}
