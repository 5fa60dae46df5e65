package com.fieldops.domain.error;

import com.fieldops.domain.DomainException;
import com.fieldops.domain.ErrorCategory;

import java.util.List;

/**
 * Metadata or role configuration is malformed or incomplete. Treated as fatal at startup.
 */
public final class ConfigurationException extends DomainException {

    public ConfigurationException(String message) {
        super(ErrorCategory.CONFIGURATION_ERROR, message, null, List.of());
    }

    public ConfigurationException(String message, List<String> problems) {
        super(ErrorCategory.CONFIGURATION_ERROR, message, null, problems);
    }
}
