package com.asiainfo.insights.core.schema;

import com.asiainfo.insights.core.exception.ApplicationConfigInvalidException;
import com.asiainfo.insights.core.generator.SafeIdentifier;

final class SchemaChecks {

    private SchemaChecks() {}

    static void required(String application, String property, String value) {
        if (value == null || value.isBlank()) {
            throw new ApplicationConfigInvalidException("Application " + application + ": " + property + " is required");
        }
        identifier(application, property, value);
    }

    static void optional(String application, String property, String value) {
        if (value != null) {
            identifier(application, property, value);
        }
    }

    static void table(String application, String property, String value) {
        if (value == null || value.isBlank()) {
            throw new ApplicationConfigInvalidException("Application " + application + ": " + property + " is required");
        }
        for (String part : value.split("\\.", -1)) {
            identifier(application, property, part);
        }
    }

    private static void identifier(String application, String property, String value) {
        if (!SafeIdentifier.isSafe(value)) {
            throw new ApplicationConfigInvalidException("Application " + application + ": " + property
                    + " is not a valid identifier");
        }
    }
}
