package dev.mars.spacetime.db.util;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.UUID;

/**
 * Validates and derives the table names the engine interpolates into SQL.
 *
 * <p>Values are always bound as parameters; only table names are spliced into
 * statement text, and every such name passes through {@link #validate}. Rules
 * follow the stricter of the supported backends (PostgreSQL):
 * <ul>
 *   <li>Maximum length: 63 characters</li>
 *   <li>Must start with a letter or underscore</li>
 *   <li>Can contain letters, digits and underscores</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-06
 * @version 1.0
 */
public final class SqlIdentifierValidator {
    private static final Logger logger = LoggerFactory.getLogger(SqlIdentifierValidator.class);

    public static final int MAX_IDENTIFIER_LENGTH = 63;

    private static final String IDENTIFIER_PATTERN = "^[a-zA-Z_][a-zA-Z0-9_]*$";

    // "_" + 8 hex chars
    private static final int HASH_SUFFIX_LENGTH = 9;

    private SqlIdentifierValidator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Validates a table name and returns it unchanged.
     *
     * @throws IllegalArgumentException if validation fails
     */
    public static String validate(String identifier, String identifierType) {
        if (identifier == null || identifier.trim().isEmpty()) {
            throw new IllegalArgumentException(identifierType + " name cannot be null or empty");
        }
        if (identifier.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(String.format(
                "%s name '%s' exceeds maximum length of %d characters (length: %d)",
                identifierType, identifier, MAX_IDENTIFIER_LENGTH, identifier.length()));
        }
        if (!identifier.matches(IDENTIFIER_PATTERN)) {
            throw new IllegalArgumentException(String.format(
                "Invalid %s name: '%s'. Must start with letter or underscore, "
                    + "followed by alphanumeric characters or underscores only.",
                identifierType, identifier));
        }
        String lower = identifier.toLowerCase(Locale.ROOT);
        if (lower.startsWith("pg_") || lower.equals("information_schema")) {
            throw new IllegalArgumentException(String.format("Reserved %s name: '%s'", identifierType, identifier));
        }
        return identifier;
    }

    public static boolean isValid(String identifier) {
        try {
            validate(identifier, "Table");
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Replaces every character that cannot appear in a table name with an underscore
     * and lower-cases the result.
     */
    public static String sanitize(String identifier) {
        String sanitized = identifier.trim().replaceAll("[^a-zA-Z0-9_]", "_").toLowerCase(Locale.ROOT);
        if (!sanitized.isEmpty() && !Character.isLetter(sanitized.charAt(0)) && sanitized.charAt(0) != '_') {
            sanitized = "_" + sanitized;
        }
        return sanitized;
    }

    /**
     * Shortens an identifier above the length limit to a prefix plus an 8 character MD5 suffix.
     */
    public static String truncateWithHash(String identifier) {
        if (identifier.length() <= MAX_IDENTIFIER_LENGTH) {
            return identifier;
        }
        String hash = md5Prefix(identifier);
        String result = identifier.substring(0, MAX_IDENTIFIER_LENGTH - HASH_SUFFIX_LENGTH) + "_" + hash;
        logger.debug("Truncated identifier '{}' to '{}'", identifier, result);
        return result;
    }

    public static String makeSafe(String identifier) {
        return truncateWithHash(sanitize(identifier));
    }

    /**
     * Table listing the members of a dataset:
     * {@code <name>_<mapset>_<maptype>_<hash>_register}. The hash is taken over
     * the unsanitized {@code name@mapset}, so ids that sanitize alike
     * ({@code a_b@c}, {@code a@b_c}) still get distinct tables.
     */
    public static String datasetRegisterTable(String name, String mapset, String mapType) {
        String suffix = "_" + md5Prefix(name + "@" + mapset + "/" + mapType) + "_register";
        String base = sanitize(name + "_" + mapset + "_" + mapType);
        if (base.length() + suffix.length() > MAX_IDENTIFIER_LENGTH) {
            base = base.substring(0, MAX_IDENTIFIER_LENGTH - suffix.length());
        }
        return validate(base + suffix, "Register table");
    }

    /**
     * Table listing the datasets a map belongs to: {@code map_<uuid>_<stdstype>_register}.
     */
    public static String mapRegisterTable(String datasetType) {
        String uid = UUID.randomUUID().toString().replace("-", "");
        return validate("map_" + uid + "_" + datasetType + "_register", "Register table");
    }

    private static String md5Prefix(String value) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] hashBytes = md.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder();
            for (byte b : hashBytes) {
                hex.append(String.format("%02x", b));
            }
            return hex.substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            logger.warn("MD5 algorithm not available, using hashCode fallback for identifier: {}", value);
            return String.format("%08x", value.hashCode());
        }
    }
}
