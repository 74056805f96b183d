package com.bastion.observability;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Redacts personally identifiable data from log output.
 * <p>
 * Two shapes of log data are handled:
 * <ul>
 *   <li>structured maps, where a value is redacted when its key contains a sensitive field
 *       name (case-insensitive), see {@link #redact(Map)};</li>
 *   <li>flat messages of {@code field=value} pairs joined by a separator, where the value of
 *       every sensitive field is replaced, see {@link #redactMessage(String)}.</li>
 * </ul>
 * Default fields: name, email, phone, ssn, password.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "***";

    /** Default separator between {@code field=value} pairs in a message. */
    public static final String DEFAULT_SEPARATOR = ";";

    /** Fields considered PII unless a redactor is built with its own list. */
    public static final List<String> PII_FIELDS = List.of("name", "email", "phone", "ssn", "password");

    private final List<String> fields;
    private final String redaction;
    private final String separator;
    private final Pattern keyPattern;
    private final Pattern messagePattern;

    /**
     * Creates a redactor for the default {@link #PII_FIELDS}.
     */
    public SensitiveDataRedactor() {
        this(PII_FIELDS);
    }

    /**
     * Creates a redactor for custom fields with the default redaction string and separator.
     *
     * @param fields field names to treat as sensitive
     */
    public SensitiveDataRedactor(Collection<String> fields) {
        this(fields, REDACTED, DEFAULT_SEPARATOR);
    }

    /**
     * Creates a fully customised redactor.
     *
     * @param fields    field names to treat as sensitive
     * @param redaction replacement for each sensitive value
     * @param separator character(s) terminating a value inside a message
     */
    public SensitiveDataRedactor(Collection<String> fields, String redaction, String separator) {
        if (fields == null) {
            throw new IllegalArgumentException("fields must not be null");
        }
        if (redaction == null) {
            throw new IllegalArgumentException("redaction must not be null");
        }
        if (separator == null || separator.isEmpty()) {
            throw new IllegalArgumentException("separator must not be null or empty");
        }
        this.fields = List.copyOf(fields);
        this.redaction = redaction;
        this.separator = separator;
        this.keyPattern = this.fields.isEmpty()
                ? null
                : Pattern.compile(alternation(this.fields), Pattern.CASE_INSENSITIVE);
        this.messagePattern = this.fields.isEmpty() ? null : messagePattern(this.fields, separator);
    }

    /**
     * Replaces the value of every {@code field=value} pair whose field is listed with
     * {@code redaction}. A value runs up to the next {@code ;} or separator character.
     *
     * @param fields    field names to obfuscate
     * @param redaction replacement for each value
     * @param message   the original log message
     * @param separator the character(s) separating pairs in the message
     * @return the message with the listed fields obfuscated
     */
    public static String filterDatum(
            Collection<String> fields, String redaction, String message, String separator) {
        return new SensitiveDataRedactor(fields, redaction, separator).redactMessage(message);
    }

    /**
     * Redacts sensitive values inside a flat {@code field=value;field=value;} message.
     * Null input returns null.
     *
     * @param message the formatted log message
     * @return the message with sensitive values replaced
     */
    public String redactMessage(String message) {
        if (message == null || messagePattern == null) {
            return message;
        }
        Matcher matcher = messagePattern.matcher(message);
        return matcher.replaceAll(match -> Matcher.quoteReplacement(match.group(1) + "=" + redaction));
    }

    /**
     * Returns a new map with sensitive field values replaced by the redaction string.
     * Non-sensitive fields are copied as-is. Null input returns an empty map.
     *
     * @param data the log data map (keys are field names, values are arbitrary)
     * @return a new map with sensitive values redacted
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }

        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            String key = entry.getKey();
            if (isSensitive(key)) {
                result.put(key, redaction);
            } else {
                result.put(key, entry.getValue());
            }
        }
        return result;
    }

    /**
     * Checks whether a field name contains any sensitive field name (case-insensitive).
     *
     * @param fieldName the field name to check
     * @return true if the field name contains a sensitive field name
     */
    public boolean isSensitive(String fieldName) {
        if (fieldName == null || keyPattern == null) {
            return false;
        }
        return keyPattern.matcher(fieldName).find();
    }

    /**
     * Returns the fields this redactor treats as sensitive.
     */
    public List<String> fields() {
        return fields;
    }

    /**
     * Returns the replacement string for sensitive values.
     */
    public String redaction() {
        return redaction;
    }

    /**
     * Returns the pair separator used by {@link #redactMessage(String)}.
     */
    public String separator() {
        return separator;
    }

    private static String alternation(List<String> fields) {
        return String.join("|", fields.stream().map(Pattern::quote).toList());
    }

    private static Pattern messagePattern(List<String> fields, String separator) {
        StringBuilder terminators = new StringBuilder(";");
        for (char c : separator.toCharArray()) {
            if (!Character.isLetterOrDigit(c)) {
                terminators.append('\\');
            }
            terminators.append(c);
        }
        return Pattern.compile("(" + alternation(fields) + ")=([^" + terminators + "]+)");
    }
}
