package com.bastion.observability.logging;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import com.bastion.observability.SensitiveDataRedactor;

import java.util.List;

/**
 * Logback converter that writes the formatted message with PII values redacted.
 * <p>
 * Register it in {@code logback-spring.xml} and use it in place of {@code %msg}:
 * <pre>{@code
 * <conversionRule conversionWord="redactedMsg"
 *                 converterClass="com.bastion.observability.logging.RedactingMessageConverter"/>
 * <pattern>[BASTION] %logger %level %d: %redactedMsg{email,password}%n</pattern>
 * }</pre>
 * Without options the default {@link SensitiveDataRedactor#PII_FIELDS} are redacted.
 */
public class RedactingMessageConverter extends ClassicConverter {

    private SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @Override
    public void start() {
        List<String> options = getOptionList();
        if (options != null && !options.isEmpty()) {
            List<String> fields = options.stream()
                    .map(String::strip)
                    .filter(option -> !option.isEmpty())
                    .toList();
            redactor = new SensitiveDataRedactor(fields);
        }
        super.start();
    }

    @Override
    public String convert(ILoggingEvent event) {
        return redactor.redactMessage(event.getFormattedMessage());
    }

    SensitiveDataRedactor redactor() {
        return redactor;
    }
}
