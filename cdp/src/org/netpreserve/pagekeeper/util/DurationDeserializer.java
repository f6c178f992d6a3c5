package org.netpreserve.pagekeeper.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;

/**
 * Reads a duration given either as a number of milliseconds or as a string like {@code 30s} or {@code 1m30s}.
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        if (jsonParser.currentToken().isNumeric()) return Duration.ofMillis(jsonParser.getLongValue());
        String text = jsonParser.getText().trim();
        if (text.equals("0")) return Duration.ZERO;
        try {
            return Duration.parse("PT" + text.toUpperCase(Locale.ROOT));
        } catch (RuntimeException e) {
            return (Duration) deserializationContext.handleWeirdStringValue(Duration.class, text,
                    "expected milliseconds or a duration like 30s");
        }
    }
}
