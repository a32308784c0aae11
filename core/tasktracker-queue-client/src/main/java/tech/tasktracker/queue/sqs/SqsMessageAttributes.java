package tech.tasktracker.queue.sqs;

import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds typed SQS message attributes from plain values.
 * Strings map to {@code String}, numbers to {@code Number} and booleans to
 * lower-case {@code String}; any other value type is skipped.
 */
public final class SqsMessageAttributes {

    public static final String SOURCE = "Source";
    public static final String TIMESTAMP = "Timestamp";
    public static final String MESSAGE_TYPE = "MessageType";

    static final String SOURCE_VALUE = "task-tracker-backend";
    static final String MESSAGE_TYPE_VALUE = "task";

    private static final String STRING_TYPE = "String";
    private static final String NUMBER_TYPE = "Number";

    private SqsMessageAttributes() {
    }

    /**
     * Merge caller attributes over the standard ones and convert them.
     */
    public static Map<String, MessageAttributeValue> prepare(Map<String, ?> attributes, Clock clock) {
        Map<String, Object> all = new LinkedHashMap<>();
        all.put(SOURCE, SOURCE_VALUE);
        all.put(TIMESTAMP, LocalDateTime.now(clock).toString());
        all.put(MESSAGE_TYPE, MESSAGE_TYPE_VALUE);
        if (attributes != null) {
            all.putAll(attributes);
        }

        Map<String, MessageAttributeValue> prepared = new LinkedHashMap<>();
        all.forEach((key, value) -> {
            MessageAttributeValue converted = convert(value);
            if (converted != null) {
                prepared.put(key, converted);
            }
        });
        return prepared;
    }

    private static MessageAttributeValue convert(Object value) {
        if (value instanceof String s) {
            return typed(STRING_TYPE, s);
        }
        if (value instanceof Boolean b) {
            return typed(STRING_TYPE, b.toString());
        }
        if (value instanceof BigDecimal d) {
            return typed(NUMBER_TYPE, d.toPlainString());
        }
        if (value instanceof Number n) {
            return typed(NUMBER_TYPE, n.toString());
        }
        return null;
    }

    private static MessageAttributeValue typed(String dataType, String value) {
        return MessageAttributeValue.builder()
            .dataType(dataType)
            .stringValue(value)
            .build();
    }
}
