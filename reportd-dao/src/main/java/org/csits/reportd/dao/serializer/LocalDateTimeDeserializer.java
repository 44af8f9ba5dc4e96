package org.csits.reportd.dao.serializer;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * 兼容多种时间写法的 LocalDateTime 反序列化：本地 ISO 字符串、带时区偏移的 ISO 字符串、epoch 秒。
 * 带偏移或 epoch 的值换算到服务时区。
 */
public class LocalDateTimeDeserializer extends JsonDeserializer<LocalDateTime> {

    private final ZoneId zone;

    public LocalDateTimeDeserializer(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public LocalDateTime deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.getCodec().readTree(p);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return LocalDateTime.ofInstant(Instant.ofEpochSecond(node.asLong()), zone);
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return LocalDateTime.parse(text);
            } catch (DateTimeParseException e) {
                try {
                    return OffsetDateTime.parse(text).atZoneSameInstant(zone).toLocalDateTime();
                } catch (DateTimeParseException ex) {
                    return (LocalDateTime) ctxt.handleWeirdStringValue(LocalDateTime.class, text,
                        "无法解析时间: %s", ex.getMessage());
                }
            }
        }
        return (LocalDateTime) ctxt.handleUnexpectedToken(LocalDateTime.class, p);
    }
}
