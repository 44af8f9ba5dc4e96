package org.csits.reportd.dao.serializer;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * 报表定义文件使用的 ObjectMapper。
 */
public final class ReportJson {

    private ReportJson() {
    }

    public static ObjectMapper newMapper() {
        return newMapper(ZoneId.systemDefault());
    }

    /**
     * 空值表示系统默认时区。
     */
    public static ZoneId zoneOf(String timeZone) {
        if (timeZone == null || timeZone.trim().isEmpty()) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(timeZone.trim());
    }

    public static ObjectMapper newMapper(ZoneId zone) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        SimpleModule module = new SimpleModule("reportd-time");
        module.addDeserializer(LocalDateTime.class, new LocalDateTimeDeserializer(zone));
        mapper.registerModule(module);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }
}
