package org.csits.reportd.dao.serializer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import org.csits.reportd.dao.RunResult;
import org.junit.jupiter.api.Test;

class LocalDateTimeDeserializerTest {

    private final ObjectMapper mapper = ReportJson.newMapper(ZoneId.of("Asia/Shanghai"));

    @Test
    void acceptsLocalOffsetAndEpochForms() throws IOException {
        assertThat(parse("\"2024-01-01T09:00:00\"")).isEqualTo(LocalDateTime.of(2024, 1, 1, 9, 0));
        assertThat(parse("\"2024-01-01T01:00:00Z\"")).isEqualTo(LocalDateTime.of(2024, 1, 1, 9, 0));
        assertThat(parse("1704070800")).isEqualTo(LocalDateTime.of(2024, 1, 1, 9, 0));
        assertThat(parse("null")).isNull();
    }

    @Test
    void rejectsGarbage() {
        assertThatThrownBy(() -> parse("\"yesterday\"")).isInstanceOf(IOException.class);
    }

    private LocalDateTime parse(String value) throws IOException {
        return mapper.readValue("{\"completedAt\":" + value + "}", RunResult.class).getCompletedAt();
    }
}
