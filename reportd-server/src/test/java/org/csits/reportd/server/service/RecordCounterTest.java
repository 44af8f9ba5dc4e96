package org.csits.reportd.server.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class RecordCounterTest {

    private final RecordCounter counter = new RecordCounter();

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void csv_excludesHeaderAndBlankLines() {
        assertThat(counter.count(utf8("id,name\r\n1,a\r\n\r\n2,b\n"), "csv")).isEqualTo(2);
    }

    @Test
    void csv_headerOnly() {
        assertThat(counter.count(utf8("id,name\n"), "csv")).isZero();
        assertThat(counter.count(new byte[0], "csv")).isZero();
    }

    @Test
    void json_valueArray() {
        assertThat(counter.count(utf8("{\"value\":[{\"a\":1},{\"a\":2},{\"a\":3}]}"), "json")).isEqualTo(3);
    }

    @Test
    void json_topLevelArray() {
        assertThat(counter.count(utf8("[{\"a\":1},{\"a\":2}]"), "JSON")).isEqualTo(2);
    }

    @Test
    void json_unparseableFallsBackToBraces() {
        assertThat(counter.count(utf8("{\"value\":[{\"a\":1},{\"a\":2}"), "json")).isEqualTo(2);
    }
}
