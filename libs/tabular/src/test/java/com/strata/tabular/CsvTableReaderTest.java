package com.strata.tabular;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CsvTableReader")
class CsvTableReaderTest {

    private final CsvTableReader reader = new CsvTableReader();

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("delimiter sniffing")
    class Sniffing {

        @Test
        @DisplayName("semicolon with padded headers")
        void semicolonPadded() {
            ParsedTable table = reader.read(utf8(" a ; b ;c\n1;2;3\n4;5;6\n"));

            assertThat(table.headers()).containsExactly("a", "b", "c");
            assertThat(table.rows()).hasSize(2);
            assertThat(table.rows().get(1)).containsEntry("a", "4").containsEntry("c", "6");
        }

        @Test
        @DisplayName("comma is the default")
        void comma() {
            ParsedTable table = reader.read(utf8("name,qty\nwidget,3\n"));

            assertThat(table.headers()).containsExactly("name", "qty");
            assertThat(table.rows().get(0)).containsEntry("name", "widget").containsEntry("qty", "3");
        }

        @Test
        @DisplayName("a semicolon past the sniff window is ignored")
        void semicolonOutsideWindow() {
            String filler = "x".repeat(CsvTableReader.SNIFF_WINDOW + 10);
            byte[] content = utf8("h1,h2\n" + filler + ",v;w\n");

            assertThat(CsvTableReader.sniffDelimiter(content)).isEqualTo(',');
        }
    }

    @Nested
    @DisplayName("ragged rows")
    class Ragged {

        @Test
        @DisplayName("short rows keep only the columns present")
        void shortRow() {
            ParsedTable table = reader.read(utf8("a,b,c\n1,2\n"));

            assertThat(table.rows().get(0)).containsOnlyKeys("a", "b");
        }

        @Test
        @DisplayName("fields beyond the header are dropped")
        void longRow() {
            ParsedTable table = reader.read(utf8("a,b\n1,2,3,4\n"));

            assertThat(table.rows().get(0)).containsOnlyKeys("a", "b");
        }

        @Test
        @DisplayName("row maps keep header order")
        void order() {
            ParsedTable table = reader.read(utf8("z,y,x\n1,2,3\n"));

            assertThat(table.rows().get(0).keySet()).containsExactly("z", "y", "x");
        }
    }

    @Test
    @DisplayName("strips a leading byte order mark")
    void bom() {
        ParsedTable table = reader.read(utf8("\uFEFFid,name\n1,x\n"));

        assertThat(table.headers()).containsExactly("id", "name");
    }

    @Test
    @DisplayName("header-only file yields no rows")
    void headerOnly() {
        ParsedTable table = reader.read(utf8("a,b\n"));

        assertThat(table.isEmpty()).isTrue();
        assertThat(table.headers()).containsExactly("a", "b");
    }

    @Test
    @DisplayName("unterminated quote fails naming the row")
    void unterminatedQuote() {
        assertThatThrownBy(() -> reader.read(utf8("a,b\n1,2\n\"open,3\n")))
                .isInstanceOf(TabularParseException.class)
                .satisfies(e -> assertThat(((TabularParseException) e).stage()).startsWith("row"));
    }

    @Test
    @DisplayName("invalid UTF-8 is rejected")
    void invalidEncoding() {
        byte[] content = {'a', ',', 'b', '\n', (byte) 0xC3, (byte) 0x28, ',', '1', '\n'};

        assertThatThrownBy(() -> reader.read(content))
                .isInstanceOf(TabularParseException.class)
                .hasMessageContaining("UTF-8");
    }
}
