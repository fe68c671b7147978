package quest.gekko.smm.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;

class CountsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("万 and 亿 shorthand is scaled")
    void parsesChineseShorthand() {
        assertThat(Counts.parse("1.2万")).hasValue(12_000L);
        assertThat(Counts.parse("3 万")).hasValue(30_000L);
        assertThat(Counts.parse("2亿")).hasValue(200_000_000L);
        assertThat(Counts.parse("10.5w")).hasValue(105_000L);
    }

    @Test
    void parsesPlainAndGroupedNumbers() {
        assertThat(Counts.parse("5000")).hasValue(5000L);
        assertThat(Counts.parse(" 1,234,567 ")).hasValue(1_234_567L);
        assertThat(Counts.parse("10000+")).hasValue(10_000L);
    }

    @Test
    void rejectsGarbageAndNegatives() {
        assertThat(Counts.parse("abc")).isEqualTo(OptionalLong.empty());
        assertThat(Counts.parse("")).isEmpty();
        assertThat(Counts.parse((String) null)).isEmpty();
        assertThat(Counts.parse("-5")).isEmpty();
    }

    @Test
    @DisplayName("Values beyond a long are rejected, never wrapped")
    void rejectsOverflow() throws Exception {
        assertThat(Counts.parse("99999999999999999999")).isEmpty();
        assertThat(Counts.parse("10000000000000000000")).isEmpty();
        assertThat(Counts.parse("9999999999999999亿")).isEmpty();
        assertThat(Counts.parse("9223372036854775807")).hasValue(Long.MAX_VALUE);
        assertThat(Counts.parse("1.23456万")).hasValue(12_345L);

        var node = mapper.readTree("{\"big\":99999999999999999999,\"huge\":1e19}");
        assertThat(Counts.parse(node.path("big"))).isEmpty();
        assertThat(Counts.parse(node.path("huge"))).isEmpty();
    }

    @Test
    void readsJsonNodes() throws Exception {
        var node = mapper.readTree("{\"a\":1234567,\"b\":\"4.5万\",\"c\":null,\"d\":true}");
        assertThat(Counts.parse(node.path("a"))).hasValue(1_234_567L);
        assertThat(Counts.parse(node.path("b"))).hasValue(45_000L);
        assertThat(Counts.parse(node.path("c"))).isEmpty();
        assertThat(Counts.parse(node.path("d"))).isEmpty();
        assertThat(Counts.parse(node.path("missing"))).isEmpty();
        assertThat(Counts.orNull(node.path("missing"))).isNull();
    }
}
