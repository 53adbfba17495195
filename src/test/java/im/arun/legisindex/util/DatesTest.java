package im.arun.legisindex.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Dates Tests")
class DatesTest {

    @Test
    @DisplayName("should accept compact and ISO dates")
    void shouldNormalize_whenDateIsCompactOrIso() {
        assertThat(Dates.parseDate("20190621")).isEqualTo("2019-06-21");
        assertThat(Dates.parseDate("2019-06-21")).isEqualTo("2019-06-21");
    }

    @Test
    @DisplayName("should reject anything else")
    void shouldReturnNull_whenDateIsMalformed() {
        assertThat(Dates.parseDate(null)).isNull();
        assertThat(Dates.parseDate("")).isNull();
        assertThat(Dates.parseDate("2019/06/21")).isNull();
        assertThat(Dates.parseDate("June 21, 2019")).isNull();
    }

    @Test
    @DisplayName("should pad date parts and default missing ones")
    void shouldBuildIsoDate_whenPartsAreIncomplete() {
        assertThat(Dates.fromParts("1997", "3", "5")).isEqualTo("1997-03-05");
        assertThat(Dates.fromParts("1997", null, "")).isEqualTo("1997-01-01");
        assertThat(Dates.fromParts(null, "03", "25")).isNull();
    }
}
