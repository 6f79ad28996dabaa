package dev.nodalis.backend;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LiteralsTest {

    @Test
    void convertsDurationsToMilliseconds() {
        assertThat(Literals.durationMillis("T#500ms")).isEqualTo(500);
        assertThat(Literals.durationMillis("TIME#1h2m3s")).isEqualTo(3_723_000);
        assertThat(Literals.durationMillis("t#1.5s")).isEqualTo(1_500);
        assertThat(Literals.durationMillis("T#1d")).isEqualTo(86_400_000);
        assertThat(Literals.durationMillis("T#-250ms")).isEqualTo(-250);
        assertThat(Literals.durationMillis("LT#1_000us")).isEqualTo(1);
    }

    @Test
    void rejectsMalformedDurations() {
        assertThatThrownBy(() -> Literals.durationMillis("T#fast")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Literals.durationMillis("T#5s!")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void readsBasedAndSignedIntegers() {
        assertThat(Literals.basedValue("16#FF")).isEqualTo(255);
        assertThat(Literals.basedValue("2#1010_0001")).isEqualTo(161);
        assertThat(Literals.basedValue("8#17")).isEqualTo(15);
        assertThat(Literals.hex(255)).isEqualTo("0xFF");
        assertThat(Literals.integerValue("-16#10")).isEqualTo(-16);
        assertThat(Literals.integerValue("1_000")).isEqualTo(1000);
    }

    @Test
    void resolvesDollarEscapes() {
        assertThat(Literals.unquote("'it$'s'")).isEqualTo("it's");
        assertThat(Literals.unquote("'a$Nb$$'")).isEqualTo("a\nb$");
        assertThat(Literals.unquote("'$41'")).isEqualTo("A");
    }

    @Test
    void quotesForCFamilyTargets() {
        assertThat(Literals.quote("say \"hi\"\\\n")).isEqualTo("\"say \\\"hi\\\"\\\\\\n\"");
    }
}
