package dev.nodalis.compiler;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompilerSettingsTest {

    @Test
    void loadsBundledDefaults() {
        CompilerSettings settings = CompilerSettings.load();

        assertThat(settings.getDefaultPlcName()).isEqualTo("NodalisPLC");
        assertThat(settings.getTickDelayMillis()).isEqualTo(1);
        assertThat(settings.getFallbackIntervalMillis()).isEqualTo(100);
    }

    @Test
    void overridesWinOverDefaults() {
        Properties defaults = new Properties();
        defaults.setProperty(CompilerSettings.TICK_DELAY_MILLIS, "5");
        Properties overrides = new Properties();
        overrides.setProperty(CompilerSettings.TICK_DELAY_MILLIS, " 20 ");
        overrides.setProperty(CompilerSettings.DEFAULT_PLC_NAME, "Cell");

        CompilerSettings settings = CompilerSettings.from(defaults, overrides);

        assertThat(settings.getTickDelayMillis()).isEqualTo(20);
        assertThat(settings.getDefaultPlcName()).isEqualTo("Cell");
        assertThat(settings.getFallbackIntervalMillis()).isEqualTo(100);
    }

    @Test
    void rejectsInvalidTiming() {
        assertThatThrownBy(() -> new CompilerSettings("P", -1, 100)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CompilerSettings("P", 1, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void namesTheKeyOfAnUnreadableNumber() {
        Properties overrides = new Properties();
        overrides.setProperty(CompilerSettings.TICK_DELAY_MILLIS, "fast");

        assertThatThrownBy(() -> CompilerSettings.from(new Properties(), overrides))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(CompilerSettings.TICK_DELAY_MILLIS)
                .hasMessageContaining("fast")
                .hasCauseInstanceOf(NumberFormatException.class);
    }
}
