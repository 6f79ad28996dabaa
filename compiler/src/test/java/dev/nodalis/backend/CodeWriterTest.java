package dev.nodalis.backend;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CodeWriterTest {

    @Test
    void indentsBlocksTwoSpacesPerLevel() {
        CodeWriter out = new CodeWriter();
        out.open("if (a) {").line("b();").reopen("} else {").line("c();").close("}");

        assertThat(out.toString()).isEqualTo("if (a) {\n  b();\n} else {\n  c();\n}\n");
        assertThat(out.level()).isZero();
    }

    @Test
    void reindentsPreRenderedBlocks() {
        CodeWriter out = new CodeWriter();
        out.open("{").block("x;\n\ny;").close("}");

        assertThat(out.toString()).isEqualTo("{\n  x;\n\n  y;\n}\n");
    }

    @Test
    void refusesUnbalancedClose() {
        assertThatThrownBy(() -> new CodeWriter().close("}")).isInstanceOf(IllegalStateException.class);
    }
}
