package dev.nodalis.backend.cpp;

import dev.nodalis.backend.GeneratedCode;
import dev.nodalis.backend.GenerationContext;
import dev.nodalis.backend.OutputKind;
import dev.nodalis.schedule.ScheduleExtractor;
import dev.nodalis.st.StructuredTextFrontEnd;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GenericCppBackendTest {

    private final GenericCppBackend backend = new GenericCppBackend();

    private GeneratedCode generate(OutputKind outputKind, String... lines) throws Exception {
        String source = String.join("\n", lines);
        return backend.generate(new StructuredTextFrontEnd().parse(source), new ScheduleExtractor().extract(source),
                new GenerationContext("generic", outputKind, "Imp", "logic", 5, 100));
    }

    @Test
    void framesEachTickWithHostIo() throws Exception {
        String code = generate(OutputKind.EXECUTABLE,
                "//Task={\"Name\":\"T\",\"Interval\":3}",
                "//Instance={\"TypeName\":\"Main\",\"AssociatedTaskName\":\"T\"}",
                "PROGRAM Main END_PROGRAM").getPrimary().getContent();

        assertThat(code).startsWith("#include \"imperium.h\"\n#include <cmath>\n");
        int gather = code.indexOf("gatherInputs();");
        int gate = code.indexOf("if (PROGRAM_COUNT % 3 == 0) {");
        int handle = code.indexOf("handleOutputs();");
        assertThat(gather).isPositive().isLessThan(gate);
        assertThat(gate).isLessThan(handle);
        assertThat(code).contains("uint64_t PROGRAM_COUNT = 0;",
                "std::this_thread::sleep_for(std::chrono::milliseconds(5));");
    }

    @Test
    void ignoresGlobalBindingsAndMaps() throws Exception {
        String code = generate(OutputKind.EXECUTABLE,
                "VAR_GLOBAL g : INT; //Global={\"Name\":\"g\",\"Address\":\"40001\"}",
                "END_VAR",
                "//Map={\\\"ModuleID\\\":\\\"io1\\\"}",
                "PROGRAM Main g := g + 1; END_PROGRAM").getPrimary().getContent();

        assertThat(code).doesNotContain("opcServer", "mapIO", "superviseIO");
        assertThat(code).contains("int16_t g{};", "g = g + 1;");
    }

    @Test
    void readsLocatedVariablesThroughAddressFunctions() throws Exception {
        String code = generate(OutputKind.SOURCE_CODE,
                "PROGRAM Main",
                "VAR sw AT %IX0.0 : BOOL; out AT %QW1 : WORD; a : BOOL; b : BOOL; END_VAR",
                "a := sw AND NOT b OR a;",
                "out.2 := a;",
                "b := out.4;",
                "END_PROGRAM").getPrimary().getContent();

        assertThat(code)
                .doesNotContain("RefVar")
                .contains(
                        "a = (readAddress(\"%IX0.0\") & !b) | a;",
                        "writeAddress(\"%QW1\", (a) ? (readAddress(\"%QW1\") | (1ULL << 2)) : (readAddress(\"%QW1\") & ~(1ULL << 2)));",
                        "b = ((readAddress(\"%QW1\") >> 4) & 1);");
    }

    @Test
    void listsImperiumSupportFiles() throws Exception {
        GeneratedCode code = generate(OutputKind.LIBRARY, "PROGRAM Main END_PROGRAM");

        assertThat(code.getSupportFiles()).containsExactly("imperium.h", "imperium.cpp", "modbus.h", "modbus.cpp");
        assertThat(code.getPrimary().getContent()).doesNotContain("int main()", "gatherInputs");
    }
}
