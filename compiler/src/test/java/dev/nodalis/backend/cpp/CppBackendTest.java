package dev.nodalis.backend.cpp;

import dev.nodalis.backend.GeneratedCode;
import dev.nodalis.backend.GenerationContext;
import dev.nodalis.backend.OutputKind;
import dev.nodalis.backend.UnrenderableConstructException;
import dev.nodalis.schedule.ScheduleExtractor;
import dev.nodalis.st.StructuredTextFrontEnd;
import dev.nodalis.st.ast.CompilationUnit;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CppBackendTest {

    private final CppBackend backend = new CppBackend();

    private GeneratedCode generate(OutputKind outputKind, String... lines) throws Exception {
        String source = String.join("\n", lines);
        CompilationUnit unit = new StructuredTextFrontEnd().parse(source);
        return backend.generate(unit, new ScheduleExtractor().extract(source, unit),
                new GenerationContext("linux-x64", outputKind, "TestPLC", "plc", 1, 100));
    }

    private String render(String... lines) throws Exception {
        return generate(OutputKind.EXECUTABLE, lines).getPrimary().getContent();
    }

    private static long countLines(String code, String line) {
        return Arrays.stream(code.split("\n")).filter(l -> l.trim().equals(line)).count();
    }

    @Test
    void gatesProgramByTaskInterval() throws Exception {
        String code = render(
                "//Task={\"Name\":\"T1\",\"Interval\":2,\"Priority\":1}",
                "//Instance={\"TypeName\":\"Pump\",\"Name\":\"P1\",\"AssociatedTaskName\":\"T1\"}",
                "PROGRAM Pump",
                "VAR x : INT; END_VAR",
                "x := x + 1;",
                "END_PROGRAM");

        assertThat(code).contains("if (PROGRAM_COUNT % 2 == 0) {");
        assertThat(countLines(code, "Pump();")).isEqualTo(1);
        assertThat(code.indexOf("if (PROGRAM_COUNT % 2 == 0) {")).isLessThan(code.indexOf("Pump();"));
        assertThat(code).contains("void Pump() {", "static int16_t x{};", "x = x + 1;");
    }

    @Test
    void intervalOneGateOpensOnEveryTick() throws Exception {
        String code = render(
                "//Task={\"Name\":\"Every\",\"Interval\":1}",
                "//Task={\"Name\":\"Slow\",\"Interval\":5}",
                "//Instance={\"TypeName\":\"A\",\"Name\":\"A1\",\"AssociatedTaskName\":\"Every\"}",
                "//Instance={\"TypeName\":\"B\",\"Name\":\"B1\",\"AssociatedTaskName\":\"Slow\"}",
                "PROGRAM A END_PROGRAM",
                "PROGRAM B END_PROGRAM");

        int loop = code.indexOf("while (true) {");
        int every = code.indexOf("if (PROGRAM_COUNT % 1 == 0) {", loop);
        int slow = code.indexOf("if (PROGRAM_COUNT % 5 == 0) {", loop);
        assertThat(every).isPositive();
        assertThat(code.indexOf("A();", every)).isBetween(every, slow);
        assertThat(code.indexOf("B();", slow)).isGreaterThan(slow);
        assertThat(countLines(code, "A();")).isEqualTo(1);
        assertThat(countLines(code, "B();")).isEqualTo(1);
    }

    @Test
    void ignoresProgramsInsideBlockComments() throws Exception {
        String code = render(
                "PROGRAM A END_PROGRAM",
                "(*",
                "PROGRAM Old",
                "END_PROGRAM",
                "*)");

        int loop = code.indexOf("while (true) {");
        assertThat(code.indexOf("A();", loop)).isPositive();
        assertThat(code).doesNotContain("Old");
    }

    @Test
    void callsEveryProgramInSourceOrderWithoutTasks() throws Exception {
        String code = render(
                "PROGRAM A END_PROGRAM",
                "PROGRAM B END_PROGRAM");

        assertThat(code).doesNotContain("PROGRAM_COUNT %");
        int loop = code.indexOf("while (true) {");
        assertThat(code.indexOf("A();", loop)).isPositive();
        assertThat(code.indexOf("A();", loop)).isLessThan(code.indexOf("B();", loop));
    }

    @Test
    void bindsGlobalsOnceBeforeTheLoop() throws Exception {
        String code = render(
                "VAR_GLOBAL",
                "    Temp1 : REAL; //Global={\"Name\":\"Temp1\",\"Address\":\"40001\"}",
                "END_VAR",
                "//Map={\\\"ModuleID\\\":\\\"io1\\\"}",
                "PROGRAM Main Temp1 := Temp1 + 0.5; END_PROGRAM");

        assertThat(countLines(code, "opcServer.mapVariable(\"Temp1\", \"40001\");")).isEqualTo(1);
        int binding = code.indexOf("opcServer.mapVariable");
        int start = code.indexOf("opcServer.start();");
        int map = code.indexOf("mapIO(\"{\\\"ModuleID\\\":\\\"io1\\\"}\");");
        assertThat(binding).isLessThan(start);
        assertThat(start).isLessThan(map);
        assertThat(map).isLessThan(code.indexOf("while (true) {"));
        assertThat(code).contains("float Temp1{};");
    }

    @Test
    void wrapsEachTickInAFaultBoundaryAndWrapsTheCounter() throws Exception {
        String code = render("PROGRAM A END_PROGRAM");

        assertThat(code).contains(
                "superviseIO();",
                "} catch (const std::exception& e) {",
                "std::this_thread::sleep_for(std::chrono::milliseconds(1));",
                "if (PROGRAM_COUNT >= std::numeric_limits<uint64_t>::max()) {",
                "std::cout << \"TestPLC is running!\" << std::endl;");
    }

    @Test
    void libraryOutputHasNoRuntime() throws Exception {
        GeneratedCode code = generate(OutputKind.LIBRARY,
                "//Task={\"Name\":\"T1\",\"Interval\":2}",
                "PROGRAM A END_PROGRAM");

        assertThat(code.getPrimary().getFileName()).isEqualTo("plc.cpp");
        assertThat(code.getPrimary().getContent())
                .contains("#include \"nodalis.h\"", "void A() {")
                .doesNotContain("int main()", "PROGRAM_COUNT", "#include <thread>");
        assertThat(code.getSupportFiles()).contains("nodalis.h", "nodalis.cpp");
    }

    @Test
    void rendersFunctionBlocksAndInstanceCalls() throws Exception {
        String code = render(
                "FUNCTION_BLOCK Counter",
                "VAR_INPUT inc : BOOL; END_VAR",
                "VAR_OUTPUT count : INT; END_VAR",
                "IF inc THEN count := count + 1; END_IF;",
                "END_FUNCTION_BLOCK",
                "PROGRAM Main",
                "VAR c : Counter; total : INT; END_VAR",
                "c(inc := TRUE, count => total);",
                "c(FALSE);",
                "END_PROGRAM");

        assertThat(code).contains(
                "class Counter {",
                "public:",
                "void operator()() {",
                "static Counter c;",
                "c.inc = true;",
                "c();",
                "total = c.count;",
                "c.inc = false;");
        assertThat(code.indexOf("class Counter {")).isLessThan(code.indexOf("void Main() {"));
    }

    @Test
    void rendersFunctionsWithPrototypesAndResultVariable() throws Exception {
        String code = render(
                "PROGRAM Main VAR r : INT; END_VAR r := Add(b := 2, a := 1); END_PROGRAM",
                "FUNCTION Add : INT",
                "VAR_INPUT a : INT; b : INT; END_VAR",
                "Add := a + b;",
                "END_FUNCTION");

        assertThat(code).contains(
                "int16_t Add(int16_t a, int16_t b);",
                "int16_t Add(int16_t a, int16_t b) {",
                "int16_t Add_result{};",
                "Add_result = a + b;",
                "return Add_result;",
                "r = Add(1, 2);");
    }

    @Test
    void rendersControlFlow() throws Exception {
        String code = render(
                "PROGRAM Main",
                "VAR i : INT; mode : INT; done : BOOL; END_VAR",
                "FOR i := 10 TO 0 BY -2 DO",
                "  IF i = 4 THEN EXIT; END_IF;",
                "END_FOR;",
                "CASE mode OF",
                "  1, 2: mode := 3;",
                "  3..5: mode := 0;",
                "ELSE",
                "  mode := 1;",
                "END_CASE;",
                "REPEAT i := i + 1; UNTIL i > 3 OR done END_REPEAT;",
                "WHILE NOT done DO done := i <> 7; END_WHILE;",
                "END_PROGRAM");

        assertThat(code).contains(
                "for (i = 10; i >= 0; i += -2) {",
                "break;",
                "const auto _case1 = mode;",
                "if (_case1 == 1 || _case1 == 2) {",
                "} else if ((_case1 >= 3 && _case1 <= 5)) {",
                "} while (!((i > 3) || done));",
                "while (!done) {",
                "done = i != 7;");
    }

    @Test
    void rendersLiteralsAndOperators() throws Exception {
        String code = render(
                "PROGRAM Main",
                "VAR t : TIME := T#1s500ms; w : WORD := 16#FF; r : REAL; s : WSTRING; b : BOOL; END_VAR",
                "r := r ** 2.0 + 7 MOD 3;",
                "s := \"wide$N\";",
                "b := b XOR TRUE;",
                "END_PROGRAM");

        assertThat(code).contains(
                "static uint32_t t = 1500;",
                "static uint16_t w = 0xFF;",
                "r = pow(r, 2.0) + (7 % 3);",
                "s = L\"wide\\n\";",
                "b = b ^ true;");
    }

    @Test
    void keepsNestedNegationsApart() throws Exception {
        String code = render(
                "PROGRAM Main",
                "VAR x : INT; y : INT; END_VAR",
                "y := - -x;",
                "y := -x;",
                "END_PROGRAM");

        assertThat(code).contains("y = -(-x);", "y = -x;").doesNotContain("--x");
    }

    @Test
    void rendersLocatedVariablesAndBits() throws Exception {
        String code = render(
                "PROGRAM Io",
                "VAR sw AT %IX0.0 : BOOL; w : WORD; END_VAR",
                "w.3 := sw;",
                "sw := w.1;",
                "%QX0.1 := %IX0.2;",
                "END_PROGRAM");

        assertThat(code).contains(
                "static RefVar<bool> sw{\"%IX0.0\"};",
                "setBit(&w, 3, sw);",
                "sw = getBit(&w, 1);",
                "writeAddress(\"%QX0.1\", readAddress(\"%IX0.2\"));");
    }

    @Test
    void rejectsExitOutsideLoop() {
        assertThatThrownBy(() -> render("PROGRAM Main EXIT; END_PROGRAM"))
                .isInstanceOfSatisfying(UnrenderableConstructException.class, e -> {
                    assertThat(e.getMessage()).contains(CppBackend.NAME, "EXIT");
                });
    }

    @Test
    void rejectsScheduledProgramThatIsNotDeclared() {
        assertThatThrownBy(() -> render(
                "//Task={\"Name\":\"T1\",\"Interval\":1}",
                "//Instance={\"TypeName\":\"Ghost\",\"AssociatedTaskName\":\"T1\"}",
                "PROGRAM Main END_PROGRAM"))
                .isInstanceOf(UnrenderableConstructException.class)
                .hasMessageContaining("Ghost");
    }
}
