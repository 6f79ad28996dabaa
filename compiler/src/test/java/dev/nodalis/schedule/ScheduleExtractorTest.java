package dev.nodalis.schedule;

import dev.nodalis.st.StructuredTextFrontEnd;
import dev.nodalis.st.ast.CompilationUnit;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleExtractorTest {

    private final ScheduleExtractor extractor = new ScheduleExtractor();

    @Test
    void bindsInstancesToTheirTasks() {
        SchedulingModel model = extractor.extract(String.join("\n",
                "//Task={\"Name\":\"Fast\",\"Interval\":2,\"Priority\":1}",
                "//Task={\"Name\":\"Slow\",\"Interval\":10,\"Priority\":5}",
                "//Instance={\"TypeName\":\"Pump\",\"Name\":\"Pump1\",\"AssociatedTaskName\":\"Fast\"}",
                "//Instance={\"TypeName\":\"Logger\",\"Name\":\"Log1\",\"AssociatedTaskName\":\"Slow\"}",
                "PROGRAM Pump END_PROGRAM",
                "PROGRAM Logger END_PROGRAM"));

        assertThat(model.getTasks()).extracting(TaskDefinition::getName).containsExactly("Fast", "Slow");
        TaskDefinition fast = model.getTasks().get(0);
        assertThat(fast.getInterval()).isEqualTo(2);
        assertThat(fast.getPriority()).hasValue(1);
        assertThat(fast.getInstances()).extracting(ProgramInstance::getTypeName).containsExactly("Pump");
        assertThat(model.getTasks().get(1).getInstances()).extracting(ProgramInstance::getTypeName)
                .containsExactly("Logger");
        assertThat(model.getPrograms()).containsExactly("Pump", "Logger");
        assertThat(model.getDiagnostics()).isEmpty();
    }

    @Test
    void resolvesInstancesDeclaredBeforeTheirTask() {
        SchedulingModel model = extractor.extract(String.join("\n",
                "//Instance={\"TypeName\":\"Pump\",\"AssociatedTaskName\":\"Fast\"}",
                "//Task={\"Name\":\"Fast\",\"Interval\":1}"));

        assertThat(model.getTasks().get(0).getInstances()).hasSize(1);
        assertThat(model.getTasks().get(0).getPriority()).isEmpty();
    }

    @Test
    void reportsInstanceOfUnknownTaskWithoutAborting() {
        SchedulingModel model = extractor.extract(String.join("\n",
                "//Task={\"Name\":\"Fast\",\"Interval\":2}",
                "//Instance={\"TypeName\":\"Pump\",\"AssociatedTaskName\":\"Missing\"}"));

        assertThat(model.getTasks().get(0).getInstances()).isEmpty();
        assertThat(model.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.getKind()).isEqualTo(Diagnostic.Kind.UNRESOLVED_TASK_REFERENCE);
            assertThat(d.getLine()).isEqualTo(2);
        });
    }

    @Test
    void acceptsIntervalWrittenAsString() {
        SchedulingModel model = extractor.extract("//Task={\"Name\":\"T\",\"Interval\":\"5\",\"Priority\":\"3\"}");

        assertThat(model.getTasks()).singleElement().satisfies(task -> {
            assertThat(task.getInterval()).isEqualTo(5);
            assertThat(task.getPriority()).hasValue(3);
        });
    }

    @Test
    void dropsTasksWithInvalidIntervals() {
        SchedulingModel model = extractor.extract(String.join("\n",
                "//Task={\"Name\":\"Zero\",\"Interval\":0}",
                "//Task={\"Name\":\"Text\",\"Interval\":\"often\"}"));

        assertThat(model.hasTasks()).isFalse();
        assertThat(model.getDiagnostics()).extracting(Diagnostic::getKind)
                .containsExactly(Diagnostic.Kind.INVALID_INTERVAL, Diagnostic.Kind.INVALID_INTERVAL);
    }

    @Test
    void keepsFirstOfDuplicateTasks() {
        SchedulingModel model = extractor.extract(String.join("\n",
                "//Task={\"Name\":\"T\",\"Interval\":2}",
                "//Task={\"Name\":\"T\",\"Interval\":7}"));

        assertThat(model.getTasks()).singleElement().satisfies(task -> assertThat(task.getInterval()).isEqualTo(2));
        assertThat(model.getDiagnostics()).extracting(Diagnostic::getKind)
                .containsExactly(Diagnostic.Kind.DUPLICATE_TASK);
    }

    @Test
    void reportsMalformedPayloads() {
        SchedulingModel model = extractor.extract(String.join("\n",
                "//Task={not json",
                "//Global={\"Name\":\"Temp\"}",
                "//Instance={\"Name\":\"OnlyName\"}"));

        assertThat(model.getTasks()).isEmpty();
        assertThat(model.getGlobals()).isEmpty();
        assertThat(model.getDiagnostics()).extracting(Diagnostic::getKind).containsOnly(
                Diagnostic.Kind.MALFORMED_DIRECTIVE);
        assertThat(model.getDiagnostics()).extracting(Diagnostic::getLine).containsExactly(1, 2, 3);
    }

    @Test
    void collectsGlobalsAfterCodeAndMapsVerbatim() {
        SchedulingModel model = extractor.extract(String.join("\n",
                "VAR_GLOBAL",
                "    Temp1 : REAL; //Global={\"Name\":\"Temp1\",\"Address\":\"40001\"}",
                "END_VAR",
                "  //Map={\\\"ModuleID\\\":\\\"io1\\\"}"));

        assertThat(model.getGlobals()).singleElement().satisfies(global -> {
            assertThat(global.getName()).isEqualTo("Temp1");
            assertThat(global.getAddress()).isEqualTo("40001");
        });
        assertThat(model.getIoMaps()).containsExactly("{\\\"ModuleID\\\":\\\"io1\\\"}");
    }

    @Test
    void findsProgramsWithoutTasks() {
        SchedulingModel model = extractor.extract("program A\nEND_PROGRAM\n  PROGRAM B\nEND_PROGRAM");

        assertThat(model.hasTasks()).isFalse();
        assertThat(model.getPrograms()).containsExactly("A", "B");
    }

    @Test
    void dropsCommentedOutProgramsAgainstTheParsedUnit() throws Exception {
        String source = String.join("\n",
                "PROGRAM A END_PROGRAM",
                "(*",
                "PROGRAM Old",
                "END_PROGRAM",
                "*)",
                "program b END_PROGRAM");
        CompilationUnit unit = new StructuredTextFrontEnd().parse(source);

        SchedulingModel model = extractor.extract(source, unit);

        assertThat(model.getPrograms()).containsExactly("A", "b");
        assertThat(model.getDiagnostics()).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.getKind()).isEqualTo(Diagnostic.Kind.UNDECLARED_PROGRAM);
            assertThat(diagnostic.getLine()).isEqualTo(3);
            assertThat(diagnostic.getMessage()).contains("Old");
        });
    }
}
