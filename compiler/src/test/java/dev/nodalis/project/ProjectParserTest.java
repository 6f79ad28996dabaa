package dev.nodalis.project;

import dev.nodalis.schedule.ScheduleExtractor;
import dev.nodalis.schedule.SchedulingModel;
import dev.nodalis.schedule.TaskDefinition;
import dev.nodalis.st.StructuredTextFrontEnd;
import dev.nodalis.st.ast.FunctionBlockDeclaration;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProjectParserTest {

    private final ProjectParser parser = new ProjectParser();

    static String fixture(String name) throws IOException {
        try (InputStream in = ProjectParserTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertThat(in).as(name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String project(String programs, String resource) {
        return "<Project xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\">"
                + "<Types><GlobalNamespace>" + programs + "</GlobalNamespace></Types>"
                + "<Instances><Configurations><Configuration name=\"C\">" + resource
                + "</Configuration></Configurations></Instances></Project>";
    }

    @Test
    void readsConfigurationsResourcesAndTypes() throws Exception {
        Project project = parser.parse(fixture("plant.iec"));

        assertThat(project.getConfigurations()).singleElement()
                .satisfies(c -> assertThat(c.getName()).isEqualTo("Plant"));
        assertThat(project.getTypes().getPrograms()).extracting(PouDefinition::getName)
                .containsExactly("Pump", "Interlock");
        assertThat(project.getMappingTable().getEntries()).hasSize(2);

        Resource line = project.requireResource("Line1");
        assertThat(line.getResourceTypeName()).isEqualTo("nodalis");
        assertThat(line.getTasks()).extracting(TaskDeclaration::getName).containsExactly("Fast", "Slow");
        assertThat(line.getInstances()).extracting(ProgramInstanceDeclaration::getName)
                .containsExactly("Pump1", "Pump2", "Lock1");
        assertThat(line.getGlobals().get(0).getAddress()).hasValueSatisfying(
                address -> assertThat(address.toDirectReference()).isEqualTo("%IX0.0"));
    }

    @Test
    void rendersResourceAsStructuredTextWithDirectives() throws Exception {
        String st = parser.parse(fixture("plant.iec")).requireResource("Line1").toSourceText();

        assertThat(st).contains(
                "//Task={\"Name\":\"Fast\",\"Interval\":\"2\",\"Priority\":\"1\"}",
                "//Instance={\"TypeName\":\"Pump\",\"Name\":\"Pump1\",\"AssociatedTaskName\":\"Fast\"}",
                "Start AT %IX0.0 : BOOL;",
                "//Global={\"Name\":\"Start\",\"Address\":\"%IX0.0\"}",
                "Stop : BOOL;");
        assertThat(st).startsWith("//Map={\\\"ModuleID\\\":\\\"rack1\\\"").doesNotContain("rack2");
        assertThat(Arrays.stream(st.split("\n")).filter("PROGRAM Pump"::equals)).hasSize(1);
    }

    @Test
    void convertsLadderRungsInEvaluationOrder() throws Exception {
        String st = parser.parse(fixture("plant.iec")).requireResource("Line1").toSourceText();

        int motor = st.indexOf("Motor := ((NOT Stop AND ((Start))));");
        int lamp = st.indexOf("IF ((Fault)) THEN");
        assertThat(motor).isPositive();
        assertThat(lamp).isGreaterThan(motor);
        assertThat(st).contains("Lamp := TRUE;");
    }

    @Test
    void renderedResourceFeedsTheFrontEndAndExtractor() throws Exception {
        String st = parser.parse(fixture("plant.iec")).requireResource("Line1").toSourceText();

        assertThat(new StructuredTextFrontEnd().parse(st).getPrograms()).hasSize(2);
        SchedulingModel model = new ScheduleExtractor().extract(st);
        assertThat(model.getDiagnostics()).isEmpty();
        assertThat(model.getTasks()).extracting(TaskDefinition::getInterval).containsExactly(2L, 10L);
        assertThat(model.getTasks().get(1).getInstances()).hasSize(2);
        assertThat(model.getGlobals()).hasSize(2);
        assertThat(model.getIoMaps()).hasSize(1);
    }

    @Test
    void reportsUnknownResource() throws Exception {
        Project project = parser.parse(fixture("plant.iec"));

        assertThat(project.findResource("Line2")).isEmpty();
        assertThatThrownBy(() -> project.requireResource("Line2"))
                .isInstanceOfSatisfying(ResourceNotFoundException.class,
                        e -> assertThat(e.getResourceName()).isEqualTo("Line2"));
    }

    @Test
    void rejectsMalformedDocuments() {
        assertThatThrownBy(() -> parser.parse("<Project><Configuration"))
                .isInstanceOf(MalformedProjectException.class);
        assertThatThrownBy(() -> parser.parse("<Plant/>"))
                .isInstanceOf(MalformedProjectException.class)
                .hasMessageContaining("<Plant>");
        assertThatThrownBy(() -> parser.parse("<Project/>"))
                .isInstanceOf(MalformedProjectException.class)
                .hasMessageContaining("no configuration");
    }

    @Test
    void rejectsInstanceOfUndeclaredProgram() throws Exception {
        Resource resource = parser.parse(project("",
                "<Resource name=\"R\"><Task name=\"T\" interval=\"1\"/>"
                        + "<ProgramInstance name=\"G\" typeName=\"Ghost\" associatedTaskName=\"T\"/></Resource>"))
                .requireResource("R");

        assertThatThrownBy(resource::toSourceText)
                .isInstanceOf(UnrenderableResourceException.class)
                .hasMessageContaining("Ghost");
    }

    @Test
    void rejectsDiagramBodiesAndLadderBlocks() throws Exception {
        String fbd = "<Program name=\"Diagram\"><MainBody><BodyContent xsi:type=\"FBD\"><Network/></BodyContent>"
                + "</MainBody></Program>";
        String ladder = "<Program name=\"Blocky\"><MainBody><BodyContent xsi:type=\"LD\">"
                + "<Rung evaluationOrder=\"1\"><FbdObject xsi:type=\"Block\" typeName=\"TON\"/></Rung>"
                + "</BodyContent></MainBody></Program>";
        Project project = parser.parse(project(fbd + ladder,
                "<Resource name=\"A\"><ProgramInstance typeName=\"Diagram\"/></Resource>"
                        + "<Resource name=\"B\"><ProgramInstance typeName=\"Blocky\"/></Resource>"));

        assertThatThrownBy(() -> project.requireResource("A").toSourceText())
                .isInstanceOf(UnrenderableResourceException.class)
                .hasMessageContaining("function block diagram");
        assertThatThrownBy(() -> project.requireResource("B").toSourceText())
                .isInstanceOf(UnrenderableResourceException.class)
                .hasMessageContaining("TON");
    }

    @Test
    void ordersFunctionBlockParametersByPosition() throws Exception {
        String block = "<FunctionBlock name=\"Mixer\"><Parameters><InputVars>"
                + "<Variable name=\"Second\" orderWithinParamSet=\"2\"><Type><TypeName>INT</TypeName></Type></Variable>"
                + "<Variable name=\"First\" orderWithinParamSet=\"1\"><Type><TypeName>INT</TypeName></Type></Variable>"
                + "</InputVars><OutputVars>"
                + "<Variable name=\"Sum\"><Type><TypeName>INT</TypeName></Type></Variable>"
                + "</OutputVars></Parameters><MainBody><BodyContent xsi:type=\"ST\">"
                + "<ST>Sum := First + Second;</ST></BodyContent></MainBody></FunctionBlock>";
        Project project = parser.parse(project(block, "<Resource name=\"R\"/>"));

        String st = project.requireResource("R").toSourceText();

        assertThat(st).contains("VAR_INPUT\n        First : INT;\n        Second : INT;\n    END_VAR");
        assertThat(st.indexOf("VAR_OUTPUT")).isGreaterThan(st.indexOf("Second : INT;"));
        assertThat(new StructuredTextFrontEnd().parse(st).getDeclarations())
                .anySatisfy(declaration -> assertThat(declaration).isInstanceOf(FunctionBlockDeclaration.class));
    }
}
