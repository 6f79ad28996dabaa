package dev.nodalis.backend.js;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import dev.nodalis.backend.AbstractBackend;
import dev.nodalis.backend.AbstractRenderer;
import dev.nodalis.backend.BackendDescriptor;
import dev.nodalis.backend.CodeWriter;
import dev.nodalis.backend.GeneratedArtifact;
import dev.nodalis.backend.GenerationContext;
import dev.nodalis.backend.Literals;
import dev.nodalis.backend.OutputKind;
import dev.nodalis.backend.Protocol;
import dev.nodalis.backend.SourceLanguage;
import dev.nodalis.backend.UnrenderableConstructException;
import dev.nodalis.schedule.GlobalBinding;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;

/**
 * JavaScript for Node.js and for the embedded Jint engine.
 * <p>
 * On Node.js the module sets up the OPC-UA server and I/O maps in
 * {@code setup()} and {@code run()} drives ticks from a timer. Under Jint the
 * host calls {@code setup()} once and {@code run()} for every tick.
 */
public final class JavaScriptBackend extends AbstractBackend {

    public static final String NAME = "JavaScriptBackend";

    private static final Logger logger = LogManager.getLogger(JavaScriptBackend.class);

    private static final ImmutableList<String> NODE_SUPPORT_FILES = ImmutableList.of(
            "nodalis.js", "modbus.js", "IOClient.js", "opcua.js");

    private static final String RUNTIME_IMPORTS = String.join("\n",
            "import {",
            "  readBit, writeBit, readByte, writeByte, readWord, writeWord, readDWord, writeDWord,",
            "  readAddress, writeAddress, getBit, setBit, resolve, newStatic, RefVar, superviseIO, mapIO,",
            "  createReference,",
            "  TON, TOF, TP, R_TRIG, F_TRIG, CTU, CTD, CTUD,",
            "  AND, OR, XOR, NOR, NAND, NOT, ASSIGNMENT,",
            "  EQ, NE, LT, GT, GE, LE,",
            "  MOVE, SEL, MUX, MIN, MAX, LIMIT",
            "} from \"./nodalis.js\";");

    private final ObjectMapper mapper;

    public JavaScriptBackend() {
        this(new ObjectMapper());
    }

    public JavaScriptBackend(ObjectMapper mapper) {
        super(new BackendDescriptor(
                NAME,
                ImmutableSet.of(SourceLanguage.ST, SourceLanguage.LD),
                ImmutableSet.of(OutputKind.SOURCE_CODE, OutputKind.EXECUTABLE, OutputKind.LIBRARY),
                ImmutableSet.of(JavaScriptDialect.NODEJS.getDevice(), JavaScriptDialect.JINT.getDevice()),
                ImmutableSet.of(Protocol.MODBUS, Protocol.OPC_UA, Protocol.BACNET),
                "1.0.0"));
        this.mapper = mapper;
    }

    @Override
    protected AbstractRenderer newRenderer(GenerationContext context) {
        return new JavaScriptRenderer(JavaScriptDialect.forDevice(context.getDevice()));
    }

    @Override
    protected String fileExtension(GenerationContext context) {
        return "js";
    }

    @Override
    protected void writePreamble(CodeWriter out, GenerationContext context) {
        if (!JavaScriptDialect.forDevice(context.getDevice()).usesModules()) {
            return;
        }
        out.block(RUNTIME_IMPORTS);
        if (context.getOutputKind().includesRuntime()) {
            out.line("import { OPCServer } from \"./opcua.js\";");
        }
        out.blank();
    }

    @Override
    protected void writeRuntime(CodeWriter out, RuntimeModel runtime, GenerationContext context)
            throws UnrenderableConstructException {
        JavaScriptDialect dialect = JavaScriptDialect.forDevice(context.getDevice());
        if (dialect.usesModules()) {
            writeNodeRuntime(out, runtime, context, dialect);
        } else {
            writeJintRuntime(out, runtime, context, dialect);
        }
    }

    private void writeNodeRuntime(CodeWriter out, RuntimeModel runtime, GenerationContext context,
                                  JavaScriptDialect dialect) throws UnrenderableConstructException {
        out.line("const opcServer = new OPCServer();");
        out.line("let PROGRAM_COUNT = 0;");
        out.blank();
        writeTick(out, runtime, "function tick() {", dialect);
        out.blank();
        out.open("export async function setup() {");
        out.line("opcServer.setReadWriteHandlers(readAddress, writeAddress);");
        out.line("await opcServer.start();");
        for (GlobalBinding global : runtime.getSchedule().getGlobals()) {
            out.line("opcServer.mapVariable(" + Literals.quote(global.getName()) + ", "
                    + Literals.quote(global.getAddress()) + ");");
        }
        writeMaps(out, runtime);
        out.line(dialect.logFunction() + "(" + Literals.quote(context.getPlcName() + " is running!") + ");");
        out.close("}");
        out.blank();
        long period = runtime.getPlan().isGated() ? context.getTickDelayMillis() : context.getFallbackIntervalMillis();
        out.open("export function run() {");
        out.line("return setInterval(tick, " + period + ");");
        out.close("}");
        out.blank();
        out.line("setup().then(run);");
    }

    private void writeJintRuntime(CodeWriter out, RuntimeModel runtime, GenerationContext context,
                                  JavaScriptDialect dialect) throws UnrenderableConstructException {
        if (!runtime.getSchedule().getGlobals().isEmpty()) {
            logger.warn("{} on {} has no OPC-UA server; {} global bindings ignored",
                    NAME, context.getDevice(), runtime.getSchedule().getGlobals().size());
        }
        out.line("let PROGRAM_COUNT = 0;");
        out.blank();
        out.open("function setup() {");
        writeMaps(out, runtime);
        out.line(dialect.logFunction() + "(" + Literals.quote(context.getPlcName() + " is running!") + ");");
        out.close("}");
        out.blank();
        writeTick(out, runtime, "function run() {", dialect);
    }

    private static void writeMaps(CodeWriter out, RuntimeModel runtime) {
        for (String map : runtime.getSchedule().getIoMaps()) {
            out.line("mapIO(\"" + map + "\");");
        }
    }

    /**
     * One tick: supervise I/O, run the due programs inside a fault boundary,
     * then advance the counter, wrapping to zero at the largest safe integer.
     */
    private void writeTick(CodeWriter out, RuntimeModel runtime, String header, JavaScriptDialect dialect)
            throws UnrenderableConstructException {
        out.open(header);
        out.open("try {");
        out.line("superviseIO();");
        writeScheduledCalls(out, runtime, "PROGRAM_COUNT");
        out.reopen("} catch (e) {");
        out.line(dialect.errorFunction() + "(\"Tick \" + PROGRAM_COUNT + \" failed: \" + e);");
        out.close("}");
        out.line("PROGRAM_COUNT = PROGRAM_COUNT >= Number.MAX_SAFE_INTEGER ? 0 : PROGRAM_COUNT + 1;");
        out.close("}");
    }

    @Override
    protected List<String> supportFiles(GenerationContext context) {
        if (JavaScriptDialect.forDevice(context.getDevice()).usesModules()) {
            return NODE_SUPPORT_FILES;
        }
        return ImmutableList.of();
    }

    @Override
    protected List<GeneratedArtifact> companions(GenerationContext context) {
        if (!JavaScriptDialect.forDevice(context.getDevice()).usesModules()) {
            return ImmutableList.of();
        }
        return ImmutableList.of(new GeneratedArtifact("package.json", packageJson(context)));
    }

    private String packageJson(GenerationContext context) {
        ObjectNode pkg = mapper.createObjectNode();
        pkg.put("name", "nodalis-" + context.getPlcName().toLowerCase(Locale.ROOT));
        pkg.put("version", "1.0.0");
        pkg.put("type", "module");
        pkg.put("main", context.getBaseName() + ".js");
        ObjectNode dependencies = pkg.putObject("dependencies");
        dependencies.put("jsmodbus", "^4.0.6");
        dependencies.put("node-opcua", "^2.156.0");
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(pkg) + "\n";
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
