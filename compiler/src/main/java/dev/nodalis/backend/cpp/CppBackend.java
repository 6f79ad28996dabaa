package dev.nodalis.backend.cpp;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import dev.nodalis.backend.AbstractBackend;
import dev.nodalis.backend.AbstractRenderer;
import dev.nodalis.backend.BackendDescriptor;
import dev.nodalis.backend.CodeWriter;
import dev.nodalis.backend.GenerationContext;
import dev.nodalis.backend.Literals;
import dev.nodalis.backend.OutputKind;
import dev.nodalis.backend.Protocol;
import dev.nodalis.backend.SourceLanguage;
import dev.nodalis.backend.UnrenderableConstructException;
import dev.nodalis.schedule.GlobalBinding;

import java.util.List;

/**
 * Native C++ runtime for desktop and embedded Linux, macOS and Windows
 * targets. The generated {@code main} binds globals into an OPC-UA server,
 * maps I/O, then runs the scheduler loop with a fault boundary per tick.
 */
public final class CppBackend extends AbstractBackend {

    public static final String NAME = "CppBackend";

    private static final ImmutableList<String> SUPPORT_FILES = ImmutableList.of(
            "nodalis.h", "nodalis.cpp",
            "modbus.h", "modbus.cpp",
            "opcua.h", "opcua.cpp",
            "bacnet.h", "bacnet.cpp");

    public CppBackend() {
        super(new BackendDescriptor(
                NAME,
                ImmutableSet.of(SourceLanguage.ST, SourceLanguage.LD),
                ImmutableSet.of(OutputKind.SOURCE_CODE, OutputKind.EXECUTABLE, OutputKind.LIBRARY),
                ImmutableSet.of("linux-arm", "linux-arm64", "linux-x64",
                        "macos-x64", "macos-arm64",
                        "windows-x64", "windows-arm64"),
                ImmutableSet.of(Protocol.MODBUS, Protocol.OPC_UA, Protocol.BACNET),
                "1.0.0"));
    }

    @Override
    protected AbstractRenderer newRenderer(GenerationContext context) {
        return new CppRenderer();
    }

    @Override
    protected String fileExtension(GenerationContext context) {
        return "cpp";
    }

    @Override
    protected void writePreamble(CodeWriter out, GenerationContext context) {
        out.line("#include \"nodalis.h\"");
        if (context.getOutputKind().includesRuntime()) {
            out.line("#include \"opcua.h\"");
            out.line("#include <chrono>");
            out.line("#include <cstdint>");
            out.line("#include <iostream>");
            out.line("#include <limits>");
            out.line("#include <thread>");
        }
        out.blank();
    }

    @Override
    protected void writeRuntime(CodeWriter out, RuntimeModel runtime, GenerationContext context)
            throws UnrenderableConstructException {
        out.line("OPCUAServer opcServer;");
        out.blank();
        out.open("int main() {");
        for (GlobalBinding global : runtime.getSchedule().getGlobals()) {
            out.line("opcServer.mapVariable(" + Literals.quote(global.getName()) + ", "
                    + Literals.quote(global.getAddress()) + ");");
        }
        out.line("opcServer.start();");
        for (String map : runtime.getSchedule().getIoMaps()) {
            out.line("mapIO(\"" + map + "\");");
        }
        out.line("std::cout << " + Literals.quote(context.getPlcName() + " is running!") + " << std::endl;");
        out.open("while (true) {");
        out.open("try {");
        out.line("superviseIO();");
        writeScheduledCalls(out, runtime, "PROGRAM_COUNT");
        out.reopen("} catch (const std::exception& e) {");
        out.line("std::cerr << \"Tick \" << PROGRAM_COUNT << \" failed: \" << e.what() << std::endl;");
        out.close("}");
        writeAdvance(out, context);
        out.close("}");
        out.line("return 0;");
        out.close("}");
    }

    /**
     * Sleep for the tick delay, then advance the counter, wrapping to zero
     * instead of overflowing.
     */
    static void writeAdvance(CodeWriter out, GenerationContext context) {
        out.line("std::this_thread::sleep_for(std::chrono::milliseconds(" + context.getTickDelayMillis() + "));");
        out.open("if (PROGRAM_COUNT >= std::numeric_limits<uint64_t>::max()) {");
        out.line("PROGRAM_COUNT = 0;");
        out.reopen("} else {");
        out.line("PROGRAM_COUNT++;");
        out.close("}");
    }

    @Override
    protected List<String> supportFiles(GenerationContext context) {
        return SUPPORT_FILES;
    }
}
