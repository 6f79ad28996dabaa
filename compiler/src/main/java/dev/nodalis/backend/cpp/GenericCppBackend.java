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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * C++ for a generic device whose host firmware provides {@code imperium.h}.
 * The host owns its I/O configuration: each tick is framed by
 * {@code gatherInputs()} and {@code handleOutputs()}, and no protocol
 * bindings are generated.
 */
public final class GenericCppBackend extends AbstractBackend {

    public static final String NAME = "GenericCppBackend";

    private static final Logger logger = LogManager.getLogger(GenericCppBackend.class);

    private static final ImmutableList<String> SUPPORT_FILES = ImmutableList.of(
            "imperium.h", "imperium.cpp",
            "modbus.h", "modbus.cpp");

    public GenericCppBackend() {
        super(new BackendDescriptor(
                NAME,
                ImmutableSet.of(SourceLanguage.ST, SourceLanguage.LD),
                ImmutableSet.of(OutputKind.SOURCE_CODE, OutputKind.EXECUTABLE, OutputKind.LIBRARY),
                ImmutableSet.of("generic"),
                ImmutableSet.of(Protocol.MODBUS),
                "1.0.0"));
    }

    @Override
    protected AbstractRenderer newRenderer(GenerationContext context) {
        return new GenericCppRenderer();
    }

    @Override
    protected String fileExtension(GenerationContext context) {
        return "cpp";
    }

    @Override
    protected void writePreamble(CodeWriter out, GenerationContext context) {
        out.line("#include \"imperium.h\"");
        out.line("#include <cmath>");
        if (context.getOutputKind().includesRuntime()) {
            out.line("#include \"modbus.h\"");
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
        int ignored = runtime.getSchedule().getGlobals().size() + runtime.getSchedule().getIoMaps().size();
        if (ignored > 0) {
            logger.warn("{} ignores {} global and I/O map directives; the host configures I/O", NAME, ignored);
        }
        out.line("uint64_t PROGRAM_COUNT = 0;");
        out.blank();
        out.open("int main() {");
        out.line("std::cout << " + Literals.quote(context.getPlcName() + " is running!") + " << std::endl;");
        out.open("while (true) {");
        out.open("try {");
        out.line("gatherInputs();");
        writeScheduledCalls(out, runtime, "PROGRAM_COUNT");
        out.line("handleOutputs();");
        out.reopen("} catch (const std::exception& e) {");
        out.line("std::cerr << \"Tick \" << PROGRAM_COUNT << \" failed: \" << e.what() << std::endl;");
        out.close("}");
        CppBackend.writeAdvance(out, context);
        out.close("}");
        out.line("return 0;");
        out.close("}");
    }

    @Override
    protected List<String> supportFiles(GenerationContext context) {
        return SUPPORT_FILES;
    }
}
