package dev.nodalis.compiler;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import dev.nodalis.NodalisException;
import dev.nodalis.backend.Backend;
import dev.nodalis.backend.BackendRegistry;
import dev.nodalis.backend.GeneratedArtifact;
import dev.nodalis.backend.GeneratedCode;
import dev.nodalis.backend.GenerationContext;
import dev.nodalis.backend.OutputKind;
import dev.nodalis.backend.Protocol;
import dev.nodalis.backend.SourceLanguage;
import dev.nodalis.project.Project;
import dev.nodalis.project.ProjectParser;
import dev.nodalis.project.Resource;
import dev.nodalis.schedule.ScheduleExtractor;
import dev.nodalis.schedule.SchedulingModel;
import dev.nodalis.st.StructuredTextFrontEnd;
import dev.nodalis.st.ast.CompilationUnit;
import dev.nodalis.toolchain.BuildToolchain;
import dev.nodalis.toolchain.DeviceProgrammer;
import dev.nodalis.toolchain.ProgramRequest;
import dev.nodalis.toolchain.TargetPlatform;
import dev.nodalis.toolchain.ToolchainHandle;
import dev.nodalis.toolchain.ToolchainSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point of the Nodalis compiler. A request flows through the project
 * model (for IEC project files), the Structured Text front end, the
 * scheduling directive extractor and finally the backend the registry
 * selects for the request's target.
 */
public final class NodalisCompiler {

    private static final Logger logger = LogManager.getLogger(NodalisCompiler.class);

    private final BackendRegistry registry;
    private final CompilerSettings settings;
    private final StructuredTextFrontEnd frontEnd = new StructuredTextFrontEnd();
    private final ScheduleExtractor extractor = new ScheduleExtractor();
    private final ProjectParser projectParser = new ProjectParser();

    public NodalisCompiler() {
        this(BackendRegistry.standard(), CompilerSettings.load());
    }

    public NodalisCompiler(BackendRegistry registry, CompilerSettings settings) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public BackendRegistry getRegistry() {
        return registry;
    }

    public CompilationResult compile(CompileRequest request) throws NodalisException {
        Objects.requireNonNull(request, "request");
        try {
            return doCompile(request);
        } catch (NodalisException e) {
            logger.error("Compile of {} for {} aborted: {}", request.getSourceName(), request.getDevice(),
                    e.getMessage());
            throw e;
        }
    }

    private CompilationResult doCompile(CompileRequest request) throws NodalisException {
        SourceKind kind = SourceKind.of(request.getSourceName(), request.getLanguage());
        Backend backend = registry.select(request.getDevice(), request.getOutputKind(), request.getLanguage());
        checkProtocols(backend, request.getProtocols());

        String source = readSource(request);
        String plcName;
        GeneratedArtifact structuredText = null;
        if (kind == SourceKind.PROJECT) {
            String resourceName = request.getResourceName()
                    .orElseThrow(() -> new MissingResourceNameException(request.getSourceName()));
            Project project = projectParser.parse(source);
            Resource resource = project.requireResource(resourceName);
            source = resource.toSourceText();
            plcName = resource.getName();
            structuredText = new GeneratedArtifact(request.getBaseName() + ".st", source);
            logger.info("Converted resource {} of {} to Structured Text", plcName, request.getSourceName());
        } else {
            plcName = request.getResourceName().orElse(settings.getDefaultPlcName());
        }

        CompilationUnit unit = frontEnd.parse(source);
        SchedulingModel schedule = extractor.extract(source, unit);

        GenerationContext context = new GenerationContext(
                request.getDevice(),
                request.getOutputKind(),
                plcName,
                request.getBaseName(),
                settings.getTickDelayMillis(),
                settings.getFallbackIntervalMillis());
        GeneratedCode code = backend.generate(unit, schedule, context);
        logger.info("Compiled {} with {} into {}", request.getSourceName(), backend.getName(),
                code.getPrimary().getFileName());
        return new CompilationResult(backend.getName(), request.getDevice(), code, structuredText,
                schedule.getDiagnostics());
    }

    private static void checkProtocols(Backend backend, Set<Protocol> requested) throws NodalisException {
        Set<Protocol> unsupported = Sets.difference(requested, backend.descriptor().getProtocols());
        if (!unsupported.isEmpty()) {
            throw new NodalisException(backend.getName() + " does not support protocols " + unsupported);
        }
    }

    private static String readSource(CompileRequest request) throws NodalisException {
        if (request.getSourceText().isPresent()) {
            return request.getSourceText().get();
        }
        Path path = request.getSourcePath().orElseThrow();
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new NodalisException("cannot read " + path, e);
        }
    }

    /**
     * Writes the result of a C++ compile to {@code outputDirectory} and links
     * it, together with the runtime sources already copied there, into an
     * executable named after the primary artifact.
     *
     * @return path of the executable
     */
    public Path buildExecutable(CompilationResult result, Path outputDirectory, BuildToolchain toolchain,
                                ToolchainSettings toolchainSettings) throws NodalisException {
        String primary = result.getPrimary().getFileName();
        if (!primary.endsWith(".cpp")) {
            throw new NodalisException(result.getBackendName() + " output " + primary + " cannot be linked");
        }
        TargetPlatform target = TargetPlatform.parse(result.getDevice());
        ToolchainHandle handle = toolchain.detect(target, toolchainSettings);
        try {
            result.writeTo(outputDirectory);
        } catch (IOException e) {
            throw new NodalisException("cannot write to " + outputDirectory, e);
        }

        List<Path> sources = new ArrayList<>();
        sources.add(outputDirectory.resolve(primary));
        for (String supportFile : result.getSupportFiles()) {
            Path file = outputDirectory.resolve(supportFile);
            if (supportFile.endsWith(".cpp") && Files.exists(file)) {
                sources.add(file);
            }
        }
        ImmutableList<Path> includes = ImmutableList.of(outputDirectory);
        List<Path> objects = new ArrayList<>();
        for (Path file : sources) {
            objects.add(toolchain.compileObject(handle, file, includes, outputDirectory));
        }
        String name = primary.substring(0, primary.length() - ".cpp".length());
        Path executable = outputDirectory.resolve(target.isWindows() ? name + ".exe" : name);
        Path linked = toolchain.linkExecutable(handle, objects, executable);
        logger.info("Linked {} for {} with {}", linked, target, handle.getCompiler());
        return linked;
    }

    /**
     * Hands the request to the programmer registered for {@code target}.
     */
    public void deploy(ProgramRequest request, String target, List<DeviceProgrammer> programmers)
            throws NodalisException {
        for (DeviceProgrammer programmer : programmers) {
            if (programmer.target().equalsIgnoreCase(target)) {
                logger.info("Programming {} through {}", request, programmer.target());
                if (!programmer.program(request)) {
                    throw new NodalisException("device " + request.getDestination() + " rejected the program");
                }
                return;
            }
        }
        throw new NodalisException("no programmer registered for target '" + target + "'");
    }

    public static void main(String[] args) throws IOException {
        if (args.length < 5 || args.length > 6) {
            System.err.println("usage: NodalisCompiler <source> <outputDir> <target> <outputKind> <language>"
                    + " [resourceName]");
            System.exit(2);
        }

        Path source = Path.of(args[0]);
        Path outputDirectory = Path.of(args[1]);
        CompileRequest request;
        try {
            request = CompileRequest.builder()
                    .sourceFile(source)
                    .device(args[2].toLowerCase(Locale.ROOT))
                    .outputKind(OutputKind.parse(args[3]))
                    .language(SourceLanguage.parse(args[4]))
                    .resourceName(args.length == 6 ? args[5] : null)
                    .build();
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(2);
            return;
        }

        try {
            CompilationResult result = new NodalisCompiler().compile(request);
            for (Path written : result.writeTo(outputDirectory)) {
                System.out.println(written);
            }
        } catch (NodalisException e) {
            System.err.println(e.getMessage());
            System.exit(1);
        }
    }
}
