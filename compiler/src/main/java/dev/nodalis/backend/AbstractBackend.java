package dev.nodalis.backend;

import com.google.common.collect.ImmutableList;
import dev.nodalis.schedule.SchedulingModel;
import dev.nodalis.st.ast.CompilationUnit;
import dev.nodalis.st.ast.ProgramDeclaration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Generation pipeline shared by the shipped backends: render the unit's
 * logic, then, unless the request is for a library, append the start-up code
 * and the scheduler loop built from a {@link SchedulerPlan}.
 */
public abstract class AbstractBackend implements Backend {

    private static final Logger logger = LogManager.getLogger(AbstractBackend.class);

    private final BackendDescriptor descriptor;

    protected AbstractBackend(BackendDescriptor descriptor) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
    }

    @Override
    public final BackendDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public final GeneratedCode generate(CompilationUnit unit, SchedulingModel schedule, GenerationContext context)
            throws UnrenderableConstructException {
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(schedule, "schedule");
        Objects.requireNonNull(context, "context");

        String logic = newRenderer(context).render(unit);

        CodeWriter source = new CodeWriter();
        writePreamble(source, context);
        source.block(logic.stripTrailing());
        if (context.getOutputKind().includesRuntime()) {
            SchedulerPlan plan = SchedulerPlan.from(schedule);
            source.blank();
            writeRuntime(source, new RuntimeModel(unit, schedule, plan, getName()), context);
        }

        GeneratedArtifact primary = new GeneratedArtifact(
                context.getBaseName() + "." + fileExtension(context), source.toString());
        logger.debug("{} rendered {}", getName(), primary);
        return new GeneratedCode(primary, companions(context), supportFiles(context));
    }

    protected abstract AbstractRenderer newRenderer(GenerationContext context);

    protected abstract String fileExtension(GenerationContext context);

    /**
     * Includes or imports the rendered logic depends on.
     */
    protected abstract void writePreamble(CodeWriter out, GenerationContext context);

    /**
     * Start-up bindings and the scheduler loop.
     */
    protected abstract void writeRuntime(CodeWriter out, RuntimeModel runtime, GenerationContext context)
            throws UnrenderableConstructException;

    protected abstract List<String> supportFiles(GenerationContext context);

    protected List<GeneratedArtifact> companions(GenerationContext context) {
        return ImmutableList.of();
    }

    /**
     * Emits the calls one tick makes: a {@code counter % interval == 0} guard
     * per task over its instances, or an unconditional call of every program
     * when no task is declared.
     */
    protected final void writeScheduledCalls(CodeWriter out, RuntimeModel runtime, String counter)
            throws UnrenderableConstructException {
        SchedulerPlan plan = runtime.getPlan();
        if (!plan.isGated()) {
            for (String program : plan.getFallbackPrograms()) {
                out.line(programCall(runtime.resolveProgram(program)));
            }
            return;
        }
        for (SchedulerPlan.Gate gate : plan.getGates()) {
            if (gate.getPrograms().isEmpty()) {
                logger.debug("Task {} has no instances", gate.getTaskName());
                continue;
            }
            out.open("if (" + counter + " % " + gate.getInterval() + " == 0) {");
            for (String program : gate.getPrograms()) {
                out.line(programCall(runtime.resolveProgram(program)));
            }
            out.close("}");
        }
    }

    protected String programCall(String program) {
        return program + "();";
    }

    /**
     * Everything a backend needs to compose its runtime.
     */
    protected static final class RuntimeModel {
        private final CompilationUnit unit;
        private final SchedulingModel schedule;
        private final SchedulerPlan plan;
        private final String backendName;

        RuntimeModel(CompilationUnit unit, SchedulingModel schedule, SchedulerPlan plan, String backendName) {
            this.unit = unit;
            this.schedule = schedule;
            this.plan = plan;
            this.backendName = backendName;
        }

        public SchedulingModel getSchedule() {
            return schedule;
        }

        public SchedulerPlan getPlan() {
            return plan;
        }

        /**
         * The declared spelling of a scheduled program.
         */
        public String resolveProgram(String name) throws UnrenderableConstructException {
            ProgramDeclaration program = unit.findProgram(name).orElse(null);
            if (program == null) {
                throw new UnrenderableConstructException(backendName, "ProgramInstance", 0,
                        "scheduled program " + name + " is not declared");
            }
            return program.getName();
        }
    }
}
