package dev.nodalis.backend;

import dev.nodalis.schedule.SchedulingModel;
import dev.nodalis.st.ast.CompilationUnit;

/**
 * A target-specific code generator.
 */
public interface Backend {

    BackendDescriptor descriptor();

    default String getName() {
        return descriptor().getName();
    }

    /**
     * Renders a parsed unit and its scheduling metadata into target source.
     * Nothing is written to disk here.
     */
    GeneratedCode generate(CompilationUnit unit, SchedulingModel schedule, GenerationContext context)
            throws UnrenderableConstructException;
}
