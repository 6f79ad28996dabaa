package dev.nodalis.st.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Root of a parsed Structured Text source: the declarations in source order.
 */
public final class CompilationUnit extends Node {

    private final ImmutableList<Declaration> declarations;

    public CompilationUnit(List<Declaration> declarations) {
        super(1);
        this.declarations = ImmutableList.copyOf(Objects.requireNonNull(declarations, "declarations"));
    }

    public ImmutableList<Declaration> getDeclarations() {
        return declarations;
    }

    /**
     * Programs in source declaration order.
     */
    public ImmutableList<ProgramDeclaration> getPrograms() {
        ImmutableList.Builder<ProgramDeclaration> programs = ImmutableList.builder();
        for (Declaration declaration : declarations) {
            if (declaration instanceof ProgramDeclaration) {
                programs.add((ProgramDeclaration) declaration);
            }
        }
        return programs.build();
    }

    public Optional<ProgramDeclaration> findProgram(String name) {
        return getPrograms().stream()
                .filter(p -> p.getName().equalsIgnoreCase(name))
                .findFirst();
    }
}
