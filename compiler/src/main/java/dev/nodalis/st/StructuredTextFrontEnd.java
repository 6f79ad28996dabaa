package dev.nodalis.st;

import dev.nodalis.antlr.StructuredTextLexer;
import dev.nodalis.antlr.StructuredTextParser;
import dev.nodalis.st.ast.CompilationUnit;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Parses Structured Text into a {@link CompilationUnit}. Wires the generated
 * ANTLR lexer and parser and stops at the first reported error.
 */
public final class StructuredTextFrontEnd {

    private static final Logger logger = LogManager.getLogger(StructuredTextFrontEnd.class);

    public CompilationUnit parse(String sourceText) throws StructuredTextSyntaxException {
        Objects.requireNonNull(sourceText, "sourceText");

        CharStream input = CharStreams.fromString(sourceText);
        StructuredTextLexer lexer = new StructuredTextLexer(input);
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        StructuredTextParser parser = new StructuredTextParser(tokens);

        FirstErrorListener listener = new FirstErrorListener();
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);
        parser.removeErrorListeners();
        parser.addErrorListener(listener);

        StructuredTextParser.CompilationUnitContext tree;
        try {
            tree = parser.compilationUnit();
        } catch (SyntaxAbort abort) {
            logger.debug("Structured Text rejected at {}:{}: {}", abort.line, abort.column, abort.getMessage());
            throw new StructuredTextSyntaxException(abort.line, abort.column, abort.getMessage());
        }

        CompilationUnit unit = new AstBuilder().build(tree);
        logger.debug("Parsed {} declaration(s), {} program(s)",
                unit.getDeclarations().size(), unit.getPrograms().size());
        return unit;
    }

    private static final class FirstErrorListener extends BaseErrorListener {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer,
                                Object offendingSymbol,
                                int line,
                                int charPositionInLine,
                                String msg,
                                RecognitionException e) {
            throw new SyntaxAbort(line, charPositionInLine, msg);
        }
    }

    /**
     * Unwinds the generated parser on the first error; converted into the
     * checked {@link StructuredTextSyntaxException} at the parse boundary.
     */
    private static final class SyntaxAbort extends RuntimeException {
        private final int line;
        private final int column;

        SyntaxAbort(int line, int column, String message) {
            super(message, null, false, false);
            this.line = line;
            this.column = column;
        }
    }
}
