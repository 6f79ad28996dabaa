package dev.nodalis.project;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Set;

/**
 * Converts one rung to Structured Text. Each coil becomes an assignment of
 * the boolean expression obtained by walking its inputs back to the left
 * power rail: elements in series are joined with {@code AND}, parallel
 * branches feeding the same input with {@code OR}.
 */
final class LadderTranslator {

    private static final Logger logger = LogManager.getLogger(LadderTranslator.class);

    private static final Set<String> COMPARE_OPERATORS = Set.of(">", ">=", "=", "<=", "<", "<>");

    private final String owner;

    LadderTranslator(String owner) {
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    String translate(Rung rung) throws UnrenderableResourceException {
        for (LadderElement element : rung.getElements()) {
            if (element.getKind() == LadderElement.Kind.BLOCK) {
                throw new UnrenderableResourceException(owner + ": rung " + rung.getEvaluationOrder()
                        + " contains block " + element.getTypeName() + ", only contacts and coils are supported");
            }
            if (element.getKind() == LadderElement.Kind.UNKNOWN) {
                logger.warn("{}: rung {} skips unsupported ladder object {}",
                        owner, rung.getEvaluationOrder(), element.getTypeName());
            }
        }

        StringBuilder st = new StringBuilder();
        for (LadderElement element : rung.getElements()) {
            if (element.getKind() == LadderElement.Kind.COIL) {
                String expression = inputsOf(rung, element, new ArrayDeque<>());
                st.append(coil(element, expression.isEmpty() ? "TRUE" : expression)).append('\n');
            }
        }
        return st.toString();
    }

    private String expressionOf(Rung rung, LadderElement start, Deque<LadderElement> path)
            throws UnrenderableResourceException {
        String inputs = inputsOf(rung, start, path);
        String self = contact(start);
        return inputs.isEmpty() ? self : self + " AND (" + inputs + ")";
    }

    private String inputsOf(Rung rung, LadderElement start, Deque<LadderElement> path)
            throws UnrenderableResourceException {
        if (path.contains(start)) {
            throw new UnrenderableResourceException(owner + ": rung " + rung.getEvaluationOrder()
                    + " has a wiring loop through " + describe(start));
        }
        path.push(start);
        StringBuilder expression = new StringBuilder();
        for (LadderElement source : rung.getElements()) {
            if (!source.feeds(start)) {
                continue;
            }
            if (source.getKind() == LadderElement.Kind.LEFT_POWER_RAIL
                    || source.getKind() == LadderElement.Kind.UNKNOWN) {
                continue;
            }
            if (expression.length() > 0) {
                expression.append(" OR ");
            }
            expression.append('(').append(expressionOf(rung, source, path)).append(')');
        }
        path.pop();
        return expression.toString();
    }

    private String contact(LadderElement element) throws UnrenderableResourceException {
        switch (element.getKind()) {
            case CONTACT:
                return (element.isNegated() ? "NOT " : "") + element.getOperand();
            case COMPARE_CONTACT:
                String operator = element.getCompareOperator();
                if (operator == null || !COMPARE_OPERATORS.contains(operator)) {
                    throw new UnrenderableResourceException(owner + ": compare contact with unsupported operator '"
                            + operator + "'");
                }
                return "(" + element.getOperand1() + " " + operator + " " + element.getOperand2() + ")";
            default:
                throw new UnrenderableResourceException(owner + ": " + describe(element)
                        + " cannot appear between the rail and a coil");
        }
    }

    private static String coil(LadderElement coil, String expression) {
        switch (coil.getLatch()) {
            case SET:
                return "IF (" + expression + ") THEN\n    " + coil.getOperand() + " := TRUE;\nEND_IF;";
            case RESET:
                return "IF (" + expression + ") THEN\n    " + coil.getOperand() + " := FALSE;\nEND_IF;";
            default:
                return coil.getOperand() + " := " + (coil.isNegated() ? "NOT " : "") + "(" + expression + ");";
        }
    }

    private static String describe(LadderElement element) {
        return element.getTypeName() + (element.getOperand() != null ? " " + element.getOperand() : "");
    }
}
