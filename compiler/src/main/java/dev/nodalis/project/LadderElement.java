package dev.nodalis.project;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * A ladder object ({@code <LdObject>}) or a block placed on a rung
 * ({@code <FbdObject>}). Wiring is by id: each input lists the output ids it
 * is connected to.
 */
public final class LadderElement {

    public enum Kind {
        LEFT_POWER_RAIL,
        RIGHT_POWER_RAIL,
        CONTACT,
        COMPARE_CONTACT,
        COIL,
        BLOCK,
        UNKNOWN
    }

    public enum Latch {
        NONE,
        SET,
        RESET
    }

    private final Kind kind;
    private final String typeName;
    private final String operand;
    private final String operand1;
    private final String operand2;
    private final String compareOperator;
    private final boolean negated;
    private final Latch latch;
    private final ImmutableList<String> inputRefs;
    private final ImmutableList<String> outputIds;

    public LadderElement(Kind kind, String typeName, String operand, String operand1, String operand2,
                         String compareOperator, boolean negated, Latch latch,
                         List<String> inputRefs, List<String> outputIds) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.operand = operand;
        this.operand1 = operand1;
        this.operand2 = operand2;
        this.compareOperator = compareOperator;
        this.negated = negated;
        this.latch = Objects.requireNonNull(latch, "latch");
        this.inputRefs = ImmutableList.copyOf(inputRefs);
        this.outputIds = ImmutableList.copyOf(outputIds);
    }

    public static Kind kindOf(String xsiType) {
        if (xsiType == null) {
            return Kind.UNKNOWN;
        }
        switch (xsiType) {
            case "LeftPowerRail":
                return Kind.LEFT_POWER_RAIL;
            case "RightPowerRail":
                return Kind.RIGHT_POWER_RAIL;
            case "Contact":
                return Kind.CONTACT;
            case "CompareContact":
                return Kind.COMPARE_CONTACT;
            case "Coil":
                return Kind.COIL;
            default:
                return Kind.UNKNOWN;
        }
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The {@code xsi:type} as written in the project file.
     */
    public String getTypeName() {
        return typeName;
    }

    public String getOperand() {
        return operand;
    }

    public String getOperand1() {
        return operand1;
    }

    public String getOperand2() {
        return operand2;
    }

    public String getCompareOperator() {
        return compareOperator;
    }

    public boolean isNegated() {
        return negated;
    }

    public Latch getLatch() {
        return latch;
    }

    public ImmutableList<String> getInputRefs() {
        return inputRefs;
    }

    public ImmutableList<String> getOutputIds() {
        return outputIds;
    }

    boolean feeds(LadderElement other) {
        for (String ref : other.inputRefs) {
            if (outputIds.contains(ref)) {
                return true;
            }
        }
        return false;
    }
}
