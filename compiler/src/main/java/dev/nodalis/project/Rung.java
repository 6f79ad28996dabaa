package dev.nodalis.project;

import com.google.common.collect.ImmutableList;

import java.util.List;

public final class Rung {

    private final int evaluationOrder;
    private final ImmutableList<LadderElement> elements;

    public Rung(int evaluationOrder, List<LadderElement> elements) {
        this.evaluationOrder = evaluationOrder;
        this.elements = ImmutableList.copyOf(elements);
    }

    public int getEvaluationOrder() {
        return evaluationOrder;
    }

    public ImmutableList<LadderElement> getElements() {
        return elements;
    }
}
