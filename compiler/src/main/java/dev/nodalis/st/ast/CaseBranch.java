package dev.nodalis.st.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

public final class CaseBranch {

    private final ImmutableList<CaseLabel> labels;
    private final ImmutableList<Statement> body;

    public CaseBranch(List<CaseLabel> labels, List<Statement> body) {
        this.labels = ImmutableList.copyOf(labels);
        this.body = ImmutableList.copyOf(body);
    }

    public ImmutableList<CaseLabel> getLabels() {
        return labels;
    }

    public ImmutableList<Statement> getBody() {
        return body;
    }
}
