package dev.nodalis.project;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

import java.util.List;
import java.util.Objects;

/**
 * A ladder diagram body. Rungs are converted in evaluation order.
 */
public final class LadderBody implements PouBody {

    private static final Ordering<Rung> BY_EVALUATION_ORDER =
            Ordering.<Integer>natural().onResultOf(Rung::getEvaluationOrder);

    private final String owner;
    private final ImmutableList<Rung> rungs;

    public LadderBody(String owner, List<Rung> rungs) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.rungs = BY_EVALUATION_ORDER.immutableSortedCopy(rungs);
    }

    @Override
    public String language() {
        return "LD";
    }

    public ImmutableList<Rung> getRungs() {
        return rungs;
    }

    @Override
    public String toSourceText() throws UnrenderableResourceException {
        LadderTranslator translator = new LadderTranslator(owner);
        StringBuilder st = new StringBuilder();
        for (Rung rung : rungs) {
            st.append(translator.translate(rung));
        }
        return st.toString().trim();
    }
}
