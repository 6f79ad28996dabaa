package dev.nodalis.st.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * A CASE selector label: a single value or an inclusive {@code low..high}
 * range. Bounds keep their source lexeme.
 */
public final class CaseLabel {

    private final String low;
    private final String high;

    public CaseLabel(String low, String high) {
        this.low = Objects.requireNonNull(low, "low");
        this.high = high;
    }

    public String getLow() {
        return low;
    }

    public Optional<String> getHigh() {
        return Optional.ofNullable(high);
    }

    public boolean isRange() {
        return high != null;
    }
}
