package dev.nodalis.st.ast;

import java.util.Locale;

public enum VariableSection {
    VAR,
    VAR_INPUT,
    VAR_OUTPUT,
    VAR_IN_OUT,
    VAR_TEMP,
    VAR_EXTERNAL,
    VAR_GLOBAL;

    public static VariableSection fromKeyword(String keyword) {
        return valueOf(keyword.toUpperCase(Locale.ROOT));
    }
}
