package dev.nodalis.backend;

import com.google.common.collect.ImmutableSet;

import java.util.Locale;

/**
 * The IEC 61131-3 elementary data types. A declared type outside this set is
 * taken to be a function block.
 */
public final class ElementaryTypes {

    private static final ImmutableSet<String> ELEMENTARY = ImmutableSet.of(
            "BOOL", "BYTE", "WORD", "DWORD", "LWORD",
            "SINT", "INT", "DINT", "LINT",
            "USINT", "UINT", "UDINT", "ULINT",
            "REAL", "LREAL",
            "TIME", "LTIME", "DATE", "TIME_OF_DAY", "TOD", "DATE_AND_TIME", "DT",
            "STRING", "WSTRING");

    private ElementaryTypes() {
    }

    /**
     * Upper-cased type name without a {@code [n]} length suffix.
     */
    public static String baseName(String typeName) {
        String name = typeName.trim();
        int bracket = name.indexOf('[');
        if (bracket >= 0) {
            name = name.substring(0, bracket).trim();
        }
        return name.toUpperCase(Locale.ROOT);
    }

    public static boolean isElementary(String typeName) {
        return ELEMENTARY.contains(baseName(typeName));
    }
}
