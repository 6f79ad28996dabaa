package dev.nodalis.project;

import com.google.common.collect.ImmutableList;

import java.util.List;

public final class MappingTable {

    private static final MappingTable EMPTY = new MappingTable(List.of());

    private final ImmutableList<MappingEntry> entries;

    public MappingTable(List<MappingEntry> entries) {
        this.entries = ImmutableList.copyOf(entries);
    }

    public static MappingTable empty() {
        return EMPTY;
    }

    public ImmutableList<MappingEntry> getEntries() {
        return entries;
    }

    public ImmutableList<MappingEntry> entriesFor(String resourceName) {
        return entries.stream()
                .filter(e -> e.getResource().equals(resourceName))
                .collect(ImmutableList.toImmutableList());
    }
}
