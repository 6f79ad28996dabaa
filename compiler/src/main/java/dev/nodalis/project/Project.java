package dev.nodalis.project;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed IEC 61131-10 project file.
 */
public final class Project {

    private final ImmutableList<Configuration> configurations;
    private final ProjectTypes types;
    private final MappingTable mappingTable;

    public Project(List<Configuration> configurations, ProjectTypes types, MappingTable mappingTable) {
        if (configurations.isEmpty()) {
            throw new IllegalArgumentException("a project has at least one configuration");
        }
        this.configurations = ImmutableList.copyOf(configurations);
        this.types = Objects.requireNonNull(types, "types");
        this.mappingTable = Objects.requireNonNull(mappingTable, "mappingTable");
    }

    public ImmutableList<Configuration> getConfigurations() {
        return configurations;
    }

    public ProjectTypes getTypes() {
        return types;
    }

    public MappingTable getMappingTable() {
        return mappingTable;
    }

    /**
     * First resource with the given name, searching configurations in
     * document order.
     */
    public Optional<Resource> findResource(String resourceName) {
        Objects.requireNonNull(resourceName, "resourceName");
        for (Configuration configuration : configurations) {
            Optional<Resource> resource = configuration.findResource(resourceName);
            if (resource.isPresent()) {
                return resource;
            }
        }
        return Optional.empty();
    }

    public Resource requireResource(String resourceName) throws ResourceNotFoundException {
        return findResource(resourceName).orElseThrow(() -> new ResourceNotFoundException(resourceName));
    }
}
