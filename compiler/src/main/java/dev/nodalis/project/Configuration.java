package dev.nodalis.project;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class Configuration {

    private final String name;
    private final ImmutableList<Resource> resources;

    public Configuration(String name, List<Resource> resources) {
        this.name = Objects.requireNonNull(name, "name");
        this.resources = ImmutableList.copyOf(resources);
    }

    public String getName() {
        return name;
    }

    public ImmutableList<Resource> getResources() {
        return resources;
    }

    public Optional<Resource> findResource(String resourceName) {
        return resources.stream().filter(r -> r.getName().equals(resourceName)).findFirst();
    }
}
