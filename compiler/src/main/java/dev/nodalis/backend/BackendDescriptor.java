package dev.nodalis.backend;

import com.google.common.collect.ImmutableSet;

import java.util.Objects;
import java.util.Set;

/**
 * Static capabilities of a backend. Dispatch is an exact membership test on
 * device, output kind and source language.
 */
public final class BackendDescriptor {

    private final String name;
    private final ImmutableSet<SourceLanguage> languages;
    private final ImmutableSet<OutputKind> outputKinds;
    private final ImmutableSet<String> devices;
    private final ImmutableSet<Protocol> protocols;
    private final String version;

    public BackendDescriptor(String name,
                             Set<SourceLanguage> languages,
                             Set<OutputKind> outputKinds,
                             Set<String> devices,
                             Set<Protocol> protocols,
                             String version) {
        this.name = Objects.requireNonNull(name, "name");
        this.languages = ImmutableSet.copyOf(languages);
        this.outputKinds = ImmutableSet.copyOf(outputKinds);
        this.devices = ImmutableSet.copyOf(devices);
        this.protocols = ImmutableSet.copyOf(protocols);
        this.version = Objects.requireNonNull(version, "version");
    }

    public String getName() {
        return name;
    }

    public ImmutableSet<SourceLanguage> getLanguages() {
        return languages;
    }

    public ImmutableSet<OutputKind> getOutputKinds() {
        return outputKinds;
    }

    public ImmutableSet<String> getDevices() {
        return devices;
    }

    public ImmutableSet<Protocol> getProtocols() {
        return protocols;
    }

    public String getVersion() {
        return version;
    }

    public boolean supports(String device, OutputKind outputKind, SourceLanguage language) {
        return devices.contains(device) && outputKinds.contains(outputKind) && languages.contains(language);
    }

    @Override
    public String toString() {
        return name + " " + version
                + " devices=" + String.join(",", devices)
                + " outputs=" + OutputKind.describe(outputKinds)
                + " languages=" + languages
                + " protocols=" + protocols;
    }
}
