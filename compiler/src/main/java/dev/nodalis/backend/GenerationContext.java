package dev.nodalis.backend;

import java.util.Objects;

/**
 * Per-request parameters handed to a backend.
 */
public final class GenerationContext {

    private final String device;
    private final OutputKind outputKind;
    private final String plcName;
    private final String baseName;
    private final long tickDelayMillis;
    private final long fallbackIntervalMillis;

    public GenerationContext(String device,
                             OutputKind outputKind,
                             String plcName,
                             String baseName,
                             long tickDelayMillis,
                             long fallbackIntervalMillis) {
        this.device = Objects.requireNonNull(device, "device");
        this.outputKind = Objects.requireNonNull(outputKind, "outputKind");
        this.plcName = Objects.requireNonNull(plcName, "plcName");
        this.baseName = Objects.requireNonNull(baseName, "baseName");
        if (tickDelayMillis < 0 || fallbackIntervalMillis <= 0) {
            throw new IllegalArgumentException("invalid scheduler timing: tick delay " + tickDelayMillis
                    + "ms, fallback interval " + fallbackIntervalMillis + "ms");
        }
        this.tickDelayMillis = tickDelayMillis;
        this.fallbackIntervalMillis = fallbackIntervalMillis;
    }

    public String getDevice() {
        return device;
    }

    public OutputKind getOutputKind() {
        return outputKind;
    }

    /**
     * Name the runtime reports itself under; the resource name for project
     * inputs.
     */
    public String getPlcName() {
        return plcName;
    }

    /**
     * File name stem for generated artifacts.
     */
    public String getBaseName() {
        return baseName;
    }

    public long getTickDelayMillis() {
        return tickDelayMillis;
    }

    public long getFallbackIntervalMillis() {
        return fallbackIntervalMillis;
    }
}
