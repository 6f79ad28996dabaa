package dev.nodalis.backend;

import com.google.common.collect.ImmutableList;
import dev.nodalis.backend.cpp.CppBackend;
import dev.nodalis.backend.cpp.GenericCppBackend;
import dev.nodalis.backend.js.JavaScriptBackend;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered set of backends. Selection returns the first backend, in
 * registration order, whose descriptor supports the requested triple.
 */
public final class BackendRegistry {

    private static final Logger logger = LogManager.getLogger(BackendRegistry.class);

    private final ImmutableList<Backend> backends;

    private BackendRegistry(List<Backend> backends) {
        this.backends = ImmutableList.copyOf(backends);
    }

    public static BackendRegistry of(Backend... backends) {
        return new BackendRegistry(ImmutableList.copyOf(backends));
    }

    public static BackendRegistry of(List<Backend> backends) {
        return new BackendRegistry(backends);
    }

    /**
     * The backends shipped with the compiler.
     */
    public static BackendRegistry standard() {
        return of(new CppBackend(), new GenericCppBackend(), new JavaScriptBackend());
    }

    public ImmutableList<Backend> getBackends() {
        return backends;
    }

    public Backend select(String device, OutputKind outputKind, SourceLanguage language)
            throws NoCompilerFoundException {
        Objects.requireNonNull(device, "device");
        Objects.requireNonNull(outputKind, "outputKind");
        Objects.requireNonNull(language, "language");
        for (Backend backend : backends) {
            if (backend.descriptor().supports(device, outputKind, language)) {
                logger.info("Selected backend {} for {}/{}/{}", backend.getName(), device, outputKind, language);
                return backend;
            }
        }
        throw new NoCompilerFoundException(device, outputKind, language);
    }

    public ImmutableList<BackendDescriptor> describe() {
        ImmutableList.Builder<BackendDescriptor> descriptors = ImmutableList.builder();
        for (Backend backend : backends) {
            descriptors.add(backend.descriptor());
        }
        return descriptors.build();
    }
}
