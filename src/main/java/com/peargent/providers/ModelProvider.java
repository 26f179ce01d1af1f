package com.peargent.providers;

import java.util.Iterator;
import java.util.List;

/**
 * Opaque text-generation backend. Implementations may block and may be remote;
 * failures surface as {@link com.peargent.shared.error.ModelException}.
 */
@FunctionalInterface
public interface ModelProvider {

    String generate(String prompt, GenerateOptions options);

    default String id() {
        return getClass().getSimpleName();
    }

    /** Incremental variant; the default yields the whole reply as one chunk. */
    default Iterator<String> generateStream(String prompt, GenerateOptions options) {
        return List.of(generate(prompt, options)).iterator();
    }
}
