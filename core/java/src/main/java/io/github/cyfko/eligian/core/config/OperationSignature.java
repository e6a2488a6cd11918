package io.github.cyfko.eligian.core.config;

import java.util.Collection;
import java.util.List;

/**
 * Name and required operation data keys of an engine operation.
 *
 * @param systemName   operation name understood by the engine
 * @param requiredKeys operation data keys that must be present
 * @author Frank KOSSI
 * @since 0.0.1
 */
public record OperationSignature(String systemName, List<String> requiredKeys) {

    public OperationSignature {
        if (systemName == null || systemName.isBlank()) {
            throw new IllegalArgumentException("systemName is required");
        }
        requiredKeys = requiredKeys == null ? List.of() : List.copyOf(requiredKeys);
    }

    public static OperationSignature of(String systemName, String... requiredKeys) {
        return new OperationSignature(systemName, List.of(requiredKeys));
    }

    /**
     * @param keys the keys supplied to the operation
     * @return the required keys absent from {@code keys}, in declaration order
     */
    public List<String> missingKeys(Collection<String> keys) {
        return requiredKeys.stream().filter(key -> !keys.contains(key)).toList();
    }
}
