package io.github.cyfko.eligian.core.config;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Engine operations accepted by {@code op NAME { ... }} statements.
 * <p>
 * A registry is immutable and is passed to the compiler when it is built.
 * </p>
 *
 * <h2>Presets</h2>
 * <pre>{@code
 * // Operations of the Eligius engine
 * OperationRegistry registry = OperationRegistry.eligius();
 *
 * // Eligius plus project-specific operations
 * OperationRegistry registry = OperationRegistry.builder()
 *     .from(OperationRegistry.eligius())
 *     .operation("playSound", "src")
 *     .build();
 * }</pre>
 *
 * @param operations signatures indexed by system name
 * @author Frank KOSSI
 * @since 0.0.1
 */
public record OperationRegistry(Map<String, OperationSignature> operations) {

    public OperationRegistry {
        if (operations == null) {
            throw new IllegalArgumentException("operations is required");
        }
        for (Map.Entry<String, OperationSignature> entry : operations.entrySet()) {
            if (entry.getValue() == null || !entry.getValue().systemName().equals(entry.getKey())) {
                throw new IllegalArgumentException("Operation key '" + entry.getKey() + "' does not match its signature");
            }
        }
        operations = Map.copyOf(operations);
    }

    /**
     * @return the operations of the Eligius engine this compiler targets
     */
    public static OperationRegistry eligius() {
        return builder()
                .operation("showElement", "selector")
                .operation("hideElement", "selector")
                .operation("animateElement", "selector")
                .operation("triggerAction", "actionName")
                .operation("requestAction", "systemName")
                .operation("startAction")
                .operation("endAction")
                .operation("selectElement", "selector")
                .operation("addClass", "className")
                .operation("removeClass", "className")
                .operation("toggleClass", "className")
                .operation("setElementContent", "template")
                .operation("setElementAttributes", "attributes")
                .operation("setStyle", "properties")
                .operation("createElement", "elementName")
                .operation("removeElement")
                .operation("setData", "properties")
                .operation("setOperationData", "properties")
                .operation("clearOperationData")
                .operation("broadcastEvent", "eventName")
                .operation("getControllerInstance", "systemName")
                .operation("addControllerToElement")
                .operation("removeControllerFromElement", "controllerName")
                .operation("loadJson", "url")
                .operation("wait", "milliseconds")
                .operation("log")
                .operation("when", "expression")
                .operation("otherwise")
                .operation("endWhen")
                .operation("forEach", "collection")
                .operation("endForEach")
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<OperationSignature> find(String systemName) {
        return Optional.ofNullable(systemName).map(operations::get);
    }

    /**
     * Closest known names by edit distance, ignoring case; ties are broken alphabetically.
     *
     * @param systemName an unknown operation name
     * @param limit      maximum number of suggestions
     */
    public List<String> suggest(String systemName, int limit) {
        String target = systemName == null ? "" : systemName.toLowerCase();
        return operations.keySet().stream()
                .sorted(Comparator.<String>comparingInt(name -> editDistance(target, name.toLowerCase()))
                        .thenComparing(Comparator.naturalOrder()))
                .limit(Math.max(0, limit))
                .toList();
    }

    static int editDistance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int substitution = previous[j - 1] + (a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1);
                current[j] = Math.min(substitution, Math.min(previous[j] + 1, current[j - 1] + 1));
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    /**
     * Builder for {@link OperationRegistry}.
     */
    public static final class Builder {
        private final Map<String, OperationSignature> operations = new LinkedHashMap<>();

        private Builder() {}

        public Builder from(OperationRegistry registry) {
            operations.putAll(registry.operations());
            return this;
        }

        public Builder operation(String systemName, String... requiredKeys) {
            return operation(OperationSignature.of(systemName, requiredKeys));
        }

        public Builder operation(OperationSignature signature) {
            operations.put(signature.systemName(), signature);
            return this;
        }

        public OperationRegistry build() {
            return new OperationRegistry(operations);
        }
    }
}
