package org.starledger.timeline.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Outputs of the processors that completed for the current snapshot.
 * <p>
 * The pipeline owns the writable instance; each processor receives a read-only view restricted to its
 * declared dependencies.
 */
public final class ProcessorOutputs {

    private final Map<String, Optional<Object>> outputs;
    private final String viewer;
    private final Set<String> visible;

    public ProcessorOutputs() {
        this(new LinkedHashMap<>(), null, null);
    }

    private ProcessorOutputs(Map<String, Optional<Object>> outputs, String viewer, Set<String> visible) {
        this.outputs = outputs;
        this.viewer = viewer;
        this.visible = visible;
    }

    /**
     * Records the output of a completed processor.
     *
     * @param id     The processor id.
     * @param output The output, possibly {@code null}.
     */
    public void put(String id, Object output) {
        if (viewer != null) {
            throw new UnsupportedOperationException("Outputs view of '" + viewer + "' is read-only");
        }
        outputs.put(id, Optional.ofNullable(output));
    }

    /**
     * @param id A processor id.
     * @return Whether the processor completed for this snapshot and is visible from this view.
     */
    public boolean has(String id) {
        return (visible == null || visible.contains(id)) && outputs.containsKey(id);
    }

    /**
     * Returns the output of a dependency.
     *
     * @param id   The dependency id.
     * @param type The expected output type.
     * @param <T>  The output type.
     * @return The output.
     * @throws MissingDependencyException if the dependency is undeclared, has not run or produced no output.
     */
    public <T> T get(String id, Class<T> type) {
        if (!has(id)) {
            throw new MissingDependencyException(viewer == null ? "pipeline" : viewer, id);
        }
        Object output = outputs.get(id).orElseThrow(
                () -> new MissingDependencyException(viewer == null ? "pipeline" : viewer, id));
        if (!type.isInstance(output)) {
            throw new IllegalStateException("Output of '" + id + "' is a " + output.getClass().getSimpleName()
                    + ", not a " + type.getSimpleName());
        }
        return type.cast(output);
    }

    /**
     * Creates the view a processor sees.
     *
     * @param processorId  The processor receiving the view.
     * @param dependencies Its declared dependencies.
     * @return A read-only view limited to {@code dependencies}.
     */
    public ProcessorOutputs viewFor(String processorId, Set<String> dependencies) {
        return new ProcessorOutputs(outputs, processorId, Set.copyOf(dependencies));
    }

    public Set<String> completed() {
        return Collections.unmodifiableSet(outputs.keySet());
    }
}
