package org.starledger.timeline.api;

import java.util.Set;

/**
 * One extraction unit of the timeline pipeline.
 * <p>
 * A processor reads the snapshot and the outputs of its declared dependencies, writes entities, events or
 * point records through the transaction, and returns an output for downstream processors. Implementations
 * keep no state between snapshots: everything that must survive a snapshot lives in the store.
 *
 * @param <O> The output type, {@link Void} for processors nobody depends on.
 */
public interface ITimelineProcessor<O> {

    /**
     * @return The unique id other processors use to declare a dependency.
     */
    String id();

    /**
     * @return Ids of processors whose output this processor reads.
     */
    default Set<String> dependencies() {
        return Set.of();
    }

    /**
     * Processes one snapshot.
     *
     * @param context The snapshot, dependency outputs and the open transaction.
     * @return The output, or {@code null} for {@link Void} processors.
     */
    O process(ProcessingContext context);
}
