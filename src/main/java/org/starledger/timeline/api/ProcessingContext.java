package org.starledger.timeline.api;

import org.starledger.parser.model.MapValue;
import org.starledger.timeline.store.ITimelineTransaction;

import java.util.Objects;

/**
 * Everything a processor may use while processing one snapshot.
 *
 * @param gamestate   The parsed snapshot.
 * @param snapshot    Identification of the snapshot.
 * @param transaction The snapshot's write transaction.
 * @param outputs     Outputs of the processor's declared dependencies.
 * @param settings    Extraction settings.
 */
public record ProcessingContext(MapValue gamestate, SnapshotInfo snapshot, ITimelineTransaction transaction,
                                ProcessorOutputs outputs, ExtractionSettings settings) {

    public ProcessingContext {
        Objects.requireNonNull(gamestate, "gamestate");
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(transaction, "transaction");
        Objects.requireNonNull(outputs, "outputs");
        Objects.requireNonNull(settings, "settings");
    }

    public int day() {
        return snapshot.day();
    }

    /**
     * Shorthand for {@link ProcessorOutputs#get(String, Class)}.
     */
    public <T> T output(String id, Class<T> type) {
        return outputs.get(id, type);
    }

    public ProcessingContext withOutputs(ProcessorOutputs view) {
        return new ProcessingContext(gamestate, snapshot, transaction, view, settings);
    }
}
