package org.starledger.timeline.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starledger.parser.model.MapValue;
import org.starledger.timeline.api.ExtractionSettings;
import org.starledger.timeline.api.ITimelineProcessor;
import org.starledger.timeline.api.ProcessingContext;
import org.starledger.timeline.api.ProcessorOutputs;
import org.starledger.timeline.api.SnapshotInfo;
import org.starledger.timeline.store.ITimelineTransaction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Ordered registry of processors, run once per snapshot inside one transaction.
 * <p>
 * The execution order is the registration order, which must respect the dependency graph: a processor can
 * only be registered after all of its dependencies. Per snapshot, a processor whose dependencies did not all
 * complete is skipped, and its own dependents are skipped in turn. If any processor throws, the transaction
 * is rolled back and nothing of the snapshot is kept.
 * <p>
 * Registration is not thread-safe; {@link #run} may be called concurrently for different series once
 * registration is complete.
 */
public class TimelinePipeline {

    private static final Logger log = LoggerFactory.getLogger(TimelinePipeline.class);

    /**
     * States of one pipeline run.
     */
    public enum State {
        IDLE,
        RUNNING,
        COMMITTED,
        ROLLED_BACK
    }

    /**
     * Outcome of processing one snapshot.
     *
     * @param state     {@link State#COMMITTED} or {@link State#ROLLED_BACK}.
     * @param completed Ids of processors that completed, in execution order.
     * @param skipped   Ids of processors skipped for missing dependencies.
     * @param failure   The exception that caused the rollback, {@code null} if committed.
     */
    public record Run(State state, List<String> completed, List<String> skipped, RuntimeException failure) {
        public boolean isCommitted() {
            return state == State.COMMITTED;
        }
    }

    private final List<ITimelineProcessor<?>> processors = new ArrayList<>();
    private final Set<String> registeredIds = new HashSet<>();

    /**
     * Appends a processor to the execution order.
     *
     * @param processor The processor.
     * @return This pipeline.
     * @throws IllegalArgumentException if the id is taken or a dependency is not registered yet.
     */
    public TimelinePipeline register(ITimelineProcessor<?> processor) {
        if (registeredIds.contains(processor.id())) {
            throw new IllegalArgumentException("Processor id '" + processor.id() + "' is already registered");
        }
        Set<String> unknown = new TreeSet<>(processor.dependencies());
        unknown.removeAll(registeredIds);
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Processor '" + processor.id()
                    + "' depends on processors that are not registered before it: " + unknown);
        }
        processors.add(processor);
        registeredIds.add(processor.id());
        return this;
    }

    public List<String> processorIds() {
        List<String> ids = new ArrayList<>(processors.size());
        processors.forEach(p -> ids.add(p.id()));
        return Collections.unmodifiableList(ids);
    }

    /**
     * Runs all processors for one snapshot and ends the transaction.
     *
     * @param gamestate   The parsed snapshot.
     * @param snapshot    Identification of the snapshot.
     * @param transaction The open transaction; committed on success, rolled back on failure.
     * @param settings    Extraction settings.
     * @return The outcome.
     */
    public Run run(MapValue gamestate, SnapshotInfo snapshot, ITimelineTransaction transaction,
                   ExtractionSettings settings) {
        ProcessorOutputs outputs = new ProcessorOutputs();
        ProcessingContext base = new ProcessingContext(gamestate, snapshot, transaction, outputs, settings);
        List<String> completed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        State state = State.RUNNING;
        log.debug("{} {} -> {}", snapshot.logPrefix(), State.IDLE, state);

        try {
            for (ITimelineProcessor<?> processor : processors) {
                Set<String> missing = new TreeSet<>(processor.dependencies());
                missing.removeAll(outputs.completed());
                if (!missing.isEmpty()) {
                    log.warn("{} Could not process {} due to missing dependencies {}",
                            snapshot.logPrefix(), processor.id(), String.join(", ", missing));
                    skipped.add(processor.id());
                    continue;
                }
                long start = System.nanoTime();
                Object output = processor.process(base.withOutputs(outputs.viewFor(processor.id(), processor.dependencies())));
                outputs.put(processor.id(), output);
                completed.add(processor.id());
                log.debug("{} Processed {} in {} ms", snapshot.logPrefix(), processor.id(),
                        (System.nanoTime() - start) / 1_000_000);
            }
            transaction.commit();
            log.debug("{} {} -> {}", snapshot.logPrefix(), state, State.COMMITTED);
            return new Run(State.COMMITTED, List.copyOf(completed), List.copyOf(skipped), null);
        } catch (RuntimeException e) {
            if (transaction.isActive()) {
                try {
                    transaction.rollback();
                } catch (RuntimeException rollbackEx) {
                    e.addSuppressed(rollbackEx);
                }
            }
            log.debug("{} {} -> {}", snapshot.logPrefix(), state, State.ROLLED_BACK);
            return new Run(State.ROLLED_BACK, List.copyOf(completed), List.copyOf(skipped), e);
        }
    }
}
