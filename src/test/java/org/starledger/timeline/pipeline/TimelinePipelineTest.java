package org.starledger.timeline.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.starledger.parser.model.MapValue;
import org.starledger.timeline.api.ExtractionSettings;
import org.starledger.timeline.api.ITimelineProcessor;
import org.starledger.timeline.api.MissingDependencyException;
import org.starledger.timeline.api.ProcessingContext;
import org.starledger.timeline.api.SnapshotInfo;
import org.starledger.timeline.store.ITimelineTransaction;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TimelinePipelineTest {

    @Mock
    private ITimelineTransaction transaction;

    private final SnapshotInfo snapshot = new SnapshotInfo("test", 30, "2200.02.01", 0L, Set.of());
    private final List<String> executed = new ArrayList<>();

    @BeforeEach
    void setUp() {
        when(transaction.isActive()).thenReturn(true);
        when(transaction.day()).thenReturn(30);
    }

    private ITimelineProcessor<Object> processor(String id, Set<String> dependencies,
                                                 Function<ProcessingContext, Object> body) {
        return new ITimelineProcessor<>() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public Set<String> dependencies() {
                return dependencies;
            }

            @Override
            public Object process(ProcessingContext context) {
                executed.add(id);
                return body.apply(context);
            }
        };
    }

    private TimelinePipeline.Run run(TimelinePipeline pipeline) {
        return pipeline.run(MapValue.EMPTY, snapshot, transaction, ExtractionSettings.defaults());
    }

    @Test
    @DisplayName("Processors run in registration order and see their dependencies' outputs")
    void runsInOrderAndPassesOutputs() {
        TimelinePipeline pipeline = new TimelinePipeline()
                .register(processor("a", Set.of(), ctx -> "from-a"))
                .register(processor("b", Set.of("a"), ctx -> ctx.output("a", String.class) + "+b"))
                .register(processor("c", Set.of("a", "b"), ctx -> {
                    assertThat(ctx.output("b", String.class)).isEqualTo("from-a+b");
                    assertThat(ctx.day()).isEqualTo(30);
                    return null;
                }));

        TimelinePipeline.Run result = run(pipeline);

        assertThat(result.isCommitted()).isTrue();
        assertThat(result.completed()).containsExactly("a", "b", "c");
        assertThat(result.skipped()).isEmpty();
        assertThat(executed).containsExactly("a", "b", "c");
        verify(transaction).commit();
        verify(transaction, never()).rollback();
    }

    @Test
    void rejectsDuplicateIds() {
        TimelinePipeline pipeline = new TimelinePipeline().register(processor("a", Set.of(), ctx -> null));

        assertThatThrownBy(() -> pipeline.register(processor("a", Set.of(), ctx -> null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already registered");
    }

    @Test
    void rejectsDependenciesRegisteredLater() {
        TimelinePipeline pipeline = new TimelinePipeline();

        assertThatThrownBy(() -> pipeline.register(processor("b", Set.of("a"), ctx -> null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("[a]");
        assertThat(pipeline.processorIds()).isEmpty();
    }

    @Test
    @DisplayName("A failing processor rolls back the whole snapshot")
    void failureRollsBack() {
        TimelinePipeline pipeline = new TimelinePipeline()
                .register(processor("a", Set.of(), ctx -> "ok"))
                .register(processor("b", Set.of("a"), ctx -> {
                    throw new IllegalStateException("boom");
                }))
                .register(processor("c", Set.of(), ctx -> null));

        TimelinePipeline.Run result = run(pipeline);

        assertThat(result.state()).isEqualTo(TimelinePipeline.State.ROLLED_BACK);
        assertThat(result.failure()).hasMessage("boom");
        assertThat(result.completed()).containsExactly("a");
        assertThat(executed).containsExactly("a", "b");
        verify(transaction).rollback();
        verify(transaction, never()).commit();
    }

    @Test
    @DisplayName("Reading an undeclared output is a processor failure")
    void undeclaredDependencyFails() {
        TimelinePipeline pipeline = new TimelinePipeline()
                .register(processor("a", Set.of(), ctx -> "secret"))
                .register(processor("b", Set.of(), ctx -> ctx.output("a", String.class)));

        TimelinePipeline.Run result = run(pipeline);

        assertThat(result.isCommitted()).isFalse();
        assertThat(result.failure()).isInstanceOf(MissingDependencyException.class);
        assertThat(((MissingDependencyException) result.failure()).getDependencyId()).isEqualTo("a");
    }

    @Test
    @DisplayName("A failing commit is reported and rolled back")
    void commitFailure() {
        doThrow(new IllegalStateException("disk full")).when(transaction).commit();
        TimelinePipeline pipeline = new TimelinePipeline().register(processor("a", Set.of(), ctx -> null));

        TimelinePipeline.Run result = run(pipeline);

        assertThat(result.state()).isEqualTo(TimelinePipeline.State.ROLLED_BACK);
        assertThat(result.failure()).hasMessage("disk full");
        verify(transaction).rollback();
    }
}
