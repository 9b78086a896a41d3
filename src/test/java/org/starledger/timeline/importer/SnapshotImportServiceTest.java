package org.starledger.timeline.importer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.starledger.parser.io.SaveFileScanner.SaveFile;
import org.starledger.parser.model.MapValue;
import org.starledger.timeline.pipeline.ImportResult;
import org.starledger.timeline.pipeline.TimelineExtractor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

@Tag("integration")
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SnapshotImportServiceTest {

    @TempDir
    Path saveDir;

    @Mock
    private TimelineExtractor extractor;

    @BeforeEach
    void setUp() {
        when(extractor.importSnapshot(anyString(), any(MapValue.class))).thenAnswer(invocation -> {
            MapValue gamestate = invocation.getArgument(1);
            int day = (int) gamestate.longValue("day").orElse(-1);
            return new ImportResult(invocation.getArgument(0), day, ImportResult.Status.COMMITTED, null);
        });
    }

    private List<SaveFile> saves(int count) throws IOException {
        List<SaveFile> files = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Path file = saveDir.resolve(String.format("2200.%02d.01.sav", i + 1));
            Files.writeString(file, "day=" + i + "\nfiller={ " + "x ".repeat(50 * (count - i)) + "}\n",
                    StandardCharsets.UTF_8);
            files.add(new SaveFile(file, "series"));
        }
        return files;
    }

    private SaveFile broken(String name) throws IOException {
        Path file = saveDir.resolve(name);
        Files.writeString(file, "a = { b = 1", StandardCharsets.UTF_8);
        return new SaveFile(file, "series");
    }

    @Test
    void importsInFileOrderWithParallelParsing() throws IOException {
        SnapshotImportService service = new SnapshotImportService(extractor, 3, 100, false);

        SnapshotImportService.Summary summary = service.importFiles(saves(8));

        assertThat(summary.results()).extracting(ImportResult::day).containsExactly(0, 1, 2, 3, 4, 5, 6, 7);
        assertThat(summary.count(ImportResult.Status.COMMITTED)).isEqualTo(8);
        assertThat(summary.aborted()).isFalse();
        assertThat(summary.cancelled()).isFalse();
        assertThat(service.importedCount()).isEqualTo(8);
    }

    @Test
    void parseFailuresAreReportedAndSkipped() throws IOException {
        List<SaveFile> files = new ArrayList<>(saves(2));
        files.add(1, broken("broken.sav"));
        SnapshotImportService service = new SnapshotImportService(extractor, 2, 100, false);

        SnapshotImportService.Summary summary = service.importFiles(files);

        assertThat(summary.results()).extracting(ImportResult::status).containsExactly(
                ImportResult.Status.COMMITTED, ImportResult.Status.FAILED, ImportResult.Status.COMMITTED);
        assertThat(summary.hasFailures()).isTrue();
        assertThat(summary.results().get(1).cause()).hasMessageContaining("Line");
    }

    @Test
    void debugModeAbortsOnFirstFailure() throws IOException {
        List<SaveFile> files = new ArrayList<>(saves(3));
        files.add(0, broken("broken.sav"));
        SnapshotImportService service = new SnapshotImportService(extractor, 1, 100, true);

        SnapshotImportService.Summary summary = service.importFiles(files);

        assertThat(summary.aborted()).isTrue();
        assertThat(summary.results()).hasSize(1);
        verify(extractor, never()).importSnapshot(anyString(), any(MapValue.class));
    }

    @Test
    void cancelStopsBeforeTheNextSnapshot() throws IOException {
        SnapshotImportService service = new SnapshotImportService(extractor, 1, 100, false);
        doAnswer(invocation -> {
            service.cancel();
            return new ImportResult(invocation.getArgument(0), 0, ImportResult.Status.COMMITTED, null);
        }).when(extractor).importSnapshot(anyString(), any(MapValue.class));

        SnapshotImportService.Summary summary = service.importFiles(saves(4));

        assertThat(summary.cancelled()).isTrue();
        assertThat(summary.results()).hasSize(1);
    }

    @Test
    void importRunsToCompletionInBackground() throws IOException {
        SnapshotImportService service = new SnapshotImportService(extractor, 2, 100, false);
        List<SaveFile> files = saves(5);

        CompletableFuture<SnapshotImportService.Summary> future =
                CompletableFuture.supplyAsync(() -> service.importFiles(files));

        await().atMost(Duration.ofSeconds(10)).until(future::isDone);
        assertThat(future.join().results()).hasSize(5);
        assertThat(service.importedCount()).isEqualTo(5);
    }

    @Test
    void emptyListAndInvalidThreadCount() {
        assertThat(new SnapshotImportService(extractor, 1, 100, false).importFiles(List.of()).results()).isEmpty();
        assertThatThrownBy(() -> new SnapshotImportService(extractor, 0, 100, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
