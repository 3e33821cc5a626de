package org.flutterjs.analyzer.scheduler;

import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.frontend.module.DependencyGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.flutterjs.analyzer.testutils.DartFixtures.file;

/**
 * Tests batch construction of the {@link BatchScheduler}.
 */
@Tag("unit")
class BatchSchedulerTest {

    private final FileIdentity base = file("base.dart");
    private final FileIdentity left = file("left.dart");
    private final FileIdentity right = file("right.dart");
    private final FileIdentity top = file("top.dart");

    private DependencyGraph diamond;

    @BeforeEach
    void setUp() {
        diamond = new DependencyGraph();
        diamond.addEdge(left, base);
        diamond.addEdge(right, base);
        diamond.addEdge(top, left);
        diamond.addEdge(top, right);
    }

    /**
     * A file never shares a batch with one of its dependencies, and independent files do.
     */
    @Test
    void batchesRespectDependencies() {
        // Act
        List<List<FileIdentity>> batches = BatchScheduler.schedule(diamond.topologicalSort(),
                Set.of(base, left, right, top), diamond, 4);

        // Assert
        assertThat(batches).containsExactly(List.of(base), List.of(left, right), List.of(top));
        Set<FileIdentity> done = new HashSet<>();
        for (List<FileIdentity> batch : batches) {
            for (FileIdentity file : batch) {
                assertThat(diamond.dependenciesOf(file)).allMatch(done::contains);
            }
            done.addAll(batch);
        }
    }

    /**
     * No batch exceeds the parallelism limit.
     */
    @Test
    void batchSizeIsCapped() {
        // Arrange
        DependencyGraph flat = new DependencyGraph();
        List<FileIdentity> files = List.of(file("1.dart"), file("2.dart"), file("3.dart"), file("4.dart"),
                file("5.dart"));
        files.forEach(flat::addNode);

        // Act
        List<List<FileIdentity>> batches = BatchScheduler.schedule(flat.topologicalSort(), Set.copyOf(files), flat, 2);

        // Assert
        assertThat(batches).hasSize(3).allSatisfy(batch -> assertThat(batch).hasSizeLessThanOrEqualTo(2));
        assertThat(batches.stream().flatMap(List::stream).collect(Collectors.toList()))
                .containsExactlyInAnyOrderElementsOf(files);
    }

    /**
     * Clean dependencies do not hold back dirty files.
     */
    @Test
    void cleanFilesCountAsSatisfied() {
        // Act
        List<List<FileIdentity>> batches = BatchScheduler.schedule(diamond.topologicalSort(), Set.of(left, top),
                diamond, 4);

        // Assert
        assertThat(batches).containsExactly(List.of(left), List.of(top));
    }

    @Test
    void nothingDirtyMeansNoBatches() {
        assertThat(BatchScheduler.schedule(diamond.topologicalSort(), Set.of(), diamond, 4)).isEmpty();
    }

    /**
     * Dirty files whose dependencies form a cycle cannot be scheduled.
     */
    @Test
    void cycleAmongDirtyFilesIsRejected() {
        // Arrange
        DependencyGraph cyclic = new DependencyGraph();
        cyclic.addEdge(left, right);
        cyclic.addEdge(right, left);

        // Act & Assert
        assertThatThrownBy(() -> BatchScheduler.schedule(List.of(left, right), Set.of(left, right), cyclic, 2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    void rejectsParallelismBelowOne() {
        assertThatThrownBy(() -> BatchScheduler.schedule(List.of(base), Set.of(base), diamond, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
