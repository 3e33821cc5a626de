package org.flutterjs.analyzer.frontend.module;

import org.flutterjs.analyzer.api.FileIdentity;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.flutterjs.analyzer.testutils.DartFixtures.file;

/**
 * Tests ordering, cycle handling and reachability queries of the {@link DependencyGraph}.
 */
@Tag("unit")
class DependencyGraphTest {

    private final FileIdentity a = file("a.dart");
    private final FileIdentity b = file("b.dart");
    private final FileIdentity c = file("c.dart");
    private final FileIdentity d = file("d.dart");

    /**
     * Every imported file must precede its importer in the topological order.
     */
    @Test
    void topologicalSortPlacesDependenciesFirst() {
        // Arrange
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge(d, b);
        graph.addEdge(d, c);
        graph.addEdge(b, a);
        graph.addEdge(c, a);

        // Act
        List<FileIdentity> order = graph.topologicalSort();

        // Assert
        assertThat(order).containsExactly(a, b, c, d);
        for (FileIdentity from : graph.nodes()) {
            for (FileIdentity to : graph.dependenciesOf(from)) {
                assertThat(order.indexOf(to)).isLessThan(order.indexOf(from));
            }
        }
    }

    /**
     * The order must not depend on the order in which edges were added.
     */
    @Test
    void topologicalSortIsDeterministic() {
        // Arrange
        DependencyGraph first = new DependencyGraph();
        first.addEdge(c, a);
        first.addEdge(b, a);
        first.addNode(d);
        DependencyGraph second = new DependencyGraph();
        second.addNode(d);
        second.addEdge(b, a);
        second.addEdge(c, a);

        // Act & Assert
        assertThat(first.topologicalSort()).isEqualTo(second.topologicalSort());
    }

    /**
     * A three-file cycle makes the sort fail, and the cycle report names all three files.
     */
    @Test
    void threeNodeCycleIsFatalForSortAndReported() {
        // Arrange
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge(a, b);
        graph.addEdge(b, c);
        graph.addEdge(c, a);

        // Act
        CycleReport report = graph.detectCycles();

        // Assert
        assertThatThrownBy(graph::topologicalSort)
                .isInstanceOf(CircularDependencyException.class)
                .satisfies(e -> assertThat(((CircularDependencyException) e).offendingFile()).isIn(a, b, c));
        assertThat(graph.hasCircularDependencies()).isTrue();
        assertThat(report.hasCycles()).isTrue();
        assertThat(report.cycles()).anySatisfy(cycle -> assertThat(cycle).contains(a, b, c));
    }

    /**
     * An acyclic graph yields the acyclic report and an empty cycle list.
     */
    @Test
    void acyclicGraphReportsNoCycles() {
        // Arrange
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge(b, a);

        // Act
        CycleReport report = graph.detectCycles();

        // Assert
        assertThat(report).isInstanceOf(CycleReport.Acyclic.class);
        assertThat(report.cycles()).isEmpty();
        assertThat(graph.hasCircularDependencies()).isFalse();
    }

    /**
     * Transitive dependents follow reverse edges through intermediate files only.
     */
    @Test
    void transitiveDependentsFollowReverseEdges() {
        // Arrange
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge(b, a);
        graph.addEdge(c, b);
        graph.addNode(d);

        // Act & Assert
        assertThat(graph.transitiveDependentsOf(a)).containsExactlyInAnyOrder(b, c);
        assertThat(graph.transitiveDependentsOf(c)).isEmpty();
        assertThat(graph.transitiveDependenciesOf(c)).containsExactlyInAnyOrder(a, b);
        assertThat(graph.dependentsOf(a)).containsExactly(b);
    }

    /**
     * Adding an edge twice or adding an existing node does not change the graph.
     */
    @Test
    void addingIsIdempotent() {
        // Arrange
        DependencyGraph graph = new DependencyGraph();

        // Act
        graph.addEdge(b, a);
        graph.addEdge(b, a);
        graph.addNode(a);

        // Assert
        assertThat(graph.size()).isEqualTo(2);
        assertThat(graph.edgeCount()).isEqualTo(1);
        assertThat(graph.contains(a)).isTrue();
        assertThat(graph.dependenciesOf(file("unknown.dart"))).isEmpty();
    }
}
