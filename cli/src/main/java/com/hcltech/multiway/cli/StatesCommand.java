package com.hcltech.multiway.cli;

import com.hcltech.multiway.DirectedGraph;
import com.hcltech.multiway.GraphKind;
import com.hcltech.multiway.GraphSummary;
import com.hcltech.multiway.GraphView;
import com.hcltech.multiway.InputSelector;
import com.hcltech.multiway.MultiwayGraphBuilder;
import com.hcltech.multiway.MultiwayNode;
import com.hcltech.multiway.OutputNames;
import com.hcltech.multiway.State;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.List;

@CommandLine.Command(name = "states", mixinStandardHelpOptions = true,
        description = "Multiway graph: every arrangement, linked by single adjacent swaps.")
public class StatesCommand extends GraphCommand<MultiwayNode> {

    @CommandLine.Option(names = "--no-super", description = "Leave out the ALL STARTS super-source.")
    boolean noSuper;

    @Override
    GraphView<MultiwayNode> build(InputSelector selector, List<State> states) {
        DirectedGraph<MultiwayNode> graph = MultiwayGraphBuilder.build(states, !noSuper);
        return GraphView.multiway(OutputNames.graphName(GraphKind.MULTIWAY, selector), graph);
    }

    @Override
    void printSummary(PrintWriter out, InputSelector selector, List<State> states, GraphView<MultiwayNode> view) {
        State sorted = selector.sortedState();
        GraphSummary summary = GraphSummary.of(view.graph(), MultiwayNode.of(sorted));
        out.printf("States: %d [%s]%n", states.size(), selector);
        out.printf("Nodes: %d  Edges: %d%n", summary.nodes(), summary.edges());
        out.printf("DAG: %s  Sources: %d  Sinks: %d%n", summary.dag(), summary.sources(), summary.sinks());
        out.printf("Max inversions (upper bound on longest path): %d%n", selector.maxInversions());
        out.printf("Sorted state %s  Present: %s  Sink: %s%n", sorted,
                summary.sortedPresent().orElse(false), summary.sortedIsSink().orElse(false));
    }

    @Override
    String nodeColorKey() {
        return ConfigKeys.NODE_COLOR_STATES;
    }

    @Override
    String defaultNodeColor() {
        return ConfigKeys.DEFAULT_NODE_COLOR_STATES;
    }
}
