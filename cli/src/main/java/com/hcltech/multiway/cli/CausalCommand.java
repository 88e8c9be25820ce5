package com.hcltech.multiway.cli;

import com.hcltech.multiway.CausalGraphBuilder;
import com.hcltech.multiway.Event;
import com.hcltech.multiway.GraphKind;
import com.hcltech.multiway.GraphSummary;
import com.hcltech.multiway.GraphView;
import com.hcltech.multiway.InputSelector;
import com.hcltech.multiway.OutputNames;
import com.hcltech.multiway.State;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.List;

@CommandLine.Command(name = "causal", mixinStandardHelpOptions = true,
        description = "Causal graph: swap events, linked when one event's output is another's input.")
public class CausalCommand extends GraphCommand<Event> {

    @Override
    GraphView<Event> build(InputSelector selector, List<State> states) {
        return GraphView.causal(OutputNames.graphName(GraphKind.CAUSAL, selector), CausalGraphBuilder.build(states));
    }

    @Override
    void printSummary(PrintWriter out, InputSelector selector, List<State> states, GraphView<Event> view) {
        GraphSummary summary = GraphSummary.of(view.graph());
        out.printf("States: %d [%s]%n", states.size(), selector);
        out.printf("Events: %d  Causal edges: %d%n", summary.nodes(), summary.edges());
        out.printf("DAG: %s  Sources: %d  Sinks: %d%n", summary.dag(), summary.sources(), summary.sinks());
    }

    @Override
    String nodeColorKey() {
        return ConfigKeys.NODE_COLOR_CAUSAL;
    }

    @Override
    String defaultNodeColor() {
        return ConfigKeys.DEFAULT_NODE_COLOR_CAUSAL;
    }
}
