package com.hcltech.multiway.cli;

import com.hcltech.multiway.GraphView;
import com.hcltech.multiway.InputSelector;
import com.hcltech.multiway.OutputNames;
import com.hcltech.multiway.State;
import com.hcltech.multiway.StateEnumerator;
import com.hcltech.multiway.common.config.Settings;
import com.hcltech.multiway.common.errorsor.ErrorsOr;
import com.hcltech.multiway.export.GraphExporter;
import com.hcltech.multiway.layout.LayeredLayout;
import com.hcltech.multiway.layout.Point;
import com.hcltech.multiway.render.GraphRenderer;
import com.hcltech.multiway.render.RenderOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Shared run for the sub-commands: resolve the input, enumerate, build, summarise, then hand the
 * graph to whichever exporters and renderer are on the classpath.
 * Exit codes: 0 success, 1 an output could not be written, 2 bad input.
 */
abstract class GraphCommand<N> implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(GraphCommand.class);

    @CommandLine.ParentCommand
    MultiwayCli parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "1")
    InputOptions input;

    @CommandLine.Mixin
    OutputOptions output = new OutputOptions();

    abstract GraphView<N> build(InputSelector selector, List<State> states);

    abstract void printSummary(PrintWriter out, InputSelector selector, List<State> states, GraphView<N> view);

    /** Config key and built-in default for this graph's node colour. */
    abstract String nodeColorKey();

    abstract String defaultNodeColor();

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        Settings settings = parent.settings();

        ErrorsOr<InputSelector> selectorOrErrors = input.selector();
        if (selectorOrErrors.isError()) return reportErrors(err, selectorOrErrors.getErrors(), CommandLine.ExitCode.USAGE);
        InputSelector selector = selectorOrErrors.valueOrThrow();

        ErrorsOr<Integer> warnSizeOrErrors = settings.getIntOr(ConfigKeys.WARN_SIZE, ConfigKeys.DEFAULT_WARN_SIZE);
        if (warnSizeOrErrors.isError()) return reportErrors(err, warnSizeOrErrors.getErrors(), CommandLine.ExitCode.USAGE);
        int warnSize = warnSizeOrErrors.valueOrThrow();

        Optional<RenderOptions> renderOptions = Optional.empty();
        if (output.png != null) {
            ErrorsOr<RenderOptions> options = renderOptions(settings);
            if (options.isError()) return reportErrors(err, options.getErrors(), CommandLine.ExitCode.USAGE);
            renderOptions = Optional.of(options.valueOrThrow());
        }

        if (selector.size() > warnSize)
            log.warn("Input size {} exceeds the recommended maximum of {}; enumeration grows factorially", selector.size(), warnSize);

        List<State> states = StateEnumerator.of(selector);
        log.info("Enumerated {} states for {}", states.size(), selector);
        GraphView<N> view = build(selector, states);
        printSummary(out, selector, states, view);
        out.flush();

        boolean ok = export(view, selector, "graphml", Optional.ofNullable(output.graphml), err);
        if (output.json != null)
            ok &= export(view, selector, "json", Optional.of(output.json).filter(s -> !s.isBlank()).map(Path::of), err);
        if (renderOptions.isPresent()) ok &= render(view, renderOptions.get(), output.png, err);
        return ok ? CommandLine.ExitCode.OK : CommandLine.ExitCode.SOFTWARE;
    }

    ErrorsOr<RenderOptions> renderOptions(Settings settings) {
        String color = output.nodeColor != null ? output.nodeColor : settings.getString(nodeColorKey(), defaultNodeColor());
        ErrorsOr<Integer> nodeSize = output.nodeSize != null ? ErrorsOr.lift(output.nodeSize)
                : settings.getIntOr(ConfigKeys.NODE_SIZE, ConfigKeys.DEFAULT_NODE_SIZE);
        ErrorsOr<Integer> fontSize = output.fontSize != null ? ErrorsOr.lift(output.fontSize)
                : settings.getIntOr(ConfigKeys.FONT_SIZE, ConfigKeys.DEFAULT_FONT_SIZE);
        ErrorsOr<Double> scale = output.scale != null ? ErrorsOr.lift(output.scale)
                : settings.getDoubleOr(ConfigKeys.SCALE, ConfigKeys.DEFAULT_SCALE);
        ErrorsOr<Integer> width = settings.getIntOr(ConfigKeys.WIDTH, ConfigKeys.DEFAULT_WIDTH);
        ErrorsOr<Integer> height = settings.getIntOr(ConfigKeys.HEIGHT, ConfigKeys.DEFAULT_HEIGHT);

        List<String> errors = new ArrayList<>();
        for (ErrorsOr<?> setting : List.of(nodeSize, fontSize, scale, width, height)) errors.addAll(setting.getErrors());
        if (!errors.isEmpty()) return ErrorsOr.errors(errors);
        return RenderOptions.of(color, RenderOptions.DEFAULT_SUPER_COLOR, nodeSize.valueOrThrow(), fontSize.valueOrThrow(),
                scale.valueOrThrow(), width.valueOrThrow(), height.valueOrThrow());
    }

    /** Writes to {@code path}, or to the default name with the exporter's own extension in the output directory. */
    private boolean export(GraphView<N> view, InputSelector selector, String format, Optional<Path> path, PrintWriter err) {
        Optional<GraphExporter> exporter = parent.exporter(format);
        if (exporter.isEmpty()) {
            log.warn("No {} exporter on the classpath; skipping {} output", format, view.name());
            return true;
        }
        Path target = path.orElseGet(() ->
                output.outputDir.resolve(OutputNames.defaultName(view.kind(), selector, exporter.get().extension())));
        return report(exporter.get().export(view, target), format, err);
    }

    private boolean render(GraphView<N> view, RenderOptions options, Path path, PrintWriter err) {
        Optional<GraphRenderer> renderer = parent.renderer("png");
        if (renderer.isEmpty()) {
            log.warn("No png renderer on the classpath; skipping {}", path);
            return true;
        }
        Map<N, Point> layout = LayeredLayout.layout(view.graph(), view.nodes());
        return report(renderer.get().render(view, layout, options, path), "png", err);
    }

    private boolean report(ErrorsOr<Path> result, String format, PrintWriter err) {
        result.ifValue(p -> log.info("Wrote {} to {}", format, p));
        result.ifError(errors -> errors.forEach(err::println));
        err.flush();
        return result.isValue();
    }

    private static int reportErrors(PrintWriter err, List<String> errors, int exitCode) {
        errors.forEach(err::println);
        err.flush();
        return exitCode;
    }
}
