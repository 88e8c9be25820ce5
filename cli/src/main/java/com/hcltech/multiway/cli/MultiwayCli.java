package com.hcltech.multiway.cli;

import com.hcltech.multiway.common.config.Settings;
import com.hcltech.multiway.export.GraphExporter;
import com.hcltech.multiway.export.GraphExporters;
import com.hcltech.multiway.render.GraphRenderer;
import com.hcltech.multiway.render.GraphRenderers;
import picocli.CommandLine;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

@CommandLine.Command(
        name = "multiway",
        mixinStandardHelpOptions = true,
        version = "multiway 1.0.0",
        description = "Builds multiway and causal graphs of bubble-sort rewrites.",
        subcommands = {StatesCommand.class, CausalCommand.class, CommandLine.HelpCommand.class})
public class MultiwayCli implements Runnable {

    private final Settings settings;
    private final Function<String, Optional<GraphExporter>> exporters;
    private final Function<String, Optional<GraphRenderer>> renderers;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public MultiwayCli() {
        this(Settings.load(), GraphExporters::find, GraphRenderers::find);
    }

    public MultiwayCli(Settings settings,
                       Function<String, Optional<GraphExporter>> exporters,
                       Function<String, Optional<GraphRenderer>> renderers) {
        this.settings = Objects.requireNonNull(settings);
        this.exporters = Objects.requireNonNull(exporters);
        this.renderers = Objects.requireNonNull(renderers);
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new MultiwayCli()).execute(args));
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing sub-command: states or causal");
    }

    Settings settings() {
        return settings;
    }

    Optional<GraphExporter> exporter(String format) {
        return exporters.apply(format);
    }

    Optional<GraphRenderer> renderer(String format) {
        return renderers.apply(format);
    }
}
