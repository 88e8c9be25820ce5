package com.hcltech.multiway.cli;

import com.hcltech.multiway.InputSelector;
import com.hcltech.multiway.common.errorsor.ErrorsOr;
import picocli.CommandLine;

/** Exactly one of {@code -n} and {@code --values}; picocli rejects both or neither. */
public class InputOptions {

    @CommandLine.Option(names = "-n", paramLabel = "<n>", description = "Permute 1..n.")
    Integer n;

    @CommandLine.Option(names = "--values", paramLabel = "<csv>",
            description = "Comma separated values to permute; duplicates allowed, e.g. 3,1,1,2.")
    String values;

    ErrorsOr<InputSelector> selector() {
        return InputSelector.resolve(n, values);
    }
}
