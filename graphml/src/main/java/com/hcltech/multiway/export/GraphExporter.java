package com.hcltech.multiway.export;

import com.hcltech.multiway.GraphView;
import com.hcltech.multiway.common.errorsor.ErrorsOr;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a built graph to a portable interchange format. Implementations are found with
 * {@link GraphExporters}; a format that is not on the classpath is simply unavailable.
 */
public interface GraphExporter {

    /** Short format name used to select the exporter, e.g. {@code graphml}. */
    String format();

    /** File extension without the dot. */
    String extension();

    <N> void write(GraphView<N> view, OutputStream out) throws IOException;

    default <N> ErrorsOr<Path> export(GraphView<N> view, Path path) {
        return ErrorsOr.trying("{0}: {1}", () -> {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (OutputStream out = Files.newOutputStream(path)) {
                write(view, out);
            }
            return path;
        }).addPrefixIfError("Could not write " + format() + " to " + path + ": ");
    }
}
