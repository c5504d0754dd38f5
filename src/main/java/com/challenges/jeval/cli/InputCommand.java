package com.challenges.jeval.cli;

import com.challenges.jeval.query.Query;
import com.challenges.jeval.query.QueryParser;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/** A command that applies one query to each input file, or to stdin. */
abstract class InputCommand extends AbstractCommand {

    @FunctionalInterface
    interface InputHandler {
        /** Returns false to skip the remaining inputs. */
        boolean accept(InputStream input) throws IOException;
    }

    @Option(names = {"-e", "--expression"}, required = true, description = "The query to apply")
    String expression;

    @Parameters(arity = "0..*", paramLabel = "FILE", description = "Input files (default: stdin)")
    List<File> files = new ArrayList<>();

    protected Query query() {
        return new QueryParser().parse(expression);
    }

    protected void forEachInput(InputHandler handler) throws IOException {
        if (files.isEmpty()) {
            handler.accept(System.in);
            return;
        }
        for (File file : files) {
            boolean more;
            try (InputStream input = new FileInputStream(file)) {
                more = handler.accept(input);
            }
            if (!more) {
                return;
            }
        }
    }
}
