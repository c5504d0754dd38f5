package com.challenges.jeval.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/** Output plumbing and failure reporting shared by the subcommands. */
abstract class AbstractCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(AbstractCommand.class);

    @Spec
    CommandSpec spec;

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }

    /** Reports {@code e} on stderr and returns {@code status} as the exit code. */
    protected int fail(Exception e, int status) {
        log.debug("{} failed", spec.name(), e);
        out().flush();
        err().println("Error: " + e.getMessage());
        err().flush();
        return status;
    }
}
