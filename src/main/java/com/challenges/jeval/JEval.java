package com.challenges.jeval;

import com.challenges.jeval.cli.CsvFilterCommand;
import com.challenges.jeval.cli.DecodeCommand;
import com.challenges.jeval.cli.EncodeCommand;
import com.challenges.jeval.cli.JsonTestCommand;
import com.challenges.jeval.cli.JsonlFilterCommand;
import com.challenges.jeval.cli.YamlTestCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(name = "jeval", mixinStandardHelpOptions = true, version = "1.0",
         description = "Filter and test structured documents with boolean queries",
         subcommands = {
             JsonlFilterCommand.class,
             CsvFilterCommand.class,
             JsonTestCommand.class,
             YamlTestCommand.class,
             EncodeCommand.class,
             DecodeCommand.class
         })
public class JEval implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JEval()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        // No subcommand given
        spec.commandLine().usage(spec.commandLine().getErr());
        return 1;
    }
}
