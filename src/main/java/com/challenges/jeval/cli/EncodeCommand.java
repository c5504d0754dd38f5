package com.challenges.jeval.cli;

import com.challenges.jeval.codec.QueryCodec;
import com.challenges.jeval.error.JEvalException;
import com.challenges.jeval.query.QueryParser;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "encode", mixinStandardHelpOptions = true,
         description = "Print the wire JSON of a query")
public class EncodeCommand extends AbstractCommand {

    @Option(names = {"-e", "--expression"}, required = true, description = "The query to encode")
    String expression;

    @Override
    public Integer call() {
        try {
            out().println(new QueryCodec().encodeToString(new QueryParser().parse(expression)));
            out().flush();
            return 0;
        } catch (JEvalException e) {
            return fail(e, 1);
        }
    }
}
