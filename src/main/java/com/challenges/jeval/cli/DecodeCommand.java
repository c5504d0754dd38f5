package com.challenges.jeval.cli;

import com.challenges.jeval.codec.QueryCodec;
import com.challenges.jeval.error.JEvalException;
import com.challenges.jeval.query.Query;
import com.challenges.jeval.query.QueryStringifier;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;

@Command(name = "decode", mixinStandardHelpOptions = true,
         description = "Read a query's wire JSON and print it as query text")
public class DecodeCommand extends AbstractCommand {

    @Parameters(arity = "0..1", paramLabel = "FILE", description = "Wire JSON file (default: stdin)")
    File file;

    @Override
    public Integer call() {
        try {
            byte[] json;
            try (InputStream input = file != null ? new FileInputStream(file) : System.in) {
                json = input.readAllBytes();
            }
            Query query = new QueryCodec().decode(json);
            out().println(new QueryStringifier().stringify(query));
            out().flush();
            return 0;
        } catch (IOException | JEvalException | IllegalArgumentException e) {
            return fail(e, 1);
        }
    }
}
