package com.challenges.jeval.cli;

import com.challenges.jeval.error.JEvalException;
import com.challenges.jeval.json.ValueReader;
import com.challenges.jeval.output.ValueFormatter;
import com.challenges.jeval.query.Query;
import com.challenges.jeval.term.Context;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.io.PrintWriter;

@Command(name = "jsonlfilter", mixinStandardHelpOptions = true,
         description = "Print the JSON Lines records that match the query")
public class JsonlFilterCommand extends InputCommand {

    @Override
    public Integer call() {
        try {
            Query query = query();
            Context context = Context.create();
            ValueReader reader = ValueReader.json();
            ValueFormatter formatter = new ValueFormatter();
            PrintWriter out = out();

            forEachInput(input -> {
                reader.readEach(input, value -> {
                    if (query.evaluate(value, context)) {
                        out.println(formatter.format(value));
                    }
                });
                return true;
            });
            out.flush();
            return 0;
        } catch (IOException | JEvalException e) {
            return fail(e, 1);
        }
    }
}
