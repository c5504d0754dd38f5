package com.challenges.jeval.cli;

import com.challenges.jeval.error.JEvalException;
import com.challenges.jeval.json.CsvRows;
import com.challenges.jeval.query.Query;
import com.challenges.jeval.term.Context;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.io.PrintWriter;

/**
 * Filters CSV rows. Cells are untyped text, so {@code is} compares textual
 * forms: {@code Age is 30} matches the cell {@code 30}.
 */
@Command(name = "csvfilter", mixinStandardHelpOptions = true,
         description = "Print the CSV rows that match the query, after the first input's header")
public class CsvFilterCommand extends InputCommand {

    @Override
    public Integer call() {
        try {
            Query query = query();
            Context context = Context.create().textualEquality(true);
            CsvRows csv = new CsvRows();
            PrintWriter out = out();
            boolean[] headerWritten = {false};

            forEachInput(input -> {
                try (CsvRows.Table table = csv.open(input)) {
                    if (!headerWritten[0]) {
                        csv.write(out, table.header());
                        headerWritten[0] = true;
                    }
                    table.forEachRow((cells, byHeader) -> {
                        if (query.evaluate(byHeader, context)) {
                            csv.write(out, cells);
                        }
                    });
                }
                return true;
            });
            out.flush();
            return 0;
        } catch (IOException | JEvalException e) {
            return fail(e, 1);
        }
    }
}
