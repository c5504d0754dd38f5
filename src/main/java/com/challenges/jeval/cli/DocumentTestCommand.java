package com.challenges.jeval.cli;

import com.challenges.jeval.error.JEvalException;
import com.challenges.jeval.json.ValueReader;
import com.challenges.jeval.query.Query;
import com.challenges.jeval.term.Context;
import com.challenges.jeval.value.Value;

import java.io.IOException;

/**
 * Tests the first document of every input against the query. Exits 0 when all
 * match, 1 at the first input that does not, and 2 on errors.
 */
abstract class DocumentTestCommand extends InputCommand {

    static final int MISMATCH = 1;
    static final int ERROR = 2;

    protected abstract ValueReader reader();

    @Override
    public Integer call() {
        try {
            Query query = query();
            Context context = Context.create();
            ValueReader reader = reader();
            boolean[] allMatched = {true};

            forEachInput(input -> {
                Value document = reader.readFirst(input)
                    .orElseThrow(() -> new IOException("input contains no document"));
                if (!query.evaluate(document, context)) {
                    allMatched[0] = false;
                }
                return allMatched[0];
            });
            return allMatched[0] ? 0 : MISMATCH;
        } catch (IOException | JEvalException e) {
            return fail(e, ERROR);
        }
    }
}
