package com.challenges.jeval.cli;

import com.challenges.jeval.json.ValueReader;
import picocli.CommandLine.Command;

@Command(name = "jsontest", mixinStandardHelpOptions = true,
         description = "Exit with status 0 if every JSON document matches the query, 1 otherwise")
public class JsonTestCommand extends DocumentTestCommand {

    @Override
    protected ValueReader reader() {
        return ValueReader.json();
    }
}
