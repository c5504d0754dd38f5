package com.challenges.jeval.cli;

import com.challenges.jeval.json.ValueReader;
import picocli.CommandLine.Command;

@Command(name = "yamltest", mixinStandardHelpOptions = true,
         description = "Exit with status 0 if every YAML document matches the query, 1 otherwise")
public class YamlTestCommand extends DocumentTestCommand {

    @Override
    protected ValueReader reader() {
        return ValueReader.yaml();
    }
}
