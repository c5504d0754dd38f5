package com.challenges.jeval;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class JEvalTest {

    @TempDir
    Path tmp;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    public void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    // ============================================================
    // Test Infrastructure
    // ============================================================

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new JEval());
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private String file(String name, String content) throws IOException {
        Path path = tmp.resolve(name);
        Files.writeString(path, content);
        return path.toString();
    }

    private List<String> outputLines() {
        return out.toString().lines().collect(Collectors.toList());
    }

    // ============================================================
    // jsonlfilter
    // ============================================================

    @Test
    public void testJsonlFilter() throws IOException {
        String first = file("a.jsonl", "{\"Name\":\"bob\",\"Age\":35}\n{\"Name\":\"alice\",\"Age\":20}\n");
        String second = file("b.jsonl", "{\"Age\":41,\"Name\":\"carol\",\"Tags\":[\"x\"]}\n[1,2]\n\"text\"\n");

        int exit = run("jsonlfilter", "-e", "Age > 30", first, second);

        assertEquals(0, exit);
        assertEquals(List.of("{\"Age\":35,\"Name\":\"bob\"}", "{\"Age\":41,\"Name\":\"carol\",\"Tags\":[\"x\"]}"),
            outputLines());
        assertEquals("", err.toString());
    }

    @Test
    public void testJsonlFilterRejectsBadQuery() throws IOException {
        String input = file("a.jsonl", "{}\n");

        int exit = run("jsonlfilter", "-e", "Name is \"bob", input);

        assertEquals(1, exit);
        assertTrue(err.toString().startsWith("Error: unterminated string at position 8"), err.toString());
        assertEquals("", out.toString());
    }

    @Test
    public void testJsonlFilterReportsMissingFile() {
        int exit = run("jsonlfilter", "-e", "a is 1", tmp.resolve("missing.jsonl").toString());

        assertEquals(1, exit);
        assertTrue(err.toString().startsWith("Error: "));
    }

    @Test
    public void testExpressionIsRequired() {
        assertEquals(CommandLine.ExitCode.USAGE, run("jsonlfilter"));
    }

    // ============================================================
    // csvfilter
    // ============================================================

    @Test
    public void testCsvFilter() throws IOException {
        String first = file("a.csv", "Name,Age,City\nbob,35,\"New York\"\nalice,20,Paris\n");
        String second = file("b.csv", "Name,Age,City\ncarol,41,\"Rome, IT\"\n");

        int exit = run("csvfilter", "-e", "Age > 30", first, second);

        assertEquals(0, exit);
        assertEquals(List.of("Name,Age,City", "bob,35,New York", "carol,41,\"Rome, IT\""), outputLines());
    }

    @Test
    public void testCsvFilterComparesCellsAsText() throws IOException {
        String input = file("a.csv", "Name,Age\nbob,35\nalice,20\n");

        int exit = run("csvfilter", "-e", "Age is 35 or Name is \"alice\" and Age is not 20", input);

        assertEquals(0, exit);
        assertEquals(List.of("Name,Age", "bob,35"), outputLines());
    }

    @Test
    public void testCsvFilterWritesHeaderWithoutMatches() throws IOException {
        String input = file("a.csv", "Name,Age\nbob,35\n");

        assertEquals(0, run("csvfilter", "-e", "Name is \"nobody\"", input));
        assertEquals(List.of("Name,Age"), outputLines());
    }

    // ============================================================
    // jsontest / yamltest
    // ============================================================

    @Test
    public void testJsonTest() throws IOException {
        String bob = file("bob.json", "{\"Name\":\"bob\",\"Age\":35}");
        String alice = file("alice.json", "{\"Name\":\"alice\",\"Age\":20}");

        assertEquals(0, run("jsontest", "-e", "Age > 30", bob));
        assertEquals(1, run("jsontest", "-e", "Age > 30", bob, alice));
        assertEquals(0, run("jsontest", "-e", "Name is \"bob\" or Name is \"alice\"", bob, alice));
        assertEquals("", out.toString());
    }

    @Test
    public void testJsonTestReadsOnlyTheFirstDocument() throws IOException {
        String input = file("two.json", "{\"Age\":35}\n{\"Age\":1}\n");

        assertEquals(0, run("jsontest", "-e", "Age > 30", input));
    }

    @Test
    public void testJsonTestErrors() throws IOException {
        String broken = file("broken.json", "{\"Age\":");
        String empty = file("empty.json", "");

        assertEquals(2, run("jsontest", "-e", "Age > 30", broken));
        assertEquals(2, run("jsontest", "-e", "Age > 30", empty));
        assertTrue(err.toString().contains("Error: input contains no document"));
    }

    @Test
    public void testYamlTest() throws IOException {
        String input = file("doc.yaml", "name: bob\nage: 35\ntags:\n  - go\n  - news\n");

        assertEquals(0, run("yamltest", "-e", "tags contains \"go\" and age >= 35", input));
        assertEquals(1, run("yamltest", "-e", "name is \"alice\"", input));
        assertEquals(2, run("yamltest", "-e", "name is", input));
    }

    // ============================================================
    // encode / decode
    // ============================================================

    @Test
    public void testEncode() {
        assertEquals(0, run("encode", "-e", "Age > 30"));
        assertEquals(List.of("{\"Expression\":{\"Type\":\"GT\",\"Expression\":{\"Field\":\"Age\",\"Value\":30}}}"),
            outputLines());
    }

    @Test
    public void testDecode() throws IOException {
        String input = file("query.json",
            "{\"Expression\":{\"Type\":\"And\",\"Expression\":{\"Expressions\":["
                + "{\"Expression\":{\"Type\":\"Is\",\"Expression\":{\"Field\":\"Name\",\"Value\":\"bob\"}}},"
                + "{\"Expression\":{\"Type\":\"GT\",\"Expression\":{\"Field\":\"Age\",\"Value\":30}}}]}}}");

        assertEquals(0, run("decode", input));
        assertEquals(List.of("(Name is \"bob\" and Age > 30)"), outputLines());
    }

    @Test
    public void testDecodeRejectsUnknownTypes() throws IOException {
        String input = file("query.json", "{\"Expression\":{\"Type\":\"Bogus\"}}");

        assertEquals(1, run("decode", input));
        assertTrue(err.toString().startsWith("Error: unrecognized expression type \"Bogus\""));
    }

    // ============================================================
    // Root command
    // ============================================================

    @Test
    public void testNoSubcommandPrintsUsage() {
        assertEquals(1, run());
        assertTrue(err.toString().contains("jsonlfilter"));
    }

    @Test
    public void testVersion() {
        assertEquals(0, run("--version"));
        assertEquals(List.of("1.0"), outputLines());
    }
}
