package com.scipatom.atomizer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class AtomizerMainTest {

    private static final Path FIXTURE_ROOT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/verus-sample");

    @Test
    void noArgsThrowsUsageException() {
        assertThrows(AtomizerMain.UsageException.class, () -> AtomizerMain.run(new String[]{}));
    }

    @Test
    void unknownSubcommandThrowsUsageException() {
        assertThrows(AtomizerMain.UsageException.class,
                () -> AtomizerMain.run(new String[]{"record"}));
    }

    @Test
    void missingIndexFlagThrowsUsageException() {
        assertThrows(AtomizerMain.UsageException.class,
                () -> AtomizerMain.run(new String[]{"atomize", "--source", "/tmp", "--output", "/tmp/a.json"}));
    }

    @Test
    void missingSourceFlagThrowsUsageException() {
        assertThrows(AtomizerMain.UsageException.class,
                () -> AtomizerMain.run(new String[]{"atomize", "--index", "/tmp/i.json", "--output", "/tmp/a.json"}));
    }

    @Test
    void missingOutputFlagThrowsUsageException() {
        assertThrows(AtomizerMain.UsageException.class,
                () -> AtomizerMain.run(new String[]{"atomize", "--index", "/tmp/i.json", "--source", "/tmp"}));
    }

    @Test
    void unknownFlagThrowsUsageException() {
        assertThrows(AtomizerMain.UsageException.class,
                () -> AtomizerMain.run(new String[]{"atomize", "--foo", "bar"}));
    }

    @Test
    void flagWithoutValueThrowsUsageException() {
        Exception ex = assertThrows(AtomizerMain.UsageException.class,
                () -> AtomizerMain.run(new String[]{"atomize", "--index"}));
        assertTrue(ex.getMessage().contains("--index"));
    }

    @Test
    void badThreadCountThrowsUsageException() {
        String[] base = {"atomize", "--index", "/tmp/i.json", "--source", "/tmp", "--output", "/tmp/a.json", "--threads"};
        assertThrows(AtomizerMain.UsageException.class,
                () -> AtomizerMain.run(append(base, "many")));
        assertThrows(AtomizerMain.UsageException.class,
                () -> AtomizerMain.run(append(base, "0")));
    }

    @Test
    void fullRunWritesRequestedOutputs(@TempDir Path tmp) throws Exception {
        Path config = tmp.resolve("atomizer.json");
        Files.writeString(config, "{ \"dot_files\": [\"verified.rs\"] }");

        Atomizer.Result result = AtomizerMain.run(new String[]{
            "atomize",
            "--index", FIXTURE_ROOT.resolve("index.json").toString(),
            "--source", FIXTURE_ROOT.toString(),
            "--output", tmp.resolve("atoms.json").toString(),
            "--config", config.toString(),
            "--threads", "3",
            "--summary", tmp.resolve("summary.json").toString(),
            "--dot", tmp.resolve("graph.dot").toString()
        });

        assertEquals(13, result.summary().functionAtoms);
        assertTrue(Files.exists(tmp.resolve("atoms.json")));
        assertTrue(Files.exists(tmp.resolve("summary.json")));
        String dot = Files.readString(tmp.resolve("graph.dot"));
        assertTrue(dot.contains("label = \"src/verified.rs\""));
        assertFalse(dot.contains("label = \"src/lib.rs\""));
    }

    @Test
    void emptyDotFunctionsThrowsUsageException() {
        assertThrows(AtomizerMain.UsageException.class, () -> AtomizerMain.run(new String[]{
            "atomize", "--index", "/tmp/i.json", "--source", "/tmp", "--output", "/tmp/a.json",
            "--dot-functions", " , "}));
    }

    @Test
    void dotFunctionsWithCallers(@TempDir Path tmp) throws Exception {
        AtomizerMain.run(new String[]{
            "atomize",
            "--index", FIXTURE_ROOT.resolve("index.json").toString(),
            "--source", FIXTURE_ROOT.toString(),
            "--output", tmp.resolve("atoms.json").toString(),
            "--dot", tmp.resolve("graph.dot").toString(),
            "--dot-functions", "helper",
            "--dot-include-callers"
        });

        String dot = Files.readString(tmp.resolve("graph.dot"));
        assertTrue(dot.startsWith("digraph function_subgraph {"));
        assertTrue(dot.contains("\"fn:sample/run\" -> \"fn:sample/a/helper\""));
        assertTrue(dot.contains("\"fn:sample/a/outer\" -> \"fn:sample/a/helper\""));
    }

    private static String[] append(String[] args, String last) {
        String[] out = new String[args.length + 1];
        System.arraycopy(args, 0, out, 0, args.length);
        out[args.length] = last;
        return out;
    }
}
