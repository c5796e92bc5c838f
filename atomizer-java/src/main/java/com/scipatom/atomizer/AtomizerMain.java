package com.scipatom.atomizer;

import com.scipatom.atomizer.config.AtomizerConfig;
import com.scipatom.atomizer.config.ConfigReader;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Command-line entry point.
 *
 * Usage:
 *   java -jar atomizer-java.jar atomize \
 *     --index  <index.json> \
 *     --source <source-root> \
 *     --output <atoms.json> \
 *     [--config <atomizer.json>] [--threads <n>] [--summary <summary.json>] [--dot <graph.dot>]
 *     [--dot-functions <name,...>] [--dot-include-callers]
 */
public class AtomizerMain {

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[atomizer] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar atomizer-java.jar atomize " +
                               "--index <index.json> --source <dir> --output <atoms.json> " +
                               "[--config <file>] [--threads <n>] [--summary <file>] [--dot <file>] " +
                               "[--dot-functions <name,...>] [--dot-include-callers]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[atomizer] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static Atomizer.Result run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("atomize")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        String indexPath = null;
        String sourceRoot = null;
        String outputPath = null;
        String configPath = null;
        String threads = null;
        String summaryPath = null;
        String dotPath = null;
        String dotFunctions = null;
        boolean dotIncludeCallers = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--index"   -> indexPath   = requireNext(args, i++, "--index");
                case "--source"  -> sourceRoot  = requireNext(args, i++, "--source");
                case "--output"  -> outputPath  = requireNext(args, i++, "--output");
                case "--config"  -> configPath  = requireNext(args, i++, "--config");
                case "--threads" -> threads     = requireNext(args, i++, "--threads");
                case "--summary" -> summaryPath = requireNext(args, i++, "--summary");
                case "--dot"     -> dotPath     = requireNext(args, i++, "--dot");
                case "--dot-functions"       -> dotFunctions = requireNext(args, i++, "--dot-functions");
                case "--dot-include-callers" -> dotIncludeCallers = true;
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (indexPath == null)  throw new UsageException("--index is required");
        if (sourceRoot == null) throw new UsageException("--source is required");
        if (outputPath == null) throw new UsageException("--output is required");

        // Config file first, then flags on top
        AtomizerConfig config;
        if (configPath != null) {
            System.err.println("[atomizer] Reading config: " + configPath);
            config = new ConfigReader().read(Paths.get(configPath));
        } else {
            config = AtomizerConfig.defaults();
        }
        if (threads != null)     config.setWorkerThreads(parseThreads(threads));
        if (summaryPath != null) config.setSummaryPath(summaryPath);
        if (dotPath != null)     config.setDotPath(dotPath);
        if (dotFunctions != null) config.setDotFunctions(splitNames(dotFunctions));
        if (dotIncludeCallers)    config.setDotIncludeCallers(true);

        Path output = Paths.get(outputPath);
        Atomizer.Result result = new Atomizer(config).atomize(Paths.get(indexPath), Paths.get(sourceRoot), output);
        System.err.println("[atomizer] Done.");
        return result;
    }

    private static int parseThreads(String value) {
        try {
            int n = Integer.parseInt(value);
            if (n < 1) throw new UsageException("--threads must be at least 1: " + value);
            return n;
        } catch (NumberFormatException e) {
            throw new UsageException("--threads expects a number: " + value);
        }
    }

    private static List<String> splitNames(String value) {
        List<String> names = Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(n -> !n.isEmpty())
            .collect(Collectors.toList());
        if (names.isEmpty()) throw new UsageException("--dot-functions expects at least one name");
        return names;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
