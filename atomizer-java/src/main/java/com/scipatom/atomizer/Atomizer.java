package com.scipatom.atomizer;

import com.scipatom.atomizer.config.AtomizerConfig;
import com.scipatom.atomizer.graph.AtomGraph;
import com.scipatom.atomizer.graph.AtomModel;
import com.scipatom.atomizer.graph.GraphBuilder;
import com.scipatom.atomizer.index.IndexLoader;
import com.scipatom.atomizer.index.LoadedIndex;
import com.scipatom.atomizer.output.AtomSerializer;
import com.scipatom.atomizer.output.DotExporter;
import com.scipatom.atomizer.output.RunSummary;
import com.scipatom.atomizer.output.RunSummaryWriter;
import com.scipatom.atomizer.resolve.ResolvedIndex;
import com.scipatom.atomizer.resolve.ResolvedSymbol;
import com.scipatom.atomizer.resolve.SymbolResolver;
import com.scipatom.atomizer.source.SourceTree;
import com.scipatom.atomizer.span.Confidence;
import com.scipatom.atomizer.span.FallbackSpanLocator;
import com.scipatom.atomizer.span.FileExtraction;
import com.scipatom.atomizer.span.RustItemParser;
import com.scipatom.atomizer.span.SpanExtractor;
import com.scipatom.atomizer.span.SpanRequest;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Orchestrates one atomization run: load the index, resolve symbols, extract spans
 * file by file on a worker pool, build the graph, and write the outputs.
 */
public class Atomizer {

    public static class AtomizeException extends RuntimeException {
        public AtomizeException(String msg, Throwable cause) { super(msg, cause); }
    }

    /** In-memory result of a run, before anything is written. */
    public record Result(AtomGraph graph, RunSummary summary) {}

    private final AtomizerConfig config;

    public Atomizer(AtomizerConfig config) {
        this.config = config;
    }

    /**
     * Runs the pipeline and writes atoms JSON to {@code output}, plus the summary and DOT
     * files when configured. Nothing is written if a fatal error occurs.
     */
    public Result atomize(Path indexPath, Path sourceRoot, Path output) {
        Result result = analyze(indexPath, sourceRoot);

        // 5. Render everything that can still fail before the first file is written
        DotExporter dotExporter = new DotExporter();
        String dot = config.getDotPath() != null
                ? dotExporter.render(result.graph(), dotSelection())
                : null;

        new AtomSerializer().write(result.graph(), output);
        if (config.getSummaryPath() != null) {
            new RunSummaryWriter().write(result.summary(), Paths.get(config.getSummaryPath()));
        }
        if (dot != null) {
            dotExporter.write(dot, Paths.get(config.getDotPath()));
        }
        return result;
    }

    private DotExporter.Selection dotSelection() {
        return new DotExporter.Selection(config.getDotFiles(), config.getDotFunctions(), config.isDotIncludeCallers());
    }

    public Result analyze(Path indexPath, Path sourceRoot) {
        // 1. Load
        System.err.println("[atomizer] Loading index: " + indexPath);
        LoadedIndex index = new IndexLoader().load(indexPath);
        SourceTree tree = SourceTree.open(sourceRoot);
        System.err.println("[atomizer] Index loaded: " + index.documents().size() + " documents, "
                + index.occurrenceCount() + " occurrences; source root " + tree.root());

        // 2. Resolve
        ResolvedIndex resolved = new SymbolResolver().resolve(index, tree);
        System.err.println("[atomizer] Resolved " + resolved.symbols().size() + " symbols, "
                + resolved.functions().size() + " functions, "
                + resolved.candidates().size() + " candidate edges");

        // 3. Extract spans
        Map<String, FileExtraction> extractions = extractSpans(resolved, tree);

        // 4. Build
        AtomGraph graph = new GraphBuilder().build(resolved, extractions, tree.rootName());
        RunSummary summary = summarize(graph, resolved, extractions);
        System.err.println("[atomizer] Run summary: " + summary.describe());
        return new Result(graph, summary);
    }

    Map<String, FileExtraction> extractSpans(ResolvedIndex resolved, SourceTree tree) {
        Map<String, List<SpanRequest>> byFile = new TreeMap<>();
        for (ResolvedSymbol fn : resolved.functions()) {
            byFile.computeIfAbsent(fn.path(), k -> new ArrayList<>())
                  .add(new SpanRequest(fn.symbol(), fn.displayName(), fn.anchorLine()));
        }

        SpanExtractor extractor = new SpanExtractor(
            tree,
            new RustItemParser(config.getItemListMacros()),
            new FallbackSpanLocator(config.getFallbackSearchWindow(), config.getFallbackMaxLines()));

        int threads = Math.max(1, Math.min(config.getWorkerThreads(), Math.max(1, byFile.size())));
        System.err.println("[atomizer] Extracting spans from " + byFile.size() + " files on "
                + threads + " threads");
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            Map<String, Future<FileExtraction>> futures = new LinkedHashMap<>();
            for (Map.Entry<String, List<SpanRequest>> e : byFile.entrySet()) {
                String path = e.getKey();
                List<SpanRequest> requests = e.getValue();
                futures.put(path, pool.submit(() -> extractor.extract(path, requests)));
            }
            Map<String, FileExtraction> slots = new LinkedHashMap<>();
            for (Map.Entry<String, Future<FileExtraction>> e : futures.entrySet()) {
                slots.put(e.getKey(), e.getValue().get());
            }
            return slots;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AtomizeException("Interrupted during span extraction", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new AtomizeException("Span extraction failed: " + cause.getMessage(), cause);
        } finally {
            pool.shutdownNow();
        }
    }

    private static RunSummary summarize(AtomGraph graph, ResolvedIndex resolved,
                                        Map<String, FileExtraction> extractions) {
        RunSummary s = new RunSummary();
        s.atoms = graph.atoms().size();
        s.functionAtoms = (int) graph.functionAtomCount();
        s.edges = graph.dependencies().size();
        s.unresolvedSymbols = resolved.unresolvedSymbols();
        s.duplicateDefinitions = resolved.duplicateDefinitions();
        for (FileExtraction fe : extractions.values()) {
            if (fe.degraded()) s.degradedFiles++;
        }
        for (AtomModel.Atom a : graph.atoms()) {
            if (!AtomModel.FUNCTION.equals(a.kind)) continue;
            if (Confidence.NOT_FOUND.wireName().equals(a.confidence)) s.notFoundSpans++;
            if (Confidence.APPROXIMATE_FALLBACK.wireName().equals(a.confidence)) s.fallbackSpans++;
        }
        return s;
    }
}
