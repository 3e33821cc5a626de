package org.flutterjs.analyzer;

import org.flutterjs.analyzer.api.AnalysisException;
import org.flutterjs.analyzer.api.AnalysisPhase;
import org.flutterjs.analyzer.api.AnalysisProgress;
import org.flutterjs.analyzer.api.AnalysisResult;
import org.flutterjs.analyzer.api.AnalysisStatistics;
import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.api.IProjectAnalyzer;
import org.flutterjs.analyzer.backend.link.DeclarationLinker;
import org.flutterjs.analyzer.backend.validate.DeclarationValidator;
import org.flutterjs.analyzer.backend.validate.ValidationResult;
import org.flutterjs.analyzer.cache.ContentHasher;
import org.flutterjs.analyzer.cache.IncrementalCache;
import org.flutterjs.analyzer.config.AnalyzerOptions;
import org.flutterjs.analyzer.diagnostics.Diagnostic;
import org.flutterjs.analyzer.diagnostics.DiagnosticsEngine;
import org.flutterjs.analyzer.frontend.irgen.AnalysisContext;
import org.flutterjs.analyzer.frontend.irgen.IrExtractor;
import org.flutterjs.analyzer.frontend.module.CircularDependencyException;
import org.flutterjs.analyzer.frontend.module.CycleReport;
import org.flutterjs.analyzer.frontend.module.DependencyGraph;
import org.flutterjs.analyzer.frontend.module.DependencyResolver;
import org.flutterjs.analyzer.frontend.module.ProjectLayout;
import org.flutterjs.analyzer.frontend.parser.DartSourceParser;
import org.flutterjs.analyzer.frontend.parser.ParseException;
import org.flutterjs.analyzer.frontend.parser.ParsedUnit;
import org.flutterjs.analyzer.frontend.parser.SourceParser;
import org.flutterjs.analyzer.frontend.semantics.SymbolRegistry;
import org.flutterjs.analyzer.frontend.semantics.TypeDescriptor;
import org.flutterjs.analyzer.frontend.semantics.TypeResolver;
import org.flutterjs.analyzer.ir.ApplicationDeclaration;
import org.flutterjs.analyzer.ir.FileDeclaration;
import org.flutterjs.analyzer.scheduler.BatchScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * The incremental project analyzer. Each call to {@link #analyze()} runs six phases:
 * <ol>
 *     <li>build the dependency graph of all source files,</li>
 *     <li>detect changed files and close the set over their transitive dependents,</li>
 *     <li>resolve the type symbols of the dirty files,</li>
 *     <li>extract the IR of the dirty files, reading all other files from the cache,</li>
 *     <li>link and validate the whole project,</li>
 *     <li>persist the fresh IR and the content hashes.</li>
 * </ol>
 * Phases 3 and 4 run in dependency-ordered batches; a batch finishes completely before the next
 * one starts. An instance keeps its symbol registry and cache between runs and must be closed
 * to release its worker threads. Runs are serialized.
 */
public class ProjectAnalyzer implements IProjectAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectAnalyzer.class);

    private final Path projectRoot;
    private final AnalyzerOptions options;
    private final SourceParser parser;
    private final IrExtractor extractor = new IrExtractor();
    private final DeclarationLinker linker = new DeclarationLinker();
    private final DeclarationValidator validator = new DeclarationValidator();
    private final SymbolRegistry registry = new SymbolRegistry();
    private final Set<FileIdentity> resolvedFiles = ConcurrentHashMap.newKeySet();
    private final List<Consumer<AnalysisProgress>> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService executor;
    private IncrementalCache cache;
    private volatile AnalysisPhase phase = AnalysisPhase.IDLE;

    /** Working state of a single run. */
    private static final class Run {
        private final List<FileIdentity> files;
        private final DependencyGraph graph;
        private final CycleReport cycles;
        private final List<FileIdentity> order;
        private final Map<FileIdentity, String> hashes = new ConcurrentHashMap<>();
        private final Map<FileIdentity, Long> modTimes = new ConcurrentHashMap<>();
        private final Map<FileIdentity, FileDeclaration> cached = new ConcurrentHashMap<>();
        private final Map<FileIdentity, ParsedUnit> parsed = new ConcurrentHashMap<>();
        private final Map<FileIdentity, FileDeclaration> fresh = new ConcurrentHashMap<>();
        private final Map<FileIdentity, List<Diagnostic>> diagnostics = new ConcurrentHashMap<>();
        private final Set<FileIdentity> failed = ConcurrentHashMap.newKeySet();
        private Set<FileIdentity> dirty = Set.of();

        private Run(List<FileIdentity> files, DependencyGraph graph, CycleReport cycles, List<FileIdentity> order) {
            this.files = files;
            this.graph = graph;
            this.cycles = cycles;
            this.order = order;
        }
    }

    /**
     * Creates an analyzer with the built-in Dart parser.
     *
     * @param projectRoot The directory holding the manifest and the source directory.
     * @param options     The analyzer options.
     */
    public ProjectAnalyzer(Path projectRoot, AnalyzerOptions options) {
        this(projectRoot, options, new DartSourceParser());
    }

    /**
     * Creates an analyzer with a custom parser.
     *
     * @param projectRoot The directory holding the manifest and the source directory.
     * @param options     The analyzer options.
     * @param parser      The parser used for symbol resolution and extraction; must be thread-safe.
     */
    public ProjectAnalyzer(Path projectRoot, AnalyzerOptions options, SourceParser parser) {
        this.projectRoot = projectRoot;
        this.options = options;
        this.parser = parser;
        int threads = options.effectiveParallelism();
        this.executor = threads > 1 ? Executors.newFixedThreadPool(threads, workerThreads()) : null;
        listeners.add(progress -> LOG.debug("{}", progress));
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "analyzer-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public void addProgressListener(Consumer<AnalysisProgress> listener) {
        listeners.add(listener);
    }

    @Override
    public AnalysisPhase phase() {
        return phase;
    }

    /**
     * @return The registry holding the symbols of the last run.
     */
    public SymbolRegistry registry() {
        return registry;
    }

    @Override
    public synchronized AnalysisResult analyze() throws AnalysisException {
        long started = System.nanoTime();
        phase = AnalysisPhase.IDLE;
        try {
            Run run = buildGraph();
            detectChanges(run);
            resolveSymbols(run);
            int batches = generateIr(run);

            Map<FileIdentity, FileDeclaration> declarations = new TreeMap<>(run.cached);
            declarations.putAll(run.fresh);
            ApplicationDeclaration application = linker.link(declarations, run.graph, registry);
            ValidationResult validation = validator.validate(application, registry);
            advance(AnalysisPhase.LINKED, "Linked " + declarations.size() + " files, " + validation.errors().size()
                    + " errors, " + validation.warnings().size() + " warnings");

            persist(run);

            AnalysisStatistics statistics = new AnalysisStatistics(
                    run.files.size(),
                    run.fresh.size(),
                    run.cached.size(),
                    run.failed.size(),
                    run.dirty.size(),
                    batches,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            advance(AnalysisPhase.COMPLETE, statistics.toString());
            return new AnalysisResult(run.order, run.dirty, declarations, application, validation, statistics,
                    run.diagnostics, run.cycles);
        } catch (AnalysisException | RuntimeException e) {
            phase = AnalysisPhase.ERROR;
            LOG.error("Analysis of {} failed: {}", projectRoot, e.getMessage());
            throw e;
        } catch (Error e) {
            phase = AnalysisPhase.ERROR;
            LOG.error("Analysis of {} aborted", projectRoot, e);
            throw e;
        }
    }

    // Phase 1
    private Run buildGraph() throws AnalysisException {
        ProjectLayout layout = ProjectLayout.open(projectRoot, options);
        List<FileIdentity> files = layout.discoverSourceFiles();
        DependencyGraph graph = new DependencyResolver(layout).buildGraph(files);

        CycleReport cycles = graph.detectCycles();
        if (cycles.hasCycles()) {
            for (List<FileIdentity> cycle : cycles.cycles()) {
                LOG.warn("Circular import: {}", cycle);
            }
        }
        List<FileIdentity> order;
        try {
            order = graph.topologicalSort();
        } catch (CircularDependencyException e) {
            throw new AnalysisException("Circular dependency involving " + e.offendingFile(), e);
        }

        if (options.cacheEnabled() && cache == null) {
            cache = new IncrementalCache(layout.root().resolve(options.cacheDirectory()), options.cacheMemoryEntries());
            cache.initialize();
        }
        advance(AnalysisPhase.GRAPH_BUILT, "Found " + files.size() + " files with " + graph.edgeCount() + " imports");
        return new Run(files, graph, cycles, order);
    }

    // Phase 2
    private void detectChanges(Run run) {
        Set<FileIdentity> changed = new LinkedHashSet<>();
        for (FileIdentity file : run.order) {
            if (!options.cacheEnabled() || !unchanged(file, run)) {
                changed.add(file);
            }
        }
        Set<FileIdentity> dirty = new TreeSet<>(changed);
        for (FileIdentity file : changed) {
            dirty.addAll(run.graph.transitiveDependentsOf(file));
        }
        for (FileIdentity file : dirty) {
            run.cached.remove(file);
        }
        run.dirty = dirty;
        advance(AnalysisPhase.CHANGES_DETECTED, changed.size() + " changed, " + dirty.size() + " to analyze");
    }

    private boolean unchanged(FileIdentity file, Run run) {
        Optional<String> previous = cache.hashOf(file);
        Optional<String> current = currentHash(file, previous, run);
        if (current.isEmpty()) return false;
        run.hashes.put(file, current.get());
        if (!current.equals(previous)) return false;
        Optional<FileDeclaration> declaration = cache.getDeclaration(file);
        declaration.ifPresent(d -> run.cached.put(file, d));
        return declaration.isPresent();
    }

    private Optional<String> currentHash(FileIdentity file, Optional<String> previous, Run run) {
        try {
            long modTime = Files.getLastModifiedTime(file.toPath()).toMillis();
            run.modTimes.put(file, modTime);
            if (previous.isPresent() && cache.modTimeOf(file).map(t -> t == modTime).orElse(false)) {
                return previous;
            }
            return Optional.of(ContentHasher.hashFile(file));
        } catch (IOException e) {
            LOG.warn("Could not hash {}, treating it as changed: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    // Phase 3
    private void resolveSymbols(Run run) {
        Set<FileIdentity> present = new HashSet<>(run.files);
        for (TypeDescriptor descriptor : registry.allTypes()) {
            if (!present.contains(descriptor.file())) registry.removeAllForFile(descriptor.file());
        }
        resolvedFiles.retainAll(present);

        Set<FileIdentity> toResolve = new HashSet<>();
        for (FileIdentity file : run.order) {
            if (run.dirty.contains(file) || !(resolvedFiles.contains(file) || registry.hasTypesFor(file))) {
                toResolve.add(file);
            }
        }
        List<List<FileIdentity>> batches = BatchScheduler.schedule(run.order, toResolve, run.graph,
                options.effectiveParallelism());
        runBatches(AnalysisPhase.SYMBOLS_RESOLVED, batches, run, file -> {
            Optional<ParsedUnit> unit = parse(file, run);
            if (unit.isEmpty()) {
                registry.removeAllForFile(file);
                resolvedFiles.remove(file);
                return;
            }
            registry.replaceFile(file, new TypeResolver(registry).resolve(unit.get()));
            resolvedFiles.add(file);
        });
        advance(AnalysisPhase.SYMBOLS_RESOLVED, "Resolved " + toResolve.size() + " files, "
                + registry.size() + " types known");
    }

    // Phase 4
    private int generateIr(Run run) {
        List<List<FileIdentity>> batches = BatchScheduler.schedule(run.order, run.dirty, run.graph,
                options.effectiveParallelism());
        runBatches(AnalysisPhase.IR_GENERATED, batches, run, file -> {
            if (run.failed.contains(file)) return;
            ParsedUnit unit = run.parsed.get(file);
            if (unit == null) {
                Optional<ParsedUnit> reparsed = parse(file, run);
                if (reparsed.isEmpty()) return;
                unit = reparsed.get();
            }
            DiagnosticsEngine diagnostics = new DiagnosticsEngine();
            FileDeclaration declaration = extractor.extract(unit, new AnalysisContext(file, registry, run.graph),
                    diagnostics);
            if (!diagnostics.getDiagnostics().isEmpty()) {
                run.diagnostics.put(file, diagnostics.getDiagnostics());
            }
            if (diagnostics.hasErrors()) {
                fail(file, run, diagnostics.getDiagnostics(), diagnostics.summary());
                return;
            }
            run.fresh.put(file, declaration);
        });
        run.parsed.clear();
        for (FileIdentity file : run.failed) {
            run.cached.remove(file);
        }
        advance(AnalysisPhase.IR_GENERATED, run.fresh.size() + " extracted, " + run.cached.size() + " cached, "
                + run.failed.size() + " failed in " + batches.size() + " batches");
        return batches.size();
    }

    private Optional<ParsedUnit> parse(FileIdentity file, Run run) {
        try {
            String source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
            ParsedUnit unit = parser.parse(file, source);
            run.parsed.put(file, unit);
            return Optional.of(unit);
        } catch (ParseException e) {
            fail(file, run, e.getDiagnostics(), e.getMessage());
        } catch (IOException e) {
            fail(file, run, List.of(readError(file, e)), e.getMessage());
        }
        return Optional.empty();
    }

    private static Diagnostic readError(FileIdentity file, Exception e) {
        return new Diagnostic(Diagnostic.Type.ERROR, "Failed to read file: " + e.getMessage(), file.path(), 0, 0);
    }

    private static void fail(FileIdentity file, Run run, List<Diagnostic> diagnostics, String message) {
        LOG.warn("Skipping {}: {}", file, message);
        run.failed.add(file);
        run.diagnostics.merge(file, diagnostics, (existing, added) -> {
            List<Diagnostic> all = new ArrayList<>(existing);
            added.stream().filter(d -> !all.contains(d)).forEach(all::add);
            return List.copyOf(all);
        });
    }

    // Phase 6
    private void persist(Run run) {
        if (cache == null || !options.cacheEnabled()) {
            advance(AnalysisPhase.CACHE_PERSISTED, "Cache disabled");
            return;
        }
        int saved = 0;
        for (Map.Entry<FileIdentity, FileDeclaration> entry : new TreeMap<>(run.fresh).entrySet()) {
            FileIdentity file = entry.getKey();
            if (cache.saveDeclaration(file, entry.getValue())) {
                saved++;
                remember(file, run);
            }
        }
        run.cached.keySet().forEach(file -> remember(file, run));

        List<FileIdentity> kept = new ArrayList<>(run.files);
        kept.removeAll(run.failed);
        cache.prune(kept);
        cache.persistIndex();
        cache.writeMetadata(run.files.size(), registry.size());
        advance(AnalysisPhase.CACHE_PERSISTED, "Saved " + saved + " of " + run.fresh.size() + " files");
    }

    private void remember(FileIdentity file, Run run) {
        String hash = run.hashes.get(file);
        if (hash == null) {
            try {
                hash = ContentHasher.hashFile(file);
            } catch (IOException e) {
                LOG.warn("Could not hash {} for the cache: {}", file, e.getMessage());
                return;
            }
        }
        cache.setHash(file, hash);
        Long modTime = run.modTimes.get(file);
        if (modTime != null) cache.setModTime(file, modTime);
    }

    /**
     * Runs a task for every file, batch after batch. Files of one batch run concurrently when a
     * worker pool exists; the next batch starts only after all tasks of the current one finished.
     * A task that throws marks its file as failed without affecting the others.
     */
    private void runBatches(AnalysisPhase target, List<List<FileIdentity>> batches, Run run,
                            Consumer<FileIdentity> task) {
        int total = batches.stream().mapToInt(List::size).sum();
        AtomicInteger done = new AtomicInteger();
        for (List<FileIdentity> batch : batches) {
            if (executor == null || batch.size() == 1) {
                batch.forEach(file -> runTask(target, file, run, task, done, total));
            } else {
                CompletableFuture<?>[] futures = batch.stream()
                        .map(file -> CompletableFuture.runAsync(() -> runTask(target, file, run, task, done, total),
                                executor))
                        .toArray(CompletableFuture[]::new);
                CompletableFuture.allOf(futures).join();
            }
        }
    }

    private void runTask(AnalysisPhase target, FileIdentity file, Run run, Consumer<FileIdentity> task,
                         AtomicInteger done, int total) {
        try {
            task.accept(file);
        } catch (RuntimeException | StackOverflowError e) {
            LOG.debug("Task for {} failed", file, e);
            fail(file, run, List.of(new Diagnostic(Diagnostic.Type.ERROR,
                    "Internal error: " + e, file.path(), 0, 0)), String.valueOf(e));
        }
        notifyListeners(AnalysisProgress.of(target, done.incrementAndGet(), total, file.fileName()));
    }

    private void advance(AnalysisPhase next, String message) {
        phase = next;
        LOG.info("{}: {}", next, message);
        notifyListeners(AnalysisProgress.of(next, 1, 1, message));
    }

    private void notifyListeners(AnalysisProgress progress) {
        for (Consumer<AnalysisProgress> listener : listeners) {
            try {
                listener.accept(progress);
            } catch (RuntimeException e) {
                LOG.warn("Progress listener failed: {}", e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        if (executor == null) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
