package com.skillgraph.audit.service;

import com.skillgraph.audit.config.AuditProperties;
import com.skillgraph.audit.consistency.ConsistencyChecker;
import com.skillgraph.audit.consistency.ConsistencyModels.ConsistencyResult;
import com.skillgraph.audit.consistency.ConsistencyModels.Verdict;
import com.skillgraph.audit.gap.GapAnalyzer;
import com.skillgraph.audit.gap.GapModels.GapAnalysis;
import com.skillgraph.audit.graph.DependencyGraphBuilder;
import com.skillgraph.audit.graph.GraphModels.GraphResult;
import com.skillgraph.audit.health.HealthModels.ModuleHealth;
import com.skillgraph.audit.health.HealthScorer;
import com.skillgraph.audit.lesson.LessonMapper;
import com.skillgraph.audit.lesson.LessonModels.LessonMappingResult;
import com.skillgraph.audit.registry.RegistryExportParser;
import com.skillgraph.audit.registry.RegistryLoadException;
import com.skillgraph.audit.registry.RegistryLoader;
import com.skillgraph.audit.registry.RegistryModels.RegistryExport;
import com.skillgraph.audit.registry.Snapshot;
import com.skillgraph.audit.report.ReportFormat;
import com.skillgraph.audit.report.ReportGenerator;
import com.skillgraph.audit.report.ReportModels.AuditReport;
import com.skillgraph.audit.usage.UsageAggregator;
import com.skillgraph.audit.usage.UsageModels.UsageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One audit run: load, resolve, aggregate, score, analyze, report.
 *
 * <pre>
 * snapshot ─┬─ graph → consistency → usage ─┬─ health → gap → report
 *           └─ lesson mapping ──────────────┘
 * </pre>
 *
 * Nothing survives the run; the worker pool is created and shut down inside {@link #run}.
 */
@Service
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final RegistryExportParser parser;
    private final RegistryLoader loader;
    private final DependencyGraphBuilder graphBuilder;
    private final ConsistencyChecker consistencyChecker;
    private final UsageAggregator usageAggregator;
    private final LessonMapper lessonMapper;
    private final HealthScorer healthScorer;
    private final GapAnalyzer gapAnalyzer;
    private final ReportGenerator reportGenerator;
    private final AuditProperties properties;

    public AuditService(RegistryExportParser parser,
                        RegistryLoader loader,
                        DependencyGraphBuilder graphBuilder,
                        ConsistencyChecker consistencyChecker,
                        UsageAggregator usageAggregator,
                        LessonMapper lessonMapper,
                        HealthScorer healthScorer,
                        GapAnalyzer gapAnalyzer,
                        ReportGenerator reportGenerator,
                        AuditProperties properties) {
        this.parser = parser;
        this.loader = loader;
        this.graphBuilder = graphBuilder;
        this.consistencyChecker = consistencyChecker;
        this.usageAggregator = usageAggregator;
        this.lessonMapper = lessonMapper;
        this.healthScorer = healthScorer;
        this.gapAnalyzer = gapAnalyzer;
        this.reportGenerator = reportGenerator;
        this.properties = properties;
    }

    /**
     * Parses a marker-format export.
     *
     * @throws RegistryLoadException when the text has syntax errors
     */
    public RegistryExport parse(String content) {
        RegistryExportParser.ParseResult result = parser.parse(content);
        if (!result.errors().isEmpty()) {
            throw new RegistryLoadException(result.errors());
        }
        return result.export();
    }

    public AuditOutcome run(RegistryExport export, AuditOptions options) {
        Snapshot snapshot = loader.load(export);
        log.info("Auditing registry: {} skills, {} modules, {} lessons, {} dependency declarations",
                snapshot.skills().size(), snapshot.modules().size(), snapshot.lessons().size(), snapshot.edges().size());

        int workers = Math.max(1, properties.getWorkers());
        ExecutorService executor = Executors.newFixedThreadPool(workers, new AuditThreadFactory());
        try {
            CompletableFuture<LessonMappingResult> lessonsFuture =
                    CompletableFuture.supplyAsync(() -> lessonMapper.map(snapshot), executor);

            GraphResult graph = graphBuilder.build(snapshot);
            ConsistencyResult consistency = consistencyChecker.check(snapshot, graph.graph(), executor, workers);
            UsageResult usage = usageAggregator.aggregate(snapshot, consistency.resolvedEdges());

            LessonMappingResult lessons = lessonsFuture.join();
            List<ModuleHealth> health = healthScorer.score(usage, lessons.mappings());
            GapAnalysis gap = gapAnalyzer.analyze(snapshot, usage, consistency.resolvedEdges(), health, options.minClusterSize());

            AuditReport report = reportGenerator.generate(snapshot, graph, consistency, usage, lessons, health, gap);
            long missing = consistency.count(Verdict.MISSING);
            int exitCode = options.failOnMissing() && missing > 0 ? EXIT_MISSING_REFERENCES : EXIT_OK;

            log.info("Audit finished: {} missing references, {} orphan modules, {} proposed skills",
                    missing, gap.orphanCount(), gap.proposedSkills().size());
            return new AuditOutcome(report, exitCode);
        } finally {
            executor.shutdown();
        }
    }

    /** Options from configuration: text report, configured cluster size, missing references advisory. */
    public AuditOptions defaultOptions() {
        return new AuditOptions(ReportFormat.TEXT, properties.getGap().getMinClusterSize(), false);
    }

    public String render(AuditReport report, ReportFormat format) {
        return reportGenerator.render(report, format);
    }

    public static final int EXIT_OK = 0;
    public static final int EXIT_LOAD_ERROR = 1;
    public static final int EXIT_MISSING_REFERENCES = 2;

    public record AuditOptions(ReportFormat format, int minClusterSize, boolean failOnMissing) {
        public AuditOptions {
            if (minClusterSize < 1) {
                throw new IllegalArgumentException("min-cluster-size must be positive, got " + minClusterSize);
            }
        }
    }

    public record AuditOutcome(AuditReport report, int exitCode) {}

    private static final class AuditThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "audit-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
