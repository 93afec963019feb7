package com.skillgraph.audit.cli;

import com.skillgraph.audit.registry.RegistryLoadException;
import com.skillgraph.audit.registry.RegistryModels.RegistryExport;
import com.skillgraph.audit.report.ReportFormat;
import com.skillgraph.audit.report.ReportGenerator;
import com.skillgraph.audit.service.AuditService;
import com.skillgraph.audit.service.AuditService.AuditOptions;
import com.skillgraph.audit.service.AuditService.AuditOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Batch entry point.
 *
 * <pre>
 * registry-audit &lt;export-location&gt; [--format=text|structured] [--min-cluster-size=N]
 *                [--fail-on-missing] [--output=path] [--registry-user=u] [--registry-password=p]
 * </pre>
 *
 * Exit codes: 0 run completed, 1 fatal load error or bad options, 2 missing references with --fail-on-missing.
 * Without a location the runner does nothing and the HTTP API serves requests instead.
 */
@Component
@ConditionalOnProperty(prefix = "audit.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AuditCommand implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(AuditCommand.class);

    private final AuditService auditService;
    private final ReportGenerator reportGenerator;
    private final RegistrySourceReader sourceReader;
    private final PrintStream stdout;
    private int exitCode = AuditService.EXIT_OK;

    @Autowired
    public AuditCommand(AuditService auditService, ReportGenerator reportGenerator, RegistrySourceReader sourceReader) {
        this(auditService, reportGenerator, sourceReader, System.out);
    }

    AuditCommand(AuditService auditService, ReportGenerator reportGenerator, RegistrySourceReader sourceReader, PrintStream stdout) {
        this.auditService = auditService;
        this.reportGenerator = reportGenerator;
        this.sourceReader = sourceReader;
        this.stdout = stdout;
    }

    public static boolean hasRegistryLocation(String[] args) {
        for (String arg : args) {
            if (!arg.startsWith("--")) return true;
        }
        return false;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            log.debug("No registry location given, serving the HTTP API only");
            return;
        }
        String location = positional.get(0);

        AuditOptions options;
        try {
            options = new AuditOptions(
                    ReportFormat.parse(option(args, "format", "text")),
                    Integer.parseInt(option(args, "min-cluster-size",
                            String.valueOf(auditService.defaultOptions().minClusterSize()))),
                    args.containsOption("fail-on-missing"));
        } catch (IllegalArgumentException e) {
            log.error("Invalid options: {}", e.getMessage());
            exitCode = AuditService.EXIT_LOAD_ERROR;
            return;
        }

        try {
            RegistryExport export = sourceReader.read(location,
                    option(args, "registry-user", null), option(args, "registry-password", null));
            AuditOutcome outcome = auditService.run(export, options);
            String output = option(args, "output", null);
            reportGenerator.write(outcome.report(), options.format(), output == null ? null : Path.of(output), stdout);
            exitCode = outcome.exitCode();
        } catch (RegistryLoadException e) {
            log.error("Registry export {} rejected ({} problem(s)):", location, e.getIssues().size());
            e.getIssues().forEach(issue -> log.error("  {}", issue.describe()));
            exitCode = AuditService.EXIT_LOAD_ERROR;
        } catch (UncheckedIOException | DataAccessException e) {
            log.error("Cannot read registry export {}: {}", location, e.getMessage());
            exitCode = AuditService.EXIT_LOAD_ERROR;
        } catch (IllegalArgumentException e) {
            log.error("Malformed registry export {}: {}", location, e.getMessage());
            exitCode = AuditService.EXIT_LOAD_ERROR;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private String option(ApplicationArguments args, String name, String fallback) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0) == null) return fallback;
        return values.get(values.size() - 1);
    }
}
