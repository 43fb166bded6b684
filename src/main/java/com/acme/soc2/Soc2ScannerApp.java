/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: SOC2 Evidence Scanner
 */

package com.acme.soc2;

import com.acme.soc2.aws.AwsSession;
import com.acme.soc2.aws.SdkAwsSession;
import com.acme.soc2.config.ConfigFile;
import com.acme.soc2.config.ConfigLoader;
import com.acme.soc2.config.ConfigurationException;
import com.acme.soc2.controls.ControlCatalogue;
import com.acme.soc2.controls.ControlEvaluator;
import com.acme.soc2.evidence.CollectorSet;
import com.acme.soc2.model.RunPayload;
import com.acme.soc2.orchestration.AccountOrchestrator;
import com.acme.soc2.orchestration.ScanConfig;
import com.acme.soc2.orchestration.ScanOutcome;
import com.acme.soc2.report.ReportAssembler;
import com.acme.soc2.report.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.concurrent.Callable;
import java.util.function.Function;

@CommandLine.Command(
        name = "soc2-evidence-scanner",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "Collects AWS configuration evidence for SOC 2 common criteria (CC1..CC8) across one or more accounts.",
        sortOptions = false
)
public class Soc2ScannerApp implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Soc2ScannerApp.class);

    static final int EXIT_PASS = 0;
    static final int EXIT_REVIEW = 1;
    static final int EXIT_FAIL = 2;
    static final int EXIT_CONFIG = 3;
    static final int EXIT_WRITE = 4;

    static final DateTimeFormatter RUN_ID = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    @CommandLine.Option(names = "--profile", description = "AWS named profile. Default: the SDK default credential chain.")
    String profile;

    @CommandLine.Option(names = "--regions", description = "Comma-separated regions to scan. Default: the session region, else us-east-1.")
    String regions;

    @CommandLine.Option(names = "--controls", description = "Comma-separated control ids. Default: CC1..CC8.")
    String controls;

    @CommandLine.Option(names = "--output", description = "Output directory; each run writes into <output>/<run id>/. Default: " + ScanConfig.DEFAULT_OUTPUT_DIR)
    String output;

    @CommandLine.Option(names = "--all-accounts", description = "Scan every ACTIVE account of the organization.")
    Boolean allAccounts;

    @CommandLine.Option(names = "--account-ids", description = "Comma-separated account ids to scan through role assumption.")
    String accountIds;

    @CommandLine.Option(names = "--role-name", description = "Role assumed in member accounts. Default: " + ScanConfig.DEFAULT_ROLE_NAME)
    String roleName;

    @CommandLine.Option(names = "--external-id", description = "External id sent with every AssumeRole call.")
    String externalId;

    @CommandLine.Option(names = "--account-external-id", paramLabel = "ACCOUNT=ID",
            description = "Per-account external id; overrides --external-id for that account. Repeatable.")
    Map<String, String> accountExternalIds;

    @CommandLine.Option(names = "--parallel-accounts", description = "Accounts scanned concurrently. Default: 1")
    Integer parallelAccounts;

    @CommandLine.Option(names = "--config", description = "JSON config file; command-line options override its values.")
    Path configFile;

    private final Function<ScanConfig, AwsSession> sessionFactory;
    private final CollectorSet collectors;
    private final Clock clock;

    public Soc2ScannerApp() {
        this(cfg -> SdkAwsSession.create(cfg.profile(), cfg.regions().isEmpty() ? null : cfg.regions().get(0)),
                CollectorSet.aws(), Clock.systemUTC());
    }

    Soc2ScannerApp(Function<ScanConfig, AwsSession> sessionFactory, CollectorSet collectors, Clock clock) {
        this.sessionFactory = sessionFactory;
        this.collectors = collectors;
        this.clock = clock;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Soc2ScannerApp()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        ScanConfig config;
        try {
            config = buildConfig(ConfigLoader.load(configFile));
        } catch (ConfigurationException e) {
            System.err.println("Configuration error: " + e.getMessage());
            return EXIT_CONFIG;
        }

        Instant generatedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        String runId = RUN_ID.format(generatedAt);
        log.info("Starting run {} for controls {}", runId, config.controls());

        ControlCatalogue catalogue = ControlCatalogue.standard();
        AccountOrchestrator orchestrator = new AccountOrchestrator(
                sessionFactory.apply(config), catalogue, new ControlEvaluator(catalogue, clock), collectors);
        ScanOutcome outcome = orchestrator.run(config);

        RunSummary summary = RunSummary.of(outcome.accounts());
        RunPayload payload = new RunPayload(
                runId,
                generatedAt,
                config.controls(),
                outcome.regions(),
                outcome.accountId(),
                outcome.callerArn(),
                outcome.identityError(),
                outcome.organizationError(),
                outcome.accounts(),
                summary);

        Path runDir = Path.of(config.outputDir()).resolve(runId);
        try {
            new ReportAssembler().assemble(payload, runDir);
        } catch (UncheckedIOException e) {
            log.error("Cannot write report artifacts to {}", runDir, e);
            System.err.println("Cannot write report: " + e.getMessage());
            return EXIT_WRITE;
        }

        System.out.println("\n=== SOC 2 Evidence Scan ===");
        System.out.println("Run: " + runId);
        System.out.println("Accounts: " + summary.accountCount() + " (" + summary.unreachableAccountCount() + " not assessed)");
        System.out.println("Pass: " + summary.passCount() + "  Fail: " + summary.failCount()
                + "  Needs review: " + summary.needsReviewCount() + "  Not implemented: " + summary.notImplementedCount());
        System.out.println("Status: " + (summary.complete() ? "complete" : "incomplete"));
        System.out.println("Report: " + runDir + "\n");

        return exitCode(summary);
    }

    /** Command-line values win over the config file, which wins over built-in defaults. */
    ScanConfig buildConfig(ConfigFile file) {
        List<String> upper = new ArrayList<>();
        for (String id : cleaned(firstNonEmpty(splitList(controls), file.controls()))) upper.add(id.toUpperCase(Locale.ROOT));

        Map<String, String> externalIds = new LinkedHashMap<>();
        if (file.accountExternalIds() != null) externalIds.putAll(file.accountExternalIds());
        if (accountExternalIds != null) externalIds.putAll(accountExternalIds);

        Integer parallel = parallelAccounts != null ? parallelAccounts : file.parallelAccounts();
        if (parallel != null && parallel < 1) {
            throw new ConfigurationException("--parallel-accounts must be at least 1");
        }

        return new ScanConfig(
                upper,
                cleaned(firstNonEmpty(splitList(regions), file.regions())),
                firstNonBlank(profile, file.profile()),
                firstNonBlank(output, file.output()),
                cleaned(firstNonEmpty(splitList(accountIds), file.accountIds())),
                allAccounts != null ? allAccounts : Boolean.TRUE.equals(file.allAccounts()),
                firstNonBlank(roleName, file.roleName()),
                firstNonBlank(externalId, file.externalId()),
                externalIds,
                parallel == null ? 1 : parallel);
    }

    static int exitCode(RunSummary summary) {
        if (summary.failCount() > 0) return EXIT_FAIL;
        return summary.complete() ? EXIT_PASS : EXIT_REVIEW;
    }

    /** Trimmed, non-blank entries of a comma-separated value; empty for null. */
    static List<String> splitList(String value) {
        if (value == null) return List.of();
        List<String> out = new ArrayList<>();
        for (String part : value.split(",")) {
            String p = part.trim();
            if (!p.isEmpty()) out.add(p);
        }
        return out;
    }

    private static List<String> cleaned(List<String> values) {
        List<String> out = new ArrayList<>(values.size());
        for (String v : values) if (v != null && !v.isBlank()) out.add(v.trim());
        return out;
    }

    private static List<String> firstNonEmpty(List<String> cli, List<String> file) {
        if (!cli.isEmpty()) return cli;
        return file == null ? List.of() : file;
    }

    private static String firstNonBlank(String cli, String file) {
        return (cli != null && !cli.isBlank()) ? cli : file;
    }
}
