/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: SOC2 Evidence Scanner
 */

package com.acme.soc2.orchestration;

import com.acme.soc2.aws.AwsSession;
import com.acme.soc2.aws.CallerIdentity;
import com.acme.soc2.aws.OrganizationAccount;
import com.acme.soc2.controls.ControlCatalogue;
import com.acme.soc2.controls.ControlEvaluator;
import com.acme.soc2.evidence.CollectorSet;
import com.acme.soc2.evidence.EvidenceContext;
import com.acme.soc2.evidence.EvidenceRecord;
import com.acme.soc2.evidence.EvidenceSource;
import com.acme.soc2.model.AccountResult;
import com.acme.soc2.model.ControlResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;

import java.util.*;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Resolves the accounts of a run and evaluates every requested control in each of them.
 *
 * <p>Failures stay with the account that produced them: an account whose role cannot be assumed
 * is reported with its error and the run moves on. Nothing in here throws for a single account or
 * control; problems end up as strings in the returned results.
 *
 * <p>Accounts may be processed by a bounded worker pool ({@link ScanConfig#maxParallelAccounts()}).
 * Each account owns its {@link EvidenceContext}; the only shared state is organization-wide evidence,
 * collected before any worker starts and read-only afterwards. Results are returned in account
 * resolution order regardless of completion order.
 */
public final class AccountOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(AccountOrchestrator.class);

    public static final String ROLE_SESSION_NAME = "soc2-scanner";
    static final String FALLBACK_REGION = "us-east-1";

    private final AwsSession baseSession;
    private final ControlCatalogue catalogue;
    private final ControlEvaluator evaluator;
    private final CollectorSet collectors;

    public AccountOrchestrator(AwsSession baseSession, ControlCatalogue catalogue,
                               ControlEvaluator evaluator, CollectorSet collectors) {
        this.baseSession = baseSession;
        this.catalogue = catalogue;
        this.evaluator = evaluator;
        this.collectors = collectors;
    }

    public ScanOutcome run(ScanConfig config) {
        List<String> regions = resolveRegions(baseSession.defaultRegion(), config.regions());

        String baseAccountId = null;
        String callerArn = null;
        String identityError = null;
        try {
            CallerIdentity identity = baseSession.callerIdentity();
            baseAccountId = identity.accountId();
            callerArn = identity.arn();
            log.info("Scanning as {} (account {})", callerArn, baseAccountId);
        } catch (SdkException e) {
            identityError = e.getMessage();
            log.warn("Unable to resolve caller identity: {}", identityError);
        }

        Map<String, String> accountNames = new HashMap<>();
        List<String> discovered = new ArrayList<>();
        String organizationError = null;
        if (config.allAccounts()) {
            try {
                for (OrganizationAccount a : baseSession.listActiveAccounts()) {
                    discovered.add(a.id());
                    if (a.name() != null) accountNames.put(a.id(), a.name());
                }
                log.info("Organization lists {} active account(s)", discovered.size());
            } catch (SdkException e) {
                organizationError = e.getMessage();
                log.warn("Unable to enumerate organization accounts: {}", organizationError);
            }
        }

        List<String> targets = resolveTargets(config.accountIds(), discovered, baseAccountId);
        Map<EvidenceSource, EvidenceRecord> shared = hoistSharedEvidence(config.controls(), baseAccountId, regions);

        List<Callable<AccountResult>> units = new ArrayList<>();
        if (targets.isEmpty()) {
            // base identity unknown and nothing else configured: still scan what the session can see
            String error = identityError;
            units.add(() -> scanWithSession(null, null, baseSession, null, error, regions, shared, config.controls()));
        } else {
            for (String accountId : targets) {
                String name = accountNames.get(accountId);
                String arn = callerArn;
                boolean base = accountId.equals(baseAccountId);
                units.add(() -> base
                        ? scanWithSession(accountId, name, baseSession, arn, null, regions, shared, config.controls())
                        : scanAssumed(accountId, name, config, regions, shared));
            }
        }

        List<AccountResult> results = runUnits(units, targets, config.maxParallelAccounts());
        return new ScanOutcome(regions, baseAccountId, callerArn, identityError, organizationError, results);
    }

    static List<String> resolveRegions(String sessionRegion, List<String> requested) {
        if (!requested.isEmpty()) return requested;
        if (sessionRegion != null && !sessionRegion.isBlank()) return List.of(sessionRegion);
        return List.of(FALLBACK_REGION);
    }

    /**
     * Explicit ids first (deduplicated, order kept), then enumerated ids not already listed. With
     * neither, the base account alone; empty when even that is unknown.
     */
    static List<String> resolveTargets(List<String> explicit, List<String> discovered, String baseAccountId) {
        LinkedHashSet<String> ids = new LinkedHashSet<>();
        for (String id : explicit) if (id != null && !id.isBlank()) ids.add(id.trim());
        for (String id : discovered) if (id != null && !id.isBlank()) ids.add(id.trim());
        if (ids.isEmpty() && baseAccountId != null) ids.add(baseAccountId);
        return List.copyOf(ids);
    }

    static String roleArn(String accountId, String roleName) {
        return "arn:aws:iam::" + accountId + ":role/" + roleName;
    }

    private Map<EvidenceSource, EvidenceRecord> hoistSharedEvidence(List<String> controls, String baseAccountId,
                                                                    List<String> regions) {
        Set<EvidenceSource> sources = catalogue.declaredSources(controls, EvidenceSource::organizationWide);
        if (sources.isEmpty()) return Map.of();

        EvidenceContext baseContext = new EvidenceContext(baseAccountId, baseSession, regions, collectors);
        Map<EvidenceSource, EvidenceRecord> shared = new EnumMap<>(EvidenceSource.class);
        for (EvidenceSource source : sources) {
            log.info("Collecting organization-wide evidence '{}' once for all accounts", source.key());
            try {
                shared.put(source, baseContext.evidence(source, source.recordType()));
            } catch (RuntimeException e) {
                // left out of the shared set; each account then collects it on its own
                log.warn("Organization-wide evidence '{}' could not be collected up front", source.key(), e);
            }
        }
        return Collections.unmodifiableMap(shared);
    }

    private AccountResult scanAssumed(String accountId, String name, ScanConfig config, List<String> regions,
                                      Map<EvidenceSource, EvidenceRecord> shared) {
        String roleArn = roleArn(accountId, config.roleName());
        AwsSession session;
        try {
            session = baseSession.assumeRole(roleArn, ROLE_SESSION_NAME, config.externalIdFor(accountId));
        } catch (SdkException e) {
            log.warn("Skipping account {}: unable to assume {}: {}", accountId, roleArn, e.getMessage());
            return AccountResult.unreachable(accountId, name, "AssumeRole " + roleArn + " failed: " + e.getMessage());
        }

        String arn = null;
        String identityError = null;
        try {
            arn = session.callerIdentity().arn();
        } catch (SdkException e) {
            identityError = e.getMessage();
            log.warn("Assumed role in {} but could not resolve identity: {}", accountId, identityError);
        }
        return scanWithSession(accountId, name, session, arn, identityError, regions, shared, config.controls());
    }

    private AccountResult scanWithSession(String accountId, String name, AwsSession session, String callerArn,
                                          String identityError, List<String> regions,
                                          Map<EvidenceSource, EvidenceRecord> shared, List<String> controls) {
        log.info("Evaluating {} control(s) in account {}", controls.size(), accountId);
        EvidenceContext ctx = new EvidenceContext(accountId, session, regions, collectors);
        shared.forEach((source, record) -> ctx.cache().seed(source, record));

        List<ControlResult> results = new ArrayList<>(controls.size());
        for (String controlId : controls) results.add(evaluator.evaluate(controlId, ctx));
        return new AccountResult(accountId, name, callerArn, identityError, results);
    }

    private List<AccountResult> runUnits(List<Callable<AccountResult>> units, List<String> targets, int parallelism) {
        List<AccountResult> results = new ArrayList<>(units.size());
        if (parallelism <= 1 || units.size() <= 1) {
            for (int i = 0; i < units.size(); i++) results.add(runContained(units.get(i), accountAt(targets, i)));
            return results;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, units.size()));
        try {
            List<Future<AccountResult>> futures = new ArrayList<>(units.size());
            for (Callable<AccountResult> unit : units) futures.add(pool.submit(unit));
            // futures are read in submission order, which is the canonical account order
            for (int i = 0; i < futures.size(); i++) {
                String accountId = accountAt(targets, i);
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Account {} scan failed", accountId, cause);
                    results.add(AccountResult.unreachable(accountId, null, "Account scan failed: " + cause.getMessage()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    results.add(AccountResult.unreachable(accountId, null, "Account scan interrupted"));
                }
            }
        } finally {
            pool.shutdownNow();
        }
        return results;
    }

    private static AccountResult runContained(Callable<AccountResult> unit, String accountId) {
        try {
            return unit.call();
        } catch (Exception e) {
            log.error("Account {} scan failed", accountId, e);
            return AccountResult.unreachable(accountId, null, "Account scan failed: " + e.getMessage());
        }
    }

    private static String accountAt(List<String> targets, int i) {
        return i < targets.size() ? targets.get(i) : null;
    }
}
