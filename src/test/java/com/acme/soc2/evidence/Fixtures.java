/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: SOC2 Evidence Scanner
 */

package com.acme.soc2.evidence;

import com.acme.soc2.collectors.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Canned evidence records for tests plus a collector set that serves them and counts calls.
 */
public final class Fixtures {
    private final Map<EvidenceSource, EvidenceRecord> records = new EnumMap<>(compliant());
    private final Map<EvidenceSource, AtomicInteger> calls = new ConcurrentHashMap<>();

    public Fixtures with(EvidenceSource source, EvidenceRecord record) {
        records.put(source, record);
        return this;
    }

    public CollectorSet collectors() {
        CollectorSet.Builder b = CollectorSet.builder();
        for (EvidenceSource source : EvidenceSource.values()) {
            b.with(source, (session, regions) -> {
                calls.computeIfAbsent(source, s -> new AtomicInteger()).incrementAndGet();
                return records.get(source);
            });
        }
        return b.build();
    }

    public int calls(EvidenceSource source) {
        AtomicInteger n = calls.get(source);
        return n == null ? 0 : n.get();
    }

    /** Records under which every control passes. */
    public static Map<EvidenceSource, EvidenceRecord> compliant() {
        Map<EvidenceSource, EvidenceRecord> m = new EnumMap<>(EvidenceSource.class);
        m.put(EvidenceSource.ACCESS_ANALYZER, new AccessAnalyzerEvidence(1, 1, List.of(), List.of()));
        m.put(EvidenceSource.BACKUP, new BackupEvidence(1, List.of(), List.of()));
        m.put(EvidenceSource.CLOUDTRAIL, trails(1));
        m.put(EvidenceSource.CLOUDWATCH, new CloudWatchEvidence(2, 3, List.of(), List.of(), List.of()));
        m.put(EvidenceSource.CODEBUILD, new CodeBuildEvidence(1, List.of(), List.of()));
        m.put(EvidenceSource.CODEPIPELINE, new CodePipelineEvidence(1, List.of(), List.of()));
        m.put(EvidenceSource.CONFIG, new ConfigEvidence(1, 1, List.of(), List.of()));
        m.put(EvidenceSource.CONFIG_RULES, new ConfigRulesEvidence(4, 0, List.of(), List.of()));
        m.put(EvidenceSource.GUARDDUTY, new GuardDutyEvidence(1, 1, List.of(), List.of()));
        m.put(EvidenceSource.IAM, new IamEvidence(true, true, 5, List.of()));
        m.put(EvidenceSource.INSPECTOR, new InspectorEvidence(1, List.of(), List.of()));
        m.put(EvidenceSource.KMS, new KmsEvidence(2, 2, List.of(), List.of()));
        m.put(EvidenceSource.ORGANIZATIONS, organizations(true, 2));
        m.put(EvidenceSource.SECURITYHUB, new SecurityHubEvidence(1, List.of(), List.of()));
        m.put(EvidenceSource.SSM, new SsmEvidence(3, 3, List.of(), List.of()));
        m.put(EvidenceSource.VPC, new VpcEvidence(1, 1, List.of(), List.of()));
        m.put(EvidenceSource.WAF, new WafEvidence(1, List.of(), List.of()));
        return Collections.unmodifiableMap(m);
    }

    public static OrganizationsEvidence organizations(boolean present, int scpCount, String... errors) {
        return new OrganizationsEvidence(present, present ? 1 : 0, scpCount, present ? 3 : 0, Arrays.asList(errors));
    }

    public static CloudTrailEvidence trails(int loggingTrails, String... errors) {
        return new CloudTrailEvidence(loggingTrails, loggingTrails, loggingTrails, List.of(), Arrays.asList(errors));
    }
}
