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

import com.acme.soc2.collectors.AccessAnalyzerCollector;
import com.acme.soc2.collectors.BackupCollector;
import com.acme.soc2.collectors.CloudTrailCollector;
import com.acme.soc2.collectors.CloudWatchCollector;
import com.acme.soc2.collectors.CodeBuildCollector;
import com.acme.soc2.collectors.CodePipelineCollector;
import com.acme.soc2.collectors.ConfigCollector;
import com.acme.soc2.collectors.ConfigRulesCollector;
import com.acme.soc2.collectors.GuardDutyCollector;
import com.acme.soc2.collectors.IamCollector;
import com.acme.soc2.collectors.InspectorCollector;
import com.acme.soc2.collectors.KmsCollector;
import com.acme.soc2.collectors.OrganizationsCollector;
import com.acme.soc2.collectors.SecurityHubCollector;
import com.acme.soc2.collectors.SsmCollector;
import com.acme.soc2.collectors.VpcCollector;
import com.acme.soc2.collectors.WafCollector;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable mapping from evidence source to the collector that produces it.
 */
public final class CollectorSet {
    private final Map<EvidenceSource, Collector<? extends EvidenceRecord>> collectors;

    private CollectorSet(Map<EvidenceSource, Collector<? extends EvidenceRecord>> collectors) {
        this.collectors = Collections.unmodifiableMap(new EnumMap<>(collectors));
    }

    /** The AWS SDK collectors, one per source. */
    public static CollectorSet aws() {
        return builder()
                .with(EvidenceSource.ACCESS_ANALYZER, new AccessAnalyzerCollector())
                .with(EvidenceSource.BACKUP, new BackupCollector())
                .with(EvidenceSource.CLOUDTRAIL, new CloudTrailCollector())
                .with(EvidenceSource.CLOUDWATCH, new CloudWatchCollector())
                .with(EvidenceSource.CODEBUILD, new CodeBuildCollector())
                .with(EvidenceSource.CODEPIPELINE, new CodePipelineCollector())
                .with(EvidenceSource.CONFIG, new ConfigCollector())
                .with(EvidenceSource.CONFIG_RULES, new ConfigRulesCollector())
                .with(EvidenceSource.GUARDDUTY, new GuardDutyCollector())
                .with(EvidenceSource.IAM, new IamCollector())
                .with(EvidenceSource.INSPECTOR, new InspectorCollector())
                .with(EvidenceSource.KMS, new KmsCollector())
                .with(EvidenceSource.ORGANIZATIONS, new OrganizationsCollector())
                .with(EvidenceSource.SECURITYHUB, new SecurityHubCollector())
                .with(EvidenceSource.SSM, new SsmCollector())
                .with(EvidenceSource.VPC, new VpcCollector())
                .with(EvidenceSource.WAF, new WafCollector())
                .build();
    }

    public static Builder builder() { return new Builder(); }

    public Collector<? extends EvidenceRecord> get(EvidenceSource source) {
        Collector<? extends EvidenceRecord> c = collectors.get(source);
        if (c == null) throw new IllegalStateException("No collector registered for evidence source '" + source.key() + "'");
        return c;
    }

    public boolean contains(EvidenceSource source) { return collectors.containsKey(source); }

    public static final class Builder {
        private final Map<EvidenceSource, Collector<? extends EvidenceRecord>> collectors = new EnumMap<>(EvidenceSource.class);

        private Builder() {}

        public Builder with(EvidenceSource source, Collector<? extends EvidenceRecord> collector) {
            collectors.put(source, collector);
            return this;
        }

        public CollectorSet build() { return new CollectorSet(collectors); }
    }
}
