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

import com.acme.soc2.collectors.AccessAnalyzerEvidence;
import com.acme.soc2.collectors.BackupEvidence;
import com.acme.soc2.collectors.CloudTrailEvidence;
import com.acme.soc2.collectors.CloudWatchEvidence;
import com.acme.soc2.collectors.CodeBuildEvidence;
import com.acme.soc2.collectors.CodePipelineEvidence;
import com.acme.soc2.collectors.ConfigEvidence;
import com.acme.soc2.collectors.ConfigRulesEvidence;
import com.acme.soc2.collectors.GuardDutyEvidence;
import com.acme.soc2.collectors.IamEvidence;
import com.acme.soc2.collectors.InspectorEvidence;
import com.acme.soc2.collectors.KmsEvidence;
import com.acme.soc2.collectors.OrganizationsEvidence;
import com.acme.soc2.collectors.SecurityHubEvidence;
import com.acme.soc2.collectors.SsmEvidence;
import com.acme.soc2.collectors.VpcEvidence;
import com.acme.soc2.collectors.WafEvidence;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Every evidence source the scanner knows about. The key doubles as the cache key and as the
 * property name under a control result's {@code data}.
 */
public enum EvidenceSource {
    ACCESS_ANALYZER("access_analyzer", "Access Analyzer", AccessAnalyzerEvidence.class),
    BACKUP("backup", "AWS Backup", BackupEvidence.class),
    CLOUDTRAIL("cloudtrail", "CloudTrail", CloudTrailEvidence.class),
    CLOUDWATCH("cloudwatch", "CloudWatch", CloudWatchEvidence.class),
    CODEBUILD("codebuild", "CodeBuild", CodeBuildEvidence.class),
    CODEPIPELINE("codepipeline", "CodePipeline", CodePipelineEvidence.class),
    CONFIG("config", "AWS Config", ConfigEvidence.class),
    CONFIG_RULES("config_rules", "AWS Config", ConfigRulesEvidence.class),
    GUARDDUTY("guardduty", "GuardDuty", GuardDutyEvidence.class),
    IAM("iam", "IAM", IamEvidence.class),
    INSPECTOR("inspector", "Inspector", InspectorEvidence.class),
    KMS("kms", "KMS", KmsEvidence.class),
    ORGANIZATIONS("organizations", "Organizations", OrganizationsEvidence.class),
    SECURITYHUB("securityhub", "Security Hub", SecurityHubEvidence.class),
    SSM("ssm", "SSM", SsmEvidence.class),
    VPC("vpc", "VPC", VpcEvidence.class),
    WAF("waf", "WAF", WafEvidence.class);

    private final String key;
    private final String displayName;
    private final Class<? extends EvidenceRecord> recordType;

    EvidenceSource(String key, String displayName, Class<? extends EvidenceRecord> recordType) {
        this.key = key;
        this.displayName = displayName;
        this.recordType = recordType;
    }

    @JsonValue
    public String key() { return key; }

    public String displayName() { return displayName; }

    public Class<? extends EvidenceRecord> recordType() { return recordType; }

    /**
     * Sources describing organization-wide state. They are collected once against the base
     * session and shared with every scanned account.
     */
    public boolean organizationWide() { return this == ORGANIZATIONS; }
}
