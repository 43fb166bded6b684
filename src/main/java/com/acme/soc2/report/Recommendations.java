/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: SOC2 Evidence Scanner
 */

package com.acme.soc2.report;

import com.acme.soc2.controls.Gaps;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Human-facing advice for gaps and collection errors. Pure data: extend the tables, not the
 * controls.
 */
public final class Recommendations {
    private Recommendations() {}

    static final String GENERIC_GAP =
            "Review this gap with the control owner and record either the remediation or an accepted risk.";
    static final String GENERIC_ERROR =
            "Evidence could not be collected. Rerun with credentials that can read this service, or review the control manually.";

    private static final Map<String, String> BY_GAP = Map.ofEntries(
            entry(Gaps.NOT_IMPLEMENTED, "Collect evidence for this control manually until automated coverage exists."),
            entry(Gaps.NO_ORGANIZATION, "Create an AWS Organization and move workload accounts under it for central governance."),
            entry(Gaps.NO_SCPS, "Attach Service Control Policies that enforce guardrails such as region and root-user restrictions."),
            entry(Gaps.NO_LOGGING_TRAILS, "Create a multi-region CloudTrail trail with logging enabled and log file validation turned on."),
            entry(Gaps.NO_LOG_GROUPS, "Send application and infrastructure logs to CloudWatch Logs with a defined retention period."),
            entry(Gaps.NO_ALARMS, "Define CloudWatch alarms for security and availability metrics and route them to an on-call channel."),
            entry(Gaps.NO_FLOW_LOGS, "Enable VPC flow logs on production VPCs and retain them centrally."),
            entry(Gaps.NO_SECURITY_HUB, "Enable Security Hub with the AWS Foundational Security Best Practices standard in every scanned region."),
            entry(Gaps.NO_GUARDDUTY, "Enable GuardDuty in every scanned region, ideally through a delegated administrator account."),
            entry(Gaps.NO_INSPECTOR, "Activate Amazon Inspector scanning for EC2, ECR and Lambda workloads."),
            entry(Gaps.NO_CONFIG_RULES, "Deploy AWS Config rules or a conformance pack that covers the SOC 2 control set."),
            entry(Gaps.NONCOMPLIANT_CONFIG_RULES, "Remediate the non-compliant AWS Config rules or document approved exceptions."),
            entry(Gaps.NO_BACKUP_PLANS, "Create AWS Backup plans for production data stores and test restores periodically."),
            entry(Gaps.NO_ROOT_MFA, "Enable MFA on the root user and lock its credentials away."),
            entry(Gaps.NO_PASSWORD_POLICY, "Set an IAM account password policy with length, complexity and rotation requirements."),
            entry(Gaps.NO_ACCESS_ANALYZER, "Create an IAM Access Analyzer for the account or organization and review its findings."),
            entry(Gaps.CONFIG_NOT_RECORDING, "Turn on the AWS Config recorder with a delivery channel in every scanned region."),
            entry(Gaps.NO_SSM_INSTANCES, "Register instances with Systems Manager so patching and inventory are managed centrally."),
            entry(Gaps.NO_CHANGE_PIPELINES, "Route production changes through CodePipeline or CodeBuild so they are reviewed and traceable.")
    );

    // matched case-insensitively as substrings, first hit wins
    private static final List<Map.Entry<String, String>> BY_ERROR_PATTERN = List.of(
            entry("accessdenied", "Grant the scanning role read-only access to this service (for example the SecurityAudit managed policy)."),
            entry("access denied", "Grant the scanning role read-only access to this service (for example the SecurityAudit managed policy)."),
            entry("not authorized", "Grant the scanning role read-only access to this service (for example the SecurityAudit managed policy)."),
            entry("throttl", "The API throttled the scan. Rerun later or scan fewer regions at a time."),
            entry("rate exceeded", "The API throttled the scan. Rerun later or scan fewer regions at a time."),
            entry("subscriptionrequired", "The service is not enabled in this account or region. Enable it or record why it is out of scope."),
            entry("optinrequired", "The region is not opted in. Opt in or remove it from the scanned regions."),
            entry("not subscribed", "The service is not enabled in this account or region. Enable it or record why it is out of scope."),
            entry("unable to load credentials", "Configure credentials for the scanner (profile, environment or instance role).")
    );

    public static String forGap(String gap) {
        return BY_GAP.getOrDefault(gap, GENERIC_GAP);
    }

    public static String forError(String error) {
        if (error == null) return GENERIC_ERROR;
        String lower = error.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> e : BY_ERROR_PATTERN) {
            if (lower.contains(e.getKey())) return e.getValue();
        }
        return GENERIC_ERROR;
    }
}
