/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: SOC2 Evidence Scanner
 */

package com.acme.soc2.controls;

/**
 * Gap messages. Several controls share a check, so they share its wording, and report
 * recommendations are keyed on these exact strings.
 */
public final class Gaps {
    private Gaps() {}

    public static final String NOT_IMPLEMENTED = "No evidence collector implemented for this control.";

    public static final String NO_ORGANIZATION = "AWS Organizations is not enabled.";
    public static final String NO_SCPS = "No Service Control Policies detected.";
    public static final String NO_LOGGING_TRAILS = "No CloudTrail trails are actively logging.";
    public static final String NO_LOG_GROUPS = "No CloudWatch log groups detected.";
    public static final String NO_ALARMS = "No CloudWatch alarms detected.";
    public static final String NO_FLOW_LOGS = "No active VPC flow logs detected.";
    public static final String NO_SECURITY_HUB = "Security Hub is not enabled in the provided regions.";
    public static final String NO_GUARDDUTY = "GuardDuty is not enabled in the provided regions.";
    public static final String NO_INSPECTOR = "Inspector coverage not detected in the provided regions.";
    public static final String NO_CONFIG_RULES = "No AWS Config rules detected.";
    public static final String NONCOMPLIANT_CONFIG_RULES = "Non-compliant AWS Config rules detected.";
    public static final String NO_BACKUP_PLANS = "No AWS Backup plans detected.";
    public static final String NO_ROOT_MFA = "Root account MFA is not enabled.";
    public static final String NO_PASSWORD_POLICY = "IAM password policy is missing.";
    public static final String NO_ACCESS_ANALYZER = "No active IAM Access Analyzer found.";
    public static final String CONFIG_NOT_RECORDING = "AWS Config is not recording in any provided region.";
    public static final String NO_SSM_INSTANCES = "No SSM managed instances detected.";
    public static final String NO_CHANGE_PIPELINES = "No CodePipeline or CodeBuild projects detected.";
}
