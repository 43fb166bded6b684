/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: SOC2 Evidence Scanner
 */

package com.acme.soc2.collectors;

import com.acme.soc2.aws.AwsSession;
import com.acme.soc2.evidence.Collector;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.config.ConfigClient;
import software.amazon.awssdk.services.config.model.ComplianceByConfigRule;
import software.amazon.awssdk.services.config.model.ConfigRule;
import software.amazon.awssdk.services.config.model.DescribeComplianceByConfigRuleRequest;
import software.amazon.awssdk.services.config.model.DescribeComplianceByConfigRuleResponse;
import software.amazon.awssdk.services.config.model.DescribeConfigRulesRequest;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * AWS Config rules with their compliance state. Consumed by CC4 and CC5.
 */
public final class ConfigRulesCollector implements Collector<ConfigRulesEvidence> {
    static final String SERVICE = "config";
    static final int SAMPLE_LIMIT = 50;
    // DescribeComplianceByConfigRule accepts at most 25 rule names per call
    static final int COMPLIANCE_BATCH = 25;

    @Override
    public ConfigRulesEvidence collect(AwsSession session, List<String> regions) {
        List<ConfigRulesEvidence.Rule> rules = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (String region : regions) {
            try (ConfigClient client = session.client(ConfigClient.builder(), Region.of(region))) {
                List<ConfigRule> found = AwsCalls.safeCall(
                        () -> client.describeConfigRulesPaginator(DescribeConfigRulesRequest.builder().build())
                                .configRules().stream().collect(Collectors.toList()),
                        SERVICE, region, errors);
                if (found == null || found.isEmpty()) continue;

                List<String> names = found.stream().map(ConfigRule::configRuleName)
                        .filter(n -> n != null && !n.isBlank()).collect(Collectors.toList());
                Map<String, String> compliance = new HashMap<>();
                for (int start = 0; start < names.size(); start += COMPLIANCE_BATCH) {
                    List<String> batch = names.subList(start, Math.min(start + COMPLIANCE_BATCH, names.size()));
                    DescribeComplianceByConfigRuleResponse resp = AwsCalls.safeCall(
                            () -> client.describeComplianceByConfigRule(
                                    DescribeComplianceByConfigRuleRequest.builder().configRuleNames(batch).build()),
                            SERVICE, region, errors);
                    if (resp == null) continue;
                    for (ComplianceByConfigRule c : resp.complianceByConfigRules()) {
                        compliance.put(c.configRuleName(), c.compliance() == null ? null : c.compliance().complianceTypeAsString());
                    }
                }

                for (ConfigRule r : found) {
                    rules.add(new ConfigRulesEvidence.Rule(r.configRuleName(), region,
                            r.configRuleStateAsString(), compliance.get(r.configRuleName())));
                }
            }
        }

        int noncompliant = (int) rules.stream().filter(r -> "NON_COMPLIANT".equals(r.compliance())).count();
        return new ConfigRulesEvidence(rules.size(), noncompliant, AwsCalls.sample(rules, SAMPLE_LIMIT), errors);
    }
}
