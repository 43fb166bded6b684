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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.config.ConfigClient;
import software.amazon.awssdk.services.config.ConfigClientBuilder;
import software.amazon.awssdk.services.config.model.Compliance;
import software.amazon.awssdk.services.config.model.ComplianceByConfigRule;
import software.amazon.awssdk.services.config.model.ComplianceType;
import software.amazon.awssdk.services.config.model.ConfigRule;
import software.amazon.awssdk.services.config.model.ConfigRuleState;
import software.amazon.awssdk.services.config.model.DescribeComplianceByConfigRuleRequest;
import software.amazon.awssdk.services.config.model.DescribeComplianceByConfigRuleResponse;
import software.amazon.awssdk.services.config.model.DescribeConfigRulesRequest;
import software.amazon.awssdk.services.config.model.DescribeConfigRulesResponse;
import software.amazon.awssdk.services.config.paginators.DescribeConfigRulesIterable;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConfigRulesCollectorTest {

    @Mock private AwsSession session;
    @Mock private ConfigClient east;
    @Mock private ConfigClient west;

    private static List<ConfigRule> rules(int n) {
        List<ConfigRule> rules = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            rules.add(ConfigRule.builder().configRuleName(String.format("rule-%02d", i))
                    .configRuleState(ConfigRuleState.ACTIVE).build());
        }
        return rules;
    }

    /** Even-numbered rules are non-compliant. */
    private static DescribeComplianceByConfigRuleResponse complianceFor(DescribeComplianceByConfigRuleRequest req) {
        List<ComplianceByConfigRule> out = new ArrayList<>();
        for (String name : req.configRuleNames()) {
            int n = Integer.parseInt(name.substring("rule-".length()));
            ComplianceType type = n % 2 == 0 ? ComplianceType.NON_COMPLIANT : ComplianceType.COMPLIANT;
            out.add(ComplianceByConfigRule.builder().configRuleName(name)
                    .compliance(Compliance.builder().complianceType(type).build()).build());
        }
        return DescribeComplianceByConfigRuleResponse.builder().complianceByConfigRules(out).build();
    }

    private void serveRules(ConfigClient client, int n) {
        when(client.describeConfigRulesPaginator(any(DescribeConfigRulesRequest.class)))
                .thenAnswer(inv -> new DescribeConfigRulesIterable(client, inv.getArgument(0)));
        when(client.describeConfigRules(any(DescribeConfigRulesRequest.class)))
                .thenReturn(DescribeConfigRulesResponse.builder().configRules(rules(n)).build());
    }

    @Test
    void collect_moreRulesThanOneComplianceCall_queriesInBatchesOfTwentyFive() {
        when(session.client(any(ConfigClientBuilder.class), eq(Region.US_EAST_1))).thenReturn(east);
        serveRules(east, 30);
        List<Integer> batchSizes = new ArrayList<>();
        when(east.describeComplianceByConfigRule(any(DescribeComplianceByConfigRuleRequest.class))).thenAnswer(inv -> {
            DescribeComplianceByConfigRuleRequest req = inv.getArgument(0);
            batchSizes.add(req.configRuleNames().size());
            return complianceFor(req);
        });

        ConfigRulesEvidence evidence = new ConfigRulesCollector().collect(session, List.of("us-east-1"));

        assertThat(batchSizes).containsExactly(25, 5);
        assertThat(evidence.ruleCount()).isEqualTo(30);
        assertThat(evidence.noncompliantCount()).isEqualTo(15);
        assertThat(evidence.rulesSample()).hasSize(30);
        assertThat(evidence.rulesSample().get(29))
                .isEqualTo(new ConfigRulesEvidence.Rule("rule-29", "us-east-1", "ACTIVE", "COMPLIANT"));
        assertThat(evidence.errors()).isEmpty();
    }

    @Test
    void collect_failedBatchAndFailedRegion_keepRulesAndRecordErrors() {
        when(session.client(any(ConfigClientBuilder.class), eq(Region.US_EAST_1))).thenReturn(east);
        when(session.client(any(ConfigClientBuilder.class), eq(Region.EU_WEST_1))).thenReturn(west);
        serveRules(east, 30);
        when(east.describeComplianceByConfigRule(any(DescribeComplianceByConfigRuleRequest.class))).thenAnswer(inv -> {
            DescribeComplianceByConfigRuleRequest req = inv.getArgument(0);
            if (req.configRuleNames().contains("rule-25")) throw SdkClientException.create("Throttling");
            return complianceFor(req);
        });
        when(west.describeConfigRulesPaginator(any(DescribeConfigRulesRequest.class)))
                .thenThrow(SdkClientException.create("AccessDenied"));

        ConfigRulesEvidence evidence = new ConfigRulesCollector().collect(session, List.of("us-east-1", "eu-west-1"));

        assertThat(evidence.ruleCount()).isEqualTo(30);
        // rule-00 .. rule-24 evens only; the second batch has no compliance
        assertThat(evidence.noncompliantCount()).isEqualTo(13);
        assertThat(evidence.rulesSample().get(26).compliance()).isNull();
        assertThat(evidence.errors()).containsExactly("config:us-east-1: Throttling", "config:eu-west-1: AccessDenied");
    }

    @Test
    void collect_noRules_skipsComplianceCall() {
        when(session.client(any(ConfigClientBuilder.class), eq(Region.US_EAST_1))).thenReturn(east);
        serveRules(east, 0);

        ConfigRulesEvidence evidence = new ConfigRulesCollector().collect(session, List.of("us-east-1"));

        assertThat(evidence.ruleCount()).isZero();
        assertThat(evidence.errors()).isEmpty();
    }
}
