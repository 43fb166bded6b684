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
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeFlowLogsRequest;
import software.amazon.awssdk.services.ec2.model.FlowLog;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * VPC flow logs. Consumed by CC2.
 */
public final class VpcCollector implements Collector<VpcEvidence> {
    static final String SERVICE = "ec2";
    static final int SAMPLE_LIMIT = 25;

    @Override
    public VpcEvidence collect(AwsSession session, List<String> regions) {
        List<VpcEvidence.FlowLogEntry> flowLogs = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (String region : regions) {
            try (Ec2Client client = session.client(Ec2Client.builder(), Region.of(region))) {
                List<FlowLog> found = AwsCalls.safeCall(
                        () -> client.describeFlowLogsPaginator(DescribeFlowLogsRequest.builder().build())
                                .flowLogs().stream().collect(Collectors.toList()),
                        SERVICE, region, errors);
                if (found == null) continue;
                for (FlowLog f : found) {
                    flowLogs.add(new VpcEvidence.FlowLogEntry(f.flowLogId(), f.resourceId(), region, f.flowLogStatus()));
                }
            }
        }

        int active = (int) flowLogs.stream().filter(f -> "ACTIVE".equals(f.logStatus())).count();
        return new VpcEvidence(flowLogs.size(), active, AwsCalls.sample(flowLogs, SAMPLE_LIMIT), errors);
    }
}
