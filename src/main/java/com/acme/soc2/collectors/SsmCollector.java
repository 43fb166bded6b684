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
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.DescribeInstanceInformationRequest;
import software.amazon.awssdk.services.ssm.model.InstanceInformation;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * SSM managed instances. Consumed by CC7.
 */
public final class SsmCollector implements Collector<SsmEvidence> {
    static final String SERVICE = "ssm";
    static final int SAMPLE_LIMIT = 25;

    @Override
    public SsmEvidence collect(AwsSession session, List<String> regions) {
        List<SsmEvidence.Instance> instances = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (String region : regions) {
            try (SsmClient client = session.client(SsmClient.builder(), Region.of(region))) {
                List<InstanceInformation> found = AwsCalls.safeCall(
                        () -> client.describeInstanceInformationPaginator(DescribeInstanceInformationRequest.builder().build())
                                .instanceInformationList().stream().collect(Collectors.toList()),
                        SERVICE, region, errors);
                if (found == null) continue;
                for (InstanceInformation i : found) {
                    instances.add(new SsmEvidence.Instance(i.instanceId(), region, i.pingStatusAsString(), i.platformName()));
                }
            }
        }

        int online = (int) instances.stream().filter(i -> "Online".equals(i.pingStatus())).count();
        return new SsmEvidence(instances.size(), online, AwsCalls.sample(instances, SAMPLE_LIMIT), errors);
    }
}
