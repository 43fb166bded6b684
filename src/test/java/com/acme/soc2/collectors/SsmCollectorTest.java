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
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.SsmClientBuilder;
import software.amazon.awssdk.services.ssm.model.DescribeInstanceInformationRequest;
import software.amazon.awssdk.services.ssm.model.DescribeInstanceInformationResponse;
import software.amazon.awssdk.services.ssm.model.InstanceInformation;
import software.amazon.awssdk.services.ssm.model.PingStatus;
import software.amazon.awssdk.services.ssm.paginators.DescribeInstanceInformationIterable;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SsmCollectorTest {

    @Mock private AwsSession session;
    @Mock private SsmClient east;
    @Mock private SsmClient west;

    private void serveInstances(SsmClient client, List<InstanceInformation> instances) {
        when(client.describeInstanceInformationPaginator(any(DescribeInstanceInformationRequest.class)))
                .thenAnswer(inv -> new DescribeInstanceInformationIterable(client, inv.getArgument(0)));
        when(client.describeInstanceInformation(any(DescribeInstanceInformationRequest.class)))
                .thenReturn(DescribeInstanceInformationResponse.builder().instanceInformationList(instances).build());
    }

    @Test
    void collect_countsOnlineInstancesAndRecordsRegionalError() {
        when(session.client(any(SsmClientBuilder.class), eq(Region.US_EAST_1))).thenReturn(east);
        when(session.client(any(SsmClientBuilder.class), eq(Region.EU_WEST_1))).thenReturn(west);
        serveInstances(east, List.of(
                InstanceInformation.builder().instanceId("i-1").pingStatus(PingStatus.ONLINE).platformName("Amazon Linux").build(),
                InstanceInformation.builder().instanceId("i-2").pingStatus(PingStatus.CONNECTION_LOST).platformName("Ubuntu").build()));
        when(west.describeInstanceInformationPaginator(any(DescribeInstanceInformationRequest.class)))
                .thenThrow(SdkClientException.create("AccessDenied"));

        SsmEvidence evidence = new SsmCollector().collect(session, List.of("us-east-1", "eu-west-1"));

        assertThat(evidence.managedInstanceCount()).isEqualTo(2);
        assertThat(evidence.onlineInstanceCount()).isEqualTo(1);
        assertThat(evidence.instancesSample()).containsExactly(
                new SsmEvidence.Instance("i-1", "us-east-1", "Online", "Amazon Linux"),
                new SsmEvidence.Instance("i-2", "us-east-1", "ConnectionLost", "Ubuntu"));
        assertThat(evidence.errors()).containsExactly("ssm:eu-west-1: AccessDenied");
    }

    @Test
    void collect_sampleIsCappedButCountsCoverEveryInstance() {
        when(session.client(any(SsmClientBuilder.class), eq(Region.US_EAST_1))).thenReturn(east);
        List<InstanceInformation> fleet = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            fleet.add(InstanceInformation.builder().instanceId("i-" + i).pingStatus(PingStatus.ONLINE).build());
        }
        serveInstances(east, fleet);

        SsmEvidence evidence = new SsmCollector().collect(session, List.of("us-east-1"));

        assertThat(evidence.managedInstanceCount()).isEqualTo(30);
        assertThat(evidence.onlineInstanceCount()).isEqualTo(30);
        assertThat(evidence.instancesSample()).hasSize(SsmCollector.SAMPLE_LIMIT);
        assertThat(evidence.instancesSample().get(0).instanceId()).isEqualTo("i-0");
    }
}
