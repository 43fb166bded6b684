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
import software.amazon.awssdk.services.guardduty.GuardDutyClient;
import software.amazon.awssdk.services.guardduty.GuardDutyClientBuilder;
import software.amazon.awssdk.services.guardduty.model.DetectorStatus;
import software.amazon.awssdk.services.guardduty.model.FindingPublishingFrequency;
import software.amazon.awssdk.services.guardduty.model.GetDetectorRequest;
import software.amazon.awssdk.services.guardduty.model.GetDetectorResponse;
import software.amazon.awssdk.services.guardduty.model.ListDetectorsRequest;
import software.amazon.awssdk.services.guardduty.model.ListDetectorsResponse;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GuardDutyCollectorTest {

    @Mock private AwsSession session;
    @Mock private GuardDutyClient east;
    @Mock private GuardDutyClient west;

    @Test
    void collect_countsEnabledDetectorsAndKeepsUndescribedOnes() {
        when(session.client(any(GuardDutyClientBuilder.class), eq(Region.US_EAST_1))).thenReturn(east);
        when(east.listDetectors(any(ListDetectorsRequest.class)))
                .thenReturn(ListDetectorsResponse.builder().detectorIds("d-enabled", "d-hidden").build());
        when(east.getDetector(any(GetDetectorRequest.class))).thenAnswer(inv -> {
            GetDetectorRequest req = inv.getArgument(0);
            if (req.detectorId().equals("d-hidden")) throw SdkClientException.create("AccessDenied");
            return GetDetectorResponse.builder().status(DetectorStatus.ENABLED)
                    .findingPublishingFrequency(FindingPublishingFrequency.SIX_HOURS).build();
        });

        GuardDutyEvidence evidence = new GuardDutyCollector().collect(session, List.of("us-east-1"));

        assertThat(evidence.detectorCount()).isEqualTo(2);
        assertThat(evidence.enabledDetectorCount()).isEqualTo(1);
        assertThat(evidence.detectors()).containsExactly(
                new GuardDutyEvidence.Detector("d-enabled", "us-east-1", "ENABLED", "SIX_HOURS"),
                new GuardDutyEvidence.Detector("d-hidden", "us-east-1", null, null));
        assertThat(evidence.errors()).containsExactly("guardduty:us-east-1: AccessDenied");
    }

    @Test
    void collect_listingFails_recordsRegionalError() {
        when(session.client(any(GuardDutyClientBuilder.class), eq(Region.US_EAST_1))).thenReturn(east);
        when(session.client(any(GuardDutyClientBuilder.class), eq(Region.EU_WEST_1))).thenReturn(west);
        when(east.listDetectors(any(ListDetectorsRequest.class))).thenReturn(ListDetectorsResponse.builder().build());
        when(west.listDetectors(any(ListDetectorsRequest.class))).thenThrow(SdkClientException.create("Rate exceeded"));

        GuardDutyEvidence evidence = new GuardDutyCollector().collect(session, List.of("us-east-1", "eu-west-1"));

        assertThat(evidence.detectorCount()).isZero();
        assertThat(evidence.errors()).containsExactly("guardduty:eu-west-1: Rate exceeded");
    }
}
