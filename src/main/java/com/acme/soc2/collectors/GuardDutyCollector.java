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
import software.amazon.awssdk.services.guardduty.GuardDutyClient;
import software.amazon.awssdk.services.guardduty.model.GetDetectorRequest;
import software.amazon.awssdk.services.guardduty.model.GetDetectorResponse;
import software.amazon.awssdk.services.guardduty.model.ListDetectorsRequest;
import software.amazon.awssdk.services.guardduty.model.ListDetectorsResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * GuardDuty detectors. Consumed by CC3.
 */
public final class GuardDutyCollector implements Collector<GuardDutyEvidence> {
    static final String SERVICE = "guardduty";

    @Override
    public GuardDutyEvidence collect(AwsSession session, List<String> regions) {
        List<GuardDutyEvidence.Detector> detectors = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (String region : regions) {
            try (GuardDutyClient client = session.client(GuardDutyClient.builder(), Region.of(region))) {
                ListDetectorsResponse resp = AwsCalls.safeCall(
                        () -> client.listDetectors(ListDetectorsRequest.builder().build()),
                        SERVICE, region, errors);
                if (resp == null) continue;

                for (String id : resp.detectorIds()) {
                    GetDetectorResponse d = AwsCalls.safeCall(
                            () -> client.getDetector(GetDetectorRequest.builder().detectorId(id).build()),
                            SERVICE, region, errors);
                    detectors.add(new GuardDutyEvidence.Detector(
                            id,
                            region,
                            d == null ? null : d.statusAsString(),
                            d == null ? null : d.findingPublishingFrequencyAsString()));
                }
            }
        }

        int enabled = (int) detectors.stream().filter(d -> "ENABLED".equals(d.status())).count();
        return new GuardDutyEvidence(detectors.size(), enabled, detectors, errors);
    }
}
