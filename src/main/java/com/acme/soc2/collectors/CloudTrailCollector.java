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
import software.amazon.awssdk.services.cloudtrail.CloudTrailClient;
import software.amazon.awssdk.services.cloudtrail.model.DescribeTrailsRequest;
import software.amazon.awssdk.services.cloudtrail.model.DescribeTrailsResponse;
import software.amazon.awssdk.services.cloudtrail.model.GetTrailStatusRequest;
import software.amazon.awssdk.services.cloudtrail.model.GetTrailStatusResponse;
import software.amazon.awssdk.services.cloudtrail.model.Trail;

import java.util.ArrayList;
import java.util.List;

/**
 * CloudTrail trails and their logging status. Consumed by CC1, CC2, CC6, CC7 and CC8.
 */
public final class CloudTrailCollector implements Collector<CloudTrailEvidence> {
    static final String SERVICE = "cloudtrail";

    @Override
    public CloudTrailEvidence collect(AwsSession session, List<String> regions) {
        List<CloudTrailEvidence.Trail> trails = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (String region : regions) {
            try (CloudTrailClient client = session.client(CloudTrailClient.builder(), Region.of(region))) {
                DescribeTrailsResponse resp = AwsCalls.safeCall(
                        () -> client.describeTrails(DescribeTrailsRequest.builder().includeShadowTrails(true).build()),
                        SERVICE, region, errors);
                if (resp == null) continue;

                for (Trail t : resp.trailList()) {
                    String statusName = t.trailARN() != null ? t.trailARN() : t.name();
                    GetTrailStatusResponse status = AwsCalls.safeCall(
                            () -> client.getTrailStatus(GetTrailStatusRequest.builder().name(statusName).build()),
                            SERVICE, region, errors);
                    trails.add(new CloudTrailEvidence.Trail(
                            t.name(),
                            t.homeRegion(),
                            region,
                            t.isMultiRegionTrail(),
                            status == null ? null : status.isLogging(),
                            t.s3BucketName(),
                            t.cloudWatchLogsLogGroupArn()));
                }
            }
        }

        int multiRegion = (int) trails.stream().filter(t -> Boolean.TRUE.equals(t.multiRegion())).count();
        int logging = (int) trails.stream().filter(t -> Boolean.TRUE.equals(t.logging())).count();
        return new CloudTrailEvidence(trails.size(), multiRegion, logging, trails, errors);
    }
}
