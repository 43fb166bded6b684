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
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.DescribeAlarmsRequest;
import software.amazon.awssdk.services.cloudwatch.model.MetricAlarm;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.DescribeLogGroupsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.LogGroup;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * CloudWatch metric alarms and log groups. Consumed by CC2 and CC4.
 */
public final class CloudWatchCollector implements Collector<CloudWatchEvidence> {
    static final String SERVICE = "cloudwatch";
    static final String LOGS_SERVICE = "cloudwatch-logs";
    static final int SAMPLE_LIMIT = 25;

    @Override
    public CloudWatchEvidence collect(AwsSession session, List<String> regions) {
        List<CloudWatchEvidence.Alarm> alarms = new ArrayList<>();
        List<CloudWatchEvidence.LogGroup> logGroups = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (String region : regions) {
            try (CloudWatchClient client = session.client(CloudWatchClient.builder(), Region.of(region))) {
                List<MetricAlarm> found = AwsCalls.safeCall(
                        () -> client.describeAlarmsPaginator(DescribeAlarmsRequest.builder().build())
                                .metricAlarms().stream().collect(Collectors.toList()),
                        SERVICE, region, errors);
                if (found != null) {
                    for (MetricAlarm a : found) alarms.add(new CloudWatchEvidence.Alarm(a.alarmName(), region, a.stateValueAsString()));
                }
            }

            try (CloudWatchLogsClient logs = session.client(CloudWatchLogsClient.builder(), Region.of(region))) {
                List<LogGroup> found = AwsCalls.safeCall(
                        () -> logs.describeLogGroupsPaginator(DescribeLogGroupsRequest.builder().build())
                                .logGroups().stream().collect(Collectors.toList()),
                        LOGS_SERVICE, region, errors);
                if (found != null) {
                    for (LogGroup g : found) logGroups.add(new CloudWatchEvidence.LogGroup(g.logGroupName(), region, g.retentionInDays()));
                }
            }
        }

        return new CloudWatchEvidence(alarms.size(), logGroups.size(),
                AwsCalls.sample(alarms, SAMPLE_LIMIT), AwsCalls.sample(logGroups, SAMPLE_LIMIT), errors);
    }
}
