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
import software.amazon.awssdk.services.config.model.ConfigurationRecorder;
import software.amazon.awssdk.services.config.model.ConfigurationRecorderStatus;
import software.amazon.awssdk.services.config.model.DescribeConfigurationRecorderStatusRequest;
import software.amazon.awssdk.services.config.model.DescribeConfigurationRecorderStatusResponse;
import software.amazon.awssdk.services.config.model.DescribeConfigurationRecordersRequest;
import software.amazon.awssdk.services.config.model.DescribeConfigurationRecordersResponse;
import software.amazon.awssdk.services.config.model.DescribeDeliveryChannelsRequest;
import software.amazon.awssdk.services.config.model.DescribeDeliveryChannelsResponse;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * AWS Config recorders, their recording status and delivery channels. Consumed by CC7.
 */
public final class ConfigCollector implements Collector<ConfigEvidence> {
    static final String SERVICE = "config";

    @Override
    public ConfigEvidence collect(AwsSession session, List<String> regions) {
        List<ConfigEvidence.Recorder> recorders = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (String region : regions) {
            try (ConfigClient client = session.client(ConfigClient.builder(), Region.of(region))) {
                DescribeConfigurationRecordersResponse recs = AwsCalls.safeCall(
                        () -> client.describeConfigurationRecorders(DescribeConfigurationRecordersRequest.builder().build()),
                        SERVICE, region, errors);
                DescribeConfigurationRecorderStatusResponse statuses = AwsCalls.safeCall(
                        () -> client.describeConfigurationRecorderStatus(DescribeConfigurationRecorderStatusRequest.builder().build()),
                        SERVICE, region, errors);
                DescribeDeliveryChannelsResponse channels = AwsCalls.safeCall(
                        () -> client.describeDeliveryChannels(DescribeDeliveryChannelsRequest.builder().build()),
                        SERVICE, region, errors);
                if (recs == null) continue;

                Map<String, ConfigurationRecorderStatus> statusByName = new HashMap<>();
                if (statuses != null) {
                    for (ConfigurationRecorderStatus s : statuses.configurationRecordersStatus()) statusByName.put(s.name(), s);
                }
                int channelCount = channels == null ? 0 : channels.deliveryChannels().size();

                for (ConfigurationRecorder r : recs.configurationRecorders()) {
                    ConfigurationRecorderStatus s = statusByName.get(r.name());
                    recorders.add(new ConfigEvidence.Recorder(
                            r.name(),
                            region,
                            s == null ? null : s.recording(),
                            s == null ? null : s.lastStatusAsString(),
                            channelCount));
                }
            }
        }

        int recording = (int) recorders.stream().filter(r -> Boolean.TRUE.equals(r.recording())).count();
        return new ConfigEvidence(recorders.size(), recording, recorders, errors);
    }
}
