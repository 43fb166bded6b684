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
import software.amazon.awssdk.services.securityhub.SecurityHubClient;
import software.amazon.awssdk.services.securityhub.model.DescribeHubRequest;
import software.amazon.awssdk.services.securityhub.model.DescribeHubResponse;
import software.amazon.awssdk.services.securityhub.model.ListEnabledProductsForImportRequest;
import software.amazon.awssdk.services.securityhub.model.ListEnabledProductsForImportResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * Security Hub enablement and product subscriptions per region. Consumed by CC3.
 */
public final class SecurityHubCollector implements Collector<SecurityHubEvidence> {
    static final String SERVICE = "securityhub";

    @Override
    public SecurityHubEvidence collect(AwsSession session, List<String> regions) {
        List<SecurityHubEvidence.Hub> hubs = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (String region : regions) {
            try (SecurityHubClient client = session.client(SecurityHubClient.builder(), Region.of(region))) {
                DescribeHubResponse hub = AwsCalls.safeCall(
                        () -> client.describeHub(DescribeHubRequest.builder().build()),
                        SERVICE, region, errors);
                if (hub == null) {
                    hubs.add(new SecurityHubEvidence.Hub(region, false, 0));
                    continue;
                }
                ListEnabledProductsForImportResponse products = AwsCalls.safeCall(
                        () -> client.listEnabledProductsForImport(ListEnabledProductsForImportRequest.builder().build()),
                        SERVICE, region, errors);
                hubs.add(new SecurityHubEvidence.Hub(region, true,
                        products == null ? 0 : products.productSubscriptions().size()));
            }
        }

        int enabled = (int) hubs.stream().filter(SecurityHubEvidence.Hub::enabled).count();
        return new SecurityHubEvidence(enabled, hubs, errors);
    }
}
