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
import software.amazon.awssdk.services.inspector2.Inspector2Client;
import software.amazon.awssdk.services.inspector2.model.ListCoverageRequest;
import software.amazon.awssdk.services.inspector2.model.ListCoverageResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * Inspector2 coverage per region, probed with a single small page. Consumed by CC3.
 */
public final class InspectorCollector implements Collector<InspectorEvidence> {
    static final String SERVICE = "inspector2";
    static final int PROBE_PAGE_SIZE = 10;

    @Override
    public InspectorEvidence collect(AwsSession session, List<String> regions) {
        List<InspectorEvidence.RegionCoverage> coverage = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (String region : regions) {
            try (Inspector2Client client = session.client(Inspector2Client.builder(), Region.of(region))) {
                ListCoverageResponse resp = AwsCalls.safeCall(
                        () -> client.listCoverage(ListCoverageRequest.builder().maxResults(PROBE_PAGE_SIZE).build()),
                        SERVICE, region, errors);
                int covered = resp == null ? 0 : resp.coveredResources().size();
                coverage.add(new InspectorEvidence.RegionCoverage(region, covered));
            }
        }

        int regionsCovered = (int) coverage.stream().filter(c -> c.coverageCount() > 0).count();
        return new InspectorEvidence(regionsCovered, coverage, errors);
    }
}
