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
import software.amazon.awssdk.services.accessanalyzer.AccessAnalyzerClient;
import software.amazon.awssdk.services.accessanalyzer.model.AnalyzerSummary;
import software.amazon.awssdk.services.accessanalyzer.model.ListAnalyzersRequest;
import software.amazon.awssdk.services.accessanalyzer.model.ListAnalyzersResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * Account-scoped IAM Access Analyzers. Consumed by CC6.
 */
public final class AccessAnalyzerCollector implements Collector<AccessAnalyzerEvidence> {
    static final String SERVICE = "accessanalyzer";

    @Override
    public AccessAnalyzerEvidence collect(AwsSession session, List<String> regions) {
        List<AccessAnalyzerEvidence.Analyzer> analyzers = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (String region : regions) {
            try (AccessAnalyzerClient client = session.client(AccessAnalyzerClient.builder(), Region.of(region))) {
                ListAnalyzersResponse resp = AwsCalls.safeCall(
                        () -> client.listAnalyzers(ListAnalyzersRequest.builder().type("ACCOUNT").build()),
                        SERVICE, region, errors);
                if (resp == null) continue;
                for (AnalyzerSummary a : resp.analyzers()) {
                    analyzers.add(new AccessAnalyzerEvidence.Analyzer(a.name(), region, a.statusAsString(), a.typeAsString()));
                }
            }
        }

        int active = (int) analyzers.stream().filter(a -> "ACTIVE".equals(a.status())).count();
        return new AccessAnalyzerEvidence(analyzers.size(), active, analyzers, errors);
    }
}
