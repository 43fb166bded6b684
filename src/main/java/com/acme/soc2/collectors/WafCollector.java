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
import software.amazon.awssdk.services.wafv2.Wafv2Client;
import software.amazon.awssdk.services.wafv2.model.ListWebAcLsRequest;
import software.amazon.awssdk.services.wafv2.model.ListWebAcLsResponse;
import software.amazon.awssdk.services.wafv2.model.Scope;
import software.amazon.awssdk.services.wafv2.model.WebACLSummary;

import java.util.ArrayList;
import java.util.List;

/**
 * Regional WAFv2 web ACLs.
 */
public final class WafCollector implements Collector<WafEvidence> {
    static final String SERVICE = "wafv2";
    static final int SAMPLE_LIMIT = 25;

    @Override
    public WafEvidence collect(AwsSession session, List<String> regions) {
        List<WafEvidence.WebAcl> acls = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (String region : regions) {
            try (Wafv2Client client = session.client(Wafv2Client.builder(), Region.of(region))) {
                ListWebAcLsResponse resp = AwsCalls.safeCall(
                        () -> client.listWebACLs(ListWebAcLsRequest.builder().scope(Scope.REGIONAL).build()),
                        SERVICE, region, errors);
                if (resp == null) continue;
                for (WebACLSummary acl : resp.webACLs()) acls.add(new WafEvidence.WebAcl(acl.name(), acl.id(), region));
            }
        }

        return new WafEvidence(acls.size(), AwsCalls.sample(acls, SAMPLE_LIMIT), errors);
    }
}
