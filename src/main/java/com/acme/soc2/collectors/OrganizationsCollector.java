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
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.organizations.OrganizationsClient;
import software.amazon.awssdk.services.organizations.model.AwsOrganizationsNotInUseException;
import software.amazon.awssdk.services.organizations.model.DescribeOrganizationRequest;
import software.amazon.awssdk.services.organizations.model.ListAccountsRequest;
import software.amazon.awssdk.services.organizations.model.ListAccountsResponse;
import software.amazon.awssdk.services.organizations.model.ListPoliciesRequest;
import software.amazon.awssdk.services.organizations.model.ListPoliciesResponse;
import software.amazon.awssdk.services.organizations.model.ListRootsRequest;
import software.amazon.awssdk.services.organizations.model.ListRootsResponse;
import software.amazon.awssdk.services.organizations.model.PolicyType;

import java.util.ArrayList;
import java.util.List;

/**
 * Organization presence, roots, service control policies and member accounts. Organization-wide
 * evidence: collected once per run against the base session. Consumed by CC1 and CC5.
 *
 * <p>An account that belongs to no organization yields {@code organizationPresent=false} with no
 * error, so CC1 reports it as a gap and fails. Callers that want a standalone account
 * routed to review rather than failure must treat that flag themselves; only a denied or failed
 * call lands in {@link OrganizationsEvidence#errors()}.
 */
public final class OrganizationsCollector implements Collector<OrganizationsEvidence> {
    static final String SERVICE = "organizations";

    @Override
    public OrganizationsEvidence collect(AwsSession session, List<String> regions) {
        List<String> errors = new ArrayList<>();

        try (OrganizationsClient client = session.client(OrganizationsClient.builder(), Region.AWS_GLOBAL)) {
            boolean present;
            try {
                client.describeOrganization(DescribeOrganizationRequest.builder().build());
                present = true;
            } catch (AwsOrganizationsNotInUseException e) {
                // not a member of any organization: nothing else to ask
                return new OrganizationsEvidence(false, 0, 0, 0, errors);
            } catch (SdkException e) {
                errors.add(AwsCalls.formatError(SERVICE, null, e.getMessage()));
                present = false;
            }

            ListRootsResponse roots = AwsCalls.safeCall(
                    () -> client.listRoots(ListRootsRequest.builder().build()), SERVICE, null, errors);
            ListPoliciesResponse policies = AwsCalls.safeCall(
                    () -> client.listPolicies(ListPoliciesRequest.builder().filter(PolicyType.SERVICE_CONTROL_POLICY).build()),
                    SERVICE, null, errors);
            ListAccountsResponse accounts = AwsCalls.safeCall(
                    () -> client.listAccounts(ListAccountsRequest.builder().build()), SERVICE, null, errors);

            return new OrganizationsEvidence(
                    present,
                    roots == null ? 0 : roots.roots().size(),
                    policies == null ? 0 : policies.policies().size(),
                    accounts == null ? 0 : accounts.accounts().size(),
                    errors);
        }
    }
}
