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
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.iam.model.GetAccountPasswordPolicyRequest;
import software.amazon.awssdk.services.iam.model.GetAccountSummaryRequest;
import software.amazon.awssdk.services.iam.model.GetAccountSummaryResponse;
import software.amazon.awssdk.services.iam.model.ListUsersRequest;
import software.amazon.awssdk.services.iam.model.NoSuchEntityException;

import java.util.ArrayList;
import java.util.List;

/**
 * Root MFA, account password policy and user count. IAM is global, regions are ignored.
 * Consumed by CC6.
 *
 * <p>A missing password policy ({@code NoSuchEntity}) is recorded as
 * {@code passwordPolicyPresent=false} rather than as an error. CC6 therefore fails on it instead
 * of asking for review. Any other failure of the policy call is an error.
 */
public final class IamCollector implements Collector<IamEvidence> {
    static final String SERVICE = "iam";

    @Override
    public IamEvidence collect(AwsSession session, List<String> regions) {
        List<String> errors = new ArrayList<>();

        try (IamClient client = session.client(IamClient.builder(), Region.AWS_GLOBAL)) {
            GetAccountSummaryResponse summary = AwsCalls.safeCall(
                    () -> client.getAccountSummary(GetAccountSummaryRequest.builder().build()),
                    SERVICE, null, errors);
            boolean rootMfa = summary != null
                    && summary.summaryMapAsStrings().getOrDefault("AccountMFAEnabled", 0) == 1;

            // no password policy is reported as NoSuchEntity, which is a finding rather than an error
            boolean policyPresent;
            try {
                client.getAccountPasswordPolicy(GetAccountPasswordPolicyRequest.builder().build());
                policyPresent = true;
            } catch (NoSuchEntityException e) {
                policyPresent = false;
            } catch (SdkException e) {
                errors.add(AwsCalls.formatError(SERVICE, null, e.getMessage()));
                policyPresent = false;
            }

            Integer users = AwsCalls.safeCall(
                    () -> (int) client.listUsersPaginator(ListUsersRequest.builder().build()).users().stream().count(),
                    SERVICE, null, errors);

            return new IamEvidence(rootMfa, policyPresent, users == null ? 0 : users, errors);
        }
    }
}
