/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: SOC2 Evidence Scanner
 */

package com.acme.soc2.aws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.regions.providers.DefaultAwsRegionProviderChain;
import software.amazon.awssdk.services.organizations.OrganizationsClient;
import software.amazon.awssdk.services.organizations.model.Account;
import software.amazon.awssdk.services.organizations.model.ListAccountsRequest;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.services.sts.model.Credentials;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityRequest;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link AwsSession} backed by the AWS SDK for Java v2.
 */
public final class SdkAwsSession implements AwsSession {
    private static final Logger log = LoggerFactory.getLogger(SdkAwsSession.class);

    private static final String STS_FALLBACK_REGION = "us-east-1";

    private final AwsCredentialsProvider credentials;
    private final String defaultRegion;

    SdkAwsSession(AwsCredentialsProvider credentials, String defaultRegion) {
        this.credentials = credentials;
        this.defaultRegion = defaultRegion;
    }

    /**
     * Session for a named profile (or the default provider chain when {@code profile} is blank).
     * {@code preferredRegion} wins over the region configured for the profile.
     */
    public static SdkAwsSession create(String profile, String preferredRegion) {
        boolean hasProfile = profile != null && !profile.isBlank();
        AwsCredentialsProvider provider = hasProfile
                ? ProfileCredentialsProvider.create(profile)
                : DefaultCredentialsProvider.create();
        String region = (preferredRegion != null && !preferredRegion.isBlank())
                ? preferredRegion
                : lookupRegion(hasProfile ? profile : null);
        return new SdkAwsSession(provider, region);
    }

    static String lookupRegion(String profile) {
        DefaultAwsRegionProviderChain.Builder chain = DefaultAwsRegionProviderChain.builder();
        if (profile != null) chain.profileName(profile);
        try {
            return chain.build().getRegion().id();
        } catch (SdkClientException e) {
            log.debug("No default region configured: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public String defaultRegion() { return defaultRegion; }

    @Override
    public CallerIdentity callerIdentity() {
        try (StsClient sts = client(StsClient.builder(), stsRegion())) {
            GetCallerIdentityResponse r = sts.getCallerIdentity(GetCallerIdentityRequest.builder().build());
            return new CallerIdentity(r.account(), r.arn());
        }
    }

    @Override
    public AwsSession assumeRole(String roleArn, String sessionName, String externalId) {
        AssumeRoleRequest.Builder req = AssumeRoleRequest.builder()
                .roleArn(roleArn)
                .roleSessionName(sessionName);
        if (externalId != null && !externalId.isBlank()) req.externalId(externalId);

        try (StsClient sts = client(StsClient.builder(), stsRegion())) {
            Credentials c = sts.assumeRole(req.build()).credentials();
            AwsSessionCredentials temporary = AwsSessionCredentials.create(
                    c.accessKeyId(), c.secretAccessKey(), c.sessionToken());
            return new SdkAwsSession(StaticCredentialsProvider.create(temporary), defaultRegion);
        }
    }

    @Override
    public List<OrganizationAccount> listActiveAccounts() {
        List<OrganizationAccount> out = new ArrayList<>();
        try (OrganizationsClient org = client(OrganizationsClient.builder(), Region.AWS_GLOBAL)) {
            for (Account a : org.listAccountsPaginator(ListAccountsRequest.builder().build()).accounts()) {
                if ("ACTIVE".equals(a.statusAsString())) out.add(new OrganizationAccount(a.id(), a.name()));
            }
        }
        return out;
    }

    @Override
    public <B extends AwsClientBuilder<B, C>, C> C client(B builder, Region region) {
        return builder.credentialsProvider(credentials).region(region).build();
    }

    private Region stsRegion() {
        return Region.of(defaultRegion != null ? defaultRegion : STS_FALLBACK_REGION);
    }
}
