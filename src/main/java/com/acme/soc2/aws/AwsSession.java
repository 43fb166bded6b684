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

import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.regions.Region;

import java.util.List;

/**
 * Credentials plus default region for one AWS account. Collectors obtain service clients through
 * {@link #client}, the orchestrator uses the identity, role and organization operations.
 *
 * <p>Every operation other than {@link #defaultRegion()} talks to AWS and may throw
 * {@link software.amazon.awssdk.core.exception.SdkException}.
 */
public interface AwsSession {

    /** Region configured for the session, or {@code null} when none could be resolved. */
    String defaultRegion();

    CallerIdentity callerIdentity();

    /** Returns a new session holding temporary credentials for {@code roleArn}. */
    AwsSession assumeRole(String roleArn, String sessionName, String externalId);

    /** All ACTIVE member accounts of the organization, following pagination. */
    List<OrganizationAccount> listActiveAccounts();

    <B extends AwsClientBuilder<B, C>, C> C client(B builder, Region region);
}
