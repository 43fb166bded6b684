/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: SOC2 Evidence Scanner
 */

package com.acme.soc2.evidence;

import com.acme.soc2.aws.AwsSession;

import java.util.List;

/**
 * Evidence scope for one account pass: the account's session, the regions to scan and the
 * cache every control of the pass reads through.
 */
public final class EvidenceContext {
    public final String accountId;
    public final AwsSession session;
    public final List<String> regions;

    private final CollectorSet collectors;
    private final EvidenceCache cache = new EvidenceCache();

    public EvidenceContext(String accountId, AwsSession session, List<String> regions, CollectorSet collectors) {
        this.accountId = accountId;
        this.session = session;
        this.regions = List.copyOf(regions);
        this.collectors = collectors;
    }

    /** Cached record for {@code source}, collecting it on first use. */
    public <R extends EvidenceRecord> R evidence(EvidenceSource source, Class<R> type) {
        return cache.getOrCollect(source, type, () -> collectors.get(source).collect(session, regions));
    }

    public EvidenceCache cache() { return cache; }
}
