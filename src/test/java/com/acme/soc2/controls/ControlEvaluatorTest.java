/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: SOC2 Evidence Scanner
 */

package com.acme.soc2.controls;

import com.acme.soc2.evidence.CollectorSet;
import com.acme.soc2.evidence.EvidenceContext;
import com.acme.soc2.evidence.EvidenceSource;
import com.acme.soc2.evidence.Fixtures;
import com.acme.soc2.model.ControlResult;
import com.acme.soc2.model.ControlStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ControlEvaluatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    private final ControlEvaluator evaluator =
            new ControlEvaluator(ControlCatalogue.standard(), Clock.fixed(NOW, ZoneOffset.UTC));

    private static EvidenceContext context(Fixtures fixtures) {
        return new EvidenceContext("111111111111", null, List.of("us-east-1"), fixtures.collectors());
    }

    @Test
    void evaluate_cc1WithoutOrganizationOrLogging_failsWithThreeGaps() {
        Fixtures fixtures = new Fixtures()
                .with(EvidenceSource.ORGANIZATIONS, Fixtures.organizations(false, 0))
                .with(EvidenceSource.CLOUDTRAIL, Fixtures.trails(0));

        ControlResult result = evaluator.evaluate("CC1", context(fixtures));

        assertThat(result.status()).isEqualTo(ControlStatus.FAIL);
        assertThat(result.gaps()).containsExactly(
                "AWS Organizations is not enabled.",
                "No Service Control Policies detected.",
                "No CloudTrail trails are actively logging.");
        assertThat(result.errors()).isEmpty();
        assertThat(result.title()).isEqualTo("Control Environment");
        assertThat(result.evidenceSources()).containsExactly("Organizations", "CloudTrail");
        assertThat(result.data()).containsOnlyKeys("organizations", "cloudtrail");
        assertThat(result.collectedAt()).isEqualTo(NOW);
    }

    @Test
    void evaluate_cc1WithThrottledCloudTrail_needsReviewRegardlessOfGaps() {
        Fixtures fixtures = new Fixtures()
                .with(EvidenceSource.ORGANIZATIONS, Fixtures.organizations(false, 0))
                .with(EvidenceSource.CLOUDTRAIL, Fixtures.trails(0, "throttled"));

        ControlResult result = evaluator.evaluate("CC1", context(fixtures));

        assertThat(result.status()).isEqualTo(ControlStatus.NEEDS_REVIEW);
        assertThat(result.errors()).containsExactly("throttled");
        assertThat(result.gaps()).isNotEmpty();
    }

    @Test
    void evaluate_compliantEvidence_passes() {
        ControlResult result = evaluator.evaluate("CC6", context(new Fixtures()));

        assertThat(result.status()).isEqualTo(ControlStatus.PASS);
        assertThat(result.gaps()).isEmpty();
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void evaluate_unknownControl_isNotImplementedWithOneGap() {
        Fixtures fixtures = new Fixtures();

        ControlResult result = evaluator.evaluate("CC9", context(fixtures));

        assertThat(result.status()).isEqualTo(ControlStatus.NOT_IMPLEMENTED);
        assertThat(result.gaps()).containsExactly("No evidence collector implemented for this control.");
        assertThat(result.errors()).isEmpty();
        assertThat(result.data()).isEmpty();
        assertThat(result.evidenceSources()).isEmpty();
        for (EvidenceSource s : EvidenceSource.values()) assertThat(fixtures.calls(s)).isZero();
    }

    @Test
    void evaluate_errorsFromEverySourceAreConcatenatedInSourceOrder() {
        Fixtures fixtures = new Fixtures()
                .with(EvidenceSource.ORGANIZATIONS, Fixtures.organizations(true, 1, "organizations: AccessDenied"))
                .with(EvidenceSource.CLOUDTRAIL, Fixtures.trails(1, "cloudtrail:us-east-1: a", "cloudtrail:eu-west-1: b"));

        ControlResult result = evaluator.evaluate("CC1", context(fixtures));

        assertThat(result.errors()).containsExactly(
                "organizations: AccessDenied", "cloudtrail:us-east-1: a", "cloudtrail:eu-west-1: b");
    }

    @Test
    void evaluate_controlsSharingASourceCollectItOnce() {
        Fixtures fixtures = new Fixtures();
        EvidenceContext ctx = context(fixtures);

        for (String id : ControlCatalogue.DEFAULT_CONTROLS) evaluator.evaluate(id, ctx);

        assertThat(fixtures.calls(EvidenceSource.CLOUDTRAIL)).isEqualTo(1);
        assertThat(fixtures.calls(EvidenceSource.ORGANIZATIONS)).isEqualTo(1);
        assertThat(fixtures.calls(EvidenceSource.KMS)).isZero();
    }

    @Test
    void evaluate_controlThatThrows_isContainedAsNeedsReview() {
        Control broken = new Control() {
            @Override public String id() { return "CCX"; }
            @Override public String title() { return "Broken"; }
            @Override public List<EvidenceSource> sources() { return List.of(EvidenceSource.IAM); }
            @Override public ControlFindings evaluate(EvidenceContext ctx) { throw new IllegalStateException("bad data"); }
        };
        ControlEvaluator custom = new ControlEvaluator(ControlCatalogue.of(broken));

        ControlResult result = custom.evaluate("CCX", context(new Fixtures()));

        assertThat(result.status()).isEqualTo(ControlStatus.NEEDS_REVIEW);
        assertThat(result.errors()).containsExactly("Control 'CCX' failed: bad data");
    }

    @Test
    void evaluate_collectorThatThrows_isCalledOnceAcrossControls() {
        AtomicInteger trailCalls = new AtomicInteger();
        CollectorSet.Builder builder = CollectorSet.builder();
        Fixtures.compliant().forEach((source, record) -> builder.with(source, (session, regions) -> record));
        builder.with(EvidenceSource.CLOUDTRAIL, (session, regions) -> {
            trailCalls.incrementAndGet();
            throw new NullPointerException("trail model");
        });
        EvidenceContext ctx = new EvidenceContext("111111111111", null, List.of("us-east-1"), builder.build());

        List<ControlResult> results = new ArrayList<>();
        for (String id : ControlCatalogue.DEFAULT_CONTROLS) results.add(evaluator.evaluate(id, ctx));

        assertThat(trailCalls).hasValue(1);
        assertThat(results.get(0).status()).isEqualTo(ControlStatus.NEEDS_REVIEW);
        assertThat(results.get(0).errors()).containsExactly("Control 'CC1' failed: trail model");
        assertThat(results).filteredOn(r -> r.evidenceSources().contains("CloudTrail"))
                .hasSizeGreaterThan(1)
                .allSatisfy(r -> assertThat(r.status()).isEqualTo(ControlStatus.NEEDS_REVIEW));
    }
}
