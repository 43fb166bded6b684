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

import com.acme.soc2.evidence.EvidenceContext;
import com.acme.soc2.evidence.EvidenceSource;
import com.acme.soc2.model.ControlResult;
import com.acme.soc2.model.ControlStatus;
import com.acme.soc2.util.StatusUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one control against an account's evidence context and stamps the result.
 */
public final class ControlEvaluator {
    private static final Logger log = LoggerFactory.getLogger(ControlEvaluator.class);

    private final ControlCatalogue catalogue;
    private final Clock clock;

    public ControlEvaluator(ControlCatalogue catalogue) {
        this(catalogue, Clock.systemUTC());
    }

    public ControlEvaluator(ControlCatalogue catalogue, Clock clock) {
        this.catalogue = catalogue;
        this.clock = clock;
    }

    public ControlResult evaluate(String controlId, EvidenceContext ctx) {
        Optional<Control> found = catalogue.find(controlId);
        if (found.isEmpty()) {
            log.info("Control {} is not implemented", controlId);
            return new ControlResult(controlId, null, ControlStatus.NOT_IMPLEMENTED, List.of(), clock.instant(),
                    List.of(Gaps.NOT_IMPLEMENTED), List.of(), Map.of());
        }

        Control control = found.get();
        ControlFindings findings;
        try {
            findings = control.evaluate(ctx);
        } catch (RuntimeException e) {
            log.warn("Control {} failed for account {}", controlId, ctx.accountId, e);
            findings = new ControlFindings();
            findings.addError("Control '" + controlId + "' failed: " + e.getMessage());
        }

        ControlStatus status = StatusUtil.statusFromFindings(findings.gaps(), findings.errors());
        log.info("Account {} control {}: {} ({} gap(s), {} error(s))",
                ctx.accountId, controlId, status, findings.gaps().size(), findings.errors().size());

        return new ControlResult(
                controlId,
                control.title(),
                status,
                control.sources().stream().map(EvidenceSource::displayName).toList(),
                clock.instant(),
                findings.gaps(),
                findings.errors(),
                findings.data());
    }
}
