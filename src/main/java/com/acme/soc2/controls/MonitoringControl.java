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

import com.acme.soc2.collectors.CloudWatchEvidence;
import com.acme.soc2.collectors.ConfigRulesEvidence;
import com.acme.soc2.evidence.EvidenceContext;
import com.acme.soc2.evidence.EvidenceSource;

import java.util.List;

import static com.acme.soc2.evidence.EvidenceSource.CLOUDWATCH;
import static com.acme.soc2.evidence.EvidenceSource.CONFIG_RULES;

/**
 * CC4: monitoring activities.
 */
public final class MonitoringControl implements Control {
    @Override public String id() { return "CC4"; }
    @Override public String title() { return "Monitoring Activities"; }
    @Override public List<EvidenceSource> sources() { return List.of(CONFIG_RULES, CLOUDWATCH); }

    @Override
    public ControlFindings evaluate(EvidenceContext ctx) {
        ControlFindings out = new ControlFindings();
        ConfigRulesEvidence rules = out.use(ctx, CONFIG_RULES, ConfigRulesEvidence.class);
        CloudWatchEvidence cw = out.use(ctx, CLOUDWATCH, CloudWatchEvidence.class);

        out.gapIf(rules.ruleCount() == 0, Gaps.NO_CONFIG_RULES);
        out.gapIf(rules.noncompliantCount() > 0, Gaps.NONCOMPLIANT_CONFIG_RULES);
        out.gapIf(cw.alarmCount() == 0, Gaps.NO_ALARMS);
        return out;
    }
}
