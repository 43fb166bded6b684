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

import com.acme.soc2.collectors.BackupEvidence;
import com.acme.soc2.collectors.ConfigRulesEvidence;
import com.acme.soc2.collectors.OrganizationsEvidence;
import com.acme.soc2.evidence.EvidenceContext;
import com.acme.soc2.evidence.EvidenceSource;

import java.util.List;

import static com.acme.soc2.evidence.EvidenceSource.BACKUP;
import static com.acme.soc2.evidence.EvidenceSource.CONFIG_RULES;
import static com.acme.soc2.evidence.EvidenceSource.ORGANIZATIONS;

/**
 * CC5: control activities that mitigate risks.
 */
public final class ControlActivitiesControl implements Control {
    @Override public String id() { return "CC5"; }
    @Override public String title() { return "Control Activities"; }
    @Override public List<EvidenceSource> sources() { return List.of(BACKUP, ORGANIZATIONS, CONFIG_RULES); }

    @Override
    public ControlFindings evaluate(EvidenceContext ctx) {
        ControlFindings out = new ControlFindings();
        BackupEvidence backup = out.use(ctx, BACKUP, BackupEvidence.class);
        OrganizationsEvidence org = out.use(ctx, ORGANIZATIONS, OrganizationsEvidence.class);
        ConfigRulesEvidence rules = out.use(ctx, CONFIG_RULES, ConfigRulesEvidence.class);

        out.gapIf(backup.backupPlanCount() == 0, Gaps.NO_BACKUP_PLANS);
        out.gapIf(org.scpCount() == 0, Gaps.NO_SCPS);
        out.gapIf(rules.ruleCount() == 0, Gaps.NO_CONFIG_RULES);
        return out;
    }
}
