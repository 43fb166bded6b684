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

import com.acme.soc2.evidence.EvidenceSource;

import java.util.*;
import java.util.function.Predicate;

/**
 * Immutable table of controls by id. Built once at startup and handed to the evaluator and
 * orchestrator; tests build their own with {@link #of(Control...)}.
 */
public final class ControlCatalogue {

    public static final List<String> DEFAULT_CONTROLS = List.of("CC1", "CC2", "CC3", "CC4", "CC5", "CC6", "CC7", "CC8");

    private final Map<String, Control> controls;

    private ControlCatalogue(Map<String, Control> controls) {
        this.controls = Collections.unmodifiableMap(controls);
    }

    public static ControlCatalogue standard() {
        return of(
                new ControlEnvironmentControl(),
                new CommunicationControl(),
                new RiskAssessmentControl(),
                new MonitoringControl(),
                new ControlActivitiesControl(),
                new LogicalAccessControl(),
                new SystemOperationsControl(),
                new ChangeManagementControl()
        );
    }

    public static ControlCatalogue of(Control... controls) {
        Map<String, Control> byId = new LinkedHashMap<>();
        for (Control c : controls) {
            if (byId.putIfAbsent(c.id(), c) != null) {
                throw new IllegalArgumentException("Duplicate control id: " + c.id());
            }
        }
        return new ControlCatalogue(byId);
    }

    public Optional<Control> find(String controlId) { return Optional.ofNullable(controls.get(controlId)); }

    public Set<String> ids() { return controls.keySet(); }

    /** Sources declared by any of {@code controlIds} that match {@code filter}, in declaration order. */
    public Set<EvidenceSource> declaredSources(Collection<String> controlIds, Predicate<EvidenceSource> filter) {
        Set<EvidenceSource> out = new LinkedHashSet<>();
        for (String id : controlIds) {
            Control c = controls.get(id);
            if (c == null) continue;
            for (EvidenceSource s : c.sources()) if (filter.test(s)) out.add(s);
        }
        return out;
    }
}
