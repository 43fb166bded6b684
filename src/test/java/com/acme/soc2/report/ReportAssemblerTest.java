/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: SOC2 Evidence Scanner
 */

package com.acme.soc2.report;

import com.acme.soc2.controls.Gaps;
import com.acme.soc2.evidence.EvidenceRecord;
import com.acme.soc2.evidence.Fixtures;
import com.acme.soc2.model.AccountResult;
import com.acme.soc2.model.ControlResult;
import com.acme.soc2.model.ControlStatus;
import com.acme.soc2.model.RunPayload;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportAssemblerTest {

    private static final Instant AT = Instant.parse("2026-03-01T10:15:30Z");

    @TempDir
    Path dir;

    private final ReportAssembler assembler = new ReportAssembler();

    static RunPayload payload() {
        ControlResult cc1 = new ControlResult("CC1", "Control Environment", ControlStatus.FAIL,
                List.of("Organizations", "CloudTrail"), AT,
                List.of(Gaps.NO_ORGANIZATION, Gaps.NO_SCPS), List.of(),
                Map.of("organizations", Fixtures.organizations(false, 0), "cloudtrail", Fixtures.trails(1)));
        ControlResult cc6 = new ControlResult("CC6", "Logical and Physical Access", ControlStatus.NEEDS_REVIEW,
                List.of("IAM"), AT, List.of(), List.of("iam: AccessDenied for GetAccountSummary"), Map.of());
        List<AccountResult> accounts = List.of(
                new AccountResult("111", "Management", "arn:aws:iam::111:user/auditor", null, List.of(cc1, cc6)),
                AccountResult.unreachable("222", null, "AssumeRole arn:aws:iam::222:role/OrganizationAccountAccessRole failed: AccessDenied"));
        return new RunPayload("20260301T101530Z", AT, List.of("CC1", "CC6"), List.of("us-east-1"),
                "111", "arn:aws:iam::111:user/auditor", null, null, accounts, RunSummary.of(accounts));
    }

    @Test
    void assemble_writesThreeArtifactsWithVerifiableHashes() {
        List<Path> written = assembler.assemble(payload(), dir.resolve("run"));

        assertThat(written).extracting(p -> p.getFileName().toString()).containsExactly(
                "evidence.json", "evidence.json.sha256",
                "evidence_summary.csv", "evidence_summary.csv.sha256",
                "evidence_report.md", "evidence_report.md.sha256");
        for (String name : List.of(ReportAssembler.EVIDENCE_JSON, ReportAssembler.SUMMARY_CSV, ReportAssembler.REPORT_MD)) {
            assertThat(ReportAssembler.verify(dir.resolve("run").resolve(name))).as(name).isTrue();
        }
    }

    @Test
    void assemble_unserializableEvidence_failsAsWriteErrorBeforeWritingArtifacts() {
        ControlResult broken = new ControlResult("CC6", "Logical and Physical Access", ControlStatus.PASS,
                List.of("IAM"), AT, List.of(), List.of(), Map.of("iam", new UnreadableEvidence()));
        List<AccountResult> accounts = List.of(new AccountResult("111", null, null, null, List.of(broken)));
        RunPayload payload = new RunPayload("20260301T101530Z", AT, List.of("CC6"), List.of("us-east-1"),
                "111", null, null, null, accounts, RunSummary.of(accounts));

        assertThatThrownBy(() -> assembler.assemble(payload, dir))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("20260301T101530Z");
        assertThat(dir.resolve(ReportAssembler.EVIDENCE_JSON)).doesNotExist();
    }

    @Test
    void verify_detectsTampering() throws Exception {
        assembler.assemble(payload(), dir);
        Path json = dir.resolve(ReportAssembler.EVIDENCE_JSON);

        Files.writeString(json, Files.readString(json).replace("fail", "pass"));

        assertThat(ReportAssembler.verify(json)).isFalse();
    }

    @Test
    void verify_missingHashFile_fails() throws Exception {
        Path lone = Files.writeString(dir.resolve("lone.json"), "{}");

        assertThat(ReportAssembler.verify(lone)).isFalse();
    }

    @Test
    void canonicalJson_isByteIdenticalForSamePayload() {
        assertThat(assembler.canonicalJson(payload())).isEqualTo(assembler.canonicalJson(payload()));
    }

    @Test
    void canonicalJson_usesSnakeCaseSortedKeysAndIsoTimestamps() throws Exception {
        String json = new String(assembler.canonicalJson(payload()), StandardCharsets.UTF_8);
        JsonNode root = new ObjectMapper().readTree(json);

        assertThat(json).endsWith("}\n");
        assertThat(root.get("run_id").asText()).isEqualTo("20260301T101530Z");
        assertThat(root.get("generated_at").asText()).isEqualTo("2026-03-01T10:15:30Z");
        assertThat(root.get("summary").get("complete").asBoolean()).isFalse();

        JsonNode cc1 = root.get("accounts").get(0).get("evidence").get(0);
        assertThat(cc1.get("status").asText()).isEqualTo("fail");
        assertThat(cc1.get("data").get("organizations").get("organization_present").asBoolean()).isFalse();
        assertThat(cc1.get("data").fieldNames()).toIterable().containsExactly("cloudtrail", "organizations");
        List<String> rootFields = new ArrayList<>();
        root.fieldNames().forEachRemaining(rootFields::add);
        assertThat(rootFields).isSorted().contains("accounts", "organization_error", "summary");
    }

    @Test
    void summaryCsv_hasOneRowPerControlAndOneForUnreachableAccount() throws Exception {
        byte[] csv = assembler.summaryCsv(payload());

        List<Map<String, String>> rows;
        try (MappingIterator<Map<String, String>> it = new CsvMapper()
                .readerFor(Map.class)
                .with(CsvSchema.emptySchema().withHeader())
                .readValues(csv)) {
            rows = it.readAll();
        }

        assertThat(rows).hasSize(3);
        assertThat(rows.get(0).keySet()).containsExactly(
                "account_id", "account_name", "control_id", "title", "status", "gap_count", "error_count", "non_compliant");
        assertThat(rows.get(0)).containsEntry("control_id", "CC1").containsEntry("title", "Control Environment")
                .containsEntry("status", "fail").containsEntry("gap_count", "2").containsEntry("non_compliant", "1");
        assertThat(rows.get(1)).containsEntry("status", "needs_review").containsEntry("error_count", "1")
                .containsEntry("non_compliant", "0");
        assertThat(rows.get(2)).containsEntry("account_id", "222").containsEntry("control_id", "")
                .containsEntry("status", "not_assessed");
    }

    @Test
    void narrative_listsGapsErrorsAndRecommendations() {
        String md = assembler.narrative(payload());

        assertThat(md).startsWith("# SOC 2 Evidence Report\n");
        assertThat(md).contains("- Run ID: 20260301T101530Z");
        assertThat(md).contains("Run status: incomplete");
        assertThat(md).contains("## Account 111 (Management)");
        assertThat(md).contains("| CC1 | Control Environment | fail | 2 | 0 |");
        assertThat(md).contains("- " + Gaps.NO_ORGANIZATION + "\n  - Recommendation: " + Recommendations.forGap(Gaps.NO_ORGANIZATION));
        assertThat(md).contains("- iam: AccessDenied for GetAccountSummary\n  - Recommendation: Grant the scanning role");
        assertThat(md).contains("## Account 222\n\nNot assessed: AssumeRole");
    }

    static final class UnreadableEvidence implements EvidenceRecord {
        @Override
        public List<String> errors() { return List.of(); }

        public String getDetail() { throw new IllegalStateException("detail unavailable"); }
    }
}
