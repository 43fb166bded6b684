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

import com.acme.soc2.model.AccountResult;
import com.acme.soc2.model.ControlResult;
import com.acme.soc2.model.ControlStatus;
import com.acme.soc2.model.RunPayload;
import com.acme.soc2.util.FsUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a run payload into the on-disk artifacts of a run directory: canonical evidence JSON,
 * a per-control CSV summary and a Markdown narrative, each with a {@code .sha256} sidecar.
 *
 * <p>All three renderings are pure functions of the payload, so the same payload always produces
 * byte-identical files.
 */
public final class ReportAssembler {
    private static final Logger log = LoggerFactory.getLogger(ReportAssembler.class);

    public static final String EVIDENCE_JSON = "evidence.json";
    public static final String SUMMARY_CSV = "evidence_summary.csv";
    public static final String REPORT_MD = "evidence_report.md";

    static final String NOT_ASSESSED = "not_assessed";

    private static final ObjectWriter JSON = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .build()
            .writer(new DefaultPrettyPrinter()
                    .withObjectIndenter(new DefaultIndenter("  ", "\n"))
                    .withArrayIndenter(new DefaultIndenter("  ", "\n")));

    private static final CsvMapper CSV = new CsvMapper();
    private static final CsvSchema CSV_SCHEMA = CSV.schemaFor(SummaryRow.class).withHeader().withLineSeparator("\n");

    /**
     * Writes every artifact into {@code runDir} (created if needed) and returns the written paths,
     * each artifact followed by its hash file.
     */
    public List<Path> assemble(RunPayload payload, Path runDir) {
        FsUtil.ensureDir(runDir);

        Map<String, byte[]> artifacts = new LinkedHashMap<>();
        artifacts.put(EVIDENCE_JSON, canonicalJson(payload));
        artifacts.put(SUMMARY_CSV, summaryCsv(payload));
        artifacts.put(REPORT_MD, narrative(payload).getBytes(StandardCharsets.UTF_8));

        List<Path> written = new ArrayList<>();
        for (Map.Entry<String, byte[]> e : artifacts.entrySet()) {
            Path file = FsUtil.write(runDir.resolve(e.getKey()), e.getValue());
            written.add(file);
            written.add(FsUtil.writeHashFile(file));
        }
        log.info("Wrote {} artifact(s) to {}", written.size(), runDir);
        return written;
    }

    public byte[] canonicalJson(RunPayload payload) {
        try {
            return (JSON.writeValueAsString(payload) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize run " + payload.runId(), e);
        }
    }

    public byte[] summaryCsv(RunPayload payload) {
        try {
            return CSV.writer(CSV_SCHEMA).writeValueAsBytes(summaryRows(payload));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot write CSV summary for run " + payload.runId(), e);
        }
    }

    static List<SummaryRow> summaryRows(RunPayload payload) {
        List<SummaryRow> rows = new ArrayList<>();
        for (AccountResult account : payload.accounts()) {
            if (!account.assessed()) {
                rows.add(new SummaryRow(account.accountId(), account.accountName(), null, null, NOT_ASSESSED, 0, 1, 0));
                continue;
            }
            for (ControlResult c : account.evidence()) {
                rows.add(new SummaryRow(
                        account.accountId(),
                        account.accountName(),
                        c.controlId(),
                        c.title(),
                        c.status().value(),
                        c.gaps().size(),
                        c.errors().size(),
                        c.status() == ControlStatus.FAIL ? 1 : 0));
            }
        }
        return rows;
    }

    public String narrative(RunPayload payload) {
        StringBuilder md = new StringBuilder();
        md.append("# SOC 2 Evidence Report\n\n");
        md.append("- Run ID: ").append(payload.runId()).append('\n');
        md.append("- Generated at: ").append(payload.generatedAt()).append('\n');
        md.append("- Scanning account: ").append(orUnknown(payload.accountId()));
        if (payload.callerArn() != null) md.append(" (").append(payload.callerArn()).append(')');
        md.append('\n');
        md.append("- Regions: ").append(String.join(", ", payload.regions())).append('\n');
        md.append("- Controls: ").append(String.join(", ", payload.controls())).append('\n');
        if (payload.identityError() != null) {
            md.append("\n> Caller identity could not be resolved: ").append(oneLine(payload.identityError())).append('\n');
        }
        if (payload.organizationError() != null) {
            md.append("\n> Organization accounts could not be listed: ").append(oneLine(payload.organizationError())).append('\n');
        }

        RunSummary s = payload.summary();
        md.append("\n## Summary\n\n");
        md.append("| Accounts | Not assessed | Results | Pass | Fail | Needs review | Not implemented |\n");
        md.append("|---|---|---|---|---|---|---|\n");
        md.append("| ").append(s.accountCount())
                .append(" | ").append(s.unreachableAccountCount())
                .append(" | ").append(s.controlResultCount())
                .append(" | ").append(s.passCount())
                .append(" | ").append(s.failCount())
                .append(" | ").append(s.needsReviewCount())
                .append(" | ").append(s.notImplementedCount())
                .append(" |\n\n");
        md.append(s.complete()
                ? "Run status: complete. Every account was assessed and every control reached a verdict.\n"
                : "Run status: incomplete. Some accounts or controls need manual review.\n");

        for (AccountResult account : payload.accounts()) appendAccount(md, account);
        return md.toString();
    }

    private static void appendAccount(StringBuilder md, AccountResult account) {
        md.append("\n## Account ").append(orUnknown(account.accountId()));
        if (account.accountName() != null) md.append(" (").append(cell(account.accountName())).append(')');
        md.append("\n\n");

        if (!account.assessed()) {
            md.append("Not assessed: ").append(oneLine(account.identityError())).append("\n\n");
            md.append("Recommendation: ").append(Recommendations.forError(account.identityError())).append('\n');
            return;
        }
        if (account.identityError() != null) {
            md.append("> Identity could not be confirmed: ").append(oneLine(account.identityError())).append("\n\n");
        }

        md.append("| Control | Title | Status | Gaps | Errors |\n");
        md.append("|---|---|---|---|---|\n");
        for (ControlResult c : account.evidence()) {
            md.append("| ").append(c.controlId())
                    .append(" | ").append(cell(c.title()))
                    .append(" | ").append(c.status())
                    .append(" | ").append(c.gaps().size())
                    .append(" | ").append(c.errors().size())
                    .append(" |\n");
        }

        for (ControlResult c : account.evidence()) {
            if (c.gaps().isEmpty() && c.errors().isEmpty()) continue;
            md.append("\n### ").append(c.controlId());
            if (c.title() != null) md.append(' ').append(c.title());
            md.append(": ").append(c.status()).append('\n');
            if (!c.gaps().isEmpty()) {
                md.append("\nGaps:\n");
                for (String gap : c.gaps()) {
                    md.append("- ").append(gap).append("\n  - Recommendation: ").append(Recommendations.forGap(gap)).append('\n');
                }
            }
            if (!c.errors().isEmpty()) {
                md.append("\nErrors:\n");
                for (String error : c.errors()) {
                    md.append("- ").append(oneLine(error)).append("\n  - Recommendation: ")
                            .append(Recommendations.forError(error)).append('\n');
                }
            }
        }
    }

    /**
     * True when {@code artifact}'s current bytes still match the digest recorded in its
     * {@code .sha256} file. A missing hash file fails verification.
     */
    public static boolean verify(Path artifact) {
        Path hashFile = FsUtil.hashFileFor(artifact);
        if (!Files.exists(hashFile) || !Files.exists(artifact)) return false;

        String line;
        try {
            line = Files.readString(hashFile, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + hashFile, e);
        }
        int sep = line.indexOf("  ");
        if (sep < 0) return false;
        String expected = line.substring(0, sep);
        String name = line.substring(sep + 2);
        return name.equals(artifact.getFileName().toString()) && expected.equalsIgnoreCase(FsUtil.sha256(artifact));
    }

    private static String orUnknown(String s) { return s == null ? "unknown" : s; }

    private static String oneLine(String s) {
        return s == null ? "" : s.replace('\r', ' ').replace('\n', ' ');
    }

    private static String cell(String s) {
        return s == null ? "" : oneLine(s).replace("|", "\\|");
    }
}
