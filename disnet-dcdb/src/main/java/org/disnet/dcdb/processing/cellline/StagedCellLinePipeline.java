package org.disnet.dcdb.processing.cellline;

/*
 * This file is part of DISNET DCDB.
 *
 * Copyright (C) 2025 DISNET
 *
 * DISNET DCDB is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * DISNET DCDB is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with DISNET DCDB.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.disnet.dcdb.api.CellosaurusClient;
import org.disnet.dcdb.api.CellosaurusClient.CellosaurusEntry;
import org.disnet.dcdb.api.DrugCombDbClient;
import org.disnet.dcdb.api.DrugCombDbClient.CellLineInfo;
import org.disnet.dcdb.api.UmlsClient;
import org.disnet.dcdb.api.UmlsClient.UmlsConcept;
import org.disnet.dcdb.om.CellLine;
import org.disnet.dcdb.om.Disease;
import org.disnet.dcdb.processing.persist.CellLineRepository;
import org.disnet.dcdb.processing.persist.PersistenceException;
import org.disnet.dcdb.processing.support.PipelineSettings;
import org.disnet.dcdb.processing.support.RunSummary;
import org.disnet.dcdb.staging.CellLineStage;
import org.disnet.dcdb.staging.CellLineStagingDao;
import org.disnet.dcdb.staging.LocalMirror;
import org.disnet.dcdb.staging.StagedCellLine;
import org.disnet.dcdb.util.Logger;

/**
 * Resolves cell line names to Cellosaurus accessions and UMLS diseases through
 * {@code staging_cell_lines}.
 *
 * <pre>
 *  0 PENDING ──stage1 (COSMIC fast path)──────────────────────▶ 2 DISEASE_FOUND
 *  0 PENDING ──stage1 (DrugCombDB fallback)──▶ 1 ACCESSION_FOUND ──stage2──▶ 2
 *  2 DISEASE_FOUND ──stage3 (UMLS)──▶ 3 MAPPED
 *  any non-terminal ──▶ -1 FAILED
 * </pre>
 *
 * A cell line with no disease, or whose NCIt code has no UMLS concept, still
 * reaches MAPPED with a null CUI. Only service errors fail a row at stage 2 or 3.
 */
public class StagedCellLinePipeline {

    private final CellLineStagingDao staging;
    private final LocalMirror mirror;
    private final DrugCombDbClient dcdb;
    private final CellosaurusClient cellosaurus;
    private final UmlsClient umls;
    private final CellLineRepository cellLines;
    private final int cellosaurusSourceId;
    private final PipelineSettings settings;

    public StagedCellLinePipeline(CellLineStagingDao staging,
                                  LocalMirror mirror,
                                  DrugCombDbClient dcdb,
                                  CellosaurusClient cellosaurus,
                                  UmlsClient umls,
                                  CellLineRepository cellLines,
                                  int cellosaurusSourceId,
                                  PipelineSettings settings) {
        this.staging = staging;
        this.mirror = mirror;
        this.dcdb = dcdb;
        this.cellosaurus = cellosaurus;
        this.umls = umls;
        this.cellLines = cellLines;
        this.cellosaurusSourceId = cellosaurusSourceId;
        this.settings = settings;
    }

    public RunSummary run(Collection<String> names) throws SQLException {
        Logger.info("Cell line pipeline: {} names", names.size());
        stage0(names);
        stage1();
        stage2();
        stage3();
        RunSummary persisted = persist();
        Map<CellLineStage, Integer> counts = staging.countByStatus();
        Logger.info("Cell line staging status: {}", counts);
        return persisted;
    }

    public int stage0(Collection<String> names) throws SQLException {
        int inserted = staging.stage0(names);
        Logger.info("Cell line stage 0: {} new of {} names", inserted, names.size());
        return inserted;
    }

    /**
     * PENDING → DISEASE_FOUND through the COSMIC fast path when Cellosaurus
     * returns accession, site and disease at once; otherwise → ACCESSION_FOUND
     * through whatever accession was found, falling back to DrugCombDB unless
     * in local mode.
     */
    public RunSummary stage1() throws SQLException {
        return runStage(CellLineStage.PENDING, "Cell line stage 1", row -> {
            Optional<String> cosmicId = mirror.findCosmicId(row.getOriginalName());
            if (cosmicId.isPresent()) {
                CellosaurusEntry entry = cellosaurus.findByCosmicId(cosmicId.get());
                if (entry != null && entry.getAccession() != null) {
                    row.setCellosaurusAccession(entry.getAccession());
                    row.setTissue(entry.getSite());
                    if (entry.isComplete()) {
                        row.setNcitCode(entry.getNcitCode());
                        row.advance(CellLineStage.DISEASE_FOUND);
                    } else {
                        row.advance(CellLineStage.ACCESSION_FOUND);
                    }
                    return;
                }
            }

            if (settings.isLocalMode()) {
                CellLineErrorCode code = cosmicId.isPresent() ? CellLineErrorCode.NO_ACCESSION : CellLineErrorCode.NOT_IN_LOCAL_MIRROR;
                row.fail(code.getCode(), code.getReason());
                return;
            }

            CellLineInfo info = dcdb.getCellLine(row.getOriginalName());
            if (info == null || info.getAccession() == null) {
                row.fail(CellLineErrorCode.NO_ACCESSION.getCode(), CellLineErrorCode.NO_ACCESSION.getReason());
                return;
            }
            row.setCellosaurusAccession(info.getAccession());
            row.setTissue(info.getTissue());
            row.advance(CellLineStage.ACCESSION_FOUND);
        });
    }

    /** ACCESSION_FOUND → DISEASE_FOUND: NCIt code from Cellosaurus (may be absent). */
    public RunSummary stage2() throws SQLException {
        return runStage(CellLineStage.ACCESSION_FOUND, "Cell line stage 2", row -> {
            row.setNcitCode(cellosaurus.getDiseaseAccession(row.getCellosaurusAccession()));
            row.advance(CellLineStage.DISEASE_FOUND);
        });
    }

    /** DISEASE_FOUND → MAPPED: UMLS CUI and disease name for the NCIt code, if any. */
    public RunSummary stage3() throws SQLException {
        return runStage(CellLineStage.DISEASE_FOUND, "Cell line stage 3", row -> {
            if (row.getNcitCode() != null) {
                UmlsConcept concept = umls.ncitToCui(row.getNcitCode());
                if (concept != null) {
                    row.setUmlsCui(concept.getCui());
                    row.setDiseaseName(concept.getName());
                }
            }
            row.advance(CellLineStage.MAPPED);
        });
    }

    /** Write every MAPPED row: disease first, then the cell line. */
    public RunSummary persist() throws SQLException {
        RunSummary summary = new RunSummary("Cell line persist");
        String after = null;
        while (true) {
            List<StagedCellLine> page = staging.selectPage(CellLineStage.MAPPED, after, settings.getPersistBatchSize());
            if (page.isEmpty()) break;
            for (StagedCellLine row : page) {
                try {
                    cellLines.save(toCellLine(row), toDisease(row));
                    summary.success();
                } catch (PersistenceException | IllegalArgumentException ex) {
                    summary.failure();
                    Logger.error("Unable to persist cell line '{}': {}", row.getOriginalName(), ex.getMessage());
                }
            }
            after = page.get(page.size() - 1).getOriginalName();
        }
        summary.log();
        return summary;
    }

    CellLine toCellLine(StagedCellLine row) {
        return new CellLine(row.getCellosaurusAccession(), cellosaurusSourceId, row.getOriginalName(),
                row.getUmlsCui(), row.getTissue());
    }

    static Disease toDisease(StagedCellLine row) {
        return row.getUmlsCui() == null ? null : new Disease(row.getUmlsCui(), row.getDiseaseName());
    }

    // -------------------------------------------------------------------------

    @FunctionalInterface
    interface RowStep {
        void apply(StagedCellLine row) throws Exception;
    }

    private RunSummary runStage(CellLineStage from, String label, RowStep step) throws SQLException {
        RunSummary summary = new RunSummary(label);
        while (true) {
            List<StagedCellLine> batch = staging.selectBatch(from, settings.getStageBatchSize());
            if (batch.isEmpty()) break;

            for (StagedCellLine row : batch) {
                try {
                    step.apply(row);
                } catch (Exception ex) {
                    Logger.warn("{}: '{}' failed: {}", label, row.getOriginalName(), ex.toString());
                    if (row.getStatus() == from) {
                        row.fail(null, ex.toString());
                    }
                }
                if (row.getStatus() == CellLineStage.FAILED) summary.failure();
                else summary.success();
            }
            staging.update(from, batch);
        }
        summary.log();
        return summary;
    }
}
