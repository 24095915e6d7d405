package org.disnet.dcdb.processing;

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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.disnet.dcdb.om.CombinationRecord;
import org.disnet.dcdb.om.DrugNames;
import org.disnet.dcdb.processing.cellline.StagedCellLinePipeline;
import org.disnet.dcdb.processing.drug.StagedDrugPipeline;
import org.disnet.dcdb.processing.experiment.ExperimentAssembler;
import org.disnet.dcdb.processing.persist.PersistenceException;
import org.disnet.dcdb.processing.score.ScoreClassification;
import org.disnet.dcdb.processing.score.ScoreClassifier;
import org.disnet.dcdb.processing.support.RunSummary;
import org.disnet.dcdb.processing.support.SkipAuditLog;
import org.disnet.dcdb.staging.CellLineStagingDao;
import org.disnet.dcdb.staging.DrugStagingDao;
import org.disnet.dcdb.staging.LocalMirror;
import org.disnet.dcdb.staging.StagedCellLine;
import org.disnet.dcdb.staging.StagedDrug;
import org.disnet.dcdb.util.Logger;

/**
 * Batch mode over the local mirror.
 * <ol>
 * <li>Read every pending combination.</li>
 * <li>Collect the unique drug and cell line names, so an entity shared by many
 * combinations is resolved once.</li>
 * <li>Run both staged pipelines to completion.</li>
 * <li>Join each combination back to the staging results; skip (and audit) it if
 * any entity is unresolved, otherwise classify its scores and persist the
 * experiment.</li>
 * <li>Mark the mirror row {@code processed} or {@code error} so a re-run picks up
 * only what is left.</li>
 * </ol>
 * Skipped rows stay {@code pending}.
 */
public class BatchIntegrationPipeline {

    private final LocalMirror mirror;
    private final DrugStagingDao drugStaging;
    private final CellLineStagingDao cellLineStaging;
    private final StagedDrugPipeline drugPipeline;
    private final StagedCellLinePipeline cellLinePipeline;
    private final ScoreClassifier classifier;
    private final ExperimentAssembler assembler;
    private final SkipAuditLog audit;

    public BatchIntegrationPipeline(LocalMirror mirror,
                                    DrugStagingDao drugStaging,
                                    CellLineStagingDao cellLineStaging,
                                    StagedDrugPipeline drugPipeline,
                                    StagedCellLinePipeline cellLinePipeline,
                                    ScoreClassifier classifier,
                                    ExperimentAssembler assembler,
                                    SkipAuditLog audit) {
        this.mirror = mirror;
        this.drugStaging = drugStaging;
        this.cellLineStaging = cellLineStaging;
        this.drugPipeline = drugPipeline;
        this.cellLinePipeline = cellLinePipeline;
        this.classifier = classifier;
        this.assembler = assembler;
        this.audit = audit;
    }

    public RunSummary run() throws SQLException {
        Logger.info("--- Batch integration started ---");
        List<CombinationRecord> combinations = mirror.pendingCombinations();
        Logger.info("{} pending combinations", combinations.size());

        Set<String> drugNames = new LinkedHashSet<>();
        Set<String> cellLineNames = new LinkedHashSet<>();
        for (CombinationRecord c : combinations) {
            if (c.getDrug1() != null) drugNames.add(DrugNames.normalize(c.getDrug1()));
            if (c.getDrug2() != null) drugNames.add(DrugNames.normalize(c.getDrug2()));
            if (c.getCellLine() != null) cellLineNames.add(c.getCellLine());
        }

        drugPipeline.run(drugNames);
        cellLinePipeline.run(cellLineNames);

        RunSummary summary = persistExperiments(combinations);
        summary.log();
        Logger.info("--- Batch integration completed ---");
        return summary;
    }

    RunSummary persistExperiments(List<CombinationRecord> combinations) throws SQLException {
        Map<String, String> drugMap = drugStaging.fetchedChemblIds();
        Map<String, String> cellMap = cellLineStaging.mappedAccessions();

        RunSummary summary = new RunSummary("Batch integration");
        for (CombinationRecord c : combinations) {
            String d1 = DrugNames.normalize(c.getDrug1());
            String d2 = DrugNames.normalize(c.getDrug2());
            String chembl1 = d1 == null ? null : drugMap.get(d1);
            String chembl2 = d2 == null ? null : drugMap.get(d2);
            String accession = c.getCellLine() == null ? null : cellMap.get(c.getCellLine());

            if (chembl1 == null || chembl2 == null || accession == null) {
                summary.skip();
                auditMissing(c, d1, chembl1, d2, chembl2, accession);
                continue;
            }

            try {
                ScoreClassification scores = classifier.classify(c);
                assembler.persist(c.getId(), List.of(chembl1, chembl2), accession, scores);
                mirror.setStatus(c.getId(), LocalMirror.STATUS_PROCESSED);
                summary.success();
            } catch (PersistenceException | IllegalArgumentException ex) {
                Logger.error("Combination {} failed: {}", c.getId(), ex.getMessage());
                mirror.setStatus(c.getId(), LocalMirror.STATUS_ERROR);
                summary.failure();
            }
        }
        return summary;
    }

    private void auditMissing(CombinationRecord c, String d1, String chembl1, String d2, String chembl2, String accession)
            throws SQLException {
        Logger.debug("Skipping combination {}: unresolved entity", c.getId());
        if (chembl1 == null) {
            StagedDrug row = d1 == null ? null : drugStaging.find(d1).orElse(null);
            record(c.getId(), SkipAuditLog.STAGE_DRUG, d1,
                    row == null ? null : row.getErrorCode(), row == null ? "not staged" : row.getErrorMsg());
        }
        if (chembl2 == null) {
            StagedDrug row = d2 == null ? null : drugStaging.find(d2).orElse(null);
            record(c.getId(), SkipAuditLog.STAGE_DRUG, d2,
                    row == null ? null : row.getErrorCode(), row == null ? "not staged" : row.getErrorMsg());
        }
        if (accession == null) {
            StagedCellLine row = c.getCellLine() == null ? null : cellLineStaging.find(c.getCellLine()).orElse(null);
            record(c.getId(), SkipAuditLog.STAGE_CELL_LINE, c.getCellLine(),
                    row == null ? null : row.getErrorCode(), row == null ? "not staged" : row.getErrorMsg());
        }
    }

    private void record(int combinationId, String stage, String entity, Integer code, String message) {
        if (code != null) {
            audit.recordCode(combinationId, stage, entity, code);
        } else {
            audit.recordMessage(combinationId, stage, entity, message == null ? "unresolved" : message);
        }
    }
}
