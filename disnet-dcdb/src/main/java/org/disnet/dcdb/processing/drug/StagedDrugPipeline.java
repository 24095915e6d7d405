package org.disnet.dcdb.processing.drug;

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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.disnet.dcdb.api.ChemblClient;
import org.disnet.dcdb.api.DrugCombDbClient;
import org.disnet.dcdb.api.DrugCombDbClient.RawDrugInfo;
import org.disnet.dcdb.api.UniChemClient;
import org.disnet.dcdb.api.UniChemClient.CompoundMapping;
import org.disnet.dcdb.om.Drug;
import org.disnet.dcdb.om.DrugNames;
import org.disnet.dcdb.processing.persist.DrugRepository;
import org.disnet.dcdb.processing.persist.PersistenceException;
import org.disnet.dcdb.processing.support.PipelineSettings;
import org.disnet.dcdb.processing.support.RunSummary;
import org.disnet.dcdb.staging.DrugStage;
import org.disnet.dcdb.staging.DrugStagingDao;
import org.disnet.dcdb.staging.LocalMirror;
import org.disnet.dcdb.staging.StagedDrug;
import org.disnet.dcdb.util.Logger;

/**
 * Resolves drug names to ChEMBL records through {@code staging_drugs}.
 *
 * <pre>
 *  0 PENDING ──stage1──▶ 1 RAW_RESOLVED ──stage2──▶ 2 CANONICAL_MAPPED ──stage3──▶ 3 FETCHED
 *       (mirror / DrugCombDB)      (UniChem)                  (ChEMBL)
 *  any non-terminal ──▶ -1 FAILED
 * </pre>
 *
 * Each stage selects rows strictly at its input status in bounded batches, so
 * re-running a finished stage touches nothing and calls no service. A row's
 * failure is recorded on the row and never aborts the batch. Updates commit
 * once per batch.
 */
public class StagedDrugPipeline {

    private final DrugStagingDao staging;
    private final LocalMirror mirror;
    private final DrugCombDbClient dcdb;
    private final UniChemClient unichem;
    private final ChemblClient chembl;
    private final DrugRepository drugs;
    private final int pubchemSourceId;
    private final int chemblSourceId;
    private final PipelineSettings settings;

    public StagedDrugPipeline(DrugStagingDao staging,
                              LocalMirror mirror,
                              DrugCombDbClient dcdb,
                              UniChemClient unichem,
                              ChemblClient chembl,
                              DrugRepository drugs,
                              int pubchemSourceId,
                              int chemblSourceId,
                              PipelineSettings settings) {
        this.staging = staging;
        this.mirror = mirror;
        this.dcdb = dcdb;
        this.unichem = unichem;
        this.chembl = chembl;
        this.drugs = drugs;
        this.pubchemSourceId = pubchemSourceId;
        this.chemblSourceId = chemblSourceId;
        this.settings = settings;
    }

    /**
     * Stage, resolve and persist {@code drugNames}. Names are normalized first,
     * so {@code "5-FU(approved)"} and {@code "5-FU"} are one drug.
     *
     * @return counters of the persist step
     */
    public RunSummary run(Collection<String> drugNames) throws SQLException {
        Logger.info("Drug pipeline: {} names", drugNames.size());
        stage0(drugNames);
        stage1();
        stage2();
        stage3();
        RunSummary persisted = persist();
        Map<DrugStage, Integer> counts = staging.countByStatus();
        Logger.info("Drug staging status: {}", counts);
        return persisted;
    }

    /** Insert each unique normalized name once. */
    public int stage0(Collection<String> drugNames) throws SQLException {
        Set<String> normalized = new LinkedHashSet<>();
        for (String n : drugNames) {
            String norm = DrugNames.normalize(n);
            if (norm != null && !norm.isEmpty()) normalized.add(norm);
        }
        int inserted = staging.stage0(normalized);
        Logger.info("Drug stage 0: {} new of {} unique names", inserted, normalized.size());
        return inserted;
    }

    /** PENDING → RAW_RESOLVED: PubChem CID from the local mirror, else DrugCombDB. */
    public RunSummary stage1() throws SQLException {
        return runStage(DrugStage.PENDING, "Drug stage 1", row -> {
            Optional<RawDrugInfo> local = mirror.findDrug(row.getDrugName());
            RawDrugInfo info = local.orElse(null);
            if (info == null && !settings.isLocalMode()) {
                info = dcdb.getDrug(row.getDrugName());
            }
            if (info == null || info.getPubchemId() == null) {
                row.fail(DrugErrorCode.NOT_FOUND_IN_SOURCE.getCode(), DrugErrorCode.NOT_FOUND_IN_SOURCE.getReason());
                return;
            }
            row.setPubchemId(info.getPubchemId());
            row.setOfficialName(info.getOfficialName());
            row.setSmiles(info.getSmiles());
            row.advance(DrugStage.RAW_RESOLVED);
        });
    }

    /** RAW_RESOLVED → CANONICAL_MAPPED: ChEMBL ID and InChI key from UniChem. */
    public RunSummary stage2() throws SQLException {
        return runStage(DrugStage.RAW_RESOLVED, "Drug stage 2", row -> {
            CompoundMapping mapping = unichem.getCompoundMapping(row.getPubchemId());
            if (mapping != null) {
                row.setInchiKey(mapping.getInchiKey());
            }
            if (mapping == null || mapping.getChemblId() == null) {
                row.fail(DrugErrorCode.NOT_FOUND_IN_CROSSREF.getCode(), DrugErrorCode.NOT_FOUND_IN_CROSSREF.getReason());
                return;
            }
            row.setChemblId(mapping.getChemblId());
            row.advance(DrugStage.CANONICAL_MAPPED);
        });
    }

    /** CANONICAL_MAPPED → FETCHED: molecule metadata from ChEMBL. */
    public RunSummary stage3() throws SQLException {
        return runStage(DrugStage.CANONICAL_MAPPED, "Drug stage 3", row -> {
            Drug molecule = chembl.getMolecule(row.getChemblId(), chemblSourceId);
            if (molecule == null) {
                row.fail(DrugErrorCode.NOT_FOUND_IN_CANONICAL.getCode(), DrugErrorCode.NOT_FOUND_IN_CANONICAL.getReason());
                return;
            }
            row.setPrefName(molecule.getDrugName());
            row.setMoleculeType(molecule.getMolecularType());
            row.setCanonicalSmiles(molecule.getChemicalStructure());
            row.setChemblInchiKey(molecule.getInchiKey());
            row.advance(DrugStage.FETCHED);
        });
    }

    /**
     * Write every FETCHED row to DISNET (raw drug, ChEMBL drug, mapping), paging
     * through the staging table. A row that fails to persist is logged and
     * counted; the others proceed.
     */
    public RunSummary persist() throws SQLException {
        RunSummary summary = new RunSummary("Drug persist");
        String after = null;
        while (true) {
            List<StagedDrug> page = staging.selectPage(DrugStage.FETCHED, after, settings.getPersistBatchSize());
            if (page.isEmpty()) break;
            for (StagedDrug row : page) {
                try {
                    drugs.saveResolved(toRawDrug(row), toChemblDrug(row));
                    summary.success();
                } catch (PersistenceException | IllegalArgumentException ex) {
                    summary.failure();
                    Logger.error("Unable to persist drug '{}': {}", row.getDrugName(), ex.getMessage());
                }
            }
            after = page.get(page.size() - 1).getDrugName();
        }
        summary.log();
        return summary;
    }

    Drug toRawDrug(StagedDrug row) {
        String name = row.getOfficialName() != null ? row.getOfficialName() : row.getDrugName();
        Drug raw = Drug.raw(row.getPubchemId(), name, pubchemSourceId, row.getSmiles());
        raw.setInchiKey(row.getInchiKey());
        return raw;
    }

    Drug toChemblDrug(StagedDrug row) {
        String name = row.getPrefName() != null ? row.getPrefName() : row.getDrugName();
        String inchi = row.getChemblInchiKey() != null ? row.getChemblInchiKey() : row.getInchiKey();
        return new Drug(row.getChemblId(), name, chemblSourceId, row.getMoleculeType(), row.getCanonicalSmiles(), inchi);
    }

    // -------------------------------------------------------------------------

    @FunctionalInterface
    interface RowStep {
        void apply(StagedDrug row) throws Exception;
    }

    private RunSummary runStage(DrugStage from, String label, RowStep step) throws SQLException {
        RunSummary summary = new RunSummary(label);
        while (true) {
            List<StagedDrug> batch = staging.selectBatch(from, settings.getStageBatchSize());
            if (batch.isEmpty()) break;

            for (StagedDrug row : batch) {
                try {
                    step.apply(row);
                } catch (Exception ex) {
                    Logger.warn("{}: '{}' failed: {}", label, row.getDrugName(), ex.toString());
                    if (row.getStatus() == from) {
                        row.fail(null, ex.toString());
                    }
                }
                if (row.getStatus() == DrugStage.FAILED) summary.failure();
                else summary.success();
            }
            staging.update(from, batch);
        }
        summary.log();
        return summary;
    }
}
