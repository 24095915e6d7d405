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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.nio.file.Path;
import java.util.List;

import org.disnet.dcdb.api.CellosaurusClient;
import org.disnet.dcdb.api.ChemblClient;
import org.disnet.dcdb.api.DrugCombDbClient;
import org.disnet.dcdb.api.DrugCombDbClient.CellLineInfo;
import org.disnet.dcdb.api.DrugCombDbClient.RawDrugInfo;
import org.disnet.dcdb.api.UmlsClient;
import org.disnet.dcdb.api.UmlsClient.UmlsConcept;
import org.disnet.dcdb.api.UniChemClient;
import org.disnet.dcdb.api.UniChemClient.CompoundMapping;
import org.disnet.dcdb.om.CombinationRecord;
import org.disnet.dcdb.om.Drug;
import org.disnet.dcdb.om.SourceNames;
import org.disnet.dcdb.processing.cellline.CellLineResolver;
import org.disnet.dcdb.processing.drug.DrugErrorCode;
import org.disnet.dcdb.processing.drug.DrugResolver;
import org.disnet.dcdb.processing.experiment.ExperimentAssembler;
import org.disnet.dcdb.processing.persist.CellLineRepository;
import org.disnet.dcdb.processing.persist.DisnetDatabase;
import org.disnet.dcdb.processing.persist.DrugCombinationRepository;
import org.disnet.dcdb.processing.persist.DrugRepository;
import org.disnet.dcdb.processing.persist.ExperimentRepository;
import org.disnet.dcdb.processing.persist.ScoreRepository;
import org.disnet.dcdb.processing.persist.SourceRepository;
import org.disnet.dcdb.processing.persist.TestDatabases;
import org.disnet.dcdb.processing.score.ScoreClassifier;
import org.disnet.dcdb.processing.support.CheckpointStore;
import org.disnet.dcdb.processing.support.PipelineSettings;
import org.disnet.dcdb.processing.support.RunSummary;
import org.disnet.dcdb.processing.support.SkipAuditLog;
import org.disnet.dcdb.util.Db;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Streaming orchestration with the real resolvers writing to an in-memory
 * DISNET database; only the HTTP clients are mocked.
 */
class StreamingIntegrationDatabaseTest {

    @TempDir
    Path tmp;

    private DisnetDatabase db;
    private DrugCombDbClient dcdb;
    private CheckpointStore checkpoint;
    private SkipAuditLog audit;
    private StreamingIntegrationPipeline pipeline;

    @BeforeEach
    void setUp() throws Exception {
        dcdb = mock(DrugCombDbClient.class);
        UniChemClient unichem = mock(UniChemClient.class);
        ChemblClient chembl = mock(ChemblClient.class);
        CellosaurusClient cellosaurus = mock(CellosaurusClient.class);
        UmlsClient umls = mock(UmlsClient.class);

        db = TestDatabases.fresh();
        SourceRepository sources = new SourceRepository(db, 10);
        int pubchemId = sources.getOrCreateSource(SourceNames.PUBCHEM);
        int chemblId = sources.getOrCreateSource(SourceNames.CHEMBL);
        int cellosaurusId = sources.getOrCreateSource(SourceNames.CELLOSAURUS);

        // index 1 pairs 5-FU with a drug no service knows; index 2 shares its cell line
        when(dcdb.getCombination(1)).thenReturn(combination(1, "5-FU(approved)", "Mystery"));
        when(dcdb.getCombination(2)).thenReturn(combination(2, "5-FU(approved)", "ABT-888"));

        when(dcdb.getDrug("5-FU")).thenReturn(new RawDrugInfo("3385", "fluorouracil", null));
        when(dcdb.getDrug("ABT-888")).thenReturn(new RawDrugInfo("11960529", "veliparib", null));
        when(unichem.getCompoundMapping("3385")).thenReturn(new CompoundMapping("CHEMBL185", "GHASVSINZRGABV-UHFFFAOYSA-N"));
        when(unichem.getCompoundMapping("11960529")).thenReturn(new CompoundMapping("CHEMBL506871", null));
        when(chembl.getMolecule("CHEMBL185", chemblId)).thenReturn(
                new Drug("CHEMBL185", "FLUOROURACIL", chemblId, "Small molecule", null, null));
        when(chembl.getMolecule("CHEMBL506871", chemblId)).thenReturn(
                new Drug("CHEMBL506871", "VELIPARIB", chemblId, "Small molecule", null, null));

        when(dcdb.getCellLine("A2058")).thenReturn(new CellLineInfo("CVCL_1059", "Skin", "COSMIC:909"));
        when(cellosaurus.getDiseaseAccession("CVCL_1059")).thenReturn("C3224");
        when(umls.ncitToCui("C3224")).thenReturn(new UmlsConcept("C0025202", "Melanoma"));

        DrugResolver drugResolver = new DrugResolver(dcdb, unichem, chembl, new DrugRepository(db),
                pubchemId, chemblId, 10);
        CellLineResolver cellLineResolver = new CellLineResolver(dcdb, cellosaurus, umls,
                new CellLineRepository(db), cellosaurusId, 10);
        ExperimentAssembler assembler = new ExperimentAssembler(db,
                new DrugCombinationRepository(db, 10), new ExperimentRepository(db, 10));
        checkpoint = new CheckpointStore(tmp.resolve("checkpoint.txt"));
        audit = new SkipAuditLog(tmp.resolve("skipped.jsonl"));

        pipeline = new StreamingIntegrationPipeline(dcdb, drugResolver, cellLineResolver,
                new ScoreClassifier(new ScoreRepository(db, 10)), assembler, checkpoint, audit,
                PipelineSettings.defaults());
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private static CombinationRecord combination(int id, String drug1, String drug2) {
        return CombinationRecord.builder().id(id).drug1(drug1).drug2(drug2).cellLine("A2058")
                .hsa(5.5369).bliss(6.2566).loewe(-2.7507).zip(1.7183).source("ONEIL").build();
    }

    private int count(String table) throws Exception {
        return Db.queryFirst(db.getConnection(), "SELECT COUNT(*) FROM " + table, null, rs -> rs.getInt(1)).orElse(-1);
    }

    @Test
    @DisplayName("A cell line resolved for a skipped index is still written for the next index that uses it")
    void cellLineOfSkippedIndexIsWrittenLater() throws Exception {
        RunSummary summary = pipeline.run(1, 3, 1);

        assertEquals(1, summary.getSucceeded());
        assertEquals(1, summary.getSkipped());
        assertEquals(0, summary.getFailed());
        assertEquals(2, checkpoint.load().getAsInt());

        assertEquals(1, count("cell_line"));
        assertEquals(1, count("disease"));
        assertEquals(1, count("experiment"));
        assertEquals(4, count("experiment_score"));
        verify(dcdb, times(1)).getCellLine("A2058");

        List<JsonNode> skipped = audit.readAll();
        assertEquals(1, skipped.size());
        assertEquals(1, skipped.get(0).get("combination_id").asInt());
        assertEquals("Mystery", skipped.get(0).get("entity").asText());
        assertEquals(DrugErrorCode.NOT_FOUND_IN_SOURCE.getCode(), skipped.get(0).get("code").asInt());
    }

    @Test
    @DisplayName("Nothing reaches the database for an index that is skipped")
    void skippedIndexWritesNothing() throws Exception {
        RunSummary summary = pipeline.run(1, 2, 1);

        assertEquals(1, summary.getSkipped());
        assertTrue(checkpoint.load().isEmpty());
        assertEquals(0, count("cell_line"));
        assertEquals(0, count("experiment"));
    }
}
