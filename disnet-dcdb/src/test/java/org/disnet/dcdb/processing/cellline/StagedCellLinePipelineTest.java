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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import java.nio.file.Path;
import java.util.List;

import org.disnet.dcdb.api.CellosaurusClient;
import org.disnet.dcdb.api.CellosaurusClient.CellosaurusEntry;
import org.disnet.dcdb.api.DrugCombDbClient;
import org.disnet.dcdb.api.DrugCombDbClient.CellLineInfo;
import org.disnet.dcdb.api.UmlsClient;
import org.disnet.dcdb.api.UmlsClient.UmlsConcept;
import org.disnet.dcdb.om.CellLine;
import org.disnet.dcdb.om.Disease;
import org.disnet.dcdb.processing.persist.CellLineRepository;
import org.disnet.dcdb.processing.support.PipelineSettings;
import org.disnet.dcdb.processing.support.RunSummary;
import org.disnet.dcdb.staging.CellLineStage;
import org.disnet.dcdb.staging.CellLineStagingDao;
import org.disnet.dcdb.staging.LocalMirror;
import org.disnet.dcdb.staging.StagedCellLine;
import org.disnet.dcdb.staging.StagingStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StagedCellLinePipelineTest {

    private static final int CELLOSAURUS = 3;

    @TempDir
    Path tmp;

    private StagingStore store;
    private CellLineStagingDao staging;
    private LocalMirror mirror;

    private DrugCombDbClient dcdb;
    private CellosaurusClient cellosaurus;
    private UmlsClient umls;
    private CellLineRepository cellLines;

    @BeforeEach
    void setUp() throws Exception {
        store = new StagingStore(tmp.resolve("staging.sqlite"));
        staging = new CellLineStagingDao(store);
        mirror = new LocalMirror(store);
        mirror.putCellLine("A2058", new CellLineInfo(null, null, "COSMIC:909"));
        mirror.putCellLine("SK-MEL-5", new CellLineInfo(null, null, "COSMIC:905"));

        dcdb = mock(DrugCombDbClient.class);
        cellosaurus = mock(CellosaurusClient.class);
        umls = mock(UmlsClient.class);
        cellLines = mock(CellLineRepository.class);

        when(cellosaurus.findByCosmicId("COSMIC:909")).thenReturn(new CellosaurusEntry("CVCL_1059", "C3224", "Skin"));
        when(umls.ncitToCui("C3224")).thenReturn(new UmlsConcept("C0025202", "Melanoma"));

        when(dcdb.getCellLine("MCF7")).thenReturn(new CellLineInfo("CVCL_0031", "Breast", null));
        when(cellosaurus.getDiseaseAccession("CVCL_0031")).thenReturn("C4872");
        when(umls.ncitToCui("C4872")).thenReturn(new UmlsConcept("C0678222", "Breast Carcinoma"));

        when(dcdb.getCellLine("HAP1")).thenReturn(new CellLineInfo("CVCL_Y019", null, null));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private StagedCellLinePipeline pipeline(PipelineSettings settings) {
        return new StagedCellLinePipeline(staging, mirror, dcdb, cellosaurus, umls, cellLines, CELLOSAURUS, settings);
    }

    private StagedCellLine row(String name) throws Exception {
        return staging.find(name).orElseThrow();
    }

    @Test
    @DisplayName("COSMIC fast path, DrugCombDB fallback and missing disease all end up MAPPED")
    void fullRun() throws Exception {
        RunSummary persisted = pipeline(PipelineSettings.builder().stageBatchSize(2).persistBatchSize(2).build())
                .run(List.of("A2058", "MCF7", "HAP1", "Ghost"));

        assertEquals(3, persisted.getSucceeded());

        StagedCellLine a2058 = row("A2058");
        assertEquals(CellLineStage.MAPPED, a2058.getStatus());
        assertEquals("CVCL_1059", a2058.getCellosaurusAccession());
        assertEquals("C0025202", a2058.getUmlsCui());

        // complete Cellosaurus entry skips the disease lookup
        verify(cellosaurus, never()).getDiseaseAccession("CVCL_1059");
        verify(dcdb, never()).getCellLine("A2058");

        assertEquals(CellLineStage.MAPPED, row("HAP1").getStatus());
        assertNull(row("HAP1").getUmlsCui());
        assertEquals(CellLineStage.FAILED, row("Ghost").getStatus());
        assertEquals(CellLineErrorCode.NO_ACCESSION.getCode(), row("Ghost").getErrorCode());

        verify(cellLines).save(new CellLine("CVCL_1059", CELLOSAURUS, "A2058", "C0025202", "Skin"),
                new Disease("C0025202", "Melanoma"));
        verify(cellLines).save(new CellLine("CVCL_0031", CELLOSAURUS, "MCF7", "C0678222", "Breast"),
                new Disease("C0678222", "Breast Carcinoma"));
        verify(cellLines).save(new CellLine("CVCL_Y019", CELLOSAURUS, "HAP1", null, null), null);
        verify(umls, never()).ncitToCui(null);
    }

    @Test
    @DisplayName("A second run calls no external service")
    void rerunIsNoOp() throws Exception {
        List<String> names = List.of("A2058", "MCF7", "Ghost");
        pipeline(PipelineSettings.defaults()).run(names);
        clearInvocations(dcdb, cellosaurus, umls);

        pipeline(PipelineSettings.defaults()).run(names);

        verifyNoInteractions(dcdb, cellosaurus, umls);
    }

    @Test
    @DisplayName("Local mode fails unmirrored cell lines instead of asking DrugCombDB")
    void localMode() throws Exception {
        pipeline(PipelineSettings.builder().localMode(true).build()).run(List.of("A2058", "SK-MEL-5", "MCF7"));

        verify(dcdb, never()).getCellLine(anyString());
        assertEquals(CellLineStage.MAPPED, row("A2058").getStatus());
        assertEquals(CellLineErrorCode.NO_ACCESSION.getCode(), row("SK-MEL-5").getErrorCode());
        assertEquals(CellLineErrorCode.NOT_IN_LOCAL_MIRROR.getCode(), row("MCF7").getErrorCode());
        verify(cellLines, times(1)).save(any(CellLine.class), any(Disease.class));
    }

    @Test
    @DisplayName("An incomplete Cellosaurus entry continues through the disease lookup")
    void incompleteEntry() throws Exception {
        when(cellosaurus.findByCosmicId("COSMIC:905")).thenReturn(new CellosaurusEntry("CVCL_0527", null, "Skin"));
        when(cellosaurus.getDiseaseAccession("CVCL_0527")).thenReturn("C3224");

        StagedCellLinePipeline p = pipeline(PipelineSettings.defaults());
        p.stage0(List.of("SK-MEL-5"));
        p.stage1();
        assertEquals(CellLineStage.ACCESSION_FOUND, row("SK-MEL-5").getStatus());
        p.stage2();
        p.stage3();

        StagedCellLine mapped = row("SK-MEL-5");
        assertEquals(CellLineStage.MAPPED, mapped.getStatus());
        assertEquals("Skin", mapped.getTissue());
        assertEquals("Melanoma", mapped.getDiseaseName());
    }
}
