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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

import org.disnet.dcdb.api.DrugCombDbClient;
import org.disnet.dcdb.api.ServiceException;
import org.disnet.dcdb.om.CellLine;
import org.disnet.dcdb.om.CombinationRecord;
import org.disnet.dcdb.om.Drug;
import org.disnet.dcdb.processing.cellline.CellLineFetchResult;
import org.disnet.dcdb.processing.cellline.CellLineResolver;
import org.disnet.dcdb.processing.drug.DrugFetchResult;
import org.disnet.dcdb.processing.drug.DrugResolver;
import org.disnet.dcdb.processing.experiment.ExperimentAssembler;
import org.disnet.dcdb.processing.score.ScoreClassification;
import org.disnet.dcdb.processing.score.ScoreClassifier;
import org.disnet.dcdb.processing.support.CheckpointStore;
import org.disnet.dcdb.processing.support.PipelineSettings;
import org.disnet.dcdb.processing.support.Resolution;
import org.disnet.dcdb.processing.support.RunSummary;
import org.disnet.dcdb.processing.support.SkipAuditLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Streaming orchestration with mocked resolvers: checkpointing, skip audit and
 * resume behaviour.
 */
class StreamingIntegrationPipelineTest {

    @TempDir
    Path tmp;

    private DrugCombDbClient dcdb;
    private DrugResolver drugResolver;
    private CellLineResolver cellLineResolver;
    private ScoreClassifier classifier;
    private ExperimentAssembler assembler;
    private CheckpointStore checkpoint;
    private SkipAuditLog audit;

    @BeforeEach
    void setUp() {
        dcdb = mock(DrugCombDbClient.class);
        drugResolver = mock(DrugResolver.class);
        cellLineResolver = mock(CellLineResolver.class);
        classifier = mock(ScoreClassifier.class);
        assembler = mock(ExperimentAssembler.class);
        checkpoint = new CheckpointStore(tmp.resolve("checkpoint.txt"));
        audit = new SkipAuditLog(tmp.resolve("skipped.jsonl"));

        // index 3 pairs 5-FU with a drug no service knows
        when(dcdb.getCombination(anyInt())).thenAnswer(inv -> {
            int id = inv.getArgument(0);
            return CombinationRecord.builder().id(id).drug1("5-FU(approved)")
                    .drug2(id == 3 ? "Mystery" : "ABT-888").cellLine("A2058")
                    .hsa(5.5369).bliss(6.2566).loewe(-2.7507).zip(1.7183).source("ONEIL").build();
        });

        when(drugResolver.resolve("5-FU(approved)")).thenReturn(Resolution.resolved(drug("CHEMBL185", "3385")));
        when(drugResolver.resolve("ABT-888")).thenReturn(Resolution.resolved(drug("CHEMBL506871", "11960529")));
        when(drugResolver.resolve("Mystery")).thenReturn(Resolution.unresolvable(1, "not found in DrugCombDB"));

        CellLine a2058 = new CellLine("CVCL_1059", 3, "A2058", "C0025202", "Skin");
        when(cellLineResolver.resolve("A2058")).thenReturn(Resolution.resolved(new CellLineFetchResult(a2058, null, false)));

        when(classifier.classify(any(CombinationRecord.class)))
                .thenReturn(new ScoreClassification(Collections.emptyList(), 1));
        when(assembler.persist(anyInt(), anyCollection(), anyString(), any())).thenReturn(1L);
    }

    private static DrugFetchResult drug(String chemblId, String cid) {
        return new DrugFetchResult(Drug.raw(cid, cid, 1, null), new Drug(chemblId, chemblId, 2, null, null, null));
    }

    private StreamingIntegrationPipeline pipeline(boolean retryFailedOnResume) {
        PipelineSettings settings = PipelineSettings.builder().retryFailedOnResume(retryFailedOnResume).build();
        return new StreamingIntegrationPipeline(dcdb, drugResolver, cellLineResolver, classifier, assembler,
                checkpoint, audit, settings);
    }

    @Test
    @DisplayName("resumeIndex continues on the step grid after the checkpoint")
    void resumeIndex() {
        assertEquals(0, StreamingIntegrationPipeline.resumeIndex(0, 1, OptionalInt.empty()));
        assertEquals(6, StreamingIntegrationPipeline.resumeIndex(0, 1, OptionalInt.of(5)));
        assertEquals(19, StreamingIntegrationPipeline.resumeIndex(10, 3, OptionalInt.of(16)));
        assertEquals(19, StreamingIntegrationPipeline.resumeIndex(10, 3, OptionalInt.of(17)));
        assertEquals(10, StreamingIntegrationPipeline.resumeIndex(10, 3, OptionalInt.of(4)));
    }

    @Test
    @DisplayName("Unresolvable drugs are audited and skipped; the checkpoint follows the last success")
    void skipAndCheckpoint() {
        RunSummary summary = pipeline(false).run(1, 6, 1);

        assertEquals(4, summary.getSucceeded());
        assertEquals(1, summary.getSkipped());
        assertEquals(5, checkpoint.load().getAsInt());

        List<JsonNode> records = audit.readAll();
        assertEquals(1, records.size());
        assertEquals(3, records.get(0).get("combination_id").asInt());
        assertEquals(SkipAuditLog.STAGE_DRUG, records.get(0).get("stage").asText());
        assertEquals("Mystery", records.get(0).get("entity").asText());
        assertEquals(1, records.get(0).get("code").asInt());

        verify(assembler, never()).persist(eq(3), anyCollection(), anyString(), any());
        verify(assembler, times(4)).persist(anyInt(), eq(List.of("CHEMBL185", "CHEMBL506871")), eq("CVCL_1059"), any());

        // nothing left to do on the same range
        clearInvocations(dcdb);
        assertEquals(0, pipeline(false).run(1, 6, 1).getTotal());
        verifyNoInteractions(dcdb);
    }

    @Test
    @DisplayName("With retry on resume the checkpoint stops before the first skip")
    void retryFailedOnResume() {
        pipeline(true).run(1, 6, 1);
        assertEquals(2, checkpoint.load().getAsInt());

        clearInvocations(dcdb);
        pipeline(true).run(1, 6, 1);
        verify(dcdb).getCombination(3);
        verify(dcdb, never()).getCombination(2);
    }

    @Test
    @DisplayName("A step greater than one visits only its own indices")
    void stepping() {
        pipeline(false).run(0, 7, 3);

        verify(dcdb).getCombination(0);
        verify(dcdb).getCombination(3);
        verify(dcdb).getCombination(6);
        verify(dcdb, times(3)).getCombination(anyInt());
        assertEquals(6, checkpoint.load().getAsInt());
    }

    @Test
    @DisplayName("A service failure during resolution fails the index and is audited")
    void serviceFailure() {
        when(drugResolver.resolve("ABT-888")).thenThrow(new ServiceException("UniChem returned 503", 503, null));

        RunSummary summary = pipeline(false).run(1, 2, 1);

        assertEquals(1, summary.getFailed());
        assertFalse(checkpoint.load().isPresent());
        JsonNode record = audit.readAll().get(0);
        assertEquals(SkipAuditLog.STAGE_DRUG, record.get("stage").asText());
        assertEquals("5-FU(approved)+ABT-888", record.get("entity").asText());
        assertTrue(record.get("message").asText().contains("503"));
        verifyNoInteractions(assembler);
    }

    @Test
    @DisplayName("Missing combinations are skipped without touching the resolvers")
    void missingCombination() {
        when(dcdb.getCombination(9)).thenReturn(null);

        RunSummary summary = pipeline(false).run(9, 10, 1);

        assertEquals(1, summary.getSkipped());
        verifyNoInteractions(drugResolver, cellLineResolver);
        assertEquals("combination not found", audit.readAll().get(0).get("message").asText());
    }

    @Test
    @DisplayName("A persist failure fails the index and the next one still runs")
    void persistFailure() {
        when(assembler.persist(eq(1), anyCollection(), anyString(), any()))
                .thenThrow(new IllegalStateException("lost connection"));

        RunSummary summary = pipeline(false).run(1, 3, 1);

        assertEquals(1, summary.getFailed());
        assertEquals(1, summary.getSucceeded());
        assertEquals(2, checkpoint.load().getAsInt());
        assertEquals(SkipAuditLog.STAGE_PERSIST, audit.readAll().get(0).get("stage").asText());
    }

    @Test
    @DisplayName("An unwritable audit log fails only the index being audited")
    void auditWriteFailure() {
        audit = mock(SkipAuditLog.class);
        doThrow(new UncheckedIOException("disk full", new IOException("disk full")))
                .when(audit).recordCode(anyInt(), anyString(), anyString(), anyInt());

        RunSummary summary = pipeline(false).run(1, 6, 1);

        assertEquals(4, summary.getSucceeded());
        assertEquals(1, summary.getFailed());
        assertEquals(0, summary.getSkipped());
        assertEquals(5, checkpoint.load().getAsInt());
    }

    @Test
    @DisplayName("A checkpoint that cannot be written does not stop the run")
    void checkpointWriteFailure() {
        checkpoint = mock(CheckpointStore.class);
        when(checkpoint.load()).thenReturn(OptionalInt.empty());
        when(checkpoint.save(1)).thenThrow(new UncheckedIOException("read-only", new IOException("read-only")));

        RunSummary summary = pipeline(false).run(1, 3, 1);

        assertEquals(2, summary.getSucceeded());
        assertEquals(0, summary.getFailed());
        verify(checkpoint).save(2);
    }
}
