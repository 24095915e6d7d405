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

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.disnet.dcdb.api.DrugCombDbClient;
import org.disnet.dcdb.om.CombinationRecord;
import org.disnet.dcdb.om.DrugNames;
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
import org.disnet.dcdb.util.Logger;

/**
 * Checkpointed mode: walks a range of DrugCombDB integration indices one at a
 * time, straight from the API.
 * <p>
 * For each index the drugs and the cell line are resolved concurrently on a
 * small pool and joined; the experiment is written only when both resolved.
 * <ul>
 * <li>Unresolvable entity: audited with its reason code, index skipped.</li>
 * <li>Service or persistence failure: logged, audited with the message, index
 * counted as failed.</li>
 * <li>Success: checkpoint saved at the index.</li>
 * <li>Audit log not writable: logged, index counted as failed.</li>
 * </ul>
 * Skipped and failed indices are never retried within a run. Whether a restart
 * retries them depends on {@link PipelineSettings#isRetryFailedOnResume()}: when
 * false the checkpoint follows the last success, when true it stops at the
 * last index below which every index of the run succeeded.
 */
public class StreamingIntegrationPipeline {

    private final DrugCombDbClient dcdb;
    private final DrugResolver drugResolver;
    private final CellLineResolver cellLineResolver;
    private final ScoreClassifier classifier;
    private final ExperimentAssembler assembler;
    private final CheckpointStore checkpoint;
    private final SkipAuditLog audit;
    private final PipelineSettings settings;

    public StreamingIntegrationPipeline(DrugCombDbClient dcdb,
                                        DrugResolver drugResolver,
                                        CellLineResolver cellLineResolver,
                                        ScoreClassifier classifier,
                                        ExperimentAssembler assembler,
                                        CheckpointStore checkpoint,
                                        SkipAuditLog audit,
                                        PipelineSettings settings) {
        this.dcdb = dcdb;
        this.drugResolver = drugResolver;
        this.cellLineResolver = cellLineResolver;
        this.classifier = classifier;
        this.assembler = assembler;
        this.checkpoint = checkpoint;
        this.audit = audit;
        this.settings = settings;
    }

    /** Outcome of one index. */
    enum Outcome { SUCCEEDED, SKIPPED, FAILED }

    /**
     * Process indices {@code start, start+step, ...} below {@code end}, resuming
     * after the stored checkpoint.
     */
    public RunSummary run(int start, int end, int step) {
        if (step <= 0) throw new IllegalArgumentException("step must be > 0");
        int first = resumeIndex(start, step, checkpoint.load());
        Logger.info("--- Streaming integration [{}, {}) step {} from {} ---", start, end, step, first);

        RunSummary summary = new RunSummary("Streaming integration");
        boolean contiguous = true;

        AtomicInteger threadNo = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(2, settings.getResolverThreads()), r -> {
            Thread t = new Thread(r, "resolver-" + threadNo.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            for (int i = first; i < end; i += step) {
                Outcome outcome;
                try {
                    outcome = processIndex(i, pool);
                } catch (UncheckedIOException ex) {
                    Logger.error("Combination {}: audit write failed: {}", i, ex.getMessage());
                    outcome = Outcome.FAILED;
                }
                switch (outcome) {
                    case SUCCEEDED:
                        summary.success();
                        if (!settings.isRetryFailedOnResume() || contiguous) {
                            saveCheckpoint(i);
                        }
                        break;
                    case SKIPPED:
                        summary.skip();
                        contiguous = false;
                        break;
                    default:
                        summary.failure();
                        contiguous = false;
                        break;
                }
                if (Thread.currentThread().isInterrupted()) {
                    Logger.warn("Interrupted after index {}", i);
                    break;
                }
            }
        } finally {
            pool.shutdownNow();
        }
        summary.log();
        return summary;
    }

    /** A checkpoint that cannot be written is logged; a later success writes it again. */
    private void saveCheckpoint(int index) {
        try {
            checkpoint.save(index);
        } catch (UncheckedIOException ex) {
            Logger.error("Checkpoint at {} not saved: {}", index, ex.getMessage());
        }
    }

    /** First index of the range strictly after {@code last}. */
    static int resumeIndex(int start, int step, OptionalInt last) {
        if (last.isEmpty() || last.getAsInt() < start) {
            return start;
        }
        int k = (last.getAsInt() - start) / step + 1;
        return start + k * step;
    }

    Outcome processIndex(int index, ExecutorService pool) {
        CombinationRecord rec;
        try {
            rec = dcdb.getCombination(index);
        } catch (RuntimeException ex) {
            Logger.error("Combination {}: fetch failed: {}", index, ex.getMessage());
            audit.recordMessage(index, SkipAuditLog.STAGE_PERSIST, String.valueOf(index), ex.toString());
            return Outcome.FAILED;
        }
        if (rec == null || rec.getDrug1() == null || rec.getDrug2() == null || rec.getCellLine() == null) {
            Logger.warn("Combination {} not found or incomplete, skipping", index);
            audit.recordMessage(index, SkipAuditLog.STAGE_PERSIST, String.valueOf(index), "combination not found");
            return Outcome.SKIPPED;
        }

        List<String> names = List.of(rec.getDrug1(), rec.getDrug2());
        Future<List<Resolution<DrugFetchResult>>> drugsF = pool.submit(() -> {
            List<Resolution<DrugFetchResult>> out = new ArrayList<>(names.size());
            for (String n : names) out.add(drugResolver.resolve(n));
            return out;
        });
        Future<Resolution<CellLineFetchResult>> cellF = pool.submit(() -> cellLineResolver.resolve(rec.getCellLine()));

        List<Resolution<DrugFetchResult>> drugs;
        Resolution<CellLineFetchResult> cell;
        try {
            drugs = drugsF.get();
            cell = cellF.get();
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            String stage = failed(drugsF) ? SkipAuditLog.STAGE_DRUG : SkipAuditLog.STAGE_CELL_LINE;
            String entity = failed(drugsF) ? rec.getDrug1() + "+" + rec.getDrug2() : rec.getCellLine();
            cellF.cancel(true);
            Logger.error("Combination {}: {} resolution failed: {}", index, stage, cause.toString());
            audit.recordMessage(index, stage, entity, cause.toString());
            return Outcome.FAILED;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            drugsF.cancel(true);
            cellF.cancel(true);
            return Outcome.FAILED;
        }

        boolean skip = false;
        for (int k = 0; k < drugs.size(); k++) {
            Resolution<DrugFetchResult> r = drugs.get(k);
            if (!r.isResolved()) {
                skip = true;
                Logger.info("Combination {}: drug '{}' unresolvable ({})", index, names.get(k), r.getReason());
                audit.recordCode(index, SkipAuditLog.STAGE_DRUG, DrugNames.normalize(names.get(k)), r.getCode());
            }
        }
        if (!cell.isResolved()) {
            skip = true;
            Logger.info("Combination {}: cell line '{}' unresolvable ({})", index, rec.getCellLine(), cell.getReason());
            audit.recordCode(index, SkipAuditLog.STAGE_CELL_LINE, rec.getCellLine(), cell.getCode());
        }
        if (skip) {
            return Outcome.SKIPPED;
        }

        try {
            List<DrugFetchResult> resolved = new ArrayList<>();
            List<String> chemblIds = new ArrayList<>();
            for (Resolution<DrugFetchResult> r : drugs) {
                resolved.add(r.getValue());
                chemblIds.add(r.getValue().getChemblId());
            }
            CellLineFetchResult cellLine = cell.getValue();

            drugResolver.persist(resolved);
            cellLineResolver.persist(cellLine);

            ScoreClassification scores = classifier.classify(rec);
            long experimentId = assembler.persist(index, chemblIds, cellLine.getCellLine().getCellLineId(), scores);
            Logger.debug("Combination {} -> experiment {}", index, experimentId);
            return Outcome.SUCCEEDED;
        } catch (RuntimeException ex) {
            Logger.error("Combination {}: persist failed: {}", index, ex.getMessage());
            audit.recordMessage(index, SkipAuditLog.STAGE_PERSIST, String.valueOf(index), ex.toString());
            return Outcome.FAILED;
        }
    }

    private static boolean failed(Future<?> f) {
        if (!f.isDone() || f.isCancelled()) return false;
        try {
            f.get();
            return false;
        } catch (ExecutionException ex) {
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
