package org.disnet.dcdb.processing.experiment;

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

import java.util.Collection;

import org.disnet.dcdb.om.Classification;
import org.disnet.dcdb.om.Experiment;
import org.disnet.dcdb.om.SourceNames;
import org.disnet.dcdb.processing.persist.DisnetDatabase;
import org.disnet.dcdb.processing.persist.DrugCombinationRepository;
import org.disnet.dcdb.processing.persist.ExperimentRepository;
import org.disnet.dcdb.processing.score.ScoreClassification;
import org.disnet.dcdb.util.Logger;

/**
 * Joins resolved drugs, a resolved cell line and classified scores into one
 * DISNET experiment. Combination, lookup rows, experiment and scores are
 * written as a single unit of work.
 */
public class ExperimentAssembler {

    private final DisnetDatabase db;
    private final DrugCombinationRepository combinations;
    private final ExperimentRepository experiments;

    public ExperimentAssembler(DisnetDatabase db,
                               DrugCombinationRepository combinations,
                               ExperimentRepository experiments) {
        this.db = db;
        this.combinations = combinations;
        this.experiments = experiments;
    }

    /**
     * @param combinationId source row ID, used for logging only
     * @param chemblIds     ChEMBL IDs of the drugs; at least two distinct
     * @param cellLineId    Cellosaurus accession
     * @return DISNET experiment ID
     * @throws IllegalArgumentException if fewer than two distinct drugs are given
     */
    public long persist(int combinationId, Collection<String> chemblIds, String cellLineId, ScoreClassification scores) {
        try {
            return db.inTransaction(c -> {
                long dcId = combinations.getOrCreateCombination(chemblIds);

                Classification label = scores.getLabel();
                if (label == Classification.ADDITIVE) {
                    Logger.warn("Combination {} ({}) on {} classified as {}", combinationId, chemblIds, cellLineId, label.getLabel());
                }
                int classId = experiments.getOrCreateClassificationId(label);
                int sourceId = experiments.getOrCreateExperimentSourceId(SourceNames.DRUGCOMBDB);

                Experiment exp = new Experiment(dcId, cellLineId, classId, sourceId, scores.getScores());
                return experiments.getOrCreateExperiment(exp);
            });
        } catch (RuntimeException ex) {
            // IDs cached inside the rolled-back unit of work may not exist
            combinations.evictAll();
            experiments.evictAll();
            throw ex;
        }
    }
}
