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
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.disnet.dcdb.api.DrugCombDbClient;
import org.disnet.dcdb.om.Classification;
import org.disnet.dcdb.om.CombinationRecord;
import org.disnet.dcdb.om.Score;
import org.disnet.dcdb.processing.score.ScoreClassifier;
import org.disnet.dcdb.processing.support.RunSummary;
import org.disnet.dcdb.staging.LocalMirror;
import org.disnet.dcdb.util.Logger;

/**
 * Fills the local mirror table {@code drug_combinations} from the DrugCombDB
 * integration endpoint. Resumes after the highest mirrored ID and commits
 * every {@value #BATCH_SIZE} indices.
 */
public class CombinationDownloader {

    /** Last integration index published by DrugCombDB. */
    public static final int MAX_COMBINATION_ID = 476718;
    public static final int BATCH_SIZE = 100;

    private final DrugCombDbClient dcdb;
    private final LocalMirror mirror;

    public CombinationDownloader(DrugCombDbClient dcdb, LocalMirror mirror) {
        this.dcdb = dcdb;
        this.mirror = mirror;
    }

    /**
     * Download indices {@code start..end}, both inclusive, skipping what is
     * already mirrored.
     */
    public RunSummary download(int start, int end) throws SQLException {
        int first = Math.max(start, mirror.maxCombinationId() + 1);
        int last = Math.min(end, MAX_COMBINATION_ID);
        RunSummary summary = new RunSummary("Mirror download");
        if (first > last) {
            Logger.info("Mirror already holds combinations up to {}; nothing to download.", first - 1);
            return summary;
        }
        Logger.info("Resuming mirror download from combination {} to {}", first, last);

        for (int from = first; from <= last; from += BATCH_SIZE) {
            int to = Math.min(from + BATCH_SIZE - 1, last);
            Logger.info("Downloading combinations {}..{}", from, to);

            List<CombinationRecord> rows = new ArrayList<>(BATCH_SIZE);
            List<String> labels = new ArrayList<>(BATCH_SIZE);
            for (int i = from; i <= to; i++) {
                CombinationRecord rec = dcdb.getCombination(i);
                if (rec == null) {
                    Logger.debug("Combination {} not found", i);
                    summary.skip();
                    continue;
                }
                CombinationRecord rounded = rounded(i, rec);
                rows.add(rounded);
                labels.add(label(rounded));
            }
            int inserted = mirror.insertCombinations(rows, labels);
            for (int k = 0; k < inserted; k++) summary.success();
            for (int k = inserted; k < rows.size(); k++) summary.skip();
        }
        summary.log();
        return summary;
    }

    static CombinationRecord rounded(int index, CombinationRecord rec) {
        return rec.toBuilder()
                .id(index)
                .hsa(round(rec.getHsa()))
                .bliss(round(rec.getBliss()))
                .loewe(round(rec.getLoewe()))
                .zip(round(rec.getZip()))
                .build();
    }

    /** Lower-case classification label stored next to the mirrored scores. */
    static String label(CombinationRecord rec) {
        int vote = ScoreClassifier.classifyValues(rec.getZip(), rec.getBliss(), rec.getLoewe(), rec.getHsa());
        return Classification.fromVote(vote).getLabel().toLowerCase(Locale.ROOT);
    }

    private static Double round(Double v) {
        return v == null || v.isNaN() ? null : Score.round4(v);
    }
}
