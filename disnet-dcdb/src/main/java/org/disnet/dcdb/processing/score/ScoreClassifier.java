package org.disnet.dcdb.processing.score;

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

import java.util.ArrayList;
import java.util.List;

import org.disnet.dcdb.om.CombinationRecord;
import org.disnet.dcdb.om.Score;
import org.disnet.dcdb.processing.persist.ScoreRepository;

/**
 * Turns the four DrugCombDB synergy scores into a classification by majority
 * vote: each present score votes +1 above {@value #EPSILON}, -1 below
 * -{@value #EPSILON}, 0 otherwise, and the classification is the sign of the
 * sum. One extreme score cannot outvote the others.
 */
public class ScoreClassifier {

    public static final double EPSILON = 1e-5;

    private final ScoreRepository scores;

    public ScoreClassifier(ScoreRepository scores) {
        this.scores = scores;
    }

    /**
     * Classify; null scores are ignored. All null yields no scores and 0.
     */
    public ScoreClassification classify(Double hsa, Double bliss, Double loewe, Double zip) {
        List<Score> out = new ArrayList<>(4);
        int sum = 0;
        sum += add(out, Score.HSA, hsa);
        sum += add(out, Score.BLISS, bliss);
        sum += add(out, Score.LOEWE, loewe);
        sum += add(out, Score.ZIP, zip);
        return new ScoreClassification(out, Integer.signum(sum));
    }

    public ScoreClassification classify(CombinationRecord rec) {
        return classify(rec.getHsa(), rec.getBliss(), rec.getLoewe(), rec.getZip());
    }

    private int add(List<Score> out, String name, Double value) {
        if (value == null || value.isNaN()) {
            return 0;
        }
        int scoreId = scores.getOrCreateScoreId(name);
        out.add(new Score(name, Score.round4(value), scoreId));
        return vote(value);
    }

    /** +1, -1 or 0 for a single score. */
    public static int vote(double value) {
        if (value > EPSILON) return 1;
        if (value < -EPSILON) return -1;
        return 0;
    }

    /** Classification of the available scores without touching the score table. */
    public static int classifyValues(Double... values) {
        int sum = 0;
        for (Double v : values) {
            if (v != null && !v.isNaN()) sum += vote(v);
        }
        return Integer.signum(sum);
    }
}
