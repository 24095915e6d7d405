package org.disnet.dcdb.om;

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
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import org.disnet.dcdb.util.Hashing;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An experiment: one drug combination tested on one cell line, with its
 * classification, source and scores.
 * <p>
 * The dedup key is {@link #contentHash()}, not the auto-increment ID: the same
 * experiment may be submitted again by re-runs or overlapping ranges.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Experiment {

    private long combinationId;
    private String cellLineId;
    private int classificationId;
    private int sourceId;
    private List<Score> scores = new ArrayList<>();

    /**
     * SHA-256 over combination, cell line, classification, source and the
     * {@code (scoreId, value)} pairs sorted by ID then value. Every score must
     * have its ID resolved.
     *
     * @throws IllegalStateException if a score has no ID
     */
    public String contentHash() {
        List<Score> sorted = new ArrayList<>(scores == null ? List.of() : scores);
        for (Score s : sorted) {
            if (s.getScoreId() == null) {
                throw new IllegalStateException("Score " + s.getScoreName() + " has no score_id");
            }
        }
        sorted.sort(Comparator.comparing(Score::getScoreId).thenComparingDouble(Score::getScoreValue));

        String pairs = sorted.stream()
                .map(s -> s.getScoreId() + ":" + String.format(Locale.ROOT, "%.4f", s.getScoreValue()))
                .collect(Collectors.joining(","));

        String canonical = combinationId + "|" + cellLineId + "|" + classificationId + "|" + sourceId + "|" + pairs;
        return Hashing.sha256Hex(canonical);
    }
}
