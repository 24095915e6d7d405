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

import java.util.List;

import org.disnet.dcdb.om.Classification;
import org.disnet.dcdb.om.Score;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Scores present on a combination, with resolved IDs and rounded values, and
 * the signed vote over them (-1, 0 or +1).
 */
@Data
@AllArgsConstructor
public class ScoreClassification {

    private List<Score> scores;
    private int classification;

    public Classification getLabel() {
        return Classification.fromVote(classification);
    }
}
