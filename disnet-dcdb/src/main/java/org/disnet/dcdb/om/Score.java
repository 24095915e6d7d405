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

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One synergy score of an experiment. {@code scoreId} is resolved lazily
 * from the score table and stays null until then.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Score {

    public static final String HSA = "HSA";
    public static final String BLISS = "Bliss";
    public static final String LOEWE = "Loewe";
    public static final String ZIP = "ZIP";

    private String scoreName;
    private double scoreValue;
    private Integer scoreId;

    /** Round half-up to four decimal places. */
    public static double round4(double value) {
        return Math.round(value * 10_000d) / 10_000d;
    }
}
