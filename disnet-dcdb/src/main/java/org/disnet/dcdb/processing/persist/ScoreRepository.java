package org.disnet.dcdb.processing.persist;

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

/**
 * Rows of {@code score}: one per score name (HSA, Bliss, Loewe, ZIP).
 */
public class ScoreRepository {

    private final DisnetDatabase db;
    private final LookupTable scores;

    public ScoreRepository(DisnetDatabase db, int cacheSize) {
        this.db = db;
        this.scores = new LookupTable("score", "score_id", "score_name", cacheSize);
    }

    public int getOrCreateScoreId(String scoreName) {
        return db.inTransaction(c -> scores.getOrCreate(c, scoreName));
    }
}
