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

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collections;
import java.util.Map;

import org.disnet.dcdb.om.Classification;
import org.disnet.dcdb.om.Experiment;
import org.disnet.dcdb.om.Score;
import org.disnet.dcdb.util.Db;
import org.disnet.dcdb.util.Logger;
import org.disnet.dcdb.util.LruCache;

/**
 * Experiments, their scores and the two lookup tables they reference
 * ({@code experiment_classification}, {@code experiment_source}).
 * <p>
 * Deduplication is by {@link Experiment#contentHash()}, stored in the unique
 * {@code experiment_hash} column.
 */
public class ExperimentRepository {

    private final DisnetDatabase db;
    private final LookupTable classifications;
    private final LookupTable sources;
    private final Map<String, Long> hashCache;

    public ExperimentRepository(DisnetDatabase db, int cacheSize) {
        this.db = db;
        this.classifications = new LookupTable("experiment_classification", "classification_id", "classification_name", cacheSize);
        this.sources = new LookupTable("experiment_source", "source_id", "source", cacheSize);
        this.hashCache = Collections.synchronizedMap(new LruCache<>(cacheSize));
    }

    public int getOrCreateClassificationId(Classification classification) {
        return db.inTransaction(c -> classifications.getOrCreate(c, classification.getLabel()));
    }

    public int getOrCreateExperimentSourceId(String sourceName) {
        return db.inTransaction(c -> sources.getOrCreate(c, sourceName));
    }

    /**
     * ID of the experiment with the same content hash, created with its scores
     * if new. When the row already exists but holds fewer scores than
     * {@code exp}, the missing scores are added; a score already present is
     * skipped.
     */
    public long getOrCreateExperiment(Experiment exp) {
        String hash = exp.contentHash();
        Long cached = hashCache.get(hash);
        if (cached != null) {
            return cached;
        }
        long id = db.inTransaction(c -> {
            Db.InsertResult r = Db.insertIfAbsent(c,
                    "INSERT INTO experiment (dc_id, cell_line_id, classification_id, source_id, experiment_hash)"
                            + " VALUES (?, ?, ?, ?, ?)",
                    ps -> {
                        ps.setLong(1, exp.getCombinationId());
                        ps.setString(2, exp.getCellLineId());
                        ps.setInt(3, exp.getClassificationId());
                        ps.setInt(4, exp.getSourceId());
                        ps.setString(5, hash);
                    });
            if (!r.existed()) {
                long newId = r.generatedKey() != null ? r.generatedKey() : byHash(c, hash);
                Db.executeBatch(c,
                        "INSERT INTO experiment_score (experiment_id, score_id, score_value) VALUES (?, ?, ?)",
                        exp.getScores(),
                        (ps, s) -> {
                            ps.setLong(1, newId);
                            ps.setInt(2, s.getScoreId());
                            ps.setDouble(3, s.getScoreValue());
                        });
                return newId;
            }

            long existingId = byHash(c, hash);
            int stored = countScores(c, existingId);
            if (stored != exp.getScores().size()) {
                int added = insertMissingScores(c, existingId, exp);
                Logger.debug("Experiment {} existed with {} scores, added {}", existingId, stored, added);
            }
            return existingId;
        });
        hashCache.put(hash, id);
        return id;
    }

    private static int insertMissingScores(Connection c, long experimentId, Experiment exp) throws SQLException {
        int added = 0;
        for (Score s : exp.getScores()) {
            Db.InsertResult r = Db.insertIfAbsent(c,
                    "INSERT INTO experiment_score (experiment_id, score_id, score_value) VALUES (?, ?, ?)",
                    ps -> {
                        ps.setLong(1, experimentId);
                        ps.setInt(2, s.getScoreId());
                        ps.setDouble(3, s.getScoreValue());
                    });
            if (!r.existed()) added++;
        }
        return added;
    }

    private static long byHash(Connection c, String hash) throws SQLException {
        return Db.queryFirst(c, "SELECT experiment_id FROM experiment WHERE experiment_hash = ?",
                        ps -> ps.setString(1, hash), rs -> rs.getLong(1))
                .orElseThrow(() -> new SQLException("experiment with hash " + hash + " not found"));
    }

    private static int countScores(Connection c, long experimentId) throws SQLException {
        return Db.queryFirst(c, "SELECT COUNT(*) FROM experiment_score WHERE experiment_id = ?",
                ps -> ps.setLong(1, experimentId), rs -> rs.getInt(1)).orElse(0);
    }

    /** Number of scores stored for an experiment. */
    public int scoreCount(long experimentId) {
        return db.inTransaction(c -> countScores(c, experimentId));
    }

    /** Forget cached IDs, e.g. after the enclosing unit of work rolled back. */
    public void evictAll() {
        hashCache.clear();
        classifications.evictAll();
        sources.evictAll();
    }
}
