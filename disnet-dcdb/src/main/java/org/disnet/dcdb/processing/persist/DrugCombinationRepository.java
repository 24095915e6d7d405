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
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

import org.disnet.dcdb.util.Db;
import org.disnet.dcdb.util.Hashing;
import org.disnet.dcdb.util.LruCache;

/**
 * Drug combinations are sets of at least two ChEMBL IDs. The set, not any
 * ordering, is the identity: {@code {A,B}} and {@code {B,A}} are one
 * combination.
 * <p>
 * Lookup is an exact-set match over {@code drug_comb_drug}. The sorted member
 * list is also hashed into the unique {@code member_key} of
 * {@code drug_combination}, so a second writer that missed the lookup loses the
 * insert and falls back to reading the winner's row.
 * <p>
 * The set-to-ID cache is per instance and assumes a single writer process.
 */
public class DrugCombinationRepository {

    private static final String EXACT_SET_SQL =
            "SELECT dc_id FROM drug_comb_drug"
            + " GROUP BY dc_id"
            + " HAVING COUNT(*) = ? AND SUM(CASE WHEN drug_id IN " + Db.IN_TOKEN + " THEN 1 ELSE 0 END) = ?";

    private final DisnetDatabase db;
    private final Map<List<String>, Long> cache;

    public DrugCombinationRepository(DisnetDatabase db, int cacheSize) {
        this.db = db;
        this.cache = Collections.synchronizedMap(new LruCache<>(cacheSize));
    }

    /**
     * ID of the combination made of exactly {@code drugIds}, created if needed.
     *
     * @throws IllegalArgumentException if fewer than two distinct IDs are given
     */
    public long getOrCreateCombination(Collection<String> drugIds) {
        List<String> members = normalize(drugIds);

        Long cached = cache.get(members);
        if (cached != null) {
            return cached;
        }
        long id = db.inTransaction(c -> {
            Optional<Long> existing = findExact(c, members);
            if (existing.isPresent()) {
                return existing.get();
            }
            return insert(c, members);
        });
        cache.put(members, id);
        return id;
    }

    /** Look up without creating. */
    public Optional<Long> findCombination(Collection<String> drugIds) {
        List<String> members = normalize(drugIds);
        return db.inTransaction(c -> findExact(c, members));
    }

    /** Sorted distinct IDs. */
    static List<String> normalize(Collection<String> drugIds) {
        if (drugIds == null) {
            throw new IllegalArgumentException("drugIds must not be null");
        }
        TreeSet<String> set = new TreeSet<>();
        for (String id : drugIds) {
            if (id != null && !id.isBlank()) set.add(id.trim());
        }
        if (set.size() < 2) {
            throw new IllegalArgumentException(
                    "At least two unique drug IDs are required to form a combination, got " + set);
        }
        return Collections.unmodifiableList(new ArrayList<>(set));
    }

    static String memberKey(List<String> sortedMembers) {
        return Hashing.sha256Hex(String.join("\u001f", sortedMembers));
    }

    private static Optional<Long> findExact(Connection c, List<String> members) throws SQLException {
        int n = members.size();
        return Db.queryFirst(c, Db.bindIn(EXACT_SET_SQL, n), ps -> {
            ps.setInt(1, n);
            int next = Db.bind(ps, 2, members);
            ps.setInt(next, n);
        }, rs -> rs.getLong(1));
    }

    private static long insert(Connection c, List<String> members) throws SQLException {
        String key = memberKey(members);
        Db.InsertResult r = Db.insertIfAbsent(c,
                "INSERT INTO drug_combination (member_key) VALUES (?)",
                ps -> ps.setString(1, key));
        if (r.existed()) {
            // another writer created it between our lookup and insert
            return byMemberKey(c, key);
        }
        long dcId = r.generatedKey() != null ? r.generatedKey() : byMemberKey(c, key);
        Db.executeBatch(c, "INSERT INTO drug_comb_drug (dc_id, drug_id) VALUES (?, ?)", members, (ps, drugId) -> {
            ps.setLong(1, dcId);
            ps.setString(2, drugId);
        });
        return dcId;
    }

    private static long byMemberKey(Connection c, String key) throws SQLException {
        return Db.queryFirst(c, "SELECT dc_id FROM drug_combination WHERE member_key = ?",
                        ps -> ps.setString(1, key), rs -> rs.getLong(1))
                .orElseThrow(() -> new SQLException("drug_combination with member_key " + key + " not found"));
    }

    /** Forget cached IDs, e.g. after the enclosing unit of work rolled back. */
    public void evictAll() {
        cache.clear();
    }
}
