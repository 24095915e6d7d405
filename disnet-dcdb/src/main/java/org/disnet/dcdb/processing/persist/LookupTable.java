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
import java.util.Optional;

import org.disnet.dcdb.util.Db;
import org.disnet.dcdb.util.LruCache;

/**
 * A small {@code (id, name)} table with a unique name and an auto-increment ID,
 * read through a name cache: cache, then query, then insert.
 */
class LookupTable {

    private final String selectSql;
    private final String insertSql;
    private final Map<String, Integer> cache;

    LookupTable(String table, String idColumn, String nameColumn, int cacheSize) {
        this.selectSql = "SELECT " + idColumn + " FROM " + table + " WHERE " + nameColumn + " = ?";
        this.insertSql = "INSERT INTO " + table + " (" + nameColumn + ") VALUES (?)";
        this.cache = Collections.synchronizedMap(new LruCache<>(cacheSize));
    }

    int getOrCreate(Connection c, String name) throws SQLException {
        Integer cached = cache.get(name);
        if (cached != null) {
            return cached;
        }
        Optional<Integer> found = find(c, name);
        int id;
        if (found.isPresent()) {
            id = found.get();
        } else {
            Db.InsertResult r = Db.insertIfAbsent(c, insertSql, ps -> ps.setString(1, name));
            if (!r.existed() && r.generatedKey() != null) {
                id = r.generatedKey().intValue();
            } else {
                id = find(c, name).orElseThrow(() -> new SQLException("Row for '" + name + "' vanished after insert"));
            }
        }
        cache.put(name, id);
        return id;
    }

    private Optional<Integer> find(Connection c, String name) throws SQLException {
        return Db.queryFirst(c, selectSql, ps -> ps.setString(1, name), rs -> rs.getInt(1));
    }

    void evictAll() {
        cache.clear();
    }
}
