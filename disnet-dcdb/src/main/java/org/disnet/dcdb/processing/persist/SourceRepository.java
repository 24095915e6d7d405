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
 * Rows of {@code source}: the namespaces of drug and cell line identifiers
 * (ChEMBL, PubChem, Cellosaurus).
 */
public class SourceRepository {

    private final DisnetDatabase db;
    private final LookupTable sources;

    public SourceRepository(DisnetDatabase db, int cacheSize) {
        this.db = db;
        this.sources = new LookupTable("source", "source_id", "name", cacheSize);
    }

    public int getOrCreateSource(String name) {
        return db.inTransaction(c -> sources.getOrCreate(c, name));
    }
}
