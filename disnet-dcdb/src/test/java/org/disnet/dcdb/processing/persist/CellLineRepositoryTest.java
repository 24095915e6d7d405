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

import static org.junit.jupiter.api.Assertions.*;

import org.disnet.dcdb.om.CellLine;
import org.disnet.dcdb.om.Disease;
import org.disnet.dcdb.om.SourceNames;
import org.disnet.dcdb.util.Db;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CellLineRepositoryTest {

    private DisnetDatabase db;
    private CellLineRepository repo;
    private int cellosaurus;

    @BeforeEach
    void setUp() {
        db = TestDatabases.fresh();
        cellosaurus = new SourceRepository(db, 10).getOrCreateSource(SourceNames.CELLOSAURUS);
        repo = new CellLineRepository(db);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void saveWritesDiseaseFirstAndOnce() throws Exception {
        Disease melanoma = new Disease("C0025202", "melanoma");
        CellLine a2058 = new CellLine("CVCL_1059", cellosaurus, "A2058", "C0025202", "skin");

        assertEquals("CVCL_1059", repo.save(a2058, melanoma));
        assertEquals("CVCL_1059", repo.save(a2058, melanoma));

        String disease = Db.queryFirst(db.getConnection(),
                "SELECT d.name FROM cell_line c JOIN disease d ON d.disease_id = c.disease_id WHERE c.cell_line_id = ?",
                ps -> ps.setString(1, "CVCL_1059"), rs -> rs.getString(1)).orElseThrow();
        assertEquals("melanoma", disease);
    }

    @Test
    void cellLineWithoutDisease() throws Exception {
        repo.save(new CellLine("CVCL_0023", cellosaurus, "A549", null, "lung"), null);
        assertEquals(1, Db.queryFirst(db.getConnection(), "SELECT COUNT(*) FROM cell_line", null, rs -> rs.getInt(1)).orElse(0));
    }

    @Test
    void diseaseIsCreatedOnce() throws Exception {
        assertEquals("C0006142", repo.getOrCreateDisease(new Disease("C0006142", "breast carcinoma")));
        assertEquals("C0006142", repo.getOrCreateDisease(new Disease("C0006142", "breast carcinoma")));
        assertEquals(1, Db.queryFirst(db.getConnection(), "SELECT COUNT(*) FROM disease", null, rs -> rs.getInt(1)).orElse(0));
    }

    @Test
    void accessionIsRequired() {
        assertThrows(IllegalArgumentException.class,
                () -> repo.getOrCreateCellLine(new CellLine(null, cellosaurus, "orphan", null, null)));
    }
}
