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

import org.disnet.dcdb.om.CellLine;
import org.disnet.dcdb.om.Disease;
import org.disnet.dcdb.util.Db;

/**
 * Writes {@code disease} and {@code cell_line} rows. A cell line's disease is
 * always written before the cell line that references it.
 */
public class CellLineRepository {

    private final DisnetDatabase db;

    public CellLineRepository(DisnetDatabase db) {
        this.db = db;
    }

    public String getOrCreateDisease(Disease disease) {
        return db.inTransaction(c -> insertDisease(c, disease));
    }

    public String getOrCreateCellLine(CellLine cellLine) {
        return db.inTransaction(c -> insertCellLine(c, cellLine));
    }

    /** Disease (if any) then cell line, as one unit of work. */
    public String save(CellLine cellLine, Disease disease) {
        return db.inTransaction(c -> {
            if (disease != null && disease.getDiseaseId() != null) {
                insertDisease(c, disease);
            }
            return insertCellLine(c, cellLine);
        });
    }

    private static String insertDisease(Connection c, Disease d) throws SQLException {
        Db.insertIfAbsent(c, "INSERT INTO disease (disease_id, name) VALUES (?, ?)", ps -> {
            ps.setString(1, d.getDiseaseId());
            ps.setString(2, d.getName());
        });
        return d.getDiseaseId();
    }

    private static String insertCellLine(Connection c, CellLine cl) throws SQLException {
        if (cl.getCellLineId() == null) {
            throw new IllegalArgumentException("Cell line without accession: " + cl.getName());
        }
        Db.insertIfAbsent(c,
                "INSERT INTO cell_line (cell_line_id, source_id, cell_line_name, disease_id, tissue) VALUES (?, ?, ?, ?, ?)",
                ps -> {
                    ps.setString(1, cl.getCellLineId());
                    ps.setInt(2, cl.getSourceId());
                    ps.setString(3, cl.getName());
                    ps.setString(4, cl.getDiseaseId());
                    ps.setString(5, cl.getTissue());
                });
        return cl.getCellLineId();
    }
}
