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

import org.disnet.dcdb.om.Drug;
import org.disnet.dcdb.om.ForeignMap;
import org.disnet.dcdb.util.Db;

/**
 * Writes raw drugs ({@code drug_raw}), cured ChEMBL drugs ({@code drug}) and
 * the mapping between them ({@code foreign_to_chembl}). Every insert is
 * idempotent: an existing row is left as it is.
 */
public class DrugRepository {

    private static final String INSERT_COLUMNS =
            " (drug_id, source_id, drug_name, molecular_type, chemical_structure, inchi_key) VALUES (?, ?, ?, ?, ?, ?)";

    private final DisnetDatabase db;

    public DrugRepository(DisnetDatabase db) {
        this.db = db;
    }

    public String getOrCreateRawDrug(Drug drug) {
        return db.inTransaction(c -> insertDrug(c, "drug_raw", drug));
    }

    public String getOrCreateChemblDrug(Drug drug) {
        return db.inTransaction(c -> insertDrug(c, "drug", drug));
    }

    /** @return true if the mapping was new */
    public boolean mapForeignToChembl(ForeignMap mapping) {
        return db.inTransaction(c -> insertMapping(c, mapping));
    }

    /**
     * Raw drug, cured drug and their mapping as one unit of work, in
     * foreign-key order.
     */
    public void saveResolved(Drug raw, Drug chembl) {
        db.inTransaction(c -> {
            insertDrug(c, "drug_raw", raw);
            insertDrug(c, "drug", chembl);
            insertMapping(c, new ForeignMap(raw.getDrugId(), raw.getSourceId(), chembl.getDrugId()));
            return null;
        });
    }

    private static String insertDrug(Connection c, String table, Drug d) throws SQLException {
        if (d.getDrugId() == null) {
            throw new IllegalArgumentException("Drug without ID: " + d.getDrugName());
        }
        Db.insertIfAbsent(c, "INSERT INTO " + table + INSERT_COLUMNS, ps -> {
            ps.setString(1, d.getDrugId());
            ps.setInt(2, d.getSourceId());
            ps.setString(3, d.getDrugName() == null ? d.getDrugId() : d.getDrugName());
            ps.setString(4, d.getMolecularType());
            ps.setString(5, d.getChemicalStructure());
            ps.setString(6, d.getInchiKey());
        });
        return d.getDrugId();
    }

    private static boolean insertMapping(Connection c, ForeignMap m) throws SQLException {
        Db.InsertResult r = Db.insertIfAbsent(c,
                "INSERT INTO foreign_to_chembl (foreign_id, foreign_source_id, chembl_id) VALUES (?, ?, ?)",
                ps -> {
                    ps.setString(1, m.getForeignId());
                    ps.setInt(2, m.getForeignSourceId());
                    ps.setString(3, m.getChemblId());
                });
        return !r.existed();
    }
}
