package org.disnet.dcdb.staging;

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
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.disnet.dcdb.util.Db;

/**
 * Reads and writes {@code staging_drugs}.
 * <p>
 * Every batch update is guarded by {@code WHERE status = from}, so a row that
 * has already moved on is never rewritten, and each batch commits as one
 * transaction.
 */
public class DrugStagingDao {

    private static final String COLUMNS = "drug_name, pubchem_id, official_name, smiles, chembl_id, inchi_key,"
            + " pref_name, molecule_type, canonical_smiles, chembl_inchi_key, status, error_code, error_msg, updated_at";

    private static final String UPDATE_SQL = "UPDATE staging_drugs SET"
            + " pubchem_id = ?, official_name = ?, smiles = ?, chembl_id = ?, inchi_key = ?,"
            + " pref_name = ?, molecule_type = ?, canonical_smiles = ?, chembl_inchi_key = ?,"
            + " status = ?, error_code = ?, error_msg = ?, updated_at = CURRENT_TIMESTAMP"
            + " WHERE drug_name = ? AND status = ?";

    private final Connection conn;

    public DrugStagingDao(StagingStore store) {
        this.conn = store.getConnection();
    }

    /**
     * Stage each unique name once at {@link DrugStage#PENDING}. Names already
     * staged are left untouched, whatever their status.
     *
     * @return number of rows actually inserted
     */
    public int stage0(Collection<String> drugNames) throws SQLException {
        List<String> unique = new ArrayList<>(new LinkedHashSet<>(drugNames));
        unique.removeIf(n -> n == null || n.isBlank());
        return Db.inTransaction(conn, c -> Db.executeBatch(c,
                "INSERT OR IGNORE INTO staging_drugs (drug_name, status) VALUES (?, 0)",
                unique,
                (ps, name) -> ps.setString(1, name)));
    }

    /** Up to {@code limit} rows currently at {@code status}. */
    public List<StagedDrug> selectBatch(DrugStage status, int limit) throws SQLException {
        return Db.runQuery(conn,
                "SELECT " + COLUMNS + " FROM staging_drugs WHERE status = ? ORDER BY drug_name LIMIT ?",
                ps -> {
                    ps.setInt(1, status.getCode());
                    ps.setInt(2, limit);
                },
                DrugStagingDao::map);
    }

    /** Keyset page over rows at {@code status} with a name strictly after {@code afterName}. */
    public List<StagedDrug> selectPage(DrugStage status, String afterName, int limit) throws SQLException {
        return Db.runQuery(conn,
                "SELECT " + COLUMNS + " FROM staging_drugs WHERE status = ? AND drug_name > ? ORDER BY drug_name LIMIT ?",
                ps -> {
                    ps.setInt(1, status.getCode());
                    ps.setString(2, afterName == null ? "" : afterName);
                    ps.setInt(3, limit);
                },
                DrugStagingDao::map);
    }

    public Optional<StagedDrug> find(String drugName) throws SQLException {
        return Db.queryFirst(conn,
                "SELECT " + COLUMNS + " FROM staging_drugs WHERE drug_name = ?",
                ps -> ps.setString(1, drugName),
                DrugStagingDao::map);
    }

    /**
     * Write back a batch that was selected at {@code from}, in one transaction.
     *
     * @return rows updated; rows that left {@code from} meanwhile are skipped
     */
    public int update(DrugStage from, List<StagedDrug> rows) throws SQLException {
        return Db.inTransaction(conn, c -> Db.executeBatch(c, UPDATE_SQL, rows, (ps, d) -> {
            ps.setString(1, d.getPubchemId());
            ps.setString(2, d.getOfficialName());
            ps.setString(3, d.getSmiles());
            ps.setString(4, d.getChemblId());
            ps.setString(5, d.getInchiKey());
            ps.setString(6, d.getPrefName());
            ps.setString(7, d.getMoleculeType());
            ps.setString(8, d.getCanonicalSmiles());
            ps.setString(9, d.getChemblInchiKey());
            ps.setInt(10, d.getStatus().getCode());
            if (d.getErrorCode() == null) ps.setNull(11, Types.INTEGER);
            else ps.setInt(11, d.getErrorCode());
            ps.setString(12, d.getErrorMsg());
            ps.setString(13, d.getDrugName());
            ps.setInt(14, from.getCode());
        }));
    }

    /** Normalized drug name to ChEMBL ID for every fetched drug. */
    public Map<String, String> fetchedChemblIds() throws SQLException {
        Map<String, String> out = new LinkedHashMap<>();
        Db.streamQuery(conn,
                "SELECT drug_name, chembl_id FROM staging_drugs WHERE status = ?",
                ps -> ps.setInt(1, DrugStage.FETCHED.getCode()),
                rs -> {
                    while (rs.next()) out.put(rs.getString(1), rs.getString(2));
                },
                1_000);
        return out;
    }

    public List<StagedDrug> failed() throws SQLException {
        return Db.runQuery(conn,
                "SELECT " + COLUMNS + " FROM staging_drugs WHERE status = ? ORDER BY drug_name",
                ps -> ps.setInt(1, DrugStage.FAILED.getCode()),
                DrugStagingDao::map);
    }

    /** Row count per stage; stages without rows map to 0. */
    public Map<DrugStage, Integer> countByStatus() throws SQLException {
        Map<DrugStage, Integer> out = new EnumMap<>(DrugStage.class);
        for (DrugStage s : DrugStage.values()) out.put(s, 0);
        Db.runQuery(conn, "SELECT status, COUNT(*) FROM staging_drugs GROUP BY status", null,
                rs -> out.put(DrugStage.fromCode(rs.getInt(1)), rs.getInt(2)));
        return out;
    }

    static StagedDrug map(ResultSet rs) throws SQLException {
        StagedDrug d = new StagedDrug(rs.getString("drug_name"));
        d.setPubchemId(rs.getString("pubchem_id"));
        d.setOfficialName(rs.getString("official_name"));
        d.setSmiles(rs.getString("smiles"));
        d.setChemblId(rs.getString("chembl_id"));
        d.setInchiKey(rs.getString("inchi_key"));
        d.setPrefName(rs.getString("pref_name"));
        d.setMoleculeType(rs.getString("molecule_type"));
        d.setCanonicalSmiles(rs.getString("canonical_smiles"));
        d.setChemblInchiKey(rs.getString("chembl_inchi_key"));
        d.setStatus(DrugStage.fromCode(rs.getInt("status")));
        int code = rs.getInt("error_code");
        d.setErrorCode(rs.wasNull() ? null : code);
        d.setErrorMsg(rs.getString("error_msg"));
        d.setUpdatedAt(rs.getString("updated_at"));
        return d;
    }
}
