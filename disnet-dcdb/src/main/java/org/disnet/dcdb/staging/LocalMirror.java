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
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Optional;

import org.disnet.dcdb.api.DrugCombDbClient;
import org.disnet.dcdb.api.DrugCombDbClient.CellLineInfo;
import org.disnet.dcdb.api.DrugCombDbClient.RawDrugInfo;
import org.disnet.dcdb.om.CombinationRecord;
import org.disnet.dcdb.util.Db;

/**
 * Local copy of DrugCombDB kept in the staging store: combinations, drugs and
 * cell lines. Lookups here are tried before any call to the DrugCombDB API.
 */
public class LocalMirror {

    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_PROCESSED = "processed";
    public static final String STATUS_ERROR = "error";

    private static final String APPROVED_SUFFIX = "(approved)";

    private final Connection conn;

    public LocalMirror(StagingStore store) {
        this.conn = store.getConnection();
    }

    /**
     * Drug row for a normalized name, if mirrored and carrying a PubChem
     * identifier. The mirror keys drugs by their DrugCombDB spelling, so
     * {@code "5-FU"} also matches a row stored as {@code "5-FU(approved)"};
     * an exact match wins.
     */
    public Optional<RawDrugInfo> findDrug(String drugName) throws SQLException {
        return Db.queryFirst(conn,
                "SELECT cIds, drugNameOfficial, smilesString FROM drugs"
                        + " WHERE drugName IN (?, ?, ?) AND cIds IS NOT NULL"
                        + " ORDER BY CASE WHEN drugName = ? THEN 0 ELSE 1 END",
                ps -> {
                    ps.setString(1, drugName);
                    ps.setString(2, drugName + APPROVED_SUFFIX);
                    ps.setString(3, drugName + " " + APPROVED_SUFFIX);
                    ps.setString(4, drugName);
                },
                rs -> new RawDrugInfo(DrugCombDbClient.pubchemCid(rs.getString(1)), rs.getString(2), rs.getString(3)));
    }

    /** COSMIC ID of a mirrored cell line, if any. */
    public Optional<String> findCosmicId(String cellLineName) throws SQLException {
        return Db.queryFirst(conn,
                "SELECT cosmicId FROM cell_lines WHERE cellName = ? AND cosmicId IS NOT NULL AND cosmicId <> ''",
                ps -> ps.setString(1, cellLineName),
                rs -> rs.getString(1));
    }

    public Optional<CellLineInfo> findCellLine(String cellLineName) throws SQLException {
        return Db.queryFirst(conn,
                "SELECT cellosaurus_assession, tissue, cosmicId FROM cell_lines WHERE cellName = ?",
                ps -> ps.setString(1, cellLineName),
                rs -> new CellLineInfo(rs.getString(1), rs.getString(2), rs.getString(3)));
    }

    /** All combinations not yet processed, in ID order. */
    public List<CombinationRecord> pendingCombinations() throws SQLException {
        return Db.runQuery(conn,
                "SELECT id, drug1, drug2, cell_line, hsa, bliss, loewe, zip, source FROM drug_combinations"
                        + " WHERE status IS NULL OR status = ? ORDER BY id",
                ps -> ps.setString(1, STATUS_PENDING),
                LocalMirror::mapCombination);
    }

    public void setStatus(int combinationId, String status) throws SQLException {
        Db.execute(conn, "UPDATE drug_combinations SET status = ? WHERE id = ?", ps -> {
            ps.setString(1, status);
            ps.setInt(2, combinationId);
        });
    }

    /** Highest mirrored combination ID, 0 when empty. */
    public int maxCombinationId() throws SQLException {
        return Db.queryFirst(conn, "SELECT MAX(id) FROM drug_combinations", null, rs -> rs.getInt(1)).orElse(0);
    }

    /** Insert downloaded combinations with their classification label, as one transaction. */
    public int insertCombinations(List<CombinationRecord> rows, List<String> labels) throws SQLException {
        if (rows.size() != labels.size()) {
            throw new IllegalArgumentException("rows and labels differ in size");
        }
        return Db.inTransaction(conn, c -> {
            int n = 0;
            for (int i = 0; i < rows.size(); i++) {
                CombinationRecord r = rows.get(i);
                String label = labels.get(i);
                n += Db.execute(c,
                        "INSERT OR IGNORE INTO drug_combinations"
                                + " (id, drug1, drug2, cell_line, hsa, bliss, loewe, zip, source, classification, status)"
                                + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                        ps -> {
                            ps.setInt(1, r.getId());
                            ps.setString(2, r.getDrug1());
                            ps.setString(3, r.getDrug2());
                            ps.setString(4, r.getCellLine());
                            setDouble(ps, 5, r.getHsa());
                            setDouble(ps, 6, r.getBliss());
                            setDouble(ps, 7, r.getLoewe());
                            setDouble(ps, 8, r.getZip());
                            ps.setString(9, r.getSource());
                            ps.setString(10, label);
                            ps.setString(11, STATUS_PENDING);
                        });
            }
            return n;
        });
    }

    /** Add or replace a mirrored drug row. */
    public void putDrug(String drugName, RawDrugInfo info) throws SQLException {
        Db.execute(conn, "INSERT OR REPLACE INTO drugs (drugName, cIds, drugNameOfficial, smilesString) VALUES (?, ?, ?, ?)",
                ps -> {
                    ps.setString(1, drugName);
                    ps.setString(2, info.getPubchemId());
                    ps.setString(3, info.getOfficialName());
                    ps.setString(4, info.getSmiles());
                });
    }

    /** Add or replace a mirrored cell line row. */
    public void putCellLine(String cellName, CellLineInfo info) throws SQLException {
        Db.execute(conn, "INSERT OR REPLACE INTO cell_lines (cellName, cosmicId, cellosaurus_assession, tissue) VALUES (?, ?, ?, ?)",
                ps -> {
                    ps.setString(1, cellName);
                    ps.setString(2, info.getCosmicId());
                    ps.setString(3, info.getAccession());
                    ps.setString(4, info.getTissue());
                });
    }

    private static void setDouble(PreparedStatement ps, int idx, Double v) throws SQLException {
        if (v == null) ps.setNull(idx, Types.DOUBLE);
        else ps.setDouble(idx, v);
    }

    private static Double getDouble(ResultSet rs, String col) throws SQLException {
        double v = rs.getDouble(col);
        return rs.wasNull() ? null : v;
    }

    static CombinationRecord mapCombination(ResultSet rs) throws SQLException {
        return CombinationRecord.builder()
                .id(rs.getInt("id"))
                .drug1(rs.getString("drug1"))
                .drug2(rs.getString("drug2"))
                .cellLine(rs.getString("cell_line"))
                .hsa(getDouble(rs, "hsa"))
                .bliss(getDouble(rs, "bliss"))
                .loewe(getDouble(rs, "loewe"))
                .zip(getDouble(rs, "zip"))
                .source(rs.getString("source"))
                .build();
    }
}
