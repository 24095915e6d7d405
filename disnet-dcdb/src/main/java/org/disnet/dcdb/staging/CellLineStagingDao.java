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
 * Reads and writes {@code staging_cell_lines}. Same guarded, batch-committed
 * update contract as {@link DrugStagingDao}.
 */
public class CellLineStagingDao {

    private static final String COLUMNS = "original_name, cellosaurus_accession, tissue, ncit_code, umls_cui,"
            + " disease_name, status, error_code, error_msg, updated_at";

    private static final String UPDATE_SQL = "UPDATE staging_cell_lines SET"
            + " cellosaurus_accession = ?, tissue = ?, ncit_code = ?, umls_cui = ?, disease_name = ?,"
            + " status = ?, error_code = ?, error_msg = ?, updated_at = CURRENT_TIMESTAMP"
            + " WHERE original_name = ? AND status = ?";

    private final Connection conn;

    public CellLineStagingDao(StagingStore store) {
        this.conn = store.getConnection();
    }

    /** Stage each unique name once; returns the number of new rows. */
    public int stage0(Collection<String> names) throws SQLException {
        List<String> unique = new ArrayList<>(new LinkedHashSet<>(names));
        unique.removeIf(n -> n == null || n.isBlank());
        return Db.inTransaction(conn, c -> Db.executeBatch(c,
                "INSERT OR IGNORE INTO staging_cell_lines (original_name, status) VALUES (?, 0)",
                unique,
                (ps, name) -> ps.setString(1, name)));
    }

    public List<StagedCellLine> selectBatch(CellLineStage status, int limit) throws SQLException {
        return Db.runQuery(conn,
                "SELECT " + COLUMNS + " FROM staging_cell_lines WHERE status = ? ORDER BY original_name LIMIT ?",
                ps -> {
                    ps.setInt(1, status.getCode());
                    ps.setInt(2, limit);
                },
                CellLineStagingDao::map);
    }

    public List<StagedCellLine> selectPage(CellLineStage status, String afterName, int limit) throws SQLException {
        return Db.runQuery(conn,
                "SELECT " + COLUMNS + " FROM staging_cell_lines WHERE status = ? AND original_name > ?"
                        + " ORDER BY original_name LIMIT ?",
                ps -> {
                    ps.setInt(1, status.getCode());
                    ps.setString(2, afterName == null ? "" : afterName);
                    ps.setInt(3, limit);
                },
                CellLineStagingDao::map);
    }

    public Optional<StagedCellLine> find(String name) throws SQLException {
        return Db.queryFirst(conn,
                "SELECT " + COLUMNS + " FROM staging_cell_lines WHERE original_name = ?",
                ps -> ps.setString(1, name),
                CellLineStagingDao::map);
    }

    public int update(CellLineStage from, List<StagedCellLine> rows) throws SQLException {
        return Db.inTransaction(conn, c -> Db.executeBatch(c, UPDATE_SQL, rows, (ps, r) -> {
            ps.setString(1, r.getCellosaurusAccession());
            ps.setString(2, r.getTissue());
            ps.setString(3, r.getNcitCode());
            ps.setString(4, r.getUmlsCui());
            ps.setString(5, r.getDiseaseName());
            ps.setInt(6, r.getStatus().getCode());
            if (r.getErrorCode() == null) ps.setNull(7, Types.INTEGER);
            else ps.setInt(7, r.getErrorCode());
            ps.setString(8, r.getErrorMsg());
            ps.setString(9, r.getOriginalName());
            ps.setInt(10, from.getCode());
        }));
    }

    /** Cell line name to Cellosaurus accession for every mapped cell line. */
    public Map<String, String> mappedAccessions() throws SQLException {
        Map<String, String> out = new LinkedHashMap<>();
        Db.streamQuery(conn,
                "SELECT original_name, cellosaurus_accession FROM staging_cell_lines WHERE status = ?",
                ps -> ps.setInt(1, CellLineStage.MAPPED.getCode()),
                rs -> {
                    while (rs.next()) out.put(rs.getString(1), rs.getString(2));
                },
                1_000);
        return out;
    }

    public List<StagedCellLine> failed() throws SQLException {
        return Db.runQuery(conn,
                "SELECT " + COLUMNS + " FROM staging_cell_lines WHERE status = ? ORDER BY original_name",
                ps -> ps.setInt(1, CellLineStage.FAILED.getCode()),
                CellLineStagingDao::map);
    }

    public Map<CellLineStage, Integer> countByStatus() throws SQLException {
        Map<CellLineStage, Integer> out = new EnumMap<>(CellLineStage.class);
        for (CellLineStage s : CellLineStage.values()) out.put(s, 0);
        Db.runQuery(conn, "SELECT status, COUNT(*) FROM staging_cell_lines GROUP BY status", null,
                rs -> out.put(CellLineStage.fromCode(rs.getInt(1)), rs.getInt(2)));
        return out;
    }

    static StagedCellLine map(ResultSet rs) throws SQLException {
        StagedCellLine c = new StagedCellLine(rs.getString("original_name"));
        c.setCellosaurusAccession(rs.getString("cellosaurus_accession"));
        c.setTissue(rs.getString("tissue"));
        c.setNcitCode(rs.getString("ncit_code"));
        c.setUmlsCui(rs.getString("umls_cui"));
        c.setDiseaseName(rs.getString("disease_name"));
        c.setStatus(CellLineStage.fromCode(rs.getInt("status")));
        int code = rs.getInt("error_code");
        c.setErrorCode(rs.wasNull() ? null : code);
        c.setErrorMsg(rs.getString("error_msg"));
        c.setUpdatedAt(rs.getString("updated_at"));
        return c;
    }
}
