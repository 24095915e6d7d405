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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

import org.disnet.dcdb.util.Db;
import org.disnet.dcdb.util.Logger;

/**
 * Embedded SQLite store holding the staging tables and the local DrugCombDB
 * mirror ({@code drug_combinations}, {@code drugs}, {@code cell_lines}).
 * <p>
 * Tables are created on open if missing. Staging rows are never deleted; they
 * double as an audit trail and as the resume point of the batch pipelines.
 */
public class StagingStore implements AutoCloseable {

    public static final String SQLITE_DRIVER = "org.sqlite.JDBC";

    private static final List<String> DDL = List.of(
            "CREATE TABLE IF NOT EXISTS staging_drugs ("
                    + " drug_name TEXT PRIMARY KEY,"
                    + " pubchem_id TEXT,"
                    + " official_name TEXT,"
                    + " smiles TEXT,"
                    + " chembl_id TEXT,"
                    + " inchi_key TEXT,"
                    + " pref_name TEXT,"
                    + " molecule_type TEXT,"
                    + " canonical_smiles TEXT,"
                    + " chembl_inchi_key TEXT,"
                    + " status INTEGER NOT NULL DEFAULT 0,"
                    + " error_code INTEGER,"
                    + " error_msg TEXT,"
                    + " updated_at TEXT DEFAULT CURRENT_TIMESTAMP)",
            "CREATE INDEX IF NOT EXISTS ix_staging_drugs_status ON staging_drugs(status)",
            "CREATE TABLE IF NOT EXISTS staging_cell_lines ("
                    + " original_name TEXT PRIMARY KEY,"
                    + " cellosaurus_accession TEXT,"
                    + " tissue TEXT,"
                    + " ncit_code TEXT,"
                    + " umls_cui TEXT,"
                    + " disease_name TEXT,"
                    + " status INTEGER NOT NULL DEFAULT 0,"
                    + " error_code INTEGER,"
                    + " error_msg TEXT,"
                    + " updated_at TEXT DEFAULT CURRENT_TIMESTAMP)",
            "CREATE INDEX IF NOT EXISTS ix_staging_cell_lines_status ON staging_cell_lines(status)",
            // local mirror of DrugCombDB
            "CREATE TABLE IF NOT EXISTS drugs ("
                    + " drugName TEXT PRIMARY KEY,"
                    + " cIds TEXT,"
                    + " drugNameOfficial TEXT,"
                    + " smilesString TEXT)",
            "CREATE TABLE IF NOT EXISTS cell_lines ("
                    + " cellName TEXT PRIMARY KEY,"
                    + " cosmicId TEXT,"
                    + " cellosaurus_assession TEXT,"
                    + " tissue TEXT)",
            "CREATE TABLE IF NOT EXISTS drug_combinations ("
                    + " id INTEGER PRIMARY KEY,"
                    + " drug1 TEXT,"
                    + " drug2 TEXT,"
                    + " cell_line TEXT,"
                    + " hsa REAL,"
                    + " bliss REAL,"
                    + " loewe REAL,"
                    + " zip REAL,"
                    + " source TEXT,"
                    + " classification TEXT,"
                    + " status TEXT DEFAULT 'pending')");

    private final Connection conn;

    /** Open (or create) the SQLite file at {@code dbFile}. */
    public StagingStore(Path dbFile) {
        this(open(dbFile));
    }

    /** Wrap an already-open connection; tables are created if missing. */
    public StagingStore(Connection conn) {
        this.conn = conn;
        try {
            createTables();
        } catch (SQLException ex) {
            throw new IllegalStateException("Unable to create staging tables: " + ex.getMessage(), ex);
        }
    }

    private static Connection open(Path dbFile) {
        try {
            Path parent = dbFile.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to create directory for " + dbFile, ex);
        }
        Logger.info("Opening staging store {}", dbFile);
        return Db.getConnection("jdbc:sqlite:" + dbFile, null, null, SQLITE_DRIVER, 2, Duration.ofMillis(200));
    }

    private void createTables() throws SQLException {
        Db.withTransaction(conn, () -> {
            for (String ddl : DDL) {
                Db.execute(conn, ddl, null);
            }
        });
    }

    public Connection getConnection() {
        return conn;
    }

    @Override
    public void close() {
        try {
            conn.close();
        } catch (SQLException ex) {
            Logger.warn("Error closing staging store: {}", ex.getMessage());
        }
    }
}
