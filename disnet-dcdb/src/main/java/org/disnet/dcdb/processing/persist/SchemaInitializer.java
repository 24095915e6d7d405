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

import java.util.List;

import org.disnet.dcdb.util.Db;
import org.disnet.dcdb.util.Logger;

/**
 * Creates the DISNET tables this module writes to, if missing, in foreign-key
 * order. Plain MySQL DDL, also accepted by H2 in MySQL mode.
 */
public class SchemaInitializer {

    static final List<String> TABLES = List.of(
            "CREATE TABLE IF NOT EXISTS source ("
                    + " source_id INT AUTO_INCREMENT PRIMARY KEY,"
                    + " name VARCHAR(64) NOT NULL UNIQUE)",
            "CREATE TABLE IF NOT EXISTS disease ("
                    + " disease_id VARCHAR(16) PRIMARY KEY,"
                    + " name VARCHAR(512))",
            "CREATE TABLE IF NOT EXISTS cell_line ("
                    + " cell_line_id VARCHAR(32) PRIMARY KEY,"
                    + " source_id INT,"
                    + " cell_line_name VARCHAR(255) NOT NULL UNIQUE,"
                    + " disease_id VARCHAR(16),"
                    + " tissue VARCHAR(255),"
                    + " FOREIGN KEY (source_id) REFERENCES source(source_id),"
                    + " FOREIGN KEY (disease_id) REFERENCES disease(disease_id))",
            "CREATE TABLE IF NOT EXISTS drug ("
                    + " drug_id VARCHAR(50) PRIMARY KEY,"
                    + " source_id INT,"
                    + " drug_name VARCHAR(255),"
                    + " molecular_type VARCHAR(50),"
                    + " chemical_structure TEXT,"
                    + " inchi_key VARCHAR(255),"
                    + " FOREIGN KEY (source_id) REFERENCES source(source_id))",
            "CREATE TABLE IF NOT EXISTS drug_raw ("
                    + " drug_id VARCHAR(50) PRIMARY KEY,"
                    + " source_id INT,"
                    + " drug_name VARCHAR(255) NOT NULL,"
                    + " molecular_type VARCHAR(50),"
                    + " chemical_structure TEXT,"
                    + " inchi_key VARCHAR(255),"
                    + " FOREIGN KEY (source_id) REFERENCES source(source_id))",
            "CREATE TABLE IF NOT EXISTS foreign_to_chembl ("
                    + " foreign_id VARCHAR(50),"
                    + " foreign_source_id INT,"
                    + " chembl_id VARCHAR(50),"
                    + " PRIMARY KEY (foreign_id, foreign_source_id),"
                    + " FOREIGN KEY (foreign_id) REFERENCES drug_raw(drug_id),"
                    + " FOREIGN KEY (chembl_id) REFERENCES drug(drug_id))",
            "CREATE TABLE IF NOT EXISTS score ("
                    + " score_id INT AUTO_INCREMENT PRIMARY KEY,"
                    + " score_name VARCHAR(32) NOT NULL UNIQUE)",
            "CREATE TABLE IF NOT EXISTS drug_combination ("
                    + " dc_id BIGINT AUTO_INCREMENT PRIMARY KEY,"
                    + " member_key CHAR(64) NOT NULL UNIQUE)",
            "CREATE TABLE IF NOT EXISTS drug_comb_drug ("
                    + " dc_id BIGINT NOT NULL,"
                    + " drug_id VARCHAR(50) NOT NULL,"
                    + " PRIMARY KEY (dc_id, drug_id),"
                    + " FOREIGN KEY (dc_id) REFERENCES drug_combination(dc_id) ON DELETE CASCADE,"
                    + " FOREIGN KEY (drug_id) REFERENCES drug(drug_id))",
            "CREATE TABLE IF NOT EXISTS experiment_classification ("
                    + " classification_id INT AUTO_INCREMENT PRIMARY KEY,"
                    + " classification_name VARCHAR(32) NOT NULL UNIQUE)",
            "CREATE TABLE IF NOT EXISTS experiment_source ("
                    + " source_id INT AUTO_INCREMENT PRIMARY KEY,"
                    + " source VARCHAR(64) NOT NULL UNIQUE)",
            "CREATE TABLE IF NOT EXISTS experiment ("
                    + " experiment_id BIGINT AUTO_INCREMENT PRIMARY KEY,"
                    + " dc_id BIGINT NOT NULL,"
                    + " cell_line_id VARCHAR(32) NOT NULL,"
                    + " classification_id INT NOT NULL,"
                    + " source_id INT NOT NULL,"
                    + " experiment_hash CHAR(64) NOT NULL UNIQUE,"
                    + " FOREIGN KEY (dc_id) REFERENCES drug_combination(dc_id),"
                    + " FOREIGN KEY (cell_line_id) REFERENCES cell_line(cell_line_id),"
                    + " FOREIGN KEY (classification_id) REFERENCES experiment_classification(classification_id),"
                    + " FOREIGN KEY (source_id) REFERENCES experiment_source(source_id))",
            "CREATE TABLE IF NOT EXISTS experiment_score ("
                    + " experiment_id BIGINT NOT NULL,"
                    + " score_id INT NOT NULL,"
                    + " score_value DOUBLE,"
                    + " PRIMARY KEY (experiment_id, score_id),"
                    + " FOREIGN KEY (experiment_id) REFERENCES experiment(experiment_id),"
                    + " FOREIGN KEY (score_id) REFERENCES score(score_id))");

    private final DisnetDatabase db;

    public SchemaInitializer(DisnetDatabase db) {
        this.db = db;
    }

    public void createTables() {
        db.inTransaction(c -> {
            for (String ddl : TABLES) {
                Db.execute(c, ddl, null);
            }
            return null;
        });
        Logger.info("DISNET schema ready ({} tables)", TABLES.size());
    }
}
