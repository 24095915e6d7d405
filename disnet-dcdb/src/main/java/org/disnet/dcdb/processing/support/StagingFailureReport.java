package org.disnet.dcdb.processing.support;

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
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.disnet.dcdb.staging.CellLineStagingDao;
import org.disnet.dcdb.staging.DrugStagingDao;
import org.disnet.dcdb.staging.StagedCellLine;
import org.disnet.dcdb.staging.StagedDrug;
import org.disnet.dcdb.util.Logger;

/**
 * Writes every FAILED staging row, drugs first, to a CSV file so the entities
 * can be fixed by hand and re-driven.
 */
public class StagingFailureReport {

    public static final String[] HEADER = { "entity_type", "name", "error_code", "error_msg", "updated_at" };

    public static final String TYPE_DRUG = "drug";
    public static final String TYPE_CELL_LINE = "cell_line";

    private final DrugStagingDao drugs;
    private final CellLineStagingDao cellLines;

    public StagingFailureReport(DrugStagingDao drugs, CellLineStagingDao cellLines) {
        this.drugs = drugs;
        this.cellLines = cellLines;
    }

    /** @return number of rows written, header excluded */
    public int write(Path csv) throws IOException, SQLException {
        Path parent = csv.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        int rows = 0;
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(HEADER).build();
        try (Writer w = Files.newBufferedWriter(csv, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(w, format)) {
            for (StagedDrug d : drugs.failed()) {
                printer.printRecord(TYPE_DRUG, d.getDrugName(), d.getErrorCode(), d.getErrorMsg(), d.getUpdatedAt());
                rows++;
            }
            for (StagedCellLine c : cellLines.failed()) {
                printer.printRecord(TYPE_CELL_LINE, c.getOriginalName(), c.getErrorCode(), c.getErrorMsg(), c.getUpdatedAt());
                rows++;
            }
        }
        Logger.info("Wrote {} failed staging rows to {}", rows, csv);
        return rows;
    }
}
