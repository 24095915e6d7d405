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

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of {@code staging_cell_lines}, keyed by the cell line name as it
 * appears in DrugCombDB.
 */
@Data
@NoArgsConstructor
public class StagedCellLine {

    private String originalName;
    private String cellosaurusAccession;
    private String tissue;
    private String ncitCode;
    private String umlsCui;
    private String diseaseName;

    private CellLineStage status = CellLineStage.PENDING;
    private Integer errorCode;
    private String errorMsg;
    private String updatedAt;

    public StagedCellLine(String originalName) {
        this.originalName = originalName;
    }

    /**
     * Move to {@code next}.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public void advance(CellLineStage next) {
        if (!status.canAdvanceTo(next)) {
            throw new IllegalStateException("Cell line '" + originalName + "' cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    public void fail(Integer code, String message) {
        advance(CellLineStage.FAILED);
        this.errorCode = code;
        this.errorMsg = message;
    }
}
