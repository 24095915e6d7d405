package org.disnet.dcdb.processing.cellline;

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

/**
 * A cell line cannot be mapped to a Cellosaurus accession. Expected; callers
 * skip the combination.
 */
public class CellLineNotResolvableException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String cellLineName;
    private final int code;

    public CellLineNotResolvableException(String cellLineName, int code, String reason) {
        super("Cell line '" + cellLineName + "' could not be resolved" + (reason == null ? "" : ": " + reason));
        this.cellLineName = cellLineName;
        this.code = code;
    }

    public String getCellLineName() {
        return cellLineName;
    }

    public int getCode() {
        return code;
    }
}
