package org.disnet.dcdb.processing.drug;

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
 * A drug of a combination cannot be mapped to ChEMBL. Expected; callers skip
 * the combination.
 */
public class DrugNotResolvableException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String drugName;
    private final int code;

    public DrugNotResolvableException(String drugName, int code, String reason) {
        super("Drug '" + drugName + "' could not be resolved" + (reason == null ? "" : ": " + reason));
        this.drugName = drugName;
        this.code = code;
    }

    public DrugNotResolvableException(String drugName, DrugErrorCode code) {
        this(drugName, code.getCode(), code.getReason());
    }

    public String getDrugName() {
        return drugName;
    }

    public int getCode() {
        return code;
    }
}
