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
 * Why a drug could not be resolved. The numeric codes are stored in
 * {@code staging_drugs.error_code} and in the skip audit log.
 */
public enum DrugErrorCode {

    NOT_FOUND_IN_SOURCE(1, "not found in DrugCombDB, despite being in a combination"),
    NOT_FOUND_IN_CROSSREF(2, "could not find a ChEMBL ID mapping in UniChem"),
    NOT_FOUND_IN_CANONICAL(3, "not found in ChEMBL, despite being mapped in UniChem");

    private final int code;
    private final String reason;

    DrugErrorCode(int code, String reason) {
        this.code = code;
        this.reason = reason;
    }

    public int getCode() {
        return code;
    }

    public String getReason() {
        return reason;
    }

    public static DrugErrorCode fromCode(int code) {
        for (DrugErrorCode c : values()) {
            if (c.code == code) return c;
        }
        throw new IllegalArgumentException("Unknown drug error code: " + code);
    }
}
