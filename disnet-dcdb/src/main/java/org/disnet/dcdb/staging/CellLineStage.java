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

import java.util.EnumSet;
import java.util.Set;

/**
 * Resolution progress of a staged cell line, stored as the integer
 * {@code status} of {@code staging_cell_lines}.
 */
public enum CellLineStage {

    PENDING(0),
    /** Accession found through the DrugCombDB fallback; disease unknown. */
    ACCESSION_FOUND(1),
    /** Accession and NCIt disease known (NCIt may be confirmed absent). */
    DISEASE_FOUND(2),
    /** UMLS mapping attempted. Terminal success, CUI may be null. */
    MAPPED(3),
    FAILED(-1);

    private final int code;

    CellLineStage(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * The COSMIC fast path may jump from {@link #PENDING} straight to
     * {@link #DISEASE_FOUND}; otherwise one stage at a time or to {@link #FAILED}.
     */
    public boolean canAdvanceTo(CellLineStage next) {
        return successors().contains(next);
    }

    private Set<CellLineStage> successors() {
        switch (this) {
            case PENDING:         return EnumSet.of(ACCESSION_FOUND, DISEASE_FOUND, FAILED);
            case ACCESSION_FOUND: return EnumSet.of(DISEASE_FOUND, FAILED);
            case DISEASE_FOUND:   return EnumSet.of(MAPPED, FAILED);
            default:              return EnumSet.noneOf(CellLineStage.class);
        }
    }

    public static CellLineStage fromCode(int code) {
        for (CellLineStage s : values()) {
            if (s.code == code) return s;
        }
        throw new IllegalArgumentException("Unknown cell line stage code: " + code);
    }
}
