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
 * Resolution progress of a staged drug, stored as the integer {@code status}
 * of {@code staging_drugs}.
 */
public enum DrugStage {

    /** Freshly staged. */
    PENDING(0),
    /** PubChem CID (and optional SMILES) known. */
    RAW_RESOLVED(1),
    /** ChEMBL ID and InChI key known. */
    CANONICAL_MAPPED(2),
    /** ChEMBL molecule fetched. Terminal success. */
    FETCHED(3),
    /** Terminal failure with an error code or message. */
    FAILED(-1);

    private final int code;

    DrugStage(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /** Forward by exactly one stage, or to {@link #FAILED} from any non-terminal stage. */
    public boolean canAdvanceTo(DrugStage next) {
        return successors().contains(next);
    }

    private Set<DrugStage> successors() {
        switch (this) {
            case PENDING:          return EnumSet.of(RAW_RESOLVED, FAILED);
            case RAW_RESOLVED:     return EnumSet.of(CANONICAL_MAPPED, FAILED);
            case CANONICAL_MAPPED: return EnumSet.of(FETCHED, FAILED);
            default:               return EnumSet.noneOf(DrugStage.class);
        }
    }

    public static DrugStage fromCode(int code) {
        for (DrugStage s : values()) {
            if (s.code == code) return s;
        }
        throw new IllegalArgumentException("Unknown drug stage code: " + code);
    }
}
