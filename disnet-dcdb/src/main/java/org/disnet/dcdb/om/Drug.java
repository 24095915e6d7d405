package org.disnet.dcdb.om;

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

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * A drug as stored in DISNET. The {@code drugId} namespace depends on
 * {@code sourceId}: a PubChem CID for raw records, a ChEMBL ID for cured ones.
 * <p>
 * Identity for caching is {@code (drugId, drugName)}; structural fields do not
 * take part in equality.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Drug {

    @EqualsAndHashCode.Include
    private String drugId;

    @EqualsAndHashCode.Include
    private String drugName;

    private int sourceId;

    private String molecularType;

    // canonical SMILES
    private String chemicalStructure;

    private String inchiKey;

    /** A raw (foreign-source) drug with only an ID, name and optional structure. */
    public static Drug raw(String drugId, String drugName, int sourceId, String smiles) {
        return new Drug(drugId, drugName, sourceId, null, smiles, null);
    }
}
