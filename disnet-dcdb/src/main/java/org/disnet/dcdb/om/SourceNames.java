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

/**
 * Names of the rows in the {@code source} and {@code experiment_source} tables.
 */
public final class SourceNames {

    public static final String CHEMBL = "CHEMBL";
    public static final String PUBCHEM = "PubChem";
    public static final String CELLOSAURUS = "Cellosaurus";

    /** Experiment source for everything loaded by this module. */
    public static final String DRUGCOMBDB = "DrugCombDB";

    private SourceNames() {}
}
