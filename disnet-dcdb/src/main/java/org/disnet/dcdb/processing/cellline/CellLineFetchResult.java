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

import org.disnet.dcdb.om.CellLine;
import org.disnet.dcdb.om.Disease;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A resolved cell line with its disease (null when it has none). {@code cached}
 * is set when the result was served from the resolver cache after an earlier
 * result for the same accession had been persisted.
 */
@Data
@AllArgsConstructor
public class CellLineFetchResult {

    private CellLine cellLine;
    private Disease disease;
    private boolean cached;
}
