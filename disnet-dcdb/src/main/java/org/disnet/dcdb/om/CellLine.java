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
import lombok.NoArgsConstructor;

/**
 * A cell line keyed by its Cellosaurus accession ({@code CVCL_XXXX}). The
 * name is unique as well; {@code diseaseId} is a UMLS CUI and may be null.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CellLine {

    private String cellLineId;
    private int sourceId;
    private String name;
    private String diseaseId;
    private String tissue;
}
