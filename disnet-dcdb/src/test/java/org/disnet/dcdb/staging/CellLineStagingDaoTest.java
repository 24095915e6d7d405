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

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CellLineStagingDaoTest {

    @TempDir
    Path tmp;

    private StagingStore store;
    private CellLineStagingDao dao;

    @BeforeEach
    void open() {
        store = new StagingStore(tmp.resolve("staging.sqlite"));
        dao = new CellLineStagingDao(store);
    }

    @AfterEach
    void close() {
        store.close();
    }

    @Test
    @DisplayName("Fast path row goes straight to DISEASE_FOUND and then MAPPED")
    void fastPathToMapped() throws Exception {
        assertEquals(2, dao.stage0(List.of("A2058", "MCF7", "A2058")));

        StagedCellLine row = dao.find("A2058").orElseThrow();
        row.setCellosaurusAccession("CVCL_1059");
        row.setTissue("Skin");
        row.setNcitCode("C3224");
        row.advance(CellLineStage.DISEASE_FOUND);
        assertEquals(1, dao.update(CellLineStage.PENDING, List.of(row)));

        assertEquals("A2058", dao.selectBatch(CellLineStage.DISEASE_FOUND, 10).get(0).getOriginalName());

        row.setUmlsCui("C0025202");
        row.setDiseaseName("Melanoma");
        row.advance(CellLineStage.MAPPED);
        dao.update(CellLineStage.DISEASE_FOUND, List.of(row));

        StagedCellLine stored = dao.find("A2058").orElseThrow();
        assertEquals("Skin", stored.getTissue());
        assertEquals("Melanoma", stored.getDiseaseName());
        assertEquals(Map.of("A2058", "CVCL_1059"), dao.mappedAccessions());

        Map<CellLineStage, Integer> counts = dao.countByStatus();
        assertEquals(1, counts.get(CellLineStage.MAPPED));
        assertEquals(1, counts.get(CellLineStage.PENDING));
        assertEquals(0, counts.get(CellLineStage.FAILED));
    }

    @Test
    @DisplayName("Skipping a stage is refused")
    void illegalTransition() {
        StagedCellLine row = new StagedCellLine("A2058");
        assertThrows(IllegalStateException.class, () -> row.advance(CellLineStage.MAPPED));
    }
}
