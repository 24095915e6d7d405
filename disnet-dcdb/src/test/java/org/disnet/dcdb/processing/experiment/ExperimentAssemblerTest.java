package org.disnet.dcdb.processing.experiment;

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

import java.util.List;

import org.disnet.dcdb.om.CellLine;
import org.disnet.dcdb.om.Drug;
import org.disnet.dcdb.om.SourceNames;
import org.disnet.dcdb.processing.persist.CellLineRepository;
import org.disnet.dcdb.processing.persist.DisnetDatabase;
import org.disnet.dcdb.processing.persist.DrugCombinationRepository;
import org.disnet.dcdb.processing.persist.DrugRepository;
import org.disnet.dcdb.processing.persist.ExperimentRepository;
import org.disnet.dcdb.processing.persist.PersistenceException;
import org.disnet.dcdb.processing.persist.ScoreRepository;
import org.disnet.dcdb.processing.persist.SourceRepository;
import org.disnet.dcdb.processing.persist.TestDatabases;
import org.disnet.dcdb.processing.score.ScoreClassification;
import org.disnet.dcdb.processing.score.ScoreClassifier;
import org.disnet.dcdb.util.Db;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExperimentAssemblerTest {

    private DisnetDatabase db;
    private ExperimentAssembler assembler;
    private ScoreClassifier classifier;

    @BeforeEach
    void setUp() {
        db = TestDatabases.fresh();
        SourceRepository sources = new SourceRepository(db, 10);
        int chembl = sources.getOrCreateSource(SourceNames.CHEMBL);
        int cellosaurus = sources.getOrCreateSource(SourceNames.CELLOSAURUS);
        DrugRepository drugs = new DrugRepository(db);
        drugs.getOrCreateChemblDrug(new Drug("CHEMBL185", "FLUOROURACIL", chembl, null, null, null));
        drugs.getOrCreateChemblDrug(new Drug("CHEMBL506871", "VELIPARIB", chembl, null, null, null));
        new CellLineRepository(db).getOrCreateCellLine(new CellLine("CVCL_1059", cellosaurus, "A2058", null, "skin"));

        assembler = new ExperimentAssembler(db, new DrugCombinationRepository(db, 10), new ExperimentRepository(db, 10));
        classifier = new ScoreClassifier(new ScoreRepository(db, 10));
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private int count(String table) throws Exception {
        return Db.queryFirst(db.getConnection(), "SELECT COUNT(*) FROM " + table, null, rs -> rs.getInt(1)).orElse(-1);
    }

    @Test
    @DisplayName("One experiment per content, replays are no-ops")
    void persistIsIdempotent() throws Exception {
        ScoreClassification scores = classifier.classify(5.5369, 6.2566, -2.7507, 1.7183);

        long id = assembler.persist(1, List.of("CHEMBL185", "CHEMBL506871"), "CVCL_1059", scores);
        long replay = assembler.persist(1, List.of("CHEMBL506871", "CHEMBL185"), "CVCL_1059", scores);

        assertEquals(id, replay);
        assertEquals(1, count("experiment"));
        assertEquals(4, count("experiment_score"));
        assertEquals(1, count("drug_combination"));
        assertEquals(2, count("drug_comb_drug"));
    }

    @Test
    @DisplayName("Unknown cell line: whole unit of work rolled back")
    void failureRollsBackCombination() throws Exception {
        ScoreClassification scores = classifier.classify(1.0, 1.0, 1.0, 1.0);

        assertThrows(PersistenceException.class,
                () -> assembler.persist(2, List.of("CHEMBL185", "CHEMBL506871"), "CVCL_MISSING", scores));

        assertEquals(0, count("experiment"));
        assertEquals(0, count("drug_combination"));

        // caches were evicted, so a valid retry recreates the combination
        assembler.persist(2, List.of("CHEMBL185", "CHEMBL506871"), "CVCL_1059", scores);
        assertEquals(1, count("drug_combination"));
        assertEquals(1, count("experiment"));
    }

    @Test
    @DisplayName("A single distinct drug is rejected")
    void singleDrugRejected() {
        ScoreClassification scores = classifier.classify(1.0, null, null, null);
        assertThrows(IllegalArgumentException.class,
                () -> assembler.persist(3, List.of("CHEMBL185", "CHEMBL185"), "CVCL_1059", scores));
    }
}
