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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.util.List;

import org.disnet.dcdb.api.ChemblClient;
import org.disnet.dcdb.api.DrugCombDbClient;
import org.disnet.dcdb.api.DrugCombDbClient.RawDrugInfo;
import org.disnet.dcdb.api.ServiceException;
import org.disnet.dcdb.api.UniChemClient;
import org.disnet.dcdb.api.UniChemClient.CompoundMapping;
import org.disnet.dcdb.om.Drug;
import org.disnet.dcdb.processing.persist.DrugRepository;
import org.disnet.dcdb.processing.support.Resolution;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DrugResolverTest {

	private DrugCombDbClient dcdb;
	private UniChemClient unichem;
	private ChemblClient chembl;
	private DrugRepository drugs;
	private DrugResolver resolver;

	@BeforeEach
	void setUp() {
		dcdb = mock(DrugCombDbClient.class);
		unichem = mock(UniChemClient.class);
		chembl = mock(ChemblClient.class);
		drugs = mock(DrugRepository.class);
		resolver = new DrugResolver(dcdb, unichem, chembl, drugs, 1, 2, 16);

		when(dcdb.getDrug("5-FU")).thenReturn(new RawDrugInfo("3385", "fluorouracil", "C1=C(C(=O)NC(=O)N1)F"));
		when(unichem.getCompoundMapping("3385")).thenReturn(new CompoundMapping("CHEMBL185", "GHASVSINZRGABV-UHFFFAOYSA-N"));
		when(chembl.getMolecule("CHEMBL185", 2)).thenReturn(
				new Drug("CHEMBL185", "FLUOROURACIL", 2, "Small molecule", "O=c1[nH]cc(F)c(=O)[nH]1", null));
	}

	@Test
	void resolves_through_all_three_services_and_caches_by_normalized_name() {
		Resolution<DrugFetchResult> first = resolver.resolve("5-FU(approved)");
		Resolution<DrugFetchResult> second = resolver.resolve("5-FU");

		assertTrue(first.isResolved());
		assertSame(first.getValue(), second.getValue());
		assertEquals("CHEMBL185", first.getValue().getChemblId());
		assertEquals("fluorouracil", first.getValue().getRaw().getDrugName());
		assertEquals("GHASVSINZRGABV-UHFFFAOYSA-N", first.getValue().getRaw().getInchiKey());

		verify(dcdb, times(1)).getDrug("5-FU");
		verify(unichem, times(1)).getCompoundMapping("3385");
		verify(chembl, times(1)).getMolecule("CHEMBL185", 2);
	}

	@Test
	void unresolvable_names_are_remembered() {
		Resolution<DrugFetchResult> r1 = resolver.resolve("Mystery");
		Resolution<DrugFetchResult> r2 = resolver.resolve("Mystery");

		assertFalse(r1.isResolved());
		assertEquals(DrugErrorCode.NOT_FOUND_IN_SOURCE.getCode(), r2.getCode());
		verify(dcdb, times(1)).getDrug("Mystery");
	}

	@Test
	void missing_chembl_mapping_and_missing_molecule_have_distinct_codes() {
		when(dcdb.getDrug("Orphan")).thenReturn(new RawDrugInfo("999", null, null));
		when(unichem.getCompoundMapping("999")).thenReturn(null);
		when(dcdb.getDrug("ABT-888")).thenReturn(new RawDrugInfo("11960529", "veliparib", null));
		when(unichem.getCompoundMapping("11960529")).thenReturn(new CompoundMapping("CHEMBL506871", null));

		assertEquals(DrugErrorCode.NOT_FOUND_IN_CROSSREF.getCode(), resolver.resolve("Orphan").getCode());
		assertEquals(DrugErrorCode.NOT_FOUND_IN_CANONICAL.getCode(), resolver.resolve("ABT-888").getCode());
	}

	@Test
	void service_errors_propagate_and_are_not_cached() {
		when(dcdb.getDrug("Flaky"))
				.thenThrow(new ServiceException("DrugCombDB returned 502", 502, null))
				.thenReturn(new RawDrugInfo("3385", "fluorouracil", null));

		assertThrows(ServiceException.class, () -> resolver.resolve("Flaky"));
		assertTrue(resolver.resolve("Flaky").isResolved());
		verify(dcdb, times(2)).getDrug("Flaky");
	}

	@Test
	void fetch_fails_on_first_unresolvable_name() {
		DrugNotResolvableException ex = assertThrows(DrugNotResolvableException.class,
				() -> resolver.fetch(List.of("5-FU", "Mystery(approved)")));

		assertEquals("Mystery", ex.getDrugName());
		assertEquals(DrugErrorCode.NOT_FOUND_IN_SOURCE.getCode(), ex.getCode());
	}

	@Test
	void persist_saves_each_result() throws Exception {
		List<DrugFetchResult> results = resolver.fetch(List.of("5-FU"));
		resolver.persist(results);

		verify(drugs).saveResolved(results.get(0).getRaw(), results.get(0).getCanonical());
	}
}
