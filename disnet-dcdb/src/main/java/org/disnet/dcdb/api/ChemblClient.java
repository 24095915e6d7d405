package org.disnet.dcdb.api;

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

import java.net.http.HttpClient;
import java.time.Duration;

import org.disnet.dcdb.conf.ConfigLoader;
import org.disnet.dcdb.om.Drug;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * ChEMBL molecule lookup by ChEMBL ID.
 */
public class ChemblClient extends ServiceClient {

    private static final String FIELDS = "molecule_chembl_id,pref_name,molecule_type,"
            + "molecule_structures__canonical_smiles,molecule_structures__standard_inchi_key";

    public ChemblClient(ConfigLoader cfg) {
        super(cfg.getChemblBaseUrl(), Duration.ofSeconds(cfg.getHttpTimeoutSeconds()), cfg.getHttpMaxRetries());
    }

    public ChemblClient(HttpClient http, String baseUrl, Duration timeout, int maxRetries) {
        super(http, baseUrl, timeout, maxRetries);
    }

    /**
     * Fetch molecule metadata as a cured {@link Drug} for {@code sourceId}, or
     * null when ChEMBL has no such molecule.
     */
    public Drug getMolecule(String chemblId, int sourceId) {
        JsonNode json = getJson("molecule.json?molecule_chembl_id=" + enc(chemblId) + "&only=" + enc(FIELDS));
        return parse(json, sourceId);
    }

    static Drug parse(JsonNode json, int sourceId) {
        if (json == null) return null;
        JsonNode molecules = json.path("molecules");
        if (!molecules.isArray() || molecules.isEmpty()) {
            return null;
        }
        JsonNode m = molecules.get(0);
        JsonNode structures = m.path("molecule_structures");
        return new Drug(
                text(m.get("molecule_chembl_id")),
                text(m.get("pref_name")),
                sourceId,
                text(m.get("molecule_type")),
                text(structures.get("canonical_smiles")),
                text(structures.get("standard_inchi_key")));
    }
}
