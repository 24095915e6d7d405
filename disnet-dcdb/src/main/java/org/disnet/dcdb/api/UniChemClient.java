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
import java.util.LinkedHashMap;
import java.util.Map;

import org.disnet.dcdb.conf.ConfigLoader;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * UniChem cross-reference lookup from a PubChem CID to ChEMBL.
 */
public class UniChemClient extends ServiceClient {

    /** UniChem source number for PubChem. */
    static final int PUBCHEM_SOURCE = 22;

    /** UniChem source number for ChEMBL. */
    static final int CHEMBL_SOURCE = 1;

    /** Mapping result. {@code chemblId} is null when UniChem has no ChEMBL entry. */
    @Data
    @AllArgsConstructor
    public static class CompoundMapping {
        private String chemblId;
        private String inchiKey;
    }

    public UniChemClient(ConfigLoader cfg) {
        super(cfg.getUnichemBaseUrl(), Duration.ofSeconds(cfg.getHttpTimeoutSeconds()), cfg.getHttpMaxRetries());
    }

    public UniChemClient(HttpClient http, String baseUrl, Duration timeout, int maxRetries) {
        super(http, baseUrl, timeout, maxRetries);
    }

    /**
     * Look up a PubChem compound. Returns null when UniChem knows no compound
     * for the ID at all.
     */
    public CompoundMapping getCompoundMapping(String pubchemId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("compound", pubchemId);
        body.put("sourceID", PUBCHEM_SOURCE);
        body.put("type", "sourceID");
        return parse(postJson("compounds/", body));
    }

    static CompoundMapping parse(JsonNode response) {
        if (response == null) return null;
        JsonNode compounds = response.path("compounds");
        if (!compounds.isArray() || compounds.isEmpty()) {
            return null;
        }
        // one compound expected when searching by source ID
        JsonNode compound = compounds.get(0);
        String chemblId = null;
        for (JsonNode src : compound.path("sources")) {
            if (src.path("id").asInt(-1) == CHEMBL_SOURCE) {
                chemblId = text(src.get("compoundId"));
                break;
            }
        }
        return new CompoundMapping(chemblId, text(compound.get("standardInchiKey")));
    }
}
