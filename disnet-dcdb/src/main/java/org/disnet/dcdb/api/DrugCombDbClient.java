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
import org.disnet.dcdb.om.CombinationRecord;
import org.disnet.dcdb.util.Logger;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Client for the DrugCombDB web API. Every endpoint answers with an envelope
 * {@code {code, msg, data}}; a missing {@code data} or a {@code code} other
 * than 200 means the entity is unknown and is returned as {@code null}.
 */
public class DrugCombDbClient extends ServiceClient {

    /** Drug info as DrugCombDB knows it: PubChem CID, official name and SMILES. */
    @Data
    @AllArgsConstructor
    public static class RawDrugInfo {
        private String pubchemId;
        private String officialName;
        private String smiles;
    }

    /** Cell line info: Cellosaurus accession, tissue and COSMIC ID, any may be null. */
    @Data
    @AllArgsConstructor
    public static class CellLineInfo {
        private String accession;
        private String tissue;
        private String cosmicId;
    }

    public DrugCombDbClient(ConfigLoader cfg) {
        super(cfg.getDcdbBaseUrl(), Duration.ofSeconds(cfg.getHttpTimeoutSeconds()), cfg.getHttpMaxRetries());
    }

    public DrugCombDbClient(HttpClient http, String baseUrl, Duration timeout, int maxRetries) {
        super(http, baseUrl, timeout, maxRetries);
    }

    /** Row {@code index} of the integration table, or null if it does not exist. */
    public CombinationRecord getCombination(int index) {
        return parseCombination(data(getJson("integration/list/" + index)));
    }

    /** Drug by name, or null if DrugCombDB does not know it. */
    public RawDrugInfo getDrug(String drugName) {
        return parseDrug(data(getJson("chemical/info/" + enc(drugName))));
    }

    /** Cell line by name, or null if DrugCombDB does not know it. */
    public CellLineInfo getCellLine(String cellLineName) {
        return parseCellLine(data(getJson("cellLine/cellName?cellName=" + enc(cellLineName))));
    }

    // ---------------------------------------------------------------- parsing

    static JsonNode data(JsonNode envelope) {
        if (envelope == null) return null;
        int code = envelope.path("code").asInt(200);
        JsonNode data = envelope.get("data");
        if (code != 200 || data == null || data.isNull()) {
            Logger.debug("DrugCombDB answered code {}: {}", code, text(envelope.get("msg")));
            return null;
        }
        return data;
    }

    static CombinationRecord parseCombination(JsonNode data) {
        if (data == null) return null;
        return CombinationRecord.builder()
                .id(data.path("id").asInt())
                .drug1(text(data.get("drug1")))
                .drug2(text(data.get("drug2")))
                .cellLine(text(data.get("cellName")))
                .source(text(data.get("source")))
                .hsa(number(data.get("HSA")))
                .bliss(number(data.get("Bliss")))
                .loewe(number(data.get("Loewe")))
                .zip(number(data.get("ZIP")))
                .build();
    }

    static RawDrugInfo parseDrug(JsonNode data) {
        if (data == null) return null;
        String cids = text(data.get("cIds"));
        if (cids == null) return null;
        return new RawDrugInfo(
                pubchemCid(cids),
                text(data.get("drugNameOfficial")),
                text(data.get("smilesString")));
    }

    static CellLineInfo parseCellLine(JsonNode data) {
        if (data == null) return null;
        return new CellLineInfo(
                text(data.get("cellosaurus_assession")),
                text(data.get("tissue")),
                text(data.get("cosmicId")));
    }

    /**
     * {@code "CIDs00003385"} to {@code "3385"}: drop the {@code CIDs} prefix and
     * leading zeros. A bare number is accepted as well.
     *
     * @throws ServiceException if no number remains
     */
    public static String pubchemCid(String cids) {
        String digits = cids.trim().replaceFirst("^(?i)CIDs?", "");
        try {
            return String.valueOf(Long.parseLong(digits));
        } catch (NumberFormatException nfe) {
            throw new ServiceException("Unexpected PubChem identifier: " + cids, nfe);
        }
    }
}
