package org.disnet.dcdb.processing.support;

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

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Append-only JSON-lines record of every skipped entity:
 * <pre>
 * {"combination_id":17,"stage":"drug","entity":"ABT-888","code":2,"timestamp":"2025-01-01T10:00:00Z"}
 * {"combination_id":18,"stage":"cell_line","entity":"XYZ","message":"HTTP 500 ...","timestamp":"..."}
 * </pre>
 */
public class SkipAuditLog {

    public static final String STAGE_DRUG = "drug";
    public static final String STAGE_CELL_LINE = "cell_line";
    public static final String STAGE_PERSIST = "persist";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path file;

    public SkipAuditLog(Path file) {
        this.file = file;
    }

    /** Skip with a reason code. */
    public void recordCode(int combinationId, String stage, String entity, int code) {
        ObjectNode n = base(combinationId, stage, entity);
        n.put("code", code);
        append(n);
    }

    /** Skip with a free-text message. */
    public void recordMessage(int combinationId, String stage, String entity, String message) {
        ObjectNode n = base(combinationId, stage, entity);
        n.put("message", message);
        append(n);
    }

    private ObjectNode base(int combinationId, String stage, String entity) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("combination_id", combinationId);
        n.put("stage", stage);
        n.put("entity", entity);
        return n;
    }

    private synchronized void append(ObjectNode n) {
        n.put("timestamp", Instant.now().toString());
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                w.write(MAPPER.writeValueAsString(n));
                w.newLine();
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to append to audit log " + file, ex);
        }
    }

    /** All records written so far, oldest first. */
    public List<JsonNode> readAll() {
        List<JsonNode> out = new ArrayList<>();
        if (!Files.exists(file)) {
            return out;
        }
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) out.add(MAPPER.readTree(line));
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read audit log " + file, ex);
        }
        return out;
    }

    public Path getFile() {
        return file;
    }
}
