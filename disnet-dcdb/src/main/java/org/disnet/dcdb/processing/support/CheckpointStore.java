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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.OptionalInt;

import org.disnet.dcdb.util.Logger;

/**
 * Last completed source index of the streaming mode, kept in a file holding a
 * single integer. The value only moves forward.
 */
public class CheckpointStore {

    private final Path file;
    private Integer current;

    public CheckpointStore(Path file) {
        this.file = file;
    }

    /** The stored index, empty if no checkpoint has been written yet. */
    public synchronized OptionalInt load() {
        if (current != null) {
            return OptionalInt.of(current);
        }
        if (!Files.isReadable(file)) {
            return OptionalInt.empty();
        }
        try {
            String raw = Files.readString(file, StandardCharsets.UTF_8).trim();
            if (raw.isEmpty()) {
                return OptionalInt.empty();
            }
            current = Integer.parseInt(raw);
            return OptionalInt.of(current);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read checkpoint " + file, ex);
        } catch (NumberFormatException nfe) {
            throw new IllegalStateException("Corrupt checkpoint file " + file + ": " + nfe.getMessage(), nfe);
        }
    }

    /**
     * Store {@code index} if it is beyond the current checkpoint. The file is
     * replaced atomically.
     *
     * @return true if written
     */
    public synchronized boolean save(int index) {
        OptionalInt prev = load();
        if (prev.isPresent() && index <= prev.getAsInt()) {
            return false;
        }
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(tmp, Integer.toString(index), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write checkpoint " + file, ex);
        }
        current = index;
        Logger.trace("Checkpoint saved at {}", index);
        return true;
    }

    public Path getFile() {
        return file;
    }
}
