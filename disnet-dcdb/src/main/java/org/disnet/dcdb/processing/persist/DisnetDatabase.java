package org.disnet.dcdb.processing.persist;

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

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

import org.disnet.dcdb.conf.ConfigLoader;
import org.disnet.dcdb.util.Db;
import org.disnet.dcdb.util.Logger;

/**
 * Owns the connection to the DISNET destination store and scopes every write
 * as one unit of work: commit on success, rollback on failure.
 * <p>
 * Units of work started while another is open on the same connection join it.
 */
public class DisnetDatabase implements AutoCloseable {

    private final Connection conn;

    public DisnetDatabase(Connection conn) {
        this.conn = conn;
    }

    /** Connect using {@code DB_*} settings, with the usual retry policy. */
    public static DisnetDatabase connect(ConfigLoader cfg) {
        String url = cfg.getDbUrl();
        Logger.info("Connecting to DISNET store {}", url);
        Connection c = Db.getConnection(url, cfg.getDbUser(), cfg.getDbPass(), cfg.getDbDriver(), 3, Duration.ofMillis(500));
        return new DisnetDatabase(c);
    }

    public Connection getConnection() {
        return conn;
    }

    /**
     * Run {@code work} in a transaction.
     *
     * @throws PersistenceException wrapping the {@link SQLException} after rollback
     */
    public <T> T inTransaction(Db.SqlWork<T> work) {
        try {
            return Db.inTransaction(conn, work);
        } catch (SQLException ex) {
            throw new PersistenceException("DISNET unit of work failed", ex);
        }
    }

    @Override
    public void close() {
        try {
            conn.close();
        } catch (SQLException ex) {
            Logger.warn("Error closing DISNET connection: {}", ex.getMessage());
        }
    }
}
