package me.golemcore.relay.adapter.outbound.storage;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

/**
 * Column conversions shared by the JDBC adapters. Instants are stored as
 * epoch milliseconds.
 */
final class JdbcColumns {

    private JdbcColumns() {
    }

    static Long toMillis(Instant instant) {
        return instant != null ? instant.toEpochMilli() : null;
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(value);
    }
}
