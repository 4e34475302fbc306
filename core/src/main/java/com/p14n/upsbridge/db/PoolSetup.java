package com.p14n.upsbridge.db;

import com.p14n.upsbridge.data.UpsBridgeConfig;
import com.zaxxer.hikari.HikariDataSource;

public class PoolSetup {

    private PoolSetup() {
    }

    /**
     * Creates and configures a connection pool using HikariCP. The pool does
     * not fail when the database is down at startup; connections are retried
     * on use.
     *
     * @param cfg Configuration containing database connection details
     * @return Configured DataSource
     */
    public static HikariDataSource createPool(UpsBridgeConfig cfg) {
        HikariDataSource ds = new HikariDataSource();
        ds.setPoolName("ups-bridge-db");
        ds.setJdbcUrl(cfg.jdbcUrl());
        ds.setUsername(cfg.dbUser());
        ds.setPassword(cfg.dbPassword());
        ds.setMaximumPoolSize(2);
        ds.setConnectionTimeout(5_000);
        ds.setInitializationFailTimeout(-1);
        return ds;
    }
}
