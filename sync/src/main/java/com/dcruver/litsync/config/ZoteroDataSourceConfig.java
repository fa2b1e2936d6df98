package com.dcruver.litsync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Read-only SQLite data source over the Zotero database.
 */
@Configuration
@Slf4j
public class ZoteroDataSourceConfig {

    // SQLITE_OPEN_READONLY
    private static final String READ_ONLY_OPEN_MODE = "1";

    @Bean
    public DataSource zoteroDataSource(SyncProperties properties) {
        Path dbPath = properties.zoteroDir().resolve("zotero.sqlite");
        if (!Files.exists(dbPath)) {
            log.warn("Zotero database not found at {}; library commands will fail", dbPath);
        }

        Properties connectionProperties = new Properties();
        connectionProperties.setProperty("open_mode", READ_ONLY_OPEN_MODE);

        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + dbPath.toAbsolutePath());
        dataSource.setConnectionProperties(connectionProperties);
        return dataSource;
    }

    @Bean
    public NamedParameterJdbcTemplate zoteroJdbcTemplate(DataSource zoteroDataSource) {
        return new NamedParameterJdbcTemplate(zoteroDataSource);
    }
}
