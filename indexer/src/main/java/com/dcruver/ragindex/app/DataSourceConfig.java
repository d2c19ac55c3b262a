package com.dcruver.ragindex.app;

import com.dcruver.ragindex.config.IndexerProperties;
import com.dcruver.ragindex.store.StoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * SQLite data source for the unit store.
 */
@Configuration
@Slf4j
public class DataSourceConfig {

    @Bean
    public DataSource dataSource(IndexerProperties properties) {
        String database = properties.getStore().getDatabase();
        Path dbPath = Paths.get(database.replace("${user.home}", System.getProperty("user.home")));
        if (dbPath.getParent() != null) {
            try {
                Files.createDirectories(dbPath.getParent());
            } catch (IOException e) {
                throw new StoreException("Cannot create database directory " + dbPath.getParent(), e);
            }
        }

        log.info("Using index database {}", dbPath.toAbsolutePath());
        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + dbPath.toAbsolutePath());

        return dataSource;
    }
}
