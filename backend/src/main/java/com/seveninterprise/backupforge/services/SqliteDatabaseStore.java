package com.seveninterprise.backupforge.services;

import com.seveninterprise.backupforge.config.BackupProperties;
import com.seveninterprise.backupforge.exceptions.BackupErrorCode;
import com.seveninterprise.backupforge.exceptions.BackupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Banco SQLite acessado pelo JdbcTemplate da aplicação
 *
 * O snapshot usa {@code VACUUM INTO}, que roda dentro de uma transação de
 * leitura: escritores concorrentes nunca produzem uma cópia pela metade.
 */
@Component
public class SqliteDatabaseStore implements IDatabaseStore {

    private static final Logger logger = LoggerFactory.getLogger(SqliteDatabaseStore.class);

    private static final String LIST_TABLES_SQL =
        "SELECT name FROM sqlite_master WHERE type = 'table' AND name NOT LIKE 'sqlite_%' ORDER BY name";

    private final JdbcTemplate jdbcTemplate;
    private final BackupProperties properties;

    public SqliteDatabaseStore(JdbcTemplate jdbcTemplate, BackupProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
    }

    @Override
    public Path getDatabaseFile() {
        return Paths.get(properties.getDatabase().getFile()).toAbsolutePath().normalize();
    }

    @Override
    public void snapshotTo(Path target) {
        String escaped = target.toAbsolutePath().toString().replace("'", "''");
        try {
            jdbcTemplate.execute("VACUUM INTO '" + escaped + "'");
            logger.debug("Snapshot do banco gravado em {}", target);
        } catch (DataAccessException e) {
            // SQLITE_BUSY/LOCKED e erros de disco chegam aqui
            throw new BackupException(BackupErrorCode.IO_FAILURE,
                "Erro ao gerar snapshot do banco: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    @Override
    public Map<String, Long> countRecords(Path databaseFile) {
        JdbcTemplate snapshot = new JdbcTemplate(openReadOnly(databaseFile));
        Map<String, Long> counts = new LinkedHashMap<>();

        List<String> tables;
        try {
            tables = snapshot.queryForList(LIST_TABLES_SQL, String.class);
        } catch (DataAccessException e) {
            throw new BackupException(BackupErrorCode.IO_FAILURE,
                "Erro ao listar tabelas de " + databaseFile + ": " + e.getMostSpecificCause().getMessage(), e);
        }

        for (String table : tables) {
            try {
                Long count = snapshot.queryForObject("SELECT COUNT(*) FROM " + quoteIdentifier(table), Long.class);
                counts.put(table, count != null ? count : 0L);
            } catch (DataAccessException e) {
                logger.warn("⚠️ Não foi possível contar registros da tabela {}: {}", table, e.getMessage());
                counts.put(table, 0L);
            }
        }
        return counts;
    }

    private static SQLiteDataSource openReadOnly(Path databaseFile) {
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + databaseFile.toAbsolutePath());
        return dataSource;
    }

    private static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
