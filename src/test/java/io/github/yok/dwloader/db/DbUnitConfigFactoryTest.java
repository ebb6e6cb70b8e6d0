package io.github.yok.dwloader.db;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.dwloader.config.DataTypeFactoryMode;
import io.github.yok.dwloader.config.DbUnitConfigProperties;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.ext.mysql.MySqlDataTypeFactory;
import org.dbunit.ext.mysql.MySqlMetadataHandler;
import org.dbunit.ext.postgresql.PostgresqlDataTypeFactory;
import org.junit.jupiter.api.Test;

class DbUnitConfigFactoryTest {

    @Test
    void configure_正常ケース_MySQL_バッククォートとメタデータハンドラが設定されること() {
        DatabaseConfig cfg = new DatabaseConfig();

        new DbUnitConfigFactory().configure(cfg, DataTypeFactoryMode.MYSQL);

        assertTrue(cfg.getProperty(
                DatabaseConfig.PROPERTY_DATATYPE_FACTORY) instanceof MySqlDataTypeFactory);
        assertEquals("`?`", cfg.getProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN));
        assertTrue(cfg.getProperty(
                DatabaseConfig.PROPERTY_METADATA_HANDLER) instanceof MySqlMetadataHandler);
    }

    @Test
    void configure_正常ケース_H2_テーブル種別とダブルクォートが設定されること() {
        DatabaseConfig cfg = new DatabaseConfig();

        new DbUnitConfigFactory().configure(cfg, DataTypeFactoryMode.H2);

        assertEquals("\"?\"", cfg.getProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN));
        assertArrayEquals(new String[] {"TABLE", "BASE TABLE"},
                (String[]) cfg.getProperty(DatabaseConfig.PROPERTY_TABLE_TYPE));
    }

    @Test
    void configure_正常ケース_プロパティ指定_バッチ設定が反映されること() {
        DbUnitConfigProperties props = new DbUnitConfigProperties();
        props.setBatchedStatements(false);
        props.setBatchSize(25);
        props.setAllowEmptyFields(false);
        DatabaseConfig cfg = new DatabaseConfig();

        new DbUnitConfigFactory(props).configure(cfg, DataTypeFactoryMode.POSTGRESQL);

        assertTrue(cfg.getProperty(
                DatabaseConfig.PROPERTY_DATATYPE_FACTORY) instanceof PostgresqlDataTypeFactory);
        assertEquals(Boolean.FALSE, cfg.getProperty(DatabaseConfig.FEATURE_BATCHED_STATEMENTS));
        assertEquals(25, cfg.getProperty(DatabaseConfig.PROPERTY_BATCH_SIZE));
        assertEquals(Boolean.FALSE, cfg.getProperty(DatabaseConfig.FEATURE_ALLOW_EMPTY_FIELDS));
    }

    @Test
    void loadChunkSize_正常ケース_0以下の設定_1に切り上げられること() {
        DbUnitConfigProperties props = new DbUnitConfigProperties();
        props.setLoadChunkSize(0);

        assertEquals(1, new DbUnitConfigFactory(props).loadChunkSize());
        assertEquals(5000, new DbUnitConfigFactory().loadChunkSize());
    }
}
