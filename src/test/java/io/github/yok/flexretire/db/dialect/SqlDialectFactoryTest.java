package io.github.yok.flexretire.db.dialect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexretire.config.DialectMode;
import io.github.yok.flexretire.config.StoreConfig;
import org.junit.jupiter.api.Test;

class SqlDialectFactoryTest {

    private final SqlDialectFactory factory = new SqlDialectFactory();

    private static StoreConfig.Entry entry(String driverClass, String url) {
        StoreConfig.Entry entry = new StoreConfig.Entry();
        entry.setId("db1");
        entry.setDriverClass(driverClass);
        entry.setUrl(url);
        return entry;
    }

    @Test
    void create_正常ケース_SQLServerURLを指定する_SqlServerDialectが返ること() {
        assertTrue(factory.create(entry(null, "jdbc:sqlserver://host:1433;databaseName=a"))
                instanceof SqlServerDialect);
    }

    @Test
    void create_正常ケース_H2ドライバを指定する_H2Dialectが返ること() {
        assertTrue(factory.create(entry("org.h2.Driver", null)) instanceof H2Dialect);
    }

    @Test
    void resolveMode_正常ケース_ドライバクラスがURLより優先されること() {
        assertEquals(DialectMode.POSTGRESQL,
                factory.resolveMode(entry("org.postgresql.Driver", "jdbc:mysql://host/db")));
        assertEquals(DialectMode.MYSQL,
                factory.resolveMode(entry("com.mysql.jdbc.Driver", null)));
        assertEquals(DialectMode.ORACLE,
                factory.resolveMode(entry(" ", "jdbc:oracle:thin:@host:1521/XE")));
    }

    @Test
    void resolveMode_正常ケース_明示的なdialectが最優先されること() {
        StoreConfig.Entry entry = entry("org.h2.Driver", "jdbc:h2:mem:x");
        entry.setDialect(DialectMode.SQLSERVER);
        assertEquals(DialectMode.SQLSERVER, factory.resolveMode(entry));
    }

    @Test
    void create_異常ケース_判定できない接続情報_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> factory.create(entry("com.example.Driver", "jdbc:unknown://host")));
    }
}
