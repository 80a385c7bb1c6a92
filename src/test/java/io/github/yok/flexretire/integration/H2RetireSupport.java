package io.github.yok.flexretire.integration;

import com.google.common.base.Ticker;
import io.github.yok.flexretire.catalog.ExecutionLogRepository;
import io.github.yok.flexretire.catalog.JobCatalogRepository;
import io.github.yok.flexretire.config.RetireConfig;
import io.github.yok.flexretire.config.StoreConfig;
import io.github.yok.flexretire.core.BatchExecutor;
import io.github.yok.flexretire.core.BatchPause;
import io.github.yok.flexretire.core.ProcessingOrderAdvisor;
import io.github.yok.flexretire.core.RunOrchestrator;
import io.github.yok.flexretire.db.StoreConnectorFactory;
import io.github.yok.flexretire.db.dialect.SqlDialectFactory;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.dataset.ITable;
import org.dbunit.ext.h2.H2DataTypeFactory;
import org.flywaydb.core.Flyway;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * 組み込み H2 を使った結合テストの共通処理です。
 *
 * <ul>
 * <li>DB準備：テスト毎に一意なインメモリ DB を作成し、Flyway migrate（classpath:db/migration/h2）</li>
 * <li>データ準備：カタログ行と EVENTS 行の投入</li>
 * <li>実行準備：StoreConfig / ConnectorFactory / Repository / Executor / Orchestrator を組み立て</li>
 * <li>検証：DBUnit のクエリテーブルで内容を取得</li>
 * </ul>
 */
final class H2RetireSupport {

    static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 30, 12, 0);

    static final Clock CLOCK = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

    private H2RetireSupport() {}

    /**
     * 一意なインメモリ DB を作成し、マイグレーションを適用します。
     *
     * @return JDBC URL
     */
    static String createDatabase() {
        String url = "jdbc:h2:mem:retire_" + UUID.randomUUID().toString().replace("-", "")
                + ";DB_CLOSE_DELAY=-1";
        Flyway.configure().dataSource(url, "sa", "").locations("classpath:db/migration/h2")
                .load().migrate();
        return url;
    }

    static Connection open(String url) throws SQLException {
        return DriverManager.getConnection(url, "sa", "");
    }

    static StoreConfig storeConfig(String url) {
        StoreConfig config = new StoreConfig();
        config.setStores(List.of(entry("local", url)));
        return config;
    }

    /**
     * ソースストア（local）とアーカイブ先ストアの2件を登録した設定を返します。
     *
     * @param url ソース DB の JDBC URL
     * @param archiveAlias アーカイブ先ストアの別名
     * @param archiveUrl アーカイブ先 DB の JDBC URL
     * @return ストア設定
     */
    static StoreConfig storeConfig(String url, String archiveAlias, String archiveUrl) {
        StoreConfig config = new StoreConfig();
        config.setStores(List.of(entry("local", url), entry(archiveAlias, archiveUrl)));
        return config;
    }

    private static StoreConfig.Entry entry(String id, String url) {
        StoreConfig.Entry entry = new StoreConfig.Entry();
        entry.setId(id);
        entry.setUrl(url);
        entry.setUser("sa");
        entry.setPassword("");
        entry.setDriverClass("org.h2.Driver");
        entry.setXaDataSourceClass("org.h2.jdbcx.JdbcDataSource");
        return entry;
    }

    /**
     * Orchestrator を実運用と同じ構成で組み立てます。
     *
     * @param url JDBC URL
     * @param config 実行設定
     * @param pause バッチ間の待機
     * @return orchestrator
     */
    static RunOrchestrator orchestrator(String url, RetireConfig config, BatchPause pause) {
        return orchestrator(storeConfig(url), config, pause);
    }

    /**
     * 任意のストア設定で Orchestrator を組み立てます。
     *
     * @param stores ストア設定
     * @param config 実行設定
     * @param pause バッチ間の待機
     * @return orchestrator
     */
    static RunOrchestrator orchestrator(StoreConfig stores, RetireConfig config,
            BatchPause pause) {
        StoreConnectorFactory factory = new StoreConnectorFactory(stores, new SqlDialectFactory());
        JdbcTemplate jdbc = new JdbcTemplate(factory.createDataSource(config.getSourceStore()));
        BatchExecutor executor =
                new BatchExecutor(factory, config.getSourceStore(), config.getBatchPause(), pause);
        ProcessingOrderAdvisor advisor =
                config.isVerifyProcessingOrder() ? new ProcessingOrderAdvisor(jdbc) : null;
        return new RunOrchestrator(new JobCatalogRepository(jdbc, config),
                new ExecutionLogRepository(jdbc, config), executor, factory, advisor, config,
                CLOCK, Ticker.systemTicker());
    }

    /**
     * カタログ行を投入します。
     */
    static void insertJob(Connection conn, int id, String sourceTable, String dateColumn,
            String actionType, String targetTable, int retentionDays, int batchSize,
            boolean testMode, int processingOrder, boolean enabled) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("INSERT INTO dbo.ArchiveConfig"
                + " (ConfigID, SourceSchema, SourceTable, DateColumn, TargetSchema, TargetTable,"
                + " RetentionDays, BatchSize, ActionType, TestMode, ProcessingOrder, IsEnabled)"
                + " VALUES (?, 'PUBLIC', ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            ps.setInt(1, id);
            ps.setString(2, sourceTable);
            ps.setString(3, dateColumn);
            ps.setString(4, targetTable == null ? null : "PUBLIC");
            ps.setString(5, targetTable);
            ps.setInt(6, retentionDays);
            ps.setInt(7, batchSize);
            ps.setString(8, actionType);
            ps.setBoolean(9, testMode);
            ps.setInt(10, processingOrder);
            ps.setBoolean(11, enabled);
            ps.executeUpdate();
        }
    }

    /**
     * 別ストアへ移動する ARCHIVE ジョブ（TargetLinkedServer 指定）を投入します。
     */
    static void insertRemoteArchiveJob(Connection conn, int id, String targetStore,
            String targetTable, int batchSize) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("INSERT INTO dbo.ArchiveConfig"
                + " (ConfigID, SourceSchema, SourceTable, DateColumn, TargetLinkedServer,"
                + " TargetSchema, TargetTable, RetentionDays, BatchSize, ActionType, TestMode,"
                + " ProcessingOrder, IsEnabled)"
                + " VALUES (?, 'PUBLIC', 'Events', 'Created_At', ?, 'PUBLIC', ?, 10, ?,"
                + " 'ARCHIVE', FALSE, 10, TRUE)")) {
            ps.setInt(1, id);
            ps.setString(2, targetStore);
            ps.setString(3, targetTable);
            ps.setInt(4, batchSize);
            ps.executeUpdate();
        }
    }

    /**
     * EVENTS に {@code total} 件投入します。ID 1..expired は 20 日前、残りは 1 日前の日時です。
     */
    static void seedEvents(Connection conn, int total, int expired) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO EVENTS (ID, CREATED_AT, PAYLOAD) VALUES (?, ?, ?)")) {
            for (int id = 1; id <= total; id++) {
                LocalDateTime createdAt = id <= expired ? NOW.minusDays(20).plusMinutes(id)
                        : NOW.minusDays(1).plusMinutes(id);
                ps.setInt(1, id);
                ps.setTimestamp(2, Timestamp.valueOf(createdAt));
                ps.setString(3, "event-" + id);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    static long count(Connection conn, String sql) throws SQLException {
        try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    /**
     * DBUnit のクエリテーブルを取得します。
     *
     * @param conn JDBC 接続（クローズしないこと）
     * @param name テーブル名
     * @param sql 問い合わせ
     * @return クエリ結果
     */
    static ITable query(Connection conn, String name, String sql) throws Exception {
        DatabaseConnection dbConn = new DatabaseConnection(conn);
        dbConn.getConfig().setProperty(DatabaseConfig.PROPERTY_DATATYPE_FACTORY,
                new H2DataTypeFactory());
        return dbConn.createQueryTable(name, sql);
    }

    static long number(Object value) {
        return ((Number) value).longValue();
    }
}
