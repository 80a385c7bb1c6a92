package io.github.yok.flexretire.db;

import io.github.yok.flexretire.config.StoreConfig;
import io.github.yok.flexretire.db.dialect.SqlDialect;
import io.github.yok.flexretire.db.dialect.SqlDialectFactory;
import io.github.yok.flexretire.db.tx.LocalTransactionCoordinator;
import io.github.yok.flexretire.db.tx.TransactionCoordinator;
import io.github.yok.flexretire.db.tx.XaTransactionCoordinator;
import io.github.yok.flexretire.util.MaskingLogUtil;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;
import javax.sql.XAConnection;
import javax.sql.XADataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.BeanUtils;
import org.springframework.beans.BeanWrapper;
import org.springframework.beans.BeanWrapperImpl;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.stereotype.Component;

/**
 * Resolves store aliases against {@code retire.stores} and opens connectors on them.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoreConnectorFactory {

    private final StoreConfig storeConfig;
    private final SqlDialectFactory dialectFactory;

    /**
     * Returns the store entry registered under an alias (case-insensitive).
     *
     * @param alias store alias
     * @return store entry
     * @throws IllegalStateException if the alias is not configured
     */
    public StoreConfig.Entry resolve(String alias) {
        return find(alias).orElseThrow(
                () -> new IllegalStateException("Unknown store alias: " + alias));
    }

    /**
     * Returns whether an alias is configured.
     *
     * @param alias store alias
     * @return {@code true} when configured
     */
    public boolean isKnown(String alias) {
        return find(alias).isPresent();
    }

    /**
     * Returns whether an alias is configured with an XA data source.
     *
     * @param alias store alias
     * @return {@code true} when the store can join a two-phase unit of work
     */
    public boolean isXaCapable(String alias) {
        return find(alias).map(e -> StringUtils.isNotBlank(e.getXaDataSourceClass()))
                .orElse(false);
    }

    /**
     * Opens a connector whose units of work are local transactions.
     *
     * @param alias store alias
     * @return connector
     * @throws SQLException if the connection cannot be opened
     */
    public StoreConnector openLocal(String alias) throws SQLException {
        StoreConfig.Entry entry = resolve(alias);
        SqlDialect dialect = dialectFactory.create(entry);
        log.debug("Opening local store: {} (dialect={})", MaskingLogUtil.describe(entry),
                dialect.getMode());
        loadDriver(entry);
        Connection connection =
                DriverManager.getConnection(entry.getUrl(), entry.getUser(), entry.getPassword());
        try {
            return new JdbcStoreConnector(entry.getId(), dialect, connection);
        } catch (SQLException | RuntimeException e) {
            connection.close();
            throw e;
        }
    }

    /**
     * Opens a connector that can join a two-phase unit of work.
     *
     * @param alias store alias
     * @return connector
     * @throws SQLException if the connection cannot be opened
     * @throws IllegalStateException if the store has no {@code xa-data-source-class}
     */
    public StoreConnector openXa(String alias) throws SQLException {
        StoreConfig.Entry entry = resolve(alias);
        if (StringUtils.isBlank(entry.getXaDataSourceClass())) {
            throw new IllegalStateException(
                    "Store " + entry.getId() + " has no xa-data-source-class configured");
        }
        SqlDialect dialect = dialectFactory.create(entry);
        log.debug("Opening XA store: {} (dialect={})", MaskingLogUtil.describe(entry),
                dialect.getMode());
        XAConnection xa = createXaDataSource(entry).getXAConnection();
        try {
            return new XaStoreConnector(entry.getId(), dialect, xa);
        } catch (SQLException | RuntimeException e) {
            xa.close();
            throw e;
        }
    }

    /**
     * Creates a non-pooled {@link DataSource} for an alias, used for the catalog and the log.
     *
     * @param alias store alias
     * @return data source
     */
    public DataSource createDataSource(String alias) {
        StoreConfig.Entry entry = resolve(alias);
        log.info("Metadata store: {}", MaskingLogUtil.describe(entry));
        DriverManagerDataSource ds = new DriverManagerDataSource();
        if (StringUtils.isNotBlank(entry.getDriverClass())) {
            ds.setDriverClassName(entry.getDriverClass());
        }
        ds.setUrl(entry.getUrl());
        ds.setUsername(entry.getUser());
        ds.setPassword(entry.getPassword());
        return ds;
    }

    /**
     * Creates the coordinator for one job.
     *
     * @param crossStore {@code true} when source and target are different stores
     * @return coordinator
     */
    public TransactionCoordinator newCoordinator(boolean crossStore) {
        return crossStore ? new XaTransactionCoordinator() : new LocalTransactionCoordinator();
    }

    private Optional<StoreConfig.Entry> find(String alias) {
        List<StoreConfig.Entry> stores = storeConfig.getStores();
        if (alias == null || stores == null) {
            return Optional.empty();
        }
        return stores.stream().filter(e -> alias.equalsIgnoreCase(e.getId())).findFirst();
    }

    private void loadDriver(StoreConfig.Entry entry) {
        if (StringUtils.isBlank(entry.getDriverClass())) {
            return;
        }
        try {
            Class.forName(entry.getDriverClass());
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("JDBC driver not found: " + entry.getDriverClass(), e);
        }
    }

    /**
     * Instantiates the configured {@link XADataSource} and sets URL and credentials through its
     * bean properties ({@code URL} or {@code url}, {@code user}, {@code password}).
     *
     * @param entry store entry
     * @return configured XA data source
     */
    private XADataSource createXaDataSource(StoreConfig.Entry entry) {
        Class<?> type;
        try {
            type = Class.forName(entry.getXaDataSourceClass());
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException(
                    "XADataSource class not found: " + entry.getXaDataSourceClass(), e);
        }
        if (!XADataSource.class.isAssignableFrom(type)) {
            throw new IllegalStateException(
                    entry.getXaDataSourceClass() + " is not an XADataSource");
        }
        Object ds = BeanUtils.instantiateClass(type);
        BeanWrapper wrapper = new BeanWrapperImpl(ds);
        if (wrapper.isWritableProperty("URL")) {
            wrapper.setPropertyValue("URL", entry.getUrl());
        } else {
            wrapper.setPropertyValue("url", entry.getUrl());
        }
        wrapper.setPropertyValue("user", entry.getUser());
        wrapper.setPropertyValue("password", entry.getPassword());
        return (XADataSource) ds;
    }
}
