package io.github.yok.flexretire.config;

import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that manages the data-store aliases loaded from {@code application.yml}.
 *
 * <p>
 * Job rows only carry an alias (the {@code TargetLinkedServer} column). The deployment resolves the
 * alias to connection details here, so credentials and host names never live in the catalog.
 * </p>
 *
 * <pre>
 * retire:
 *   stores:
 *     - id: local
 *       url: jdbc:sqlserver://localhost:1433;databaseName=testa
 *       user: retire
 *       password: secret
 *       driverClass: com.microsoft.sqlserver.jdbc.SQLServerDriver
 *       xaDataSourceClass: com.microsoft.sqlserver.jdbc.SQLServerXADataSource
 *     - id: REMOTE_SRV
 *       url: jdbc:sqlserver://archive-host:1433;databaseName=archive
 *       ...
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "retire")
@Data
public class StoreConfig {

    /**
     * List of store entries.
     */
    private List<Entry> stores;

    /**
     * Inner class that holds one store setting.
     */
    @Data
    public static class Entry {
        // Alias referenced by job rows (e.g., "REMOTE_SRV")
        private String id;
        // JDBC connection URL
        private String url;
        // Database user name
        private String user;
        // Database password
        private String password;
        // Fully qualified JDBC driver class name; blank relies on JDBC 4 auto-loading
        private String driverClass;
        // Fully qualified XADataSource class, required when the store takes part in a cross-store
        // unit of work
        private String xaDataSourceClass;
        // Explicit dialect; resolved from driver class or URL when absent
        private DialectMode dialect;
    }
}
