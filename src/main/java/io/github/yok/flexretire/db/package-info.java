/**
 * Store connectors: bounded JDBC statements over local or XA connections.
 */
package io.github.yok.flexretire.db;
