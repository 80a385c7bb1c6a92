/**
 * Configuration model package for FlexRetire.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml}: the store aliases
 * and the engine settings. This package holds configuration data only; execution logic lives in
 * {@code core} and {@code db}.
 * </p>
 */
package io.github.yok.flexretire.config;
