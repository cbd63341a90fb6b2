/**
 * Database-specific mention stores: H2 ({@code MERGE}), MySQL ({@code ON DUPLICATE KEY UPDATE})
 * and PostgreSQL ({@code ON CONFLICT}).
 */
package webmention.jdbc.store;
