/**
 * Relational storage for the Bastion platform.
 *
 * <p>Flyway owns the schema ({@code db/migration/bastion/V{n}__{desc}.sql}); Spring JDBC owns
 * data access. Each operation borrows a connection from the caller-supplied {@code DataSource}
 * and returns it when done, so no session object outlives a call.
 *
 * @see com.bastion.database.migration.UserStoreConfig
 * @see com.bastion.database.user.JdbcUserDirectory
 */
package com.bastion.database;
