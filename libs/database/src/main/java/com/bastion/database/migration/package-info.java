/**
 * Datasource and Flyway migration configuration.
 *
 * <ul>
 *   <li>{@link com.bastion.database.migration.DatabaseProperties}: externalized connection and
 *       migration settings
 *   <li>{@link com.bastion.database.migration.UserStoreConfig}: Spring {@code @Configuration}
 *       creating the datasource, the migrated Flyway instance and the user directory
 * </ul>
 */
package com.bastion.database.migration;
