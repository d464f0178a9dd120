package org.atomicswap.repository.hsqldb;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class HSQLDBDatabaseUpdates {

	private static final Logger LOGGER = LogManager.getLogger(HSQLDBDatabaseUpdates.class);

	/**
	 * Apply any incremental changes to database schema.
	 * 
	 * @return true if database was non-existent/empty, false otherwise
	 * @throws SQLException
	 */
	public static boolean updateDatabase(Connection connection) throws SQLException {
		final boolean wasPristine = fetchDatabaseVersion(connection) == 0;

		while (databaseUpdating(connection))
			incrementDatabaseVersion(connection);

		return wasPristine;
	}

	/**
	 * Increment database's schema version.
	 * 
	 * @throws SQLException
	 */
	private static void incrementDatabaseVersion(Connection connection) throws SQLException {
		try (Statement stmt = connection.createStatement()) {
			stmt.execute("UPDATE DatabaseInfo SET version = version + 1");
			connection.commit();
		}
	}

	/**
	 * Fetch current version of database schema.
	 * 
	 * @return database version, or 0 if no schema yet
	 * @throws SQLException
	 */
	private static int fetchDatabaseVersion(Connection connection) throws SQLException {
		try (Statement stmt = connection.createStatement()) {
			if (stmt.execute("SELECT version FROM DatabaseInfo"))
				try (ResultSet resultSet = stmt.getResultSet()) {
					if (resultSet.next())
						return resultSet.getInt(1);
				}
		} catch (SQLException e) {
			// Assume database is empty
			LOGGER.trace(() -> String.format("No DatabaseInfo table yet: %s", e.getMessage()));
		}

		return 0;
	}

	/**
	 * Incrementally update database schema, returning whether an update happened.
	 * 
	 * @return true - if a schema update happened, false otherwise
	 * @throws SQLException
	 */
	private static boolean databaseUpdating(Connection connection) throws SQLException {
		int databaseVersion = fetchDatabaseVersion(connection);

		try (Statement stmt = connection.createStatement()) {

			switch (databaseVersion) {
				case 0:
					// create from new
					stmt.execute("SET DATABASE SQL NAMES TRUE"); // SQL keywords cannot be used as DB object names, e.g. table names
					stmt.execute("SET DATABASE TRANSACTION CONTROL MVCC"); // Use MVCC over default two-phase locking, a-k-a "LOCKS"

					stmt.execute("CREATE TABLE DatabaseInfo ( version INTEGER NOT NULL )");
					stmt.execute("INSERT INTO DatabaseInfo VALUES ( 0 )");

					// Amounts: up to 19 whole digits, 8 fractional digits
					stmt.execute("CREATE TYPE SwapID AS VARCHAR(36)");
					stmt.execute("CREATE TYPE AssetName AS VARCHAR(16)");
					stmt.execute("CREATE TYPE SwapAmount AS DECIMAL(27, 8)");
					stmt.execute("CREATE TYPE LedgerAddress AS VARCHAR(256)");
					stmt.execute("CREATE TYPE LedgerReference AS VARCHAR(256)");
					stmt.execute("CREATE TYPE EpochMillis AS BIGINT");
					break;

				case 1:
					// Swap offers
					stmt.execute("CREATE TABLE SwapOffers (swap_id SwapID NOT NULL, status VARCHAR(32) NOT NULL, "
							+ "initiator_asset AssetName NOT NULL, initiator_amount SwapAmount NOT NULL, "
							+ "acceptor_asset AssetName NOT NULL, acceptor_amount SwapAmount NOT NULL, "
							+ "initiator_address LedgerAddress NOT NULL, acceptor_address LedgerAddress, "
							+ "hashlock CHAR(64) NOT NULL, secret VARBINARY(32) NOT NULL, "
							+ "initiator_timelock EpochMillis NOT NULL, acceptor_timelock EpochMillis NOT NULL, "
							+ "initiator_txid LedgerReference, acceptor_txid LedgerReference, "
							+ "created_at EpochMillis NOT NULL, accepted_at EpochMillis, "
							+ "initiator_claimed_at EpochMillis, completed_at EpochMillis, "
							+ "initiator_refunded_at EpochMillis, acceptor_refunded_at EpochMillis, "
							+ "last_failure VARCHAR(1024), last_failure_at EpochMillis, "
							+ "pending_action VARCHAR(32), pending_since EpochMillis, "
							+ "updated_at EpochMillis NOT NULL, version INTEGER NOT NULL, "
							+ "PRIMARY KEY (swap_id), "
							+ "CHECK (initiator_asset <> acceptor_asset), "
							+ "CHECK (acceptor_timelock < initiator_timelock))");
					stmt.execute("CREATE INDEX SwapOfferStatusIndex ON SwapOffers (status, created_at)");
					stmt.execute("CREATE INDEX SwapOfferCreationIndex ON SwapOffers (created_at)");
					break;

				default:
					// nothing to do
					return false;
			}
		}

		// database was updated
		LOGGER.info(() -> String.format("HSQLDB repository updated to version %d", databaseVersion + 1));
		return true;
	}

}
