package org.atomicswap.repository.hsqldb;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Database helper for building, and executing, INSERT and UPDATE SQL statements.
 * <p>
 * {@code HSQLDBSaver saver = new HSQLDBSaver("Cars");}<br>
 * {@code saver.bind("make", "Ferrari").bind("model", "F40");}<br>
 * {@code saver.insert(repository);}
 */
public class HSQLDBSaver {

	private final String table;

	private final List<String> columns = new ArrayList<>();
	private final List<Object> objects = new ArrayList<>();

	/**
	 * Construct a saver for table.
	 * 
	 * @param table
	 */
	public HSQLDBSaver(String table) {
		this.table = table;
	}

	/**
	 * Add a column, and bound value, to be saved by insert() or update().
	 * 
	 * @param column
	 * @param value
	 * @return the same HSQLDBSaver object
	 */
	public HSQLDBSaver bind(String column, Object value) {
		this.columns.add(column);
		this.objects.add(value);
		return this;
	}

	/**
	 * Build INSERT statement and execute it.
	 * <p>
	 * Fails with SQLException if row already exists.
	 */
	public void insert(HSQLDBRepository repository) throws SQLException {
		String[] placeholders = new String[this.columns.size()];
		Arrays.fill(placeholders, "?");

		StringBuilder sql = new StringBuilder(1024);
		sql.append("INSERT INTO ");
		sql.append(this.table);
		sql.append(" (");
		sql.append(String.join(", ", this.columns));
		sql.append(") VALUES (");
		sql.append(String.join(", ", placeholders));
		sql.append(")");

		repository.executeCheckedUpdate(sql.toString(), this.objects.toArray());
	}

	/**
	 * Build UPDATE statement, restricted by <tt>whereClause</tt>, and execute it.
	 * 
	 * @param whereClause SQL "WHERE" clause containing "?" placeholders
	 * @param whereObjects values for <tt>whereClause</tt> placeholders
	 * @return number of updated rows
	 */
	public int update(HSQLDBRepository repository, String whereClause, Object... whereObjects) throws SQLException {
		StringBuilder sql = new StringBuilder(1024);
		sql.append("UPDATE ");
		sql.append(this.table);
		sql.append(" SET ");

		for (int i = 0; i < this.columns.size(); ++i) {
			if (i != 0)
				sql.append(", ");

			sql.append(this.columns.get(i));
			sql.append(" = ?");
		}

		sql.append(" WHERE ");
		sql.append(whereClause);

		List<Object> allObjects = new ArrayList<>(this.objects);
		allObjects.addAll(Arrays.asList(whereObjects));

		return repository.executeCheckedUpdate(sql.toString(), allObjects.toArray());
	}

}
