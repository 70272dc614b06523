package org.biosignal.archiver.config.persistence;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.biosignal.archiver.config.ConfigService;
import org.biosignal.archiver.config.SessionInfo;
import org.biosignal.archiver.config.SessionPersistence;
import org.biosignal.archiver.config.exception.ConfigException;
import org.json.simple.JSONObject;
import org.json.simple.JSONValue;

/**
 * Uses SQLite as a persistence layer for sessions; use in small, single node deployments.
 * SQLite stores its data in a file, to set the path to the SQLite file, use the environment variable ARCHIVER_PERSISTENCE_LAYER_SQLITEFILENAME.
 * This defaults to <code>./archiversessions.db</code>
 * To use this persistence layer, use
 * <pre>
 * export ARCHIVER_PERSISTENCE_LAYER="org.biosignal.archiver.config.persistence.SQLitePersistence"
 * export ARCHIVER_PERSISTENCE_LAYER_SQLITEFILENAME="/scratch/archiver/sessions.db"
 * </pre>
 * The tables are created if we are creating the file for the first time.
 *
 * This implementation tries to set WAL to improve write performance but continues on if setting pragma fails.
 *
 * @author mshankar
 *
 */
public class SQLitePersistence implements SessionPersistence {
	private static final Logger configlogger = LogManager.getLogger("config." + SQLitePersistence.class.getName());
	private static final Logger logger = LogManager.getLogger(SQLitePersistence.class.getName());
	public static final String ARCHIVER_SQLITE_FILENAME = ConfigService.ARCHIVER_PERSISTENCE_LAYER + "_SQLITEFILENAME";
	private String pathToSessionData = "./archiversessions.db";
	private String sqliteJDBCURL = null;
	private Connection theConnection;

	public SQLitePersistence() throws ConfigException {
		this(null);
	}

	public SQLitePersistence(String path) throws ConfigException {
		try {
			Class.forName("org.sqlite.JDBC");
		} catch (Exception ex) {
			throw new ConfigException("Cannot find the SQLite database driver in the classpath. Please add the library from https://github.com/xerial/sqlite-jdbc", ex);
		}

		String pathFromEnv = path;
		if(pathFromEnv == null) {
			pathFromEnv = System.getProperty(ARCHIVER_SQLITE_FILENAME);
		}
		if(pathFromEnv == null) {
			pathFromEnv = System.getenv(ARCHIVER_SQLITE_FILENAME);
		}
		if(pathFromEnv != null) {
			pathToSessionData = pathFromEnv;
		}
		sqliteJDBCURL = "jdbc:sqlite:" + pathToSessionData;

		boolean createTables = !Files.exists(Paths.get(pathToSessionData));
		try {
			theConnection = DriverManager.getConnection(sqliteJDBCURL);
			theConnection.setAutoCommit(true);
			try(Statement stmt = theConnection.createStatement()) {
				stmt.executeUpdate("pragma journal_mode=wal");
			} catch(SQLException ex) {
				configlogger.error("Exception setting WAL pragma - https://www.sqlite.org/wal.html", ex);
			}
		} catch(SQLException ex) {
			throw new ConfigException("Cannot initialize the JDBC Connection to " + pathToSessionData, ex);
		}

		if(createTables) {
			configlogger.info("The SQLite data file " + sqliteJDBCURL + " does not exist. Creating the file, tables and indexes");
		}
		try {
			createTablesAndIndices();
		} catch(SQLException ex) {
			throw new ConfigException("Cannot create tables and indices in SQLite data file " + pathToSessionData, ex);
		}
		configlogger.info("Loading SQLite session data from " + pathToSessionData);
	}

	@Override
	public void initialize(ConfigService configService) {
		configService.addShutdownHook(() -> {
			try {
				theConnection.close();
			} catch(Exception ex) {
				configlogger.error("Exception closing connection to SQLite " + pathToSessionData, ex);
			}
		});
	}

	private void createTablesAndIndices() throws SQLException {
		try(Statement stmt = theConnection.createStatement()) {
			stmt.executeUpdate("CREATE TABLE IF NOT EXISTS Sessions ( sessionId TEXT NOT NULL PRIMARY KEY, userId TEXT NOT NULL, sessionJSON TEXT NOT NULL)");
			stmt.executeUpdate("CREATE INDEX IF NOT EXISTS SessionsByUser ON Sessions (userId)");
		}
	}

	@Override
	public List<String> getSessionKeys() throws IOException {
		LinkedList<String> ret = new LinkedList<String>();
		synchronized(this) {
			try(PreparedStatement stmt = theConnection.prepareStatement("SELECT sessionId AS sessionId FROM Sessions ORDER BY sessionId;")) {
				try(ResultSet rs = stmt.executeQuery()) {
					while(rs.next()) {
						ret.add(rs.getString(1));
					}
				}
			} catch(SQLException ex) {
				throw new IOException(ex);
			}
		}
		logger.debug("getSessionKeys returns " + ret.size() + " keys");
		return ret;
	}

	@Override
	public SessionInfo getSession(String sessionId) throws IOException {
		if(sessionId == null || sessionId.equals("")) return null;

		synchronized(this) {
			try(PreparedStatement stmt = theConnection.prepareStatement("SELECT sessionJSON AS sessionJSON FROM Sessions WHERE sessionId = ?;")) {
				stmt.setString(1, sessionId);
				try(ResultSet rs = stmt.executeQuery()) {
					while(rs.next()) {
						return parseSession(rs.getString(1));
					}
				}
			} catch(Exception ex) {
				throw new IOException(ex);
			}
		}
		return null;
	}

	@Override
	public List<SessionInfo> getSessionsForUser(String userId) throws IOException {
		LinkedList<SessionInfo> ret = new LinkedList<SessionInfo>();
		synchronized(this) {
			try(PreparedStatement stmt = theConnection.prepareStatement("SELECT sessionJSON AS sessionJSON FROM Sessions WHERE userId = ?;")) {
				stmt.setString(1, userId);
				try(ResultSet rs = stmt.executeQuery()) {
					while(rs.next()) {
						ret.add(parseSession(rs.getString(1)));
					}
				}
			} catch(Exception ex) {
				throw new IOException(ex);
			}
		}
		return ret;
	}

	@Override
	public boolean addSession(SessionInfo session) throws IOException {
		checkKey(session, "addSession");
		synchronized(this) {
			try(PreparedStatement stmt = theConnection.prepareStatement("INSERT INTO Sessions (sessionId, userId, sessionJSON) VALUES (?, ?, ?) ON CONFLICT(sessionId) DO NOTHING;")) {
				stmt.setString(1, session.getSessionId());
				stmt.setString(2, session.getUserId());
				stmt.setString(3, session.toJSON().toJSONString());
				int rowsChanged = stmt.executeUpdate();
				logger.debug(rowsChanged + " rows changed when adding session " + session.getSessionId());
				return rowsChanged == 1;
			} catch(SQLException ex) {
				throw new IOException(ex);
			}
		}
	}

	@Override
	public void putSession(SessionInfo session) throws IOException {
		checkKey(session, "putSession");
		synchronized(this) {
			try(PreparedStatement stmt = theConnection.prepareStatement("INSERT INTO Sessions (sessionId, userId, sessionJSON) VALUES (?, ?, ?) ON CONFLICT(sessionId) DO UPDATE SET userId = ?, sessionJSON = ?;")) {
				String jsonStr = session.toJSON().toJSONString();
				stmt.setString(1, session.getSessionId());
				stmt.setString(2, session.getUserId());
				stmt.setString(3, jsonStr);
				stmt.setString(4, session.getUserId());
				stmt.setString(5, jsonStr);
				int rowsChanged = stmt.executeUpdate();
				if(rowsChanged != 1) {
					logger.warn(rowsChanged + " rows changed when updating session " + session.getSessionId());
				} else {
					logger.debug("Successfully updated session " + session.getSessionId());
				}
			} catch(SQLException ex) {
				throw new IOException(ex);
			}
		}
	}

	@Override
	public void deleteSession(String sessionId) throws IOException {
		synchronized(this) {
			try(PreparedStatement stmt = theConnection.prepareStatement("DELETE FROM Sessions WHERE sessionId = ?;")) {
				stmt.setString(1, sessionId);
				int rowsChanged = stmt.executeUpdate();
				if(rowsChanged != 1) {
					logger.warn(rowsChanged + " rows changed when removing session " + sessionId);
				} else {
					logger.debug("Successfully removed session " + sessionId);
				}
			} catch(SQLException ex) {
				throw new IOException(ex);
			}
		}
	}

	private static void checkKey(SessionInfo session, String msg) throws IOException {
		if(session == null) throw new IOException("session cannot be null when persisting " + msg);
		if(session.getSessionId() == null || session.getSessionId().equals("")) throw new IOException("session id cannot be null when persisting " + msg);
		if(session.getUserId() == null) throw new IOException("user id cannot be null when persisting " + msg);
	}

	private static SessionInfo parseSession(String jsonStr) {
		JSONObject jsonObj = (JSONObject) JSONValue.parse(jsonStr);
		return SessionInfo.fromJSON(jsonObj);
	}
}
