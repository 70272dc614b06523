package org.biosignal.archiver.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.LinkedList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.biosignal.archiver.ChunkStore;
import org.biosignal.archiver.config.ConfigService;
import org.biosignal.archiver.config.exception.ConfigException;
import org.biosignal.archiver.data.ChunkKind;
import org.biosignal.archiver.data.DataChunk;
import org.biosignal.archiver.utils.ui.ChunkJSONCodec;

/**
 * Stores chunks in a SQLite file; one row per chunk with the payload as JSON text.
 * The path to the file comes from the JVM property/environment variable ARCHIVER_CHUNKSTORE_SQLITEFILENAME and defaults to <code>./archiverchunks.db</code>.
 * <pre>
 * export ARCHIVER_CHUNKSTORE="org.biosignal.archiver.storage.SQLiteChunkStore"
 * export ARCHIVER_CHUNKSTORE_SQLITEFILENAME="/scratch/archiver/chunks.db"
 * </pre>
 * (sessionId, chunkIndex, kind) is a unique key; an insert that violates it throws a {@link DuplicateKeyException}.
 * All access to the connection is synchronized on this object.
 * @author mshankar
 *
 */
public class SQLiteChunkStore implements ChunkStore {
	private static final Logger configlogger = LogManager.getLogger("config." + SQLiteChunkStore.class.getName());
	private static final Logger logger = LogManager.getLogger(SQLiteChunkStore.class.getName());
	public static final String ARCHIVER_SQLITE_FILENAME = ConfigService.ARCHIVER_CHUNKSTORE + "_SQLITEFILENAME";
	private static final String PROVISIONAL = ChunkKind.PROVISIONAL.getExternalName();
	private static final String CONSOLIDATED = ChunkKind.CONSOLIDATED.getExternalName();

	private String pathToChunkData = "./archiverchunks.db";
	private Connection theConnection;

	public SQLiteChunkStore() throws ConfigException {
		this(null);
	}

	public SQLiteChunkStore(String path) throws ConfigException {
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
			pathToChunkData = pathFromEnv;
		}

		boolean newFile = !Files.exists(Paths.get(pathToChunkData));
		try {
			theConnection = DriverManager.getConnection("jdbc:sqlite:" + pathToChunkData);
			theConnection.setAutoCommit(true);
			try(Statement stmt = theConnection.createStatement()) {
				stmt.executeUpdate("pragma journal_mode=wal");
			} catch(SQLException ex) {
				configlogger.error("Exception setting WAL pragma - https://www.sqlite.org/wal.html", ex);
			}
			if(newFile) {
				configlogger.info("The SQLite chunk file " + pathToChunkData + " does not exist. Creating the file, tables and indexes");
			}
			try(Statement stmt = theConnection.createStatement()) {
				stmt.executeUpdate("CREATE TABLE IF NOT EXISTS Chunks ( sessionId TEXT NOT NULL, chunkIndex INTEGER NOT NULL, kind TEXT NOT NULL, "
						+ "arrivalOrder INTEGER, startTime INTEGER NOT NULL, endTime INTEGER NOT NULL, chunkJSON TEXT NOT NULL, "
						+ "UNIQUE(sessionId, chunkIndex, kind))");
				stmt.executeUpdate("CREATE INDEX IF NOT EXISTS ChunksByTime ON Chunks (sessionId, startTime, endTime)");
			}
		} catch(SQLException ex) {
			throw new ConfigException("Cannot initialize the SQLite chunk store in " + pathToChunkData, ex);
		}
		configlogger.info("Using SQLite chunk data from " + pathToChunkData);
	}

	@Override
	public void initialize(ConfigService configService) {
		configService.addShutdownHook(() -> {
			try {
				synchronized(this) {
					theConnection.close();
				}
			} catch(Exception ex) {
				configlogger.error("Exception closing connection to SQLite " + pathToChunkData, ex);
			}
		});
	}

	@Override
	public void insert(DataChunk chunk) throws IOException {
		synchronized(this) {
			try(PreparedStatement stmt = theConnection.prepareStatement("INSERT INTO Chunks (sessionId, chunkIndex, kind, arrivalOrder, startTime, endTime, chunkJSON) VALUES (?, ?, ?, ?, ?, ?, ?) ON CONFLICT DO NOTHING;")) {
				stmt.setString(1, chunk.getSessionId());
				stmt.setInt(2, chunk.getChunkIndex());
				stmt.setString(3, chunk.getKind().getExternalName());
				if(chunk.getArrivalOrder() != null) {
					stmt.setInt(4, chunk.getArrivalOrder());
				} else {
					stmt.setNull(4, Types.INTEGER);
				}
				stmt.setLong(5, chunk.getStartTime());
				stmt.setLong(6, chunk.getEndTime());
				stmt.setString(7, ChunkJSONCodec.toJSONString(chunk));
				int rowsChanged = stmt.executeUpdate();
				if(rowsChanged != 1) {
					throw new DuplicateKeyException(chunk.getChunkId());
				}
				logger.debug("Inserted " + chunk);
			} catch(SQLException ex) {
				throw new IOException(ex);
			}
		}
	}

	@Override
	public List<DataChunk> scanByTimeRange(String sessionId, Long start, Long end, int[] channels) throws IOException {
		LinkedList<DataChunk> ret = new LinkedList<DataChunk>();
		synchronized(this) {
			try(PreparedStatement stmt = theConnection.prepareStatement("SELECT chunkJSON FROM Chunks WHERE sessionId = ? "
					+ "AND (? IS NULL OR endTime >= ?) AND (? IS NULL OR startTime <= ?) "
					+ "ORDER BY chunkIndex, CASE kind WHEN '" + CONSOLIDATED + "' THEN 0 ELSE 1 END;")) {
				stmt.setString(1, sessionId);
				setNullableLong(stmt, 2, start);
				setNullableLong(stmt, 3, start);
				setNullableLong(stmt, 4, end);
				setNullableLong(stmt, 5, end);
				try(ResultSet rs = stmt.executeQuery()) {
					while(rs.next()) {
						ret.add(ChunkJSONCodec.fromJSONString(rs.getString(1)).project(channels));
					}
				}
			} catch(SQLException ex) {
				throw new IOException(ex);
			}
		}
		return ret;
	}

	@Override
	public List<DataChunk> scanProvisional(String sessionId) throws IOException {
		LinkedList<DataChunk> ret = new LinkedList<DataChunk>();
		synchronized(this) {
			try(PreparedStatement stmt = theConnection.prepareStatement("SELECT chunkJSON FROM Chunks WHERE sessionId = ? AND kind = ? ORDER BY arrivalOrder;")) {
				stmt.setString(1, sessionId);
				stmt.setString(2, PROVISIONAL);
				try(ResultSet rs = stmt.executeQuery()) {
					while(rs.next()) {
						ret.add(ChunkJSONCodec.fromJSONString(rs.getString(1)));
					}
				}
			} catch(SQLException ex) {
				throw new IOException(ex);
			}
		}
		logger.debug("Found " + ret.size() + " provisional chunks for " + sessionId);
		return ret;
	}

	@Override
	public int countProvisional(String sessionId) throws IOException {
		synchronized(this) {
			try(PreparedStatement stmt = theConnection.prepareStatement("SELECT COUNT(*) FROM Chunks WHERE sessionId = ? AND kind = ?;")) {
				stmt.setString(1, sessionId);
				stmt.setString(2, PROVISIONAL);
				try(ResultSet rs = stmt.executeQuery()) {
					return rs.next() ? rs.getInt(1) : 0;
				}
			} catch(SQLException ex) {
				throw new IOException(ex);
			}
		}
	}

	@Override
	public DataChunk getConsolidated(String sessionId) throws IOException {
		synchronized(this) {
			try(PreparedStatement stmt = theConnection.prepareStatement("SELECT chunkJSON FROM Chunks WHERE sessionId = ? AND kind = ?;")) {
				stmt.setString(1, sessionId);
				stmt.setString(2, CONSOLIDATED);
				try(ResultSet rs = stmt.executeQuery()) {
					if(rs.next()) {
						return ChunkJSONCodec.fromJSONString(rs.getString(1));
					}
				}
			} catch(SQLException ex) {
				throw new IOException(ex);
			}
		}
		return null;
	}

	@Override
	public int deleteProvisional(String sessionId) throws IOException {
		return delete("DELETE FROM Chunks WHERE sessionId = ? AND kind = '" + PROVISIONAL + "';", sessionId);
	}

	@Override
	public int deleteConsolidated(String sessionId) throws IOException {
		return delete("DELETE FROM Chunks WHERE sessionId = ? AND kind = '" + CONSOLIDATED + "';", sessionId);
	}

	@Override
	public int deleteAll(String sessionId) throws IOException {
		return delete("DELETE FROM Chunks WHERE sessionId = ?;", sessionId);
	}

	private int delete(String sql, String sessionId) throws IOException {
		synchronized(this) {
			try(PreparedStatement stmt = theConnection.prepareStatement(sql)) {
				stmt.setString(1, sessionId);
				int rowsChanged = stmt.executeUpdate();
				logger.debug(rowsChanged + " chunks removed for session " + sessionId);
				return rowsChanged;
			} catch(SQLException ex) {
				throw new IOException(ex);
			}
		}
	}

	private static void setNullableLong(PreparedStatement stmt, int index, Long value) throws SQLException {
		if(value == null) {
			stmt.setNull(index, Types.INTEGER);
		} else {
			stmt.setLong(index, value);
		}
	}
}
