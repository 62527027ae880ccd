package com.solo.game_state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Хранилище сохранений в SQLite: одна запись JSON на сессию
 */
public class GameManager {
    private static final Logger log = LoggerFactory.getLogger(GameManager.class);

    private final String dbPath;
    private final SaveCodec codec;

    public GameManager(String dbPath, SaveCodec codec) {
        this.dbPath = dbPath;
        this.codec = codec;
        initDatabase();
    }

    public static String newSessionId() {
        return "game_" + LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS"));
    }

    Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    private void initDatabase() {
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS games (
                    session_id TEXT PRIMARY KEY,
                    updated_at TIMESTAMP,
                    game_data TEXT NOT NULL
                )
            """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS characters (
                    slug TEXT PRIMARY KEY,
                    name TEXT NOT NULL,
                    character_data TEXT NOT NULL
                )
            """);
        } catch (SQLException e) {
            throw new GamePersistenceException("Failed to initialise database at " + dbPath, e);
        }
    }

    public String getDbPath() {
        return dbPath;
    }

    public void saveGame(GameState state) {
        if (state.getSessionId() == null || state.getSessionId().isEmpty()) {
            state.setSessionId(newSessionId());
        }
        String gameData = codec.toJson(state);
        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement(
                 "INSERT OR REPLACE INTO games (session_id, updated_at, game_data) VALUES (?, ?, ?)")) {
            stmt.setString(1, state.getSessionId());
            stmt.setString(2, LocalDateTime.now().toString());
            stmt.setString(3, gameData);
            stmt.executeUpdate();
            log.debug("Saved game '{}' at turn {}", state.getSessionId(), state.getTurn());
        } catch (SQLException e) {
            throw new GamePersistenceException("Failed to save game " + state.getSessionId(), e);
        }
    }

    /**
     * Загрузить игру по session_id. Неизвестная сессия даёт null, для повреждённой записи бросается SaveCorruptedException.
     */
    public GameState loadGame(String sessionId) {
        if (sessionId == null) {
            return null;
        }
        String gameData;
        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement("SELECT game_data FROM games WHERE session_id = ?")) {
            stmt.setString(1, sessionId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                gameData = rs.getString("game_data");
            }
        } catch (SQLException e) {
            throw new GamePersistenceException("Failed to load game " + sessionId, e);
        }
        try {
            return codec.fromJson(gameData);
        } catch (SaveCorruptedException e) {
            log.error("Save '{}' is corrupt: {}", sessionId, e.getMessage());
            throw e;
        }
    }

    public boolean gameExists(String sessionId) {
        if (sessionId == null) {
            return false;
        }
        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement("SELECT 1 FROM games WHERE session_id = ?")) {
            stmt.setString(1, sessionId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new GamePersistenceException("Failed to look up game " + sessionId, e);
        }
    }
}
