package in.brainlog.migration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("AuthSchemaMigration Tests")
class AuthSchemaMigrationTest {

    private DataSource dataSource;
    private Connection connection;
    private DatabaseMetaData metadata;
    private Statement statement;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = mock(DataSource.class);
        connection = mock(Connection.class);
        metadata = mock(DatabaseMetaData.class);
        statement = mock(Statement.class);

        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.getMetaData()).thenReturn(metadata);
        when(connection.createStatement()).thenReturn(statement);
    }

    private static ResultSet rows(boolean present) throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(present);
        return rs;
    }

    private List<String> executedSql() throws SQLException {
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(statement, atLeast(0)).executeUpdate(sql.capture());
        return sql.getAllValues();
    }

    @Test
    @DisplayName("Empty database gets all three tables and the settings row")
    void testFreshDatabase() throws SQLException {
        when(metadata.getTables(isNull(), isNull(), anyString(), any())).thenAnswer(inv -> rows(false));

        new AuthSchemaMigration(dataSource).migrate();

        List<String> sql = executedSql();
        assertTrue(sql.stream().anyMatch(s -> s.contains("CREATE TABLE users")));
        assertTrue(sql.stream().anyMatch(s -> s.contains("CREATE TABLE audit_log")));
        assertTrue(sql.stream().anyMatch(s -> s.contains("CREATE TABLE system_settings")));
        assertTrue(sql.contains("INSERT INTO system_settings (id) VALUES ('system')"));
        assertTrue(sql.stream().anyMatch(s -> s.contains("users_pending_inactive")));
    }

    @Test
    @DisplayName("Existing users table without lockout columns is altered in place")
    void testUpgradeAddsMissingColumns() throws SQLException {
        when(metadata.getTables(isNull(), isNull(), anyString(), any())).thenAnswer(inv -> rows(true));
        when(metadata.getColumns(isNull(), isNull(), eq("users"), anyString()))
            .thenAnswer(inv -> rows(!"locked_until".equals(inv.getArgument(3))));

        new AuthSchemaMigration(dataSource).migrate();

        List<String> sql = executedSql();
        assertEquals(List.of("ALTER TABLE users ADD COLUMN locked_until TIMESTAMPTZ"), sql);
    }

    @Test
    @DisplayName("Up-to-date schema is left untouched")
    void testIdempotent() throws SQLException {
        when(metadata.getTables(isNull(), isNull(), anyString(), any())).thenAnswer(inv -> rows(true));
        when(metadata.getColumns(isNull(), isNull(), anyString(), anyString())).thenAnswer(inv -> rows(true));

        new AuthSchemaMigration(dataSource).migrate();

        verify(statement, never()).executeUpdate(anyString());
    }

    @Test
    @DisplayName("SQL failure aborts startup")
    void testFailurePropagates() throws SQLException {
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> new AuthSchemaMigration(dataSource).migrate());
        assertInstanceOf(SQLException.class, e.getCause());
    }
}
