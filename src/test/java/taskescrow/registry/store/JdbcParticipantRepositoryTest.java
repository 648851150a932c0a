package taskescrow.registry.store;

import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcParticipantRepositoryTest {

    private Database db;
    private JdbcParticipantRepository repo;

    @BeforeEach
    void setUp() {
        db = new Database("jdbc:h2:mem:test-participants-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 2);
        repo = new JdbcParticipantRepository(db);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void taskListKeepsAppendOrder() {
        db.inTransaction(conn -> {
            repo.appendTask(conn, "alice", 3);
            repo.appendTask(conn, "alice", 1);
            repo.appendTask(conn, "bob", 1);
            repo.appendTask(conn, "alice", 2);
            return null;
        });

        assertEquals(List.of(3L, 1L, 2L), repo.findTaskIds("alice"));
        assertEquals(List.of(1L), repo.findTaskIds("bob"));
        assertEquals(List.of(), repo.findTaskIds("carol"));
    }

    @Test
    void completedCountStartsAtZeroAndIncrements() {
        assertEquals(0, repo.completedCount("bob"));

        db.inTransaction(conn -> {
            repo.incrementCompleted(conn, "bob");
            repo.incrementCompleted(conn, "bob");
            repo.incrementCompleted(conn, "alice");
            return null;
        });

        assertEquals(2, repo.completedCount("bob"));
        assertEquals(1, repo.completedCount("alice"));
    }
}
