package io.herald.core.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteScheduleStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldInsertAndReadBackSchedules() throws Exception {
        SqliteScheduleStore store = new SqliteScheduleStore(tempDir.resolve("data/schedules.db"));

        Schedule created = store.insert(schedule("alice", "standup", RepeatType.WEEKLY, "mon,wed 09:00"));

        assertThat(created.id()).isPositive();
        assertThat(store.find(created.id())).contains(created);
        assertThat(store.listByOwner("alice")).containsExactly(created);
        assertThat(store.listByOwner("bob")).isEmpty();
    }

    @Test
    void shouldPersistAcrossStoreInstances() throws Exception {
        Path db = tempDir.resolve("schedules.db");
        SqliteScheduleStore first = new SqliteScheduleStore(db);
        Schedule a = first.insert(schedule("alice", "a", RepeatType.INTERVAL, "30m"));
        Schedule b = first.insert(schedule("bob", "b", RepeatType.NONE, ""));
        first.setActive(b.id(), false);

        SqliteScheduleStore reopened = new SqliteScheduleStore(db);

        assertThat(reopened.getActiveSchedules()).containsExactly(a);
        assertThat(reopened.listAll()).hasSize(2);
        assertThat(reopened.find(b.id())).get().extracting(Schedule::active).isEqualTo(false);
    }

    @Test
    void shouldUpdateAndDelete() throws Exception {
        SqliteScheduleStore store = new SqliteScheduleStore(tempDir.resolve("schedules.db"));
        Schedule created = store.insert(schedule("alice", "old", RepeatType.INTERVAL, "1h"));
        Schedule edited = new Schedule(
            created.id(), "alice", "new", "changed", "chan-2", RepeatType.WEEKLY, "fri 17:00", true, "Europe/Berlin"
        );

        assertThat(store.update(edited)).isTrue();
        assertThat(store.find(created.id())).contains(edited);
        assertThat(store.delete(created.id())).isTrue();
        assertThat(store.delete(created.id())).isFalse();
        assertThat(store.find(created.id())).isEmpty();
        assertThat(store.update(edited)).isFalse();
    }

    @Test
    void shouldUpsertUserTimezone() throws Exception {
        SqliteScheduleStore store = new SqliteScheduleStore(tempDir.resolve("schedules.db"));

        assertThat(store.find("alice")).isEmpty();
        store.save("alice", "Europe/Paris");
        store.save("alice", "America/Bogota");

        assertThat(store.find("alice")).contains("America/Bogota");
    }

    @Test
    void shouldOrderListingsById() throws Exception {
        SqliteScheduleStore store = new SqliteScheduleStore(tempDir.resolve("schedules.db"));
        Schedule first = store.insert(schedule("alice", "1", RepeatType.INTERVAL, "1h"));
        Schedule second = store.insert(schedule("bob", "2", RepeatType.INTERVAL, "2h"));

        List<Schedule> all = store.listAll();

        assertThat(all).extracting(Schedule::id).containsExactly(first.id(), second.id());
    }

    private Schedule schedule(String owner, String title, RepeatType type, String value) {
        return new Schedule(0L, owner, title, "message for " + title, "chan-1", type, value, true, "Asia/Kolkata");
    }
}
