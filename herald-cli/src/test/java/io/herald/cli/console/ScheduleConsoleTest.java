package io.herald.cli.console;

import static org.assertj.core.api.Assertions.assertThat;

import io.herald.core.engine.JobRegistry;
import io.herald.core.engine.ScheduleDispatcher;
import io.herald.core.engine.TriggerTranslator;
import io.herald.core.engine.timer.ExecutorTimer;
import io.herald.core.schedule.Schedule;
import io.herald.core.schedule.SqliteScheduleStore;
import io.herald.core.service.ScheduleService;
import io.herald.core.transport.EchoTransport;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ScheduleConsoleTest {

    @TempDir
    Path tempDir;

    private ExecutorTimer timer;
    private SqliteScheduleStore store;
    private ScheduleService service;
    private ByteArrayOutputStream delivered;

    @BeforeEach
    void setUp() throws Exception {
        store = new SqliteScheduleStore(tempDir.resolve("schedules.db"));
        delivered = new ByteArrayOutputStream();
        EchoTransport transport = new EchoTransport(new PrintStream(delivered, true, StandardCharsets.UTF_8));
        timer = new ExecutorTimer(1, Clock.systemUTC());
        TriggerTranslator translator = new TriggerTranslator(ZoneOffset.UTC, Clock.systemUTC());
        JobRegistry registry = new JobRegistry(timer, translator, new ScheduleDispatcher(store, transport));
        service = new ScheduleService(store, store, translator, registry, transport, Set.of("root"), "Asia/Kolkata");
    }

    @AfterEach
    void tearDown() {
        timer.close();
    }

    @Test
    void shouldCreateAndListSchedules() throws Exception {
        StringWriter output = new StringWriter();
        ScheduleConsole console = console("alice", "", output);

        int code = console.execute(
            "create --title \"Stand-up\" --message \"Join the call\" --channel 123 --repeat weekly --value \"mon,wed 09:00\""
        );

        assertThat(code).isZero();
        assertThat(output.toString()).contains("Schedule created! ID: 1", "Repeat: weekly mon,wed 09:00", "Asia/Kolkata");
        assertThat(store.listByOwner("alice")).hasSize(1);

        console.execute("list");
        assertThat(output.toString()).contains("ID 1: Stand-up | Active | weekly mon,wed 09:00 | Channel: 123");
    }

    @Test
    void shouldPrintErrorsForRejectedCommands() throws Exception {
        StringWriter output = new StringWriter();
        ScheduleConsole console = console("alice", "", output);

        int code = console.execute("create --title T --message M --channel 1 --repeat weekly --value \"Funday 09:00\"");

        assertThat(code).isEqualTo(1);
        assertThat(output.toString()).contains("Error: Invalid day 'Funday'");
        assertThat(store.listAll()).isEmpty();

        assertThat(console.execute("pause 42")).isEqualTo(1);
        assertThat(output.toString()).contains("Error: Schedule 42 not found or you don't have permission");
        assertThat(console.execute("admin-list")).isEqualTo(1);
        assertThat(output.toString()).contains("Error: You don't have permission");
    }

    @Test
    void shouldEditOnlyTheGivenFields() throws Exception {
        StringWriter output = new StringWriter();
        ScheduleConsole console = console("alice", "", output);
        console.execute("create --title Reminder --message Drink --channel 9 --repeat interval --value 30m");

        assertThat(console.execute("edit 1 --value 2h")).isZero();

        Schedule edited = store.find(1L).orElseThrow();
        assertThat(edited.title()).isEqualTo("Reminder");
        assertThat(edited.message()).isEqualTo("Drink");
        assertThat(edited.repeatValue()).isEqualTo("2h");
    }

    @Test
    void shouldPauseResumeTestAndDelete() throws Exception {
        StringWriter output = new StringWriter();
        ScheduleConsole console = console("alice", "", output);
        console.execute("create --title Reminder --message Drink --channel 9 --repeat interval --value 30m");

        assertThat(console.execute("pause 1")).isZero();
        assertThat(service.isScheduled(1L)).isFalse();
        assertThat(console.execute("resume 1")).isZero();
        assertThat(service.isScheduled(1L)).isTrue();
        assertThat(console.execute("test 1")).isZero();
        assertThat(delivered.toString(StandardCharsets.UTF_8)).contains("[9] Drink");
        assertThat(console.execute("delete 1")).isZero();
        assertThat(store.find(1L)).isEmpty();
    }

    @Test
    void shouldLetAdminsManageOtherUsersSchedules() throws Exception {
        console("alice", "", new StringWriter())
            .execute("create --title Reminder --message Drink --channel 9 --repeat interval --value 30m");
        StringWriter output = new StringWriter();
        ScheduleConsole admin = console("root", "", output);

        assertThat(admin.execute("admin-list")).isZero();
        assertThat(output.toString()).contains("User: alice");
        assertThat(admin.execute("admin-pause 1")).isZero();
        assertThat(store.find(1L).orElseThrow().active()).isFalse();
        assertThat(admin.execute("admin-delete 1")).isZero();
        assertThat(store.listAll()).isEmpty();
    }

    @Test
    void shouldRunUntilQuitAndReportParseErrors() throws Exception {
        StringWriter output = new StringWriter();
        ScheduleConsole console = console("alice", """
            help
            set-timezone Europe/Berlin
            frobnicate
            create --title "oops
            quit
            list
            """, output);

        console.run();

        String text = output.toString();
        assertThat(text).contains("Schedule commands:", "Timezone set to Europe/Berlin", "Unmatched argument", "Unterminated");
        assertThat(text).doesNotContain("You have no schedules.");
        assertThat(text).endsWith("Bye." + System.lineSeparator());
        assertThat(service.timezoneOf("alice")).isEqualTo("Europe/Berlin");
    }

    private ScheduleConsole console(String user, String input, StringWriter output) {
        return new ScheduleConsole(service, user, new BufferedReader(new StringReader(input)), new PrintWriter(output));
    }
}
