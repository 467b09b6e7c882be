package io.herald.core.service;

import io.herald.core.engine.JobRegistry;
import io.herald.core.engine.ScheduleSpecException;
import io.herald.core.engine.Timezones;
import io.herald.core.engine.Trigger;
import io.herald.core.engine.TriggerTranslator;
import io.herald.core.schedule.RepeatType;
import io.herald.core.schedule.Schedule;
import io.herald.core.schedule.ScheduleDraft;
import io.herald.core.schedule.ScheduleStore;
import io.herald.core.schedule.UserTimezoneStore;
import io.herald.core.transport.DeliveryException;
import io.herald.core.transport.MessageTransport;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * User and admin commands over schedules. Every spec is translated before anything is written,
 * and every mutation cancels the live trigger before a new one is registered.
 */
public final class ScheduleService {
    private static final Logger LOG = LoggerFactory.getLogger(ScheduleService.class);

    static final int MAX_TITLE_LENGTH = 100;
    static final int MAX_MESSAGE_LENGTH = 2000;

    private final ScheduleStore store;
    private final UserTimezoneStore timezones;
    private final TriggerTranslator translator;
    private final JobRegistry registry;
    private final MessageTransport transport;
    private final Set<String> admins;
    private final String defaultTimezone;

    public ScheduleService(
        ScheduleStore store,
        UserTimezoneStore timezones,
        TriggerTranslator translator,
        JobRegistry registry,
        MessageTransport transport,
        Set<String> admins,
        String defaultTimezone
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.timezones = Objects.requireNonNull(timezones, "timezones must not be null");
        this.translator = Objects.requireNonNull(translator, "translator must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.admins = Set.copyOf(admins);
        this.defaultTimezone = Timezones.resolve(defaultTimezone).getId();
    }

    public String timezoneOf(String userId) throws IOException {
        return timezones.find(userId).filter(zone -> !zone.isBlank()).orElse(defaultTimezone);
    }

    public synchronized String setTimezone(String userId, String timezone) throws IOException {
        String zone = Timezones.resolve(timezone).getId();
        timezones.save(userId, zone);
        LOG.debug("User {} set timezone to {}", userId, zone);
        return zone;
    }

    public synchronized Schedule create(String userId, ScheduleDraft draft) throws IOException {
        RepeatType type = validate(draft);
        String timezone = timezoneOf(userId);
        Trigger trigger = translator.translate(type, draft.repeatValue(), timezone);

        Schedule created = store.insert(new Schedule(
            0L,
            userId,
            draft.title(),
            draft.message(),
            draft.channel(),
            type,
            draft.repeatValue(),
            true,
            timezone
        ));
        registry.replace(created.id(), trigger);
        LOG.debug("User {} created schedule {}: {}", userId, created.id(), created.title());
        return created;
    }

    public synchronized Schedule edit(String userId, long id, ScheduleDraft draft) throws IOException {
        Schedule existing = owned(userId, id);
        RepeatType type = validate(draft);
        String timezone = timezoneOf(userId);
        Trigger trigger = translator.translate(type, draft.repeatValue(), timezone);

        Schedule edited = new Schedule(
            id,
            existing.ownerId(),
            draft.title(),
            draft.message(),
            draft.channel(),
            type,
            draft.repeatValue(),
            existing.active(),
            timezone
        );
        if (edited.active()) {
            registry.replace(id, trigger, () -> store.update(edited));
        } else {
            store.update(edited);
            registry.cancel(id);
        }
        LOG.debug("User {} edited schedule {}", userId, id);
        return edited;
    }

    public synchronized Schedule pause(String userId, long id) throws IOException {
        Schedule existing = owned(userId, id);
        return deactivate(existing, userId);
    }

    public synchronized Schedule resume(String userId, long id) throws IOException {
        Schedule existing = owned(userId, id);
        Trigger trigger = translator.translate(existing.repeatType(), existing.repeatValue(), existing.ownerTimezone());
        registry.replace(id, trigger, () -> store.setActive(id, true));
        LOG.debug("User {} resumed schedule {}", userId, id);
        return existing.withActive(true);
    }

    public synchronized void delete(String userId, long id) throws IOException {
        owned(userId, id);
        remove(id, userId);
    }

    /**
     * Sends the schedule's message right away without touching its state or trigger.
     */
    public void test(String userId, long id) throws IOException, DeliveryException {
        Schedule schedule = owned(userId, id);
        transport.send(schedule.channel(), schedule.message());
        LOG.debug("User {} tested schedule {}", userId, id);
    }

    public Schedule get(String userId, long id) throws IOException {
        return owned(userId, id);
    }

    public List<Schedule> list(String userId) throws IOException {
        return store.listByOwner(userId);
    }

    public boolean isScheduled(long id) {
        return registry.isScheduled(id);
    }

    public boolean isAdmin(String userId) {
        return userId != null && admins.contains(userId);
    }

    public List<Schedule> adminListAll(String userId) throws IOException {
        requireAdmin(userId);
        LOG.debug("Admin {} listed all schedules", userId);
        return store.listAll();
    }

    public synchronized Schedule adminPause(String userId, long id) throws IOException {
        requireAdmin(userId);
        Schedule existing = store.find(id).orElseThrow(() -> new ScheduleNotFoundException(id));
        return deactivate(existing, userId);
    }

    public synchronized void adminDelete(String userId, long id) throws IOException {
        requireAdmin(userId);
        store.find(id).orElseThrow(() -> new ScheduleNotFoundException(id));
        remove(id, userId);
    }

    private Schedule deactivate(Schedule existing, String actor) throws IOException {
        store.setActive(existing.id(), false);
        registry.cancel(existing.id());
        LOG.debug("{} paused schedule {}", actor, existing.id());
        return existing.withActive(false);
    }

    private void remove(long id, String actor) throws IOException {
        store.delete(id);
        registry.cancel(id);
        LOG.debug("{} deleted schedule {}", actor, id);
    }

    private Schedule owned(String userId, long id) throws IOException {
        Optional<Schedule> found = store.find(id);
        if (found.isEmpty() || !found.get().ownerId().equals(userId)) {
            throw new ScheduleNotFoundException(id);
        }
        return found.get();
    }

    private void requireAdmin(String userId) {
        if (!isAdmin(userId)) {
            throw new AccessDeniedException("You don't have permission to use this command");
        }
    }

    private RepeatType validate(ScheduleDraft draft) {
        if (draft.title().isBlank()) {
            throw new ScheduleSpecException(ScheduleSpecException.Field.TITLE, "title is required");
        }
        if (draft.title().length() > MAX_TITLE_LENGTH) {
            throw new ScheduleSpecException(
                ScheduleSpecException.Field.TITLE,
                "title must be at most " + MAX_TITLE_LENGTH + " characters"
            );
        }
        if (draft.message().isBlank()) {
            throw new ScheduleSpecException(ScheduleSpecException.Field.MESSAGE, "message is required");
        }
        if (draft.message().length() > MAX_MESSAGE_LENGTH) {
            throw new ScheduleSpecException(
                ScheduleSpecException.Field.MESSAGE,
                "message must be at most " + MAX_MESSAGE_LENGTH + " characters"
            );
        }
        if (draft.channel().isBlank()) {
            throw new ScheduleSpecException(ScheduleSpecException.Field.CHANNEL, "channel is required");
        }
        return RepeatType.parse(draft.repeatType()).orElseThrow(() -> new ScheduleSpecException(
            ScheduleSpecException.Field.REPEAT_TYPE,
            "Invalid repeat type. Use: none, interval, or weekly"
        ));
    }
}
