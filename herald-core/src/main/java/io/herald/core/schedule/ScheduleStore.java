package io.herald.core.schedule;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface ScheduleStore {
    List<Schedule> getActiveSchedules() throws IOException;

    Optional<Schedule> find(long id) throws IOException;

    void setActive(long id, boolean active) throws IOException;

    Schedule insert(Schedule schedule) throws IOException;

    boolean update(Schedule schedule) throws IOException;

    boolean delete(long id) throws IOException;

    List<Schedule> listByOwner(String ownerId) throws IOException;

    List<Schedule> listAll() throws IOException;
}
