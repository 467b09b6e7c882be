package io.herald.core.schedule;

import java.io.IOException;
import java.util.Optional;

public interface UserTimezoneStore {
    Optional<String> find(String userId) throws IOException;

    void save(String userId, String timezone) throws IOException;
}
