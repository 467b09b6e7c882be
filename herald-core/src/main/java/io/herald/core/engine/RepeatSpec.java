package io.herald.core.engine;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

/**
 * Parsed form of a repeat specification, still in the owner's local time.
 */
public interface RepeatSpec {

    record Once(Optional<LocalDateTime> localDateTime) implements RepeatSpec {
        public static Once immediately() {
            return new Once(Optional.empty());
        }

        public static Once at(LocalDateTime localDateTime) {
            return new Once(Optional.of(localDateTime));
        }
    }

    record Every(Duration period) implements RepeatSpec {
    }

    record Weekly(List<DayOfWeek> days, LocalTime time) implements RepeatSpec {
        public Weekly {
            days = List.copyOf(days);
        }
    }
}
