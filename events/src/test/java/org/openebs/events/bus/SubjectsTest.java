package org.openebs.events.bus;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.openebs.events.model.Action;
import org.openebs.events.model.Category;
import org.openebs.events.model.Component;
import org.openebs.events.model.EventMessage;
import org.openebs.events.model.EventMeta;
import org.openebs.events.model.EventSource;
import org.openebs.events.model.Version;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Subjects Tests")
class SubjectsTest {

    private static EventMessage message(Category category, String id) {
        return EventMessage.builder()
                .category(category)
                .action(Action.CREATE)
                .target("t")
                .metadata(new EventMeta(id, new EventSource(Component.CORE_AGENT, "n"), Instant.now(), Version.V1))
                .build();
    }

    @Test
    @DisplayName("Should build the subject from category and id")
    void shouldBuildSubject() {
        assertThat(Subjects.of(message(Category.VOLUME, "abc"))).isEqualTo("events.volume.abc");
        assertThat(Subjects.of(message(Category.HIGH_AVAILABILITY, "x1"))).isEqualTo("events.high_availability.x1");
    }

    @Test
    @DisplayName("Should reject a missing or empty id")
    void shouldRejectMissingId() {
        EventMessage noMeta = EventMessage.builder().category(Category.POOL).build();

        assertThatThrownBy(() -> Subjects.of(noMeta)).isInstanceOf(InvalidMessageIdException.class);
        assertThatThrownBy(() -> Subjects.of(message(Category.POOL, ""))).isInstanceOf(InvalidMessageIdException.class);
    }

    @Test
    @DisplayName("Should reject ids that are not a valid subject token")
    void shouldRejectInvalidToken() {
        for (String id : new String[] {"a b", "a*", "a.>", "tab\tid", ".a", "a.", "a..b"}) {
            assertThatThrownBy(() -> Subjects.of(message(Category.POOL, id)))
                    .as(id)
                    .isInstanceOf(InvalidMessageIdException.class);
        }
        assertThat(Subjects.of(message(Category.POOL, "p-1"))).isEqualTo("events.pool.p-1");
    }

    @Test
    @DisplayName("Should be covered by the stream filter")
    void shouldMatchStreamFilter() {
        assertThat(Subjects.of(message(Category.NODE, "id"))).startsWith(Subjects.PREFIX + ".");
        assertThat(Subjects.ALL).isEqualTo("events.>");
    }
}
