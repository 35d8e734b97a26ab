package org.openebs.events.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.Objects;

/**
 * Event published on the message bus.
 *
 * <p>Subjects are derived from {@link #getCategory()} and the metadata id, so the id
 * must be unique per logical event.</p>
 */
@JsonDeserialize(builder = EventMessage.Builder.class)
public class EventMessage {

    /** Category of the resource */
    private final Category category;

    /** Action performed on the resource */
    private final Action action;

    /** Id of the resource the action is performed on */
    private final String target;

    /** Event metadata; may be null on messages built by hand */
    private final EventMeta metadata;

    private EventMessage(Builder builder) {
        this.category = builder.category;
        this.action = builder.action;
        this.target = builder.target;
        this.metadata = builder.metadata;
    }

    public static Builder builder() {
        return new Builder();
    }

    // --- Getters ---

    public Category getCategory() { return category; }
    public Action getAction() { return action; }
    public String getTarget() { return target; }
    public EventMeta getMetadata() { return metadata; }

    /**
     * @return the event id, or null when the message carries no metadata
     */
    public String eventId() {
        return metadata != null ? metadata.id() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventMessage that)) return false;
        return category == that.category
                && action == that.action
                && Objects.equals(target, that.target)
                && Objects.equals(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, action, target, metadata);
    }

    @Override
    public String toString() {
        return "EventMessage{" +
                "category=" + category +
                ", action=" + action +
                ", target='" + target + '\'' +
                ", metadata=" + metadata +
                '}';
    }

    // ========== Builder ==========

    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private Category category;
        private Action action;
        private String target;
        private EventMeta metadata;

        public Builder category(Category category) { this.category = category; return this; }
        public Builder action(Action action) { this.action = action; return this; }
        public Builder target(String target) { this.target = target; return this; }
        public Builder metadata(EventMeta metadata) { this.metadata = metadata; return this; }

        public EventMessage build() {
            if (category == null) {
                category = Category.UNKNOWN;
            }
            if (action == null) {
                action = Action.UNKNOWN;
            }
            return new EventMessage(this);
        }
    }
}
