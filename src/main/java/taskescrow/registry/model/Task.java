package taskescrow.registry.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable domain model of an escrowed task.
 * State changes produce a new instance through {@link #toBuilder()}.
 */
public final class Task {

    /** Longest accepted title, in characters */
    public static final int MAX_TITLE_LENGTH = 1024;
    /** Longest accepted client, freelancer or owner identity, in characters */
    public static final int MAX_IDENTITY_LENGTH = 256;

    private final long id;
    private final String title;
    private final String description;
    private final long reward;
    private final String client;
    private final String freelancer; // null until assigned
    private final TaskStatus status;
    private final Instant deadline;
    private final boolean freelancerSubmitted;
    private final boolean clientApproved;

    private Task(Builder builder) {
        if (builder.id <= 0) {
            throw new IllegalArgumentException("id must be positive");
        }
        this.id = builder.id;
        this.title = Objects.requireNonNull(builder.title, "title is required");
        this.description = builder.description != null ? builder.description : "";
        this.reward = builder.reward;
        this.client = Objects.requireNonNull(builder.client, "client is required");
        this.freelancer = builder.freelancer;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.deadline = Objects.requireNonNull(builder.deadline, "deadline is required");
        this.freelancerSubmitted = builder.freelancerSubmitted;
        this.clientApproved = builder.clientApproved;
    }

    public long id() {
        return id;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    public long reward() {
        return reward;
    }

    public String client() {
        return client;
    }

    public Optional<String> freelancer() {
        return Optional.ofNullable(freelancer);
    }

    public TaskStatus status() {
        return status;
    }

    public Instant deadline() {
        return deadline;
    }

    public boolean freelancerSubmitted() {
        return freelancerSubmitted;
    }

    public boolean clientApproved() {
        return clientApproved;
    }

    public boolean isClient(String identity) {
        return client.equals(identity);
    }

    public boolean isFreelancer(String identity) {
        return freelancer != null && freelancer.equals(identity);
    }

    /** Both confirmations recorded */
    public boolean isConfirmedByBoth() {
        return freelancerSubmitted && clientApproved;
    }

    /** Acceptance is allowed strictly before the deadline */
    public boolean acceptsBefore(Instant now) {
        return now.isBefore(deadline);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .title(title)
                .description(description)
                .reward(reward)
                .client(client)
                .freelancer(freelancer)
                .status(status)
                .deadline(deadline)
                .freelancerSubmitted(freelancerSubmitted)
                .clientApproved(clientApproved);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long id;
        private String title;
        private String description;
        private long reward;
        private String client;
        private String freelancer;
        private TaskStatus status = TaskStatus.OPEN;
        private Instant deadline;
        private boolean freelancerSubmitted;
        private boolean clientApproved;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder reward(long reward) {
            this.reward = reward;
            return this;
        }

        public Builder client(String client) {
            this.client = client;
            return this;
        }

        public Builder freelancer(String freelancer) {
            this.freelancer = freelancer;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder deadline(Instant deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder freelancerSubmitted(boolean freelancerSubmitted) {
            this.freelancerSubmitted = freelancerSubmitted;
            return this;
        }

        public Builder clientApproved(boolean clientApproved) {
            this.clientApproved = clientApproved;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return id == task.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Task{id=" + id + ", status=" + status + ", client='" + client
                + "', freelancer='" + freelancer + "', reward=" + reward + "}";
    }
}
