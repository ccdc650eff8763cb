package app.kartoteka.exchange.domain;

import java.util.EnumSet;
import java.util.Set;

public enum JobStatus {
    PENDING,
    VALIDATING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    private static final Set<JobStatus> ACTIVE = EnumSet.of(PENDING, VALIDATING, PROCESSING);

    public boolean isTerminal() {
        return !ACTIVE.contains(this);
    }

    public boolean isCancellable() {
        return ACTIVE.contains(this);
    }

    public boolean canTransitionTo(JobStatus target) {
        return sourcesOf(target).contains(this);
    }

    public static Set<JobStatus> sourcesOf(JobStatus target) {
        return switch (target) {
            case PENDING -> EnumSet.noneOf(JobStatus.class);
            case VALIDATING -> EnumSet.of(PENDING);
            case PROCESSING -> EnumSet.of(PENDING, VALIDATING);
            case COMPLETED -> EnumSet.of(PROCESSING);
            case FAILED, CANCELLED -> EnumSet.copyOf(ACTIVE);
        };
    }
}
