package io.tempo4j.core;

/**
 * Lifecycle of a single {@link JobExecution}.
 *
 * <pre>
 * PENDING -> RUNNING -> SUCCESS
 *                    -> FAILED
 * PENDING -> FAILED  (abandoned before it ran)
 * </pre>
 */
public enum ExecutionStatus {
    PENDING {
        @Override
        public boolean canTransitionTo(ExecutionStatus next) {
            return next == RUNNING || next == FAILED;
        }
    },
    RUNNING {
        @Override
        public boolean canTransitionTo(ExecutionStatus next) {
            return next == SUCCESS || next == FAILED;
        }
    },
    SUCCESS {
        @Override
        public boolean canTransitionTo(ExecutionStatus next) {
            return false;
        }
    },
    FAILED {
        @Override
        public boolean canTransitionTo(ExecutionStatus next) {
            return false;
        }
    };

    public abstract boolean canTransitionTo(ExecutionStatus next);

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}
