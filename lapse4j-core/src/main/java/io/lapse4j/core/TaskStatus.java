package io.lapse4j.core;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Task lifecycle: {@code PENDING -> RUNNING -> COMPLETED | FAILED | CANCELLED}, plus
 * {@code PENDING -> CANCELLED}. Terminal states are final.
 */
public enum TaskStatus {
    @JsonProperty("pending")
    PENDING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    @JsonProperty("running")
    RUNNING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    @JsonProperty("completed")
    COMPLETED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },
    @JsonProperty("failed")
    FAILED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },
    @JsonProperty("cancelled")
    CANCELLED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    };

    public abstract boolean isTerminal();
}
