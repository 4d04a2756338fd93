package io.guildcron.core;

import java.util.Locale;

public enum Cadence {
    ONCE {
        @Override
        public boolean isRecurring() {
            return false;
        }
    },
    DAILY {
        @Override
        public boolean isRecurring() {
            return true;
        }
    },
    WEEKLY {
        @Override
        public boolean isRecurring() {
            return true;
        }
    },
    MONTHLY {
        @Override
        public boolean isRecurring() {
            return true;
        }
    },
    YEARLY {
        @Override
        public boolean isRecurring() {
            return true;
        }
    };

    public abstract boolean isRecurring();

    /**
     * Parses the stored lower-case form ("once", "weekly", ...), case-insensitive.
     */
    public static Cadence fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("cadence must not be blank");
        }
        try {
            return Cadence.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unsupported cadence: " + value);
        }
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
