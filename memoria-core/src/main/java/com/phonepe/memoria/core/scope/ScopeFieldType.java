package com.phonepe.memoria.core.scope;

import com.google.common.base.Strings;
import com.google.common.primitives.Longs;

/**
 * Value type of a scope field. Values travel as strings and must parse as the declared type; nothing is coerced.
 */
public enum ScopeFieldType {
    /**
     * Any non-empty string
     */
    STRING {
        @Override
        public boolean accepts(String value) {
            return !Strings.isNullOrEmpty(value);
        }
    },
    /**
     * Base 10 signed 64 bit integer
     */
    LONG {
        @Override
        public boolean accepts(String value) {
            return !Strings.isNullOrEmpty(value) && Longs.tryParse(value) != null;
        }
    },
    /**
     * Literal <code>true</code> or <code>false</code>
     */
    BOOLEAN {
        @Override
        public boolean accepts(String value) {
            return "true".equals(value) || "false".equals(value);
        }
    };

    public abstract boolean accepts(String value);
}
