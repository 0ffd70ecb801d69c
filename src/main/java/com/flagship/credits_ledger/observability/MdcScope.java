package com.flagship.credits_ledger.observability;

import org.slf4j.MDC;

/**
 * Puts one MDC key for the length of a try-with-resources block and restores whatever
 * value the key had before, so nested operations do not clear their caller's context.
 */
public final class MdcScope implements AutoCloseable {

    private final String key;
    private final String previous;

    private MdcScope(String key, String previous) {
        this.key = key;
        this.previous = previous;
    }

    public static MdcScope put(String key, Object value) {
        MdcScope scope = new MdcScope(key, MDC.get(key));
        MDC.put(key, String.valueOf(value));
        return scope;
    }

    @Override
    public void close() {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }
}
