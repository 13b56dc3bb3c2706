package com.warden.engine.domain.queue;

/**
 * Expected processing time of a queue's jobs. Decides when an active job counts as stuck.
 */
public enum QueueClass {

    /** Jobs finish in seconds to minutes (e.g. email delivery). */
    SHORT,

    /** Jobs may legitimately run for up to an hour (e.g. file processing). */
    LONG
}
