package com.warden.engine.config;

import com.warden.engine.domain.queue.QueueClass;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Background queues the engine monitors, bound from {@code warden.queues.*}.
 *
 * <pre>
 * warden:
 *   queues:
 *     definitions:
 *       - name: file-processing
 *         queue-class: LONG
 *         workers: 2
 *       - name: email
 *         queue-class: SHORT
 *         workers: 2
 * </pre>
 *
 * @param definitions monitored queues; defaults to {@code file-processing} (LONG) and {@code email} (SHORT).
 */
@ConfigurationProperties(prefix = "warden.queues")
@Validated
public record QueueProperties(@Valid List<QueueDefinition> definitions) {

    public QueueProperties {
        if (definitions == null || definitions.isEmpty()) {
            definitions =
                    List.of(
                            new QueueDefinition("file-processing", QueueClass.LONG, 2),
                            new QueueDefinition("email", QueueClass.SHORT, 2));
        } else {
            definitions = List.copyOf(definitions);
        }
    }

    /**
     * One monitored queue.
     *
     * @param name queue name.
     * @param queueClass staleness class used to detect stuck jobs (default SHORT).
     * @param workers initial worker count (default 1).
     */
    public record QueueDefinition(@NotBlank String name, QueueClass queueClass, int workers) {

        public QueueDefinition {
            if (queueClass == null) {
                queueClass = QueueClass.SHORT;
            }
            if (workers <= 0) {
                workers = 1;
            }
        }
    }
}
