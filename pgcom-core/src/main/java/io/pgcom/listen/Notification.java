package io.pgcom.listen;

/**
 * One asynchronous notification received on a listening connection.
 *
 * @param channel   channel the notification was sent on
 * @param payload   payload string, passed through verbatim; empty when none was given
 * @param processId backend process id of the notifying session
 */
public record Notification(String channel, String payload, int processId) {
}
