/**
 * The events-by-tag publisher and the pieces of its state machine: cursor, bounded
 * delivery buffer, demand tracking, poll timer and the mailbox that serializes them.
 */
package io.tagstream.publisher;
