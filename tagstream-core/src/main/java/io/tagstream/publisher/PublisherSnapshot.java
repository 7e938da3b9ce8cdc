package io.tagstream.publisher;

/**
 * Point-in-time view of a publisher, taken on its own execution context.
 *
 * @param state      {@code ACTIVE}, {@code POLLING}, {@code STOPPED} or {@code FAILED}
 * @param nextOffset offset the next poll will query from
 * @param bufferSize envelopes waiting for demand
 * @param demand     requested-but-undelivered elements
 */
public record PublisherSnapshot(String state, long nextOffset, int bufferSize, long demand) {
}
