/**
 * Storage-side records: raw journal entries and their decoded form.
 *
 * @see io.tagstream.model.RawEntry
 * @see io.tagstream.model.StoredEvent
 */
package io.tagstream.model;
