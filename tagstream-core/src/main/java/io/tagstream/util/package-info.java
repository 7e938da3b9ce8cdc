/**
 * Small helpers shared by the core: the default JSON event codec and thread naming.
 */
package io.tagstream.util;
