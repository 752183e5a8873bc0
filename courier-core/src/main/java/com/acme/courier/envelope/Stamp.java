package com.acme.courier.envelope;

/**
 * Marker for immutable metadata attached to an {@link Envelope}. Stamps travel with the message
 * and are how the bus records where a message came from and which handlers already ran.
 */
public interface Stamp {}
