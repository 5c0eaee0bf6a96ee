package org.ipod.datapipeline.api.model;

/**
 * The observatory and time at which an observation was made.
 *
 * @param code Observatory code.
 * @param time Time of the observation.
 */
public record Observer(String code, Timestamp time) {
}
