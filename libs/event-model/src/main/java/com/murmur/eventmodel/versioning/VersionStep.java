package com.murmur.eventmodel.versioning;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One hop between adjacent schema versions of a payload.
 *
 * <p>A step must be pure and total for any valid payload of its source version. It receives a
 * private copy of the payload, so it may modify and return its argument.
 */
@FunctionalInterface
public interface VersionStep {

    ObjectNode apply(ObjectNode payload);
}
