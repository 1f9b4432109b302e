package com.xammer.posture.lister;

import com.xammer.posture.domain.Resource;

import java.util.stream.Stream;

/**
 * Paged read access to one kind of cloud resource.
 * <p>
 * The returned stream is lazy and single-pass: pages are fetched as it is consumed,
 * and a provider error surfaces as an exception from the terminal operation.
 */
@FunctionalInterface
public interface ResourceLister {

    Stream<Resource> list();
}
