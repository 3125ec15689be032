/** Signed-request client for the Mechanical Turk requester query API. */
@NullMarked
package io.github.wphillipmoore.mturk.requester;

import org.jspecify.annotations.NullMarked;
