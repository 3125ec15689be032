/** Exception hierarchy for request, transport and service failures. */
@NullMarked
package io.github.wphillipmoore.mturk.requester.exception;

import org.jspecify.annotations.NullMarked;
