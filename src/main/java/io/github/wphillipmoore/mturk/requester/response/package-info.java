/** XML response decoding and error classification. */
@NullMarked
package io.github.wphillipmoore.mturk.requester.response;

import org.jspecify.annotations.NullMarked;
