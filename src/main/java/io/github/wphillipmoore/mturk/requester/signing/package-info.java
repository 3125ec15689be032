/** Legacy HMAC-SHA1 request signatures. */
@NullMarked
package io.github.wphillipmoore.mturk.requester.signing;

import org.jspecify.annotations.NullMarked;
