/** Request parameters, the operation catalogue and signed URL assembly. */
@NullMarked
package io.github.wphillipmoore.mturk.requester.request;

import org.jspecify.annotations.NullMarked;
