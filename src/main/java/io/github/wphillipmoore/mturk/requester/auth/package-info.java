/** Access key credentials. */
@NullMarked
package io.github.wphillipmoore.mturk.requester.auth;

import org.jspecify.annotations.NullMarked;
