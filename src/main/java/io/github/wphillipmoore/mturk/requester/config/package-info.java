/** Endpoint modes and default request parameters. */
@NullMarked
package io.github.wphillipmoore.mturk.requester.config;

import org.jspecify.annotations.NullMarked;
