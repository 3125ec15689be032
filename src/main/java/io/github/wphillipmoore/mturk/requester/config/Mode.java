package io.github.wphillipmoore.mturk.requester.config;

/** Which Mechanical Turk site a session talks to. */
public enum Mode {

  /** The live marketplace; HITs are seen by workers and rewards are paid. */
  PRODUCTION,

  /** The requester sandbox; nothing is paid. */
  SANDBOX
}
