package com.github.workflow;

/**
 * What re-opening a specification does when it re-declares something that already exists.
 * Declaring new states, and new events on existing states, is never a redefinition.
 */
public enum RedefinitionPolicy {
  // later declaration wins: events replaced in place, hooks replaced when given, meta merged
  OVERWRITE,
  // any re-declared event, already-set entry/exit hook or existing meta key fails the whole batch
  REJECT;
}
